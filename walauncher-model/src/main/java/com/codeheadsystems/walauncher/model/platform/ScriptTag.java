package com.codeheadsystems.walauncher.model.platform;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * A script tag registration on a storefront.
 *
 * @param id    platform identifier, absent on create requests
 * @param event load event, always {@code onload}
 * @param src   URL of the script the storefront loads
 */
@JsonIgnoreProperties(ignoreUnknown = true)
@JsonInclude(JsonInclude.Include.NON_NULL)
public record ScriptTag(
    @JsonProperty("id") Long id,
    @JsonProperty("event") String event,
    @JsonProperty("src") String src) {

  public static ScriptTag onload(String src) {
    return new ScriptTag(null, "onload", src);
  }
}
