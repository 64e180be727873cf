package com.codeheadsystems.walauncher.model.platform;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;
import java.util.List;

/**
 * Response of {@code GET /admin/api/{version}/script_tags.json}.
 *
 * @param scriptTags registrations present on the storefront, never null
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public record ScriptTagList(@JsonProperty("script_tags") List<ScriptTag> scriptTags) {

  public ScriptTagList {
    scriptTags = scriptTags == null ? List.of() : List.copyOf(scriptTags);
  }
}
