package com.codeheadsystems.walauncher.model.platform;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * Response of the authorization code exchange.
 *
 * @param accessToken the offline access credential for the shop
 * @param scope       comma-separated granted scopes
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public record AccessTokenResponse(
    @JsonProperty("access_token") String accessToken,
    @JsonProperty("scope") String scope) {

  @Override
  public String toString() {
    return "AccessTokenResponse[accessToken=***, scope=" + scope + "]";
  }
}
