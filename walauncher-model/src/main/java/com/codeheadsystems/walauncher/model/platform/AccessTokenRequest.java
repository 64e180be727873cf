package com.codeheadsystems.walauncher.model.platform;

import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * Body of the authorization code exchange ({@code POST /admin/oauth/access_token}).
 *
 * @param clientId     the app's public client identifier
 * @param clientSecret the app's shared secret
 * @param code         the authorization code from the callback
 */
public record AccessTokenRequest(
    @JsonProperty("client_id") String clientId,
    @JsonProperty("client_secret") String clientSecret,
    @JsonProperty("code") String code) {

  @Override
  public String toString() {
    return "AccessTokenRequest[clientId=" + clientId + ", clientSecret=***, code=***]";
  }
}
