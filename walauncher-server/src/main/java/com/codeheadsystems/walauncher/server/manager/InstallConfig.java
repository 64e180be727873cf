package com.codeheadsystems.walauncher.server.manager;

import java.time.Duration;
import java.util.Objects;

/**
 * Settings for the install flow.
 *
 * @param clientId the app's public client identifier
 * @param appUrl   public base URL of this app, without trailing slash
 * @param scopes   comma-separated scopes requested at install
 * @param stateTtl how long a pending authorization stays valid
 */
public record InstallConfig(String clientId, String appUrl, String scopes, Duration stateTtl) {

  public InstallConfig {
    Objects.requireNonNull(clientId, "clientId");
    Objects.requireNonNull(appUrl, "appUrl");
    Objects.requireNonNull(scopes, "scopes");
    Objects.requireNonNull(stateTtl, "stateTtl");
    if (stateTtl.isNegative() || stateTtl.isZero()) {
      throw new IllegalArgumentException("stateTtl must be positive");
    }
    appUrl = appUrl.endsWith("/") ? appUrl.substring(0, appUrl.length() - 1) : appUrl;
  }

  public String redirectUri() {
    return appUrl + "/auth/callback";
  }
}
