package com.codeheadsystems.walauncher.server.store;

import com.codeheadsystems.walauncher.server.tenant.ShopDomain;
import java.time.Instant;
import java.util.Objects;

/**
 * A completed install: the offline access token granted for one tenant.
 *
 * @param shop        the tenant
 * @param accessToken the platform access token; never logged
 * @param installedAt when authorization completed
 */
public record Installation(ShopDomain shop, String accessToken, Instant installedAt) {

  public Installation {
    Objects.requireNonNull(shop, "shop");
    Objects.requireNonNull(installedAt, "installedAt");
    if (accessToken == null || accessToken.isBlank()) {
      throw new IllegalArgumentException("accessToken must not be blank");
    }
  }

  @Override
  public String toString() {
    return "Installation[shop=" + shop + ", accessToken=***, installedAt=" + installedAt + "]";
  }
}
