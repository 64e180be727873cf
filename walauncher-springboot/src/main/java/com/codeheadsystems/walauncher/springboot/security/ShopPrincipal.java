package com.codeheadsystems.walauncher.springboot.security;

import com.codeheadsystems.walauncher.server.tenant.ShopDomain;
import java.security.Principal;

/**
 * The tenant an API request is attributed to.
 *
 * @param shop        the tenant
 * @param subject     platform user id from the session token, null for the development fallback
 * @param devFallback true when attributed through the development query-parameter fallback
 */
public record ShopPrincipal(ShopDomain shop, String subject, boolean devFallback) implements Principal {

  @Override
  public String getName() {
    return shop.value();
  }
}
