package com.codeheadsystems.walauncher.server.store;

import com.codeheadsystems.walauncher.server.tenant.ShopDomain;

/**
 * Thrown when a tenant-scoped write targets a shop with no installation.
 */
public class UnknownTenantException extends RuntimeException {

  private final ShopDomain shop;

  public UnknownTenantException(ShopDomain shop) {
    super("Shop is not installed: " + shop);
    this.shop = shop;
  }

  public ShopDomain shop() {
    return shop;
  }
}
