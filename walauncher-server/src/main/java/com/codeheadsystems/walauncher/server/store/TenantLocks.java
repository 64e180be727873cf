package com.codeheadsystems.walauncher.server.store;

import com.codeheadsystems.walauncher.server.tenant.ShopDomain;
import java.util.concurrent.locks.ReentrantLock;
import java.util.function.Supplier;

/**
 * Striped per-tenant locks. Operations on the same shop are serialized; operations on different
 * shops usually are not. Locks are process-local.
 */
public class TenantLocks {

  private static final int DEFAULT_STRIPES = 64;

  private final ReentrantLock[] stripes;

  public TenantLocks() {
    this(DEFAULT_STRIPES);
  }

  public TenantLocks(int stripeCount) {
    if (stripeCount <= 0) {
      throw new IllegalArgumentException("stripeCount must be positive");
    }
    this.stripes = new ReentrantLock[stripeCount];
    for (int i = 0; i < stripeCount; i++) {
      stripes[i] = new ReentrantLock();
    }
  }

  public <T> T withLock(ShopDomain shop, Supplier<T> action) {
    ReentrantLock lock = stripes[Math.floorMod(shop.hashCode(), stripes.length)];
    lock.lock();
    try {
      return action.get();
    } finally {
      lock.unlock();
    }
  }

  public void withLock(ShopDomain shop, Runnable action) {
    withLock(shop, () -> {
      action.run();
      return null;
    });
  }
}
