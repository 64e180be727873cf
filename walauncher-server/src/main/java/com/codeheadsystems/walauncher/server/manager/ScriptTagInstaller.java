package com.codeheadsystems.walauncher.server.manager;

import com.codeheadsystems.walauncher.model.config.WidgetRegistrationStatus;
import com.codeheadsystems.walauncher.model.platform.ScriptTag;
import com.codeheadsystems.walauncher.server.accessor.ShopifyAdminAccessor;
import com.codeheadsystems.walauncher.server.exceptions.AdminApiException;
import com.codeheadsystems.walauncher.server.exceptions.ScriptTagInstallException;
import com.codeheadsystems.walauncher.server.store.Installation;
import com.codeheadsystems.walauncher.server.tenant.ShopDomain;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.locks.ReentrantLock;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Ensures the widget loader is registered exactly once on a storefront.
 * <p>
 * Lists the existing script tags and creates one only when none has exactly the loader URL.
 * Calls for the same shop are serialized within this process so concurrent saves cannot both
 * create a tag. The lock is held across outbound calls, so each shop has its own lock and a slow
 * storefront never delays another shop. A failed attempt is retried once.
 */
public class ScriptTagInstaller {

  private static final Logger log = LoggerFactory.getLogger(ScriptTagInstaller.class);
  static final int MAX_ATTEMPTS = 2;

  private final ShopifyAdminAccessor accessor;
  private final ConcurrentHashMap<ShopDomain, ReentrantLock> shopLocks = new ConcurrentHashMap<>();

  public ScriptTagInstaller(ShopifyAdminAccessor accessor) {
    this.accessor = accessor;
  }

  /**
   * Registers the loader if it is not registered yet.
   *
   * @param installation the shop's installation, supplying the access token
   * @param loaderUrl    the exact loader URL
   * @return {@link WidgetRegistrationStatus#REGISTERED} or {@link WidgetRegistrationStatus#ALREADY_PRESENT}
   * @throws ScriptTagInstallException if every attempt failed
   */
  public WidgetRegistrationStatus ensureRegistered(Installation installation, String loaderUrl) {
    ReentrantLock lock = shopLocks.computeIfAbsent(installation.shop(), shop -> new ReentrantLock());
    lock.lock();
    try {
      AdminApiException last = null;
      for (int attempt = 1; attempt <= MAX_ATTEMPTS; attempt++) {
        try {
          return registerOnce(installation, loaderUrl);
        } catch (AdminApiException e) {
          last = e;
          log.warn("Script tag registration attempt {}/{} failed for shop={}: {}",
              attempt, MAX_ATTEMPTS, installation.shop(), e.getMessage());
        }
      }
      throw new ScriptTagInstallException("Unable to register widget loader for shop: " + installation.shop(), last);
    } finally {
      lock.unlock();
    }
  }

  private WidgetRegistrationStatus registerOnce(Installation installation, String loaderUrl) {
    boolean present = accessor.listScriptTags(installation.shop(), installation.accessToken()).stream()
        .map(ScriptTag::src)
        .anyMatch(loaderUrl::equals);
    if (present) {
      log.debug("Widget loader already registered for shop={}", installation.shop());
      return WidgetRegistrationStatus.ALREADY_PRESENT;
    }
    accessor.createScriptTag(installation.shop(), installation.accessToken(), loaderUrl);
    log.info("Registered widget loader for shop={}", installation.shop());
    return WidgetRegistrationStatus.REGISTERED;
  }
}
