package com.codeheadsystems.walauncher.springboot.security;

import com.codeheadsystems.walauncher.server.store.InstallationStore;
import com.codeheadsystems.walauncher.server.tenant.ShopDomain;
import java.net.URI;
import java.util.Arrays;
import java.util.Locale;
import java.util.Optional;
import java.util.Set;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Development-only attribution of API requests through a {@code shop} query parameter, for
 * running the dashboard outside the platform admin where no session token exists.
 * <p>
 * Refuses to start when enabled under a {@code prod}/{@code production} profile or with a public
 * https app URL. Even when enabled it only attributes requests to shops that are installed.
 */
public class DevTenantFallback {

  private static final Logger log = LoggerFactory.getLogger(DevTenantFallback.class);
  private static final Set<String> PRODUCTION_PROFILES = Set.of("prod", "production");
  private static final Set<String> LOCAL_HOSTS = Set.of("localhost", "127.0.0.1", "[::1]", "::1");

  private final boolean enabled;
  private final InstallationStore store;

  DevTenantFallback(boolean enabled, InstallationStore store) {
    this.enabled = enabled;
    this.store = store;
  }

  /**
   * Creates the fallback, validating that it may be enabled in this environment.
   *
   * @param enabled        the configured flag
   * @param appUrl         the public app URL
   * @param activeProfiles active Spring profiles
   * @param store          the installation store
   * @return the fallback
   * @throws IllegalStateException if enabled in a production-like environment
   */
  public static DevTenantFallback create(boolean enabled, String appUrl, String[] activeProfiles,
                                         InstallationStore store) {
    if (!enabled) {
      return new DevTenantFallback(false, store);
    }
    boolean productionProfile = Arrays.stream(activeProfiles)
        .anyMatch(p -> PRODUCTION_PROFILES.contains(p.toLowerCase(Locale.ROOT)));
    if (productionProfile) {
      throw new IllegalStateException(
          "walauncher.dev-query-param-auth must not be enabled with a production profile active");
    }
    URI uri = URI.create(appUrl);
    if ("https".equalsIgnoreCase(uri.getScheme()) && !LOCAL_HOSTS.contains(String.valueOf(uri.getHost()))) {
      throw new IllegalStateException(
          "walauncher.dev-query-param-auth must not be enabled for a public https app-url");
    }
    log.warn("Development query-parameter tenant fallback is ENABLED. API requests without a session "
        + "token are attributed to the ?shop= parameter. Never enable this in production.");
    return new DevTenantFallback(true, store);
  }

  public boolean isEnabled() {
    return enabled;
  }

  /**
   * Attributes a request to the given shop if the fallback is enabled and the shop is installed.
   *
   * @param rawShop the {@code shop} query parameter
   * @return the shop, or empty
   */
  public Optional<ShopDomain> resolve(String rawShop) {
    if (!enabled || rawShop == null || rawShop.isBlank()) {
      return Optional.empty();
    }
    final ShopDomain shop;
    try {
      shop = ShopDomain.of(rawShop);
    } catch (IllegalArgumentException e) {
      return Optional.empty();
    }
    if (store.loadInstallation(shop).isEmpty()) {
      return Optional.empty();
    }
    log.warn("Request attributed to shop={} through the development query-parameter fallback", shop);
    return Optional.of(shop);
  }
}
