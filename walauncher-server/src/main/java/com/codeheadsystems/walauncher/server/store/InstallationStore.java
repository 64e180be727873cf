package com.codeheadsystems.walauncher.server.store;

import com.codeheadsystems.walauncher.server.tenant.ShopDomain;
import java.time.Instant;
import java.util.List;
import java.util.Optional;
import java.util.Set;

/**
 * Storage abstraction for tenant records: installations, widget configurations, click analytics
 * and pending OAuth states.
 * <p>
 * Implementations must be thread-safe, and every operation must be atomic with respect to
 * concurrent callers. Reads never observe a partially applied write.
 * <p>
 * <strong>Tenant contract:</strong> a widget configuration or analytics record exists only for
 * a shop that has an installation. Writes for a shop without one fail with
 * {@link UnknownTenantException}, and {@link #deleteInstallation(ShopDomain)} removes every
 * record keyed by the shop in one step.
 * <p>
 * Implementations backed by a durable medium throw {@link PersistenceException} when it fails.
 */
public interface InstallationStore {

  /**
   * Creates or replaces the installation for its shop.
   *
   * @param installation the installation
   */
  void storeInstallation(Installation installation);

  Optional<Installation> loadInstallation(ShopDomain shop);

  /**
   * Removes the installation and every record keyed by the same shop. Deleting a shop that is
   * not installed is a no-op.
   *
   * @param shop the tenant
   * @return true if an installation was removed
   */
  boolean deleteInstallation(ShopDomain shop);

  /**
   * Shops that currently have an installation.
   *
   * @return a snapshot of installed shops
   */
  Set<ShopDomain> installedShops();

  /**
   * Creates or replaces the widget configuration for its shop.
   *
   * @param config the configuration
   * @throws UnknownTenantException if the shop is not installed
   */
  void storeWidgetConfig(WidgetConfig config);

  Optional<WidgetConfig> loadWidgetConfig(ShopDomain shop);

  boolean deleteWidgetConfig(ShopDomain shop);

  /**
   * Creates or replaces the analytics record for its shop.
   *
   * @param record the analytics record
   * @throws UnknownTenantException if the shop is not installed
   */
  void storeAnalytics(AnalyticsRecord record);

  Optional<AnalyticsRecord> loadAnalytics(ShopDomain shop);

  boolean deleteAnalytics(ShopDomain shop);

  /**
   * Atomically records one widget click. Concurrent calls are never lost: N calls increase the
   * count by exactly N.
   *
   * @param shop the tenant
   * @param at   when the click happened
   * @return the record after the increment
   * @throws UnknownTenantException if the shop is not installed
   */
  AnalyticsRecord incrementClicks(ShopDomain shop, Instant at);

  void storeOAuthState(OAuthState state);

  Optional<OAuthState> loadOAuthState(String nonce);

  /**
   * Atomically loads and removes a pending state. Of any number of concurrent callers with the
   * same nonce, at most one receives it.
   *
   * @param nonce the state nonce
   * @return the state, or empty if it does not exist or was already consumed
   */
  Optional<OAuthState> consumeOAuthState(String nonce);

  boolean deleteOAuthState(String nonce);

  List<OAuthState> loadOAuthStates(ShopDomain shop);

  /**
   * Removes every pending state expired at the given instant.
   *
   * @param now the current time
   * @return the number of states removed
   */
  int purgeExpiredOAuthStates(Instant now);

  /**
   * Releases resources. The default does nothing.
   */
  default void shutdown() {
  }
}
