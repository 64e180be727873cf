package com.codeheadsystems.walauncher.server.store;

import com.codeheadsystems.walauncher.server.tenant.ShopDomain;
import java.time.Instant;
import java.util.Collection;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;
import java.util.function.Supplier;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Non-persistent in-memory {@link InstallationStore} backed by {@link ConcurrentHashMap}s.
 * <p>
 * Tenant-scoped writes are serialized per shop with {@link TenantLocks}, which makes the
 * installed-shop check and the write a single step and keeps click increments exact. All data
 * is lost on restart, so this is suitable for development and testing only.
 * <p>
 * Subclasses can make the tenant records durable by overriding {@link #afterMutation()}.
 * Pending OAuth states always live in memory.
 */
public class InMemoryInstallationStore implements InstallationStore {

  private static final Logger log = LoggerFactory.getLogger(InMemoryInstallationStore.class);

  private final ConcurrentHashMap<ShopDomain, Installation> installations = new ConcurrentHashMap<>();
  private final ConcurrentHashMap<ShopDomain, WidgetConfig> configs = new ConcurrentHashMap<>();
  private final ConcurrentHashMap<ShopDomain, AnalyticsRecord> analytics = new ConcurrentHashMap<>();
  private final ConcurrentHashMap<String, OAuthState> oauthStates = new ConcurrentHashMap<>();
  private final TenantLocks locks = new TenantLocks();

  @Override
  public void storeInstallation(Installation installation) {
    commit(installation.shop(), () -> installations.put(installation.shop(), installation));
    log.debug("Stored installation shop={}", installation.shop());
  }

  @Override
  public Optional<Installation> loadInstallation(ShopDomain shop) {
    return Optional.ofNullable(installations.get(shop));
  }

  @Override
  public boolean deleteInstallation(ShopDomain shop) {
    boolean removed = commit(shop, () -> {
      configs.remove(shop);
      analytics.remove(shop);
      return installations.remove(shop) != null;
    });
    log.debug("Deleted installation shop={} removed={}", shop, removed);
    return removed;
  }

  @Override
  public Set<ShopDomain> installedShops() {
    return Set.copyOf(installations.keySet());
  }

  @Override
  public void storeWidgetConfig(WidgetConfig config) {
    commit(config.shop(), () -> {
      requireInstalled(config.shop());
      return configs.put(config.shop(), config);
    });
    log.debug("Stored widget config shop={}", config.shop());
  }

  @Override
  public Optional<WidgetConfig> loadWidgetConfig(ShopDomain shop) {
    return Optional.ofNullable(configs.get(shop));
  }

  @Override
  public boolean deleteWidgetConfig(ShopDomain shop) {
    return commit(shop, () -> configs.remove(shop) != null);
  }

  @Override
  public void storeAnalytics(AnalyticsRecord record) {
    commit(record.shop(), () -> {
      requireInstalled(record.shop());
      return analytics.put(record.shop(), record);
    });
  }

  @Override
  public Optional<AnalyticsRecord> loadAnalytics(ShopDomain shop) {
    return Optional.ofNullable(analytics.get(shop));
  }

  @Override
  public boolean deleteAnalytics(ShopDomain shop) {
    return commit(shop, () -> analytics.remove(shop) != null);
  }

  @Override
  public AnalyticsRecord incrementClicks(ShopDomain shop, Instant at) {
    return commit(shop, () -> {
      requireInstalled(shop);
      AnalyticsRecord next = analytics.getOrDefault(shop, AnalyticsRecord.empty(shop)).recordClick(at);
      analytics.put(shop, next);
      return next;
    });
  }

  @Override
  public void storeOAuthState(OAuthState state) {
    oauthStates.put(state.nonce(), state);
  }

  @Override
  public Optional<OAuthState> loadOAuthState(String nonce) {
    return Optional.ofNullable(oauthStates.get(nonce));
  }

  @Override
  public Optional<OAuthState> consumeOAuthState(String nonce) {
    return Optional.ofNullable(oauthStates.remove(nonce));
  }

  @Override
  public boolean deleteOAuthState(String nonce) {
    return oauthStates.remove(nonce) != null;
  }

  @Override
  public List<OAuthState> loadOAuthStates(ShopDomain shop) {
    return oauthStates.values().stream().filter(s -> s.shop().equals(shop)).toList();
  }

  @Override
  public int purgeExpiredOAuthStates(Instant now) {
    int before = oauthStates.size();
    oauthStates.values().removeIf(s -> s.isExpired(now));
    int purged = Math.max(0, before - oauthStates.size());
    if (purged > 0) {
      log.debug("Purged {} expired OAuth state(s)", purged);
    }
    return purged;
  }

  /**
   * Called after every change to an installation, configuration or analytics record, inside the
   * tenant lock and inside {@link #serialized(Supplier)}. If it throws, the shop's records are
   * put back to what they were before the change and the exception propagates. The default does
   * nothing.
   */
  protected void afterMutation() {
  }

  /**
   * Runs one whole mutation, change plus {@link #afterMutation()}. Subclasses that persist a
   * snapshot of every tenant override this to keep mutations of different shops from
   * interleaving. The default runs the work directly.
   */
  protected <T> T serialized(Supplier<T> work) {
    return work.get();
  }

  private <T> T commit(ShopDomain shop, Supplier<T> change) {
    Supplier<T> committed = () -> {
      TenantRecords before = recordsOf(shop);
      T result = change.get();
      try {
        afterMutation();
      } catch (RuntimeException e) {
        log.warn("Rolling back change for shop={} after a failed write", shop);
        before.restore();
        throw e;
      }
      return result;
    };
    Supplier<T> serializedCommit = () -> serialized(committed);
    return locks.withLock(shop, serializedCommit);
  }

  private TenantRecords recordsOf(ShopDomain shop) {
    return new TenantRecords(shop, installations.get(shop), configs.get(shop), analytics.get(shop));
  }

  /**
   * Replaces the tenant records wholesale. Used by subclasses to load durable state at startup.
   */
  protected void restore(Collection<Installation> installationList,
                         Collection<WidgetConfig> configList,
                         Collection<AnalyticsRecord> analyticsList) {
    installations.clear();
    configs.clear();
    analytics.clear();
    installationList.forEach(i -> installations.put(i.shop(), i));
    configList.stream().filter(c -> installations.containsKey(c.shop()))
        .forEach(c -> configs.put(c.shop(), c));
    analyticsList.stream().filter(a -> installations.containsKey(a.shop()))
        .forEach(a -> analytics.put(a.shop(), a));
  }

  protected Map<ShopDomain, Installation> installationSnapshot() {
    return Map.copyOf(installations);
  }

  protected Map<ShopDomain, WidgetConfig> configSnapshot() {
    return Map.copyOf(configs);
  }

  protected Map<ShopDomain, AnalyticsRecord> analyticsSnapshot() {
    return Map.copyOf(analytics);
  }

  private void requireInstalled(ShopDomain shop) {
    if (!installations.containsKey(shop)) {
      throw new UnknownTenantException(shop);
    }
  }

  private final class TenantRecords {

    private final ShopDomain shop;
    private final Installation installation;
    private final WidgetConfig config;
    private final AnalyticsRecord analyticsRecord;

    private TenantRecords(ShopDomain shop, Installation installation, WidgetConfig config,
                          AnalyticsRecord analyticsRecord) {
      this.shop = shop;
      this.installation = installation;
      this.config = config;
      this.analyticsRecord = analyticsRecord;
    }

    private void restore() {
      put(installations, installation);
      put(configs, config);
      put(analytics, analyticsRecord);
    }

    private <V> void put(ConcurrentHashMap<ShopDomain, V> map, V value) {
      if (value == null) {
        map.remove(shop);
      } else {
        map.put(shop, value);
      }
    }
  }
}
