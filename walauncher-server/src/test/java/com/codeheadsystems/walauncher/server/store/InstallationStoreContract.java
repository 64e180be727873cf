package com.codeheadsystems.walauncher.server.store;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatCode;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import com.codeheadsystems.walauncher.server.tenant.ShopDomain;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.concurrent.Callable;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

/**
 * Behaviour every {@link InstallationStore} must share. Subclasses supply the store.
 */
public abstract class InstallationStoreContract {

  protected static final ShopDomain SHOP = new ShopDomain("test-store.example");
  protected static final ShopDomain OTHER = new ShopDomain("other-store.example");
  protected static final Instant T0 = Instant.parse("2026-01-15T12:00:00Z");

  protected InstallationStore store;

  protected abstract InstallationStore newStore() throws Exception;

  @BeforeEach
  public void createStore() throws Exception {
    store = newStore();
  }

  @AfterEach
  public void shutdownStore() {
    store.shutdown();
  }

  protected static Installation installation(ShopDomain shop) {
    return new Installation(shop, "shpat_" + shop.value(), T0);
  }

  protected static WidgetConfig config(ShopDomain shop) {
    return new WidgetConfig(shop, "+15551234567", "Hi", T0);
  }

  @Test
  public void installation_storeAndLoad() {
    store.storeInstallation(installation(SHOP));

    assertThat(store.loadInstallation(SHOP)).contains(installation(SHOP));
    assertThat(store.loadInstallation(OTHER)).isEmpty();
    assertThat(store.installedShops()).containsExactly(SHOP);
  }

  @Test
  public void installation_upsertReplacesToken() {
    store.storeInstallation(installation(SHOP));
    Installation replaced = new Installation(SHOP, "shpat_new", T0.plusSeconds(10));
    store.storeInstallation(replaced);

    assertThat(store.loadInstallation(SHOP)).contains(replaced);
  }

  @Test
  public void widgetConfig_withoutInstallation_unknownTenant() {
    assertThatThrownBy(() -> store.storeWidgetConfig(config(SHOP)))
        .isInstanceOf(UnknownTenantException.class);
    assertThat(store.loadWidgetConfig(SHOP)).isEmpty();
  }

  @Test
  public void analytics_withoutInstallation_unknownTenant() {
    assertThatThrownBy(() -> store.storeAnalytics(AnalyticsRecord.empty(SHOP)))
        .isInstanceOf(UnknownTenantException.class);
    assertThatThrownBy(() -> store.incrementClicks(SHOP, T0))
        .isInstanceOf(UnknownTenantException.class);
  }

  @Test
  public void widgetConfig_storeLoadDelete() {
    store.storeInstallation(installation(SHOP));
    store.storeWidgetConfig(config(SHOP));

    assertThat(store.loadWidgetConfig(SHOP)).contains(config(SHOP));
    assertThat(store.deleteWidgetConfig(SHOP)).isTrue();
    assertThat(store.loadWidgetConfig(SHOP)).isEmpty();
    assertThat(store.deleteWidgetConfig(SHOP)).isFalse();
    assertThat(store.loadInstallation(SHOP)).isPresent();
  }

  @Test
  public void analytics_storeLoadDelete() {
    store.storeInstallation(installation(SHOP));
    AnalyticsRecord record = new AnalyticsRecord(SHOP, 3, T0, T0.plusSeconds(30));
    store.storeAnalytics(record);

    assertThat(store.loadAnalytics(SHOP)).contains(record);
    assertThat(store.deleteAnalytics(SHOP)).isTrue();
    assertThat(store.loadAnalytics(SHOP)).isEmpty();
  }

  @Test
  public void deleteInstallation_cascadesAndIsIdempotent() {
    store.storeInstallation(installation(SHOP));
    store.storeWidgetConfig(config(SHOP));
    store.incrementClicks(SHOP, T0);
    store.storeInstallation(installation(OTHER));
    store.storeWidgetConfig(config(OTHER));

    assertThat(store.deleteInstallation(SHOP)).isTrue();

    assertThat(store.loadInstallation(SHOP)).isEmpty();
    assertThat(store.loadWidgetConfig(SHOP)).isEmpty();
    assertThat(store.loadAnalytics(SHOP)).isEmpty();
    assertThat(store.loadWidgetConfig(OTHER)).isPresent();
    assertThat(store.installedShops()).containsExactly(OTHER);

    assertThatCode(() -> assertThat(store.deleteInstallation(SHOP)).isFalse()).doesNotThrowAnyException();
  }

  @Test
  public void incrementClicks_tracksFirstAndLast() {
    store.storeInstallation(installation(SHOP));

    AnalyticsRecord first = store.incrementClicks(SHOP, T0);
    AnalyticsRecord second = store.incrementClicks(SHOP, T0.plusSeconds(60));

    assertThat(first.widgetClicks()).isEqualTo(1);
    assertThat(second.widgetClicks()).isEqualTo(2);
    assertThat(second.firstClick()).isEqualTo(T0);
    assertThat(second.lastClick()).isEqualTo(T0.plusSeconds(60));
    assertThat(store.loadAnalytics(SHOP)).contains(second);
  }

  /**
   * N concurrent increments for one shop end at exactly N.
   */
  @Test
  public void incrementClicks_concurrent_noLostUpdates() throws Exception {
    store.storeInstallation(installation(SHOP));
    store.storeInstallation(installation(OTHER));
    int clicks = 200;
    ExecutorService pool = Executors.newFixedThreadPool(16);
    CountDownLatch start = new CountDownLatch(1);
    try {
      List<Future<?>> futures = new ArrayList<>();
      for (int i = 0; i < clicks; i++) {
        ShopDomain target = (i % 4 == 0) ? OTHER : SHOP;
        futures.add(pool.submit(() -> {
          start.await();
          return store.incrementClicks(target, T0);
        }));
      }
      start.countDown();
      for (Future<?> f : futures) {
        f.get(30, TimeUnit.SECONDS);
      }
    } finally {
      pool.shutdownNow();
    }

    assertThat(store.loadAnalytics(SHOP).orElseThrow().widgetClicks()).isEqualTo(150);
    assertThat(store.loadAnalytics(OTHER).orElseThrow().widgetClicks()).isEqualTo(50);
  }

  @Test
  public void oauthState_storeLoadDelete() {
    OAuthState state = new OAuthState("nonce-1", SHOP, T0, T0.plusSeconds(600));
    store.storeOAuthState(state);

    assertThat(store.loadOAuthState("nonce-1")).contains(state);
    assertThat(store.loadOAuthStates(SHOP)).containsExactly(state);
    assertThat(store.loadOAuthStates(OTHER)).isEmpty();
    assertThat(store.deleteOAuthState("nonce-1")).isTrue();
    assertThat(store.loadOAuthState("nonce-1")).isEmpty();
  }

  @Test
  public void consumeOAuthState_onlyOnce() {
    store.storeOAuthState(new OAuthState("nonce-1", SHOP, T0, T0.plusSeconds(600)));

    assertThat(store.consumeOAuthState("nonce-1")).isPresent();
    assertThat(store.consumeOAuthState("nonce-1")).isEmpty();
    assertThat(store.consumeOAuthState("never-issued")).isEmpty();
  }

  @Test
  public void consumeOAuthState_concurrent_singleWinner() throws Exception {
    store.storeOAuthState(new OAuthState("nonce-race", SHOP, T0, T0.plusSeconds(600)));
    int callers = 8;
    ExecutorService pool = Executors.newFixedThreadPool(callers);
    CountDownLatch start = new CountDownLatch(1);
    List<Future<Optional<OAuthState>>> results = new ArrayList<>();
    try {
      for (int i = 0; i < callers; i++) {
        Callable<Optional<OAuthState>> call = () -> {
          start.await();
          return store.consumeOAuthState("nonce-race");
        };
        results.add(pool.submit(call));
      }
      start.countDown();
      int winners = 0;
      for (Future<Optional<OAuthState>> f : results) {
        if (f.get(30, TimeUnit.SECONDS).isPresent()) {
          winners++;
        }
      }
      assertThat(winners).isEqualTo(1);
    } finally {
      pool.shutdownNow();
    }
  }

  @Test
  public void purgeExpiredOAuthStates_removesOnlyExpired() {
    store.storeOAuthState(new OAuthState("old", SHOP, T0, T0.plusSeconds(10)));
    store.storeOAuthState(new OAuthState("fresh", SHOP, T0, T0.plusSeconds(600)));

    assertThat(store.purgeExpiredOAuthStates(T0.plusSeconds(10))).isEqualTo(1);
    assertThat(store.loadOAuthState("old")).isEmpty();
    assertThat(store.loadOAuthState("fresh")).isPresent();
  }
}
