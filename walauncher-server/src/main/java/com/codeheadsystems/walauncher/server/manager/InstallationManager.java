package com.codeheadsystems.walauncher.server.manager;

import com.codeheadsystems.walauncher.server.accessor.ShopifyAdminAccessor;
import com.codeheadsystems.walauncher.server.exceptions.AdminApiException;
import com.codeheadsystems.walauncher.server.exceptions.InvalidStateException;
import com.codeheadsystems.walauncher.server.exceptions.TokenExchangeException;
import com.codeheadsystems.walauncher.server.store.Installation;
import com.codeheadsystems.walauncher.server.store.InstallationStore;
import com.codeheadsystems.walauncher.server.store.OAuthState;
import com.codeheadsystems.walauncher.server.tenant.ShopDomain;
import java.net.URI;
import java.net.URLEncoder;
import java.nio.charset.StandardCharsets;
import java.security.SecureRandom;
import java.time.Clock;
import java.time.Instant;
import java.util.Base64;
import java.util.Optional;
import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.TimeUnit;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Framework-agnostic service driving the OAuth authorization-code install flow.
 * <p>
 * A shop moves from unauthenticated, to pending authorization once {@link #beginInstall} issued
 * a state nonce, to authorized once {@link #completeAuthorization} consumed that nonce and
 * stored an access token. Uninstalling returns it to unauthenticated.
 * <p>
 * <strong>Exception contract</strong> (callers should map these to HTTP responses):
 * <ul>
 *   <li>{@link IllegalArgumentException}: missing or malformed shop, code or parameters, HTTP 400</li>
 *   <li>{@link InvalidStateException}: unknown, reused, expired or mismatched state, HTTP 401</li>
 *   <li>{@link TokenExchangeException}: the platform refused or failed the exchange, HTTP 502</li>
 * </ul>
 */
public class InstallationManager {

  private static final Logger log = LoggerFactory.getLogger(InstallationManager.class);
  private static final Base64.Encoder NONCE_ENCODER = Base64.getUrlEncoder().withoutPadding();
  private static final int NONCE_BYTES = 32;

  private final InstallationStore store;
  private final ShopifyAdminAccessor accessor;
  private final InstallConfig config;
  private final SecureRandom random;
  private final Clock clock;

  private final ScheduledExecutorService stateReaper =
      Executors.newSingleThreadScheduledExecutor(r -> {
        Thread t = new Thread(r, "oauth-state-reaper");
        t.setDaemon(true);
        return t;
      });

  public InstallationManager(InstallationStore store,
                             ShopifyAdminAccessor accessor,
                             InstallConfig config,
                             SecureRandom random,
                             Clock clock) {
    this.store = store;
    this.accessor = accessor;
    this.config = config;
    this.random = random;
    this.clock = clock;
    long period = Math.max(1, config.stateTtl().toSeconds() / 4);
    stateReaper.scheduleAtFixedRate(this::purgeExpiredStates, period, period, TimeUnit.SECONDS);
  }

  /**
   * Shuts down the state reaper thread.
   * In Spring Boot, declare the bean with {@code @Bean(destroyMethod = "shutdown")}.
   */
  public void shutdown() {
    stateReaper.shutdown();
  }

  /**
   * Starts an install: records a fresh single-use state for the shop and returns the platform
   * consent URL to redirect the merchant to.
   *
   * @param rawShop the shop as given on the install request
   * @return the authorization URL
   * @throws IllegalArgumentException if the shop is missing or malformed
   */
  public URI beginInstall(String rawShop) {
    ShopDomain shop = ShopDomain.of(rawShop);
    byte[] bytes = new byte[NONCE_BYTES];
    random.nextBytes(bytes);
    String nonce = NONCE_ENCODER.encodeToString(bytes);
    Instant now = clock.instant();
    store.storeOAuthState(new OAuthState(nonce, shop, now, now.plus(config.stateTtl())));
    log.info("Install started for shop={}", shop);
    return URI.create("https://" + shop.value() + "/admin/oauth/authorize"
        + "?client_id=" + encode(config.clientId())
        + "&scope=" + encode(config.scopes())
        + "&redirect_uri=" + encode(config.redirectUri())
        + "&state=" + encode(nonce));
  }

  /**
   * Completes an install. The state is consumed before anything else happens, so a replayed
   * callback fails even if the first attempt failed later.
   *
   * @param rawShop the shop from the callback
   * @param code    the authorization code
   * @param nonce   the state from the callback
   * @return the stored installation
   */
  public Installation completeAuthorization(String rawShop, String code, String nonce) {
    ShopDomain shop = ShopDomain.of(rawShop);
    if (nonce == null || nonce.isBlank()) {
      throw new InvalidStateException("Missing state");
    }
    // A callback naming another shop must not burn the nonce of the shop it was issued to.
    store.loadOAuthState(nonce)
        .filter(pending -> !pending.shop().equals(shop))
        .ifPresent(pending -> {
          log.warn("State issued for shop={} presented for shop={}", pending.shop(), shop);
          throw new InvalidStateException("State does not match shop");
        });
    OAuthState state = store.consumeOAuthState(nonce)
        .orElseThrow(() -> new InvalidStateException("Unknown or already used state"));
    Instant now = clock.instant();
    if (state.isExpired(now)) {
      throw new InvalidStateException("Expired state");
    }
    if (!state.shop().equals(shop)) {
      throw new InvalidStateException("State does not match shop");
    }
    if (code == null || code.isBlank()) {
      throw new IllegalArgumentException("Missing authorization code");
    }

    final String accessToken;
    try {
      accessToken = accessor.exchangeAuthorizationCode(shop, code);
    } catch (AdminApiException e) {
      log.error("Token exchange failed for shop={} status={}", shop, e.statusCode());
      throw new TokenExchangeException("Token exchange failed", e);
    }
    Installation installation = new Installation(shop, accessToken, now);
    store.storeInstallation(installation);
    log.info("Installed shop={}", shop);
    return installation;
  }

  /**
   * Removes a shop's installation and everything keyed by it. Idempotent.
   *
   * @param shop the tenant
   * @return true if an installation existed
   */
  public boolean uninstall(ShopDomain shop) {
    boolean removed = store.deleteInstallation(shop);
    store.loadOAuthStates(shop).forEach(s -> store.deleteOAuthState(s.nonce()));
    log.info("Uninstalled shop={} existed={}", shop, removed);
    return removed;
  }

  public Optional<Installation> installation(ShopDomain shop) {
    return store.loadInstallation(shop);
  }

  public boolean isInstalled(ShopDomain shop) {
    return store.loadInstallation(shop).isPresent();
  }

  public InstallationState stateOf(ShopDomain shop) {
    if (isInstalled(shop)) {
      return InstallationState.AUTHORIZED;
    }
    Instant now = clock.instant();
    boolean pending = store.loadOAuthStates(shop).stream().anyMatch(s -> !s.isExpired(now));
    return pending ? InstallationState.PENDING_AUTHORIZATION : InstallationState.UNAUTHENTICATED;
  }

  void purgeExpiredStates() {
    try {
      store.purgeExpiredOAuthStates(clock.instant());
    } catch (RuntimeException e) {
      log.warn("Unable to purge expired OAuth states", e);
    }
  }

  private static String encode(String value) {
    return URLEncoder.encode(value, StandardCharsets.UTF_8);
  }
}
