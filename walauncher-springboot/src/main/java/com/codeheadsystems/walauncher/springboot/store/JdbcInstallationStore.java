package com.codeheadsystems.walauncher.springboot.store;

import com.codeheadsystems.walauncher.server.store.AnalyticsRecord;
import com.codeheadsystems.walauncher.server.store.Installation;
import com.codeheadsystems.walauncher.server.store.InstallationStore;
import com.codeheadsystems.walauncher.server.store.OAuthState;
import com.codeheadsystems.walauncher.server.store.PersistenceException;
import com.codeheadsystems.walauncher.server.store.TenantLocks;
import com.codeheadsystems.walauncher.server.store.UnknownTenantException;
import com.codeheadsystems.walauncher.server.store.WidgetConfig;
import com.codeheadsystems.walauncher.server.tenant.ShopDomain;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.sql.Timestamp;
import java.time.Instant;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Optional;
import java.util.Set;
import java.util.function.Supplier;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.dao.DataAccessException;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.jdbc.core.RowMapper;
import org.springframework.transaction.PlatformTransactionManager;
import org.springframework.transaction.support.TransactionTemplate;

/**
 * Relational {@link InstallationStore} on Spring JDBC.
 * <p>
 * Creates its tables on startup if they do not exist. Widget configurations and analytics
 * reference the installation row with {@code ON DELETE CASCADE}; uninstall still deletes them
 * explicitly in the same transaction. Tenant-scoped writes run in a transaction under a
 * process-local {@link TenantLocks} stripe, and click increments use a single
 * {@code UPDATE ... SET widget_clicks = widget_clicks + 1}. Every {@link DataAccessException}
 * surfaces as a {@link PersistenceException}.
 */
public class JdbcInstallationStore implements InstallationStore {

  private static final Logger log = LoggerFactory.getLogger(JdbcInstallationStore.class);

  private static final List<String> SCHEMA = List.of(
      "CREATE TABLE IF NOT EXISTS walauncher_installations ("
          + "shop VARCHAR(255) PRIMARY KEY, "
          + "access_token VARCHAR(512) NOT NULL, "
          + "installed_at TIMESTAMP NOT NULL)",
      "CREATE TABLE IF NOT EXISTS walauncher_widget_configs ("
          + "shop VARCHAR(255) PRIMARY KEY REFERENCES walauncher_installations (shop) ON DELETE CASCADE, "
          + "phone_number VARCHAR(64) NOT NULL, "
          + "initial_message VARCHAR(1000) NOT NULL, "
          + "updated_at TIMESTAMP NOT NULL)",
      "CREATE TABLE IF NOT EXISTS walauncher_analytics ("
          + "shop VARCHAR(255) PRIMARY KEY REFERENCES walauncher_installations (shop) ON DELETE CASCADE, "
          + "widget_clicks BIGINT NOT NULL, "
          + "first_click TIMESTAMP, "
          + "last_click TIMESTAMP)",
      "CREATE TABLE IF NOT EXISTS walauncher_oauth_states ("
          + "nonce VARCHAR(128) PRIMARY KEY, "
          + "shop VARCHAR(255) NOT NULL, "
          + "issued_at TIMESTAMP NOT NULL, "
          + "expires_at TIMESTAMP NOT NULL)");

  private static final RowMapper<Installation> INSTALLATION = (rs, i) -> new Installation(
      new ShopDomain(rs.getString("shop")), rs.getString("access_token"), instant(rs, "installed_at"));
  private static final RowMapper<WidgetConfig> WIDGET_CONFIG = (rs, i) -> new WidgetConfig(
      new ShopDomain(rs.getString("shop")), rs.getString("phone_number"), rs.getString("initial_message"),
      instant(rs, "updated_at"));
  private static final RowMapper<AnalyticsRecord> ANALYTICS = (rs, i) -> new AnalyticsRecord(
      new ShopDomain(rs.getString("shop")), rs.getLong("widget_clicks"), instant(rs, "first_click"),
      instant(rs, "last_click"));
  private static final RowMapper<OAuthState> OAUTH_STATE = (rs, i) -> new OAuthState(
      rs.getString("nonce"), new ShopDomain(rs.getString("shop")), instant(rs, "issued_at"),
      instant(rs, "expires_at"));

  private final JdbcTemplate jdbc;
  private final TransactionTemplate tx;
  private final TenantLocks locks = new TenantLocks();

  public JdbcInstallationStore(JdbcTemplate jdbc, PlatformTransactionManager transactionManager) {
    this.jdbc = jdbc;
    this.tx = new TransactionTemplate(transactionManager);
    run("create schema", () -> {
      SCHEMA.forEach(jdbc::execute);
      return null;
    });
  }

  // ── Installations ────────────────────────────────────────────────────────

  @Override
  public void storeInstallation(Installation installation) {
    ShopDomain shop = installation.shop();
    locked(shop, "store installation", () -> {
      int updated = jdbc.update("UPDATE walauncher_installations SET access_token = ?, installed_at = ? WHERE shop = ?",
          installation.accessToken(), timestamp(installation.installedAt()), shop.value());
      if (updated == 0) {
        jdbc.update("INSERT INTO walauncher_installations (shop, access_token, installed_at) VALUES (?, ?, ?)",
            shop.value(), installation.accessToken(), timestamp(installation.installedAt()));
      }
      return null;
    });
    log.debug("Stored installation shop={}", shop);
  }

  @Override
  public Optional<Installation> loadInstallation(ShopDomain shop) {
    return run("load installation", () -> jdbc.query(
        "SELECT shop, access_token, installed_at FROM walauncher_installations WHERE shop = ?",
        INSTALLATION, shop.value()).stream().findFirst());
  }

  @Override
  public boolean deleteInstallation(ShopDomain shop) {
    boolean removed = locked(shop, "delete installation", () -> {
      jdbc.update("DELETE FROM walauncher_widget_configs WHERE shop = ?", shop.value());
      jdbc.update("DELETE FROM walauncher_analytics WHERE shop = ?", shop.value());
      return jdbc.update("DELETE FROM walauncher_installations WHERE shop = ?", shop.value()) > 0;
    });
    log.debug("Deleted installation shop={} removed={}", shop, removed);
    return removed;
  }

  @Override
  public Set<ShopDomain> installedShops() {
    return run("list installations", () -> new LinkedHashSet<>(jdbc.query(
        "SELECT shop FROM walauncher_installations ORDER BY shop",
        (rs, i) -> new ShopDomain(rs.getString("shop")))));
  }

  // ── Widget configuration ─────────────────────────────────────────────────

  @Override
  public void storeWidgetConfig(WidgetConfig config) {
    ShopDomain shop = config.shop();
    locked(shop, "store widget config", () -> {
      requireInstalled(shop);
      int updated = jdbc.update("UPDATE walauncher_widget_configs SET phone_number = ?, initial_message = ?, "
              + "updated_at = ? WHERE shop = ?",
          config.phoneNumber(), config.initialMessage(), timestamp(config.updatedAt()), shop.value());
      if (updated == 0) {
        jdbc.update("INSERT INTO walauncher_widget_configs (shop, phone_number, initial_message, updated_at) "
                + "VALUES (?, ?, ?, ?)",
            shop.value(), config.phoneNumber(), config.initialMessage(), timestamp(config.updatedAt()));
      }
      return null;
    });
  }

  @Override
  public Optional<WidgetConfig> loadWidgetConfig(ShopDomain shop) {
    return run("load widget config", () -> jdbc.query(
        "SELECT shop, phone_number, initial_message, updated_at FROM walauncher_widget_configs WHERE shop = ?",
        WIDGET_CONFIG, shop.value()).stream().findFirst());
  }

  @Override
  public boolean deleteWidgetConfig(ShopDomain shop) {
    return locked(shop, "delete widget config",
        () -> jdbc.update("DELETE FROM walauncher_widget_configs WHERE shop = ?", shop.value()) > 0);
  }

  // ── Analytics ────────────────────────────────────────────────────────────

  @Override
  public void storeAnalytics(AnalyticsRecord record) {
    ShopDomain shop = record.shop();
    locked(shop, "store analytics", () -> {
      requireInstalled(shop);
      int updated = jdbc.update("UPDATE walauncher_analytics SET widget_clicks = ?, first_click = ?, last_click = ? "
              + "WHERE shop = ?",
          record.widgetClicks(), timestamp(record.firstClick()), timestamp(record.lastClick()), shop.value());
      if (updated == 0) {
        jdbc.update("INSERT INTO walauncher_analytics (shop, widget_clicks, first_click, last_click) "
                + "VALUES (?, ?, ?, ?)",
            shop.value(), record.widgetClicks(), timestamp(record.firstClick()), timestamp(record.lastClick()));
      }
      return null;
    });
  }

  @Override
  public Optional<AnalyticsRecord> loadAnalytics(ShopDomain shop) {
    return run("load analytics", () -> selectAnalytics(shop));
  }

  @Override
  public boolean deleteAnalytics(ShopDomain shop) {
    return locked(shop, "delete analytics",
        () -> jdbc.update("DELETE FROM walauncher_analytics WHERE shop = ?", shop.value()) > 0);
  }

  @Override
  public AnalyticsRecord incrementClicks(ShopDomain shop, Instant at) {
    return locked(shop, "increment clicks", () -> {
      requireInstalled(shop);
      Timestamp now = timestamp(at);
      int updated = jdbc.update("UPDATE walauncher_analytics SET widget_clicks = widget_clicks + 1, "
          + "first_click = COALESCE(first_click, ?), last_click = ? WHERE shop = ?", now, now, shop.value());
      if (updated == 0) {
        jdbc.update("INSERT INTO walauncher_analytics (shop, widget_clicks, first_click, last_click) "
            + "VALUES (?, 1, ?, ?)", shop.value(), now, now);
      }
      return selectAnalytics(shop).orElseThrow();
    });
  }

  // ── OAuth states ─────────────────────────────────────────────────────────

  @Override
  public void storeOAuthState(OAuthState state) {
    run("store oauth state", () -> jdbc.update(
        "INSERT INTO walauncher_oauth_states (nonce, shop, issued_at, expires_at) VALUES (?, ?, ?, ?)",
        state.nonce(), state.shop().value(), timestamp(state.issuedAt()), timestamp(state.expiresAt())));
  }

  @Override
  public Optional<OAuthState> loadOAuthState(String nonce) {
    return run("load oauth state", () -> jdbc.query(
        "SELECT nonce, shop, issued_at, expires_at FROM walauncher_oauth_states WHERE nonce = ?",
        OAUTH_STATE, nonce).stream().findFirst());
  }

  /**
   * Deletes the row under the shop's lock; only the caller whose delete removed it gets the state.
   */
  @Override
  public Optional<OAuthState> consumeOAuthState(String nonce) {
    Optional<OAuthState> candidate = loadOAuthState(nonce);
    if (candidate.isEmpty()) {
      return Optional.empty();
    }
    return locked(candidate.get().shop(), "consume oauth state", () ->
        jdbc.update("DELETE FROM walauncher_oauth_states WHERE nonce = ?", nonce) == 1
            ? candidate : Optional.<OAuthState>empty());
  }

  @Override
  public boolean deleteOAuthState(String nonce) {
    return run("delete oauth state",
        () -> jdbc.update("DELETE FROM walauncher_oauth_states WHERE nonce = ?", nonce) > 0);
  }

  @Override
  public List<OAuthState> loadOAuthStates(ShopDomain shop) {
    return run("load oauth states", () -> jdbc.query(
        "SELECT nonce, shop, issued_at, expires_at FROM walauncher_oauth_states WHERE shop = ?",
        OAUTH_STATE, shop.value()));
  }

  @Override
  public int purgeExpiredOAuthStates(Instant now) {
    int purged = run("purge oauth states",
        () -> jdbc.update("DELETE FROM walauncher_oauth_states WHERE expires_at <= ?", timestamp(now)));
    if (purged > 0) {
      log.debug("Purged {} expired OAuth state(s)", purged);
    }
    return purged;
  }

  private Optional<AnalyticsRecord> selectAnalytics(ShopDomain shop) {
    return jdbc.query(
        "SELECT shop, widget_clicks, first_click, last_click FROM walauncher_analytics WHERE shop = ?",
        ANALYTICS, shop.value()).stream().findFirst();
  }

  private void requireInstalled(ShopDomain shop) {
    Integer count = jdbc.queryForObject(
        "SELECT COUNT(*) FROM walauncher_installations WHERE shop = ?", Integer.class, shop.value());
    if (count == null || count == 0) {
      throw new UnknownTenantException(shop);
    }
  }

  private <T> T locked(ShopDomain shop, String operation, Supplier<T> action) {
    return locks.withLock(shop, () -> run(operation, () -> tx.execute(status -> action.get())));
  }

  private <T> T run(String operation, Supplier<T> action) {
    try {
      return action.get();
    } catch (DataAccessException e) {
      log.error("Unable to {}", operation, e);
      throw new PersistenceException("Unable to " + operation, e);
    }
  }

  private static Timestamp timestamp(Instant instant) {
    return instant == null ? null : Timestamp.from(instant);
  }

  private static Instant instant(ResultSet rs, String column) throws SQLException {
    Timestamp value = rs.getTimestamp(column);
    return value == null ? null : value.toInstant();
  }
}
