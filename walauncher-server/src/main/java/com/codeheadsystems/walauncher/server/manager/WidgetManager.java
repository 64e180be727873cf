package com.codeheadsystems.walauncher.server.manager;

import com.codeheadsystems.walauncher.model.analytics.AnalyticsResponse;
import com.codeheadsystems.walauncher.model.config.ConfigureResponse;
import com.codeheadsystems.walauncher.model.config.WidgetConfigRequest;
import com.codeheadsystems.walauncher.model.config.WidgetConfigResponse;
import com.codeheadsystems.walauncher.model.config.WidgetRegistrationStatus;
import com.codeheadsystems.walauncher.server.exceptions.ScriptTagInstallException;
import com.codeheadsystems.walauncher.server.store.AnalyticsRecord;
import com.codeheadsystems.walauncher.server.store.Installation;
import com.codeheadsystems.walauncher.server.store.InstallationStore;
import com.codeheadsystems.walauncher.server.store.UnknownTenantException;
import com.codeheadsystems.walauncher.server.store.WidgetConfig;
import com.codeheadsystems.walauncher.server.tenant.ShopDomain;
import java.net.URLEncoder;
import java.nio.charset.StandardCharsets;
import java.time.Clock;
import java.util.Optional;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Framework-agnostic service behind the merchant dashboard API: widget configuration and click
 * analytics. Callers pass the shop from a verified session, never from the request body.
 * <p>
 * <strong>Exception contract</strong>:
 * <ul>
 *   <li>{@link IllegalArgumentException}: invalid configuration, HTTP 400</li>
 *   <li>{@link UnknownTenantException}: the shop is not installed, HTTP 404</li>
 * </ul>
 */
public class WidgetManager {

  private static final Logger log = LoggerFactory.getLogger(WidgetManager.class);

  private final InstallationStore store;
  private final ScriptTagInstaller scriptTagInstaller;
  private final String appUrl;
  private final Clock clock;

  public WidgetManager(InstallationStore store, ScriptTagInstaller scriptTagInstaller, String appUrl, Clock clock) {
    this.store = store;
    this.scriptTagInstaller = scriptTagInstaller;
    this.appUrl = appUrl.endsWith("/") ? appUrl.substring(0, appUrl.length() - 1) : appUrl;
    this.clock = clock;
  }

  /**
   * URL of the storefront loader script for a shop.
   *
   * @param shop the tenant
   * @return the loader URL
   */
  public String loaderUrl(ShopDomain shop) {
    return appUrl + "/whatsapp-widget.js?shop=" + URLEncoder.encode(shop.value(), StandardCharsets.UTF_8);
  }

  /**
   * Saves the configuration, then makes sure the loader is registered. The save stands even if
   * registration fails; the response then reports a degraded success.
   *
   * @param shop    the tenant from the verified session
   * @param request the submitted configuration
   * @return the save result
   */
  public ConfigureResponse saveConfiguration(ShopDomain shop, WidgetConfigRequest request) {
    if (request == null) {
      throw new IllegalArgumentException("Missing configuration");
    }
    Installation installation = store.loadInstallation(shop)
        .orElseThrow(() -> new UnknownTenantException(shop));
    WidgetConfig config = new WidgetConfig(shop, request.phoneNumber(), request.initialMessage(), clock.instant());
    store.storeWidgetConfig(config);
    log.info("Saved widget config for shop={}", shop);

    try {
      WidgetRegistrationStatus status = scriptTagInstaller.ensureRegistered(installation, loaderUrl(shop));
      return ConfigureResponse.saved(status);
    } catch (ScriptTagInstallException e) {
      log.warn("Widget config saved but loader registration failed for shop={}", shop, e);
      return ConfigureResponse.savedWithRegistrationFailure();
    }
  }

  public WidgetConfigResponse currentConfiguration(ShopDomain shop) {
    return store.loadWidgetConfig(shop)
        .map(c -> WidgetConfigResponse.of(c.phoneNumber(), c.initialMessage(), c.updatedAt()))
        .orElseGet(WidgetConfigResponse::notConfigured);
  }

  /**
   * Configuration the storefront loader renders. Present only for installed, configured shops.
   *
   * @param shop the tenant named by the loader URL
   * @return the saved configuration, or empty
   */
  public Optional<WidgetConfig> storefrontConfiguration(ShopDomain shop) {
    return store.loadWidgetConfig(shop);
  }

  public AnalyticsResponse analytics(ShopDomain shop) {
    if (store.loadInstallation(shop).isEmpty()) {
      return AnalyticsResponse.notConfigured();
    }
    AnalyticsRecord record = store.loadAnalytics(shop).orElseGet(() -> AnalyticsRecord.empty(shop));
    return toResponse(record);
  }

  /**
   * Records one widget click.
   *
   * @param shop the tenant from the verified session
   * @return analytics after the click
   * @throws UnknownTenantException if the shop is not installed
   */
  public AnalyticsResponse recordClick(ShopDomain shop) {
    AnalyticsRecord record = store.incrementClicks(shop, clock.instant());
    log.debug("Recorded widget click for shop={} total={}", shop, record.widgetClicks());
    return toResponse(record);
  }

  private static AnalyticsResponse toResponse(AnalyticsRecord record) {
    return AnalyticsResponse.of(record.widgetClicks(), record.firstClick(), record.lastClick());
  }
}
