package com.codeheadsystems.walauncher.server.store;

import com.codeheadsystems.walauncher.server.tenant.ShopDomain;
import java.time.Instant;
import java.util.Objects;

/**
 * Click counter for one tenant.
 *
 * @param shop         the tenant
 * @param widgetClicks number of recorded clicks, never negative
 * @param firstClick   time of the first click, null until one is recorded
 * @param lastClick    time of the most recent click, null until one is recorded
 */
public record AnalyticsRecord(ShopDomain shop, long widgetClicks, Instant firstClick, Instant lastClick) {

  public AnalyticsRecord {
    Objects.requireNonNull(shop, "shop");
    if (widgetClicks < 0) {
      throw new IllegalArgumentException("widgetClicks must not be negative");
    }
    if (widgetClicks > 0 && lastClick == null) {
      throw new IllegalArgumentException("lastClick is required once a click is recorded");
    }
  }

  public static AnalyticsRecord empty(ShopDomain shop) {
    return new AnalyticsRecord(shop, 0, null, null);
  }

  /**
   * Returns a copy with one more click recorded at the given time.
   *
   * @param at when the click happened
   * @return the updated record
   */
  public AnalyticsRecord recordClick(Instant at) {
    Objects.requireNonNull(at, "at");
    return new AnalyticsRecord(shop, widgetClicks + 1, firstClick == null ? at : firstClick, at);
  }
}
