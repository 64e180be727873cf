package com.codeheadsystems.walauncher.model.analytics;

import com.fasterxml.jackson.annotation.JsonProperty;
import java.time.Instant;

/**
 * Body of {@code GET /api/analytics} and {@code POST /api/widget-click}.
 * <p>
 * An installed shop without clicks reports zero clicks and null timestamps. A shop without an
 * installation reports {@code configured=false} with the same zero values.
 *
 * @param configured   whether the shop is installed
 * @param widgetClicks total recorded clicks
 * @param firstClick   time of the first recorded click, or null
 * @param lastClick    time of the most recent click, or null
 */
public record AnalyticsResponse(
    @JsonProperty("configured") boolean configured,
    @JsonProperty("widget_clicks") long widgetClicks,
    @JsonProperty("first_click") Instant firstClick,
    @JsonProperty("last_click") Instant lastClick) {

  public static AnalyticsResponse notConfigured() {
    return new AnalyticsResponse(false, 0L, null, null);
  }

  public static AnalyticsResponse of(long widgetClicks, Instant firstClick, Instant lastClick) {
    return new AnalyticsResponse(true, widgetClicks, firstClick, lastClick);
  }
}
