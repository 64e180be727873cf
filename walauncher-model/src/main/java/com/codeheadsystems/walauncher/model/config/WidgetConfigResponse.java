package com.codeheadsystems.walauncher.model.config;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;
import java.time.Instant;

/**
 * Body of {@code GET /api/config}.
 * <p>
 * When the shop has no saved configuration (or no installation at all) the response is the
 * explicit not-configured form: {@code {"configured": false}}.
 *
 * @param configured     whether a configuration exists for the shop
 * @param phoneNumber    saved contact number, absent when not configured
 * @param initialMessage saved initial message, absent when not configured
 * @param updatedAt      when the configuration was last saved, absent when not configured
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record WidgetConfigResponse(
    @JsonProperty("configured") boolean configured,
    @JsonProperty("phone_number") String phoneNumber,
    @JsonProperty("initial_message") String initialMessage,
    @JsonProperty("updated_at") Instant updatedAt) {

  public static WidgetConfigResponse notConfigured() {
    return new WidgetConfigResponse(false, null, null, null);
  }

  public static WidgetConfigResponse of(String phoneNumber, String initialMessage, Instant updatedAt) {
    return new WidgetConfigResponse(true, phoneNumber, initialMessage, updatedAt);
  }
}
