package com.codeheadsystems.walauncher.model.config;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * Body of {@code POST /api/configure-whatsapp}.
 * <p>
 * Field validation (digits-only phone number, bounded message) happens at the store boundary,
 * not here; this record only carries what the dashboard sent.
 *
 * @param phoneNumber    contact number in international form, e.g. {@code +15551234567}
 * @param initialMessage message pre-filled in the chat window
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public record WidgetConfigRequest(
    @JsonProperty("phone_number") String phoneNumber,
    @JsonProperty("initial_message") String initialMessage) {
}
