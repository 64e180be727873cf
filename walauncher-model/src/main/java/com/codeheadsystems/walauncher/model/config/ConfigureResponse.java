package com.codeheadsystems.walauncher.model.config;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * Result of saving a widget configuration.
 * <p>
 * {@code success} reflects the configuration save only. A failed loader registration is a
 * degraded success: {@code success} stays {@code true}, {@code widgetRegistration} is
 * {@link WidgetRegistrationStatus#FAILED} and {@code warning} explains it.
 *
 * @param success            whether the configuration was saved
 * @param message            human-readable summary
 * @param widgetRegistration outcome of the loader registration side effect
 * @param warning            non-fatal warning, absent when registration succeeded
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record ConfigureResponse(
    @JsonProperty("success") boolean success,
    @JsonProperty("message") String message,
    @JsonProperty("widget_registration") WidgetRegistrationStatus widgetRegistration,
    @JsonProperty("warning") String warning) {

  public static ConfigureResponse saved(WidgetRegistrationStatus status) {
    return new ConfigureResponse(true, "Configuration saved successfully", status, null);
  }

  public static ConfigureResponse savedWithRegistrationFailure() {
    return new ConfigureResponse(true, "Configuration saved; widget registration pending",
        WidgetRegistrationStatus.FAILED,
        "The storefront widget could not be registered. It will be retried on the next save.");
  }

  public boolean degraded() {
    return widgetRegistration == WidgetRegistrationStatus.FAILED;
  }
}
