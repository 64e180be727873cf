package com.codeheadsystems.walauncher.model.config;

import com.fasterxml.jackson.annotation.JsonValue;

/**
 * Outcome of the best-effort widget loader registration that follows a configuration save.
 */
public enum WidgetRegistrationStatus {
  /** The loader was not registered yet and has now been registered. */
  REGISTERED("registered"),
  /** A registration for the loader URL already existed; nothing was changed. */
  ALREADY_PRESENT("already_present"),
  /** Registration failed after the permitted retry; the configuration is still saved. */
  FAILED("failed");

  private final String wireValue;

  WidgetRegistrationStatus(String wireValue) {
    this.wireValue = wireValue;
  }

  @JsonValue
  public String wireValue() {
    return wireValue;
  }
}
