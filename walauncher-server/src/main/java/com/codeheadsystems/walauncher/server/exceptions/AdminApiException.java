package com.codeheadsystems.walauncher.server.exceptions;

/**
 * Thrown when a call to the platform's admin API fails: transport error, timeout, error status
 * or an unreadable response.
 */
public class AdminApiException extends RuntimeException {

  private final int statusCode;

  /**
   * Instantiates a new Admin api exception.
   *
   * @param message    the message
   * @param statusCode the HTTP status, or -1 when no response was received
   * @param cause      the cause
   */
  public AdminApiException(final String message, final int statusCode, final Throwable cause) {
    super(message, cause);
    this.statusCode = statusCode;
  }

  public int statusCode() {
    return statusCode;
  }
}
