package com.codeheadsystems.walauncher.server.auth;

/**
 * Thrown when a session token from the embedded frontend fails verification.
 * <p>
 * The {@link Reason} is for logging and tests only; HTTP adapters must answer every reason with
 * the same generic unauthorized response.
 */
public class SessionTokenException extends SecurityException {

  /**
   * Why a session token was rejected, in the order the checks run.
   */
  public enum Reason {
    MALFORMED_TOKEN,
    INVALID_SIGNATURE,
    EXPIRED_TOKEN,
    AUDIENCE_MISMATCH
  }

  private final Reason reason;

  public SessionTokenException(Reason reason, String message) {
    super(message);
    this.reason = reason;
  }

  public SessionTokenException(Reason reason, String message, Throwable cause) {
    super(message, cause);
    this.reason = reason;
  }

  public Reason reason() {
    return reason;
  }
}
