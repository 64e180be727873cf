package com.codeheadsystems.walauncher.server.exceptions;

/**
 * Thrown when an OAuth callback carries a state nonce that is missing, unknown, already used,
 * expired, or issued for a different shop.
 */
public class InvalidStateException extends SecurityException {

  public InvalidStateException(final String message) {
    super(message);
  }
}
