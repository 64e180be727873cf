package com.codeheadsystems.walauncher.server.exceptions;

/**
 * Thrown when the authorization code could not be exchanged for an access token.
 */
public class TokenExchangeException extends RuntimeException {

  public TokenExchangeException(final String message, final Throwable cause) {
    super(message, cause);
  }
}
