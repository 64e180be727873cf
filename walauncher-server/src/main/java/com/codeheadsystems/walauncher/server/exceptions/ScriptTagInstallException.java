package com.codeheadsystems.walauncher.server.exceptions;

/**
 * Thrown when the widget loader could not be registered on a storefront after retrying.
 */
public class ScriptTagInstallException extends RuntimeException {

  public ScriptTagInstallException(final String message, final Throwable cause) {
    super(message, cause);
  }
}
