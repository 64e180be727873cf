package com.codeheadsystems.walauncher.server.auth;

/**
 * Thrown when the signed query string of a launch or OAuth callback request does not verify.
 */
public class LaunchRequestException extends SecurityException {

  public LaunchRequestException(String message) {
    super(message);
  }
}
