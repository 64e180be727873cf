package com.codeheadsystems.walauncher.server.auth;

/**
 * Thrown when a webhook delivery's signature is missing or does not match its body.
 */
public class WebhookSignatureException extends SecurityException {

  public WebhookSignatureException(String message) {
    super(message);
  }
}
