package com.codeheadsystems.walauncher.server.auth;

import java.nio.charset.StandardCharsets;
import java.util.Base64;
import javax.crypto.spec.SecretKeySpec;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Verifies platform webhook deliveries.
 * <p>
 * The platform sends the base64 HMAC-SHA256 of the request body, keyed with the app's shared
 * secret, in {@value #SIGNATURE_HEADER}. The digest must be computed over the body bytes exactly
 * as received. Parsing and re-serializing the body first changes whitespace and key order, and
 * therefore the digest, so callers must hand over the raw bytes.
 */
public class WebhookVerifier {

  /**
   * Header carrying the webhook signature.
   */
  public static final String SIGNATURE_HEADER = "X-Shopify-Hmac-Sha256";

  private static final Logger log = LoggerFactory.getLogger(WebhookVerifier.class);
  private static final Base64.Encoder B64 = Base64.getEncoder();

  private final SecretKeySpec key;

  public WebhookVerifier(byte[] secret) {
    this.key = HmacSha256.key(secret);
  }

  /**
   * Computes the signature the platform would send for the given body.
   *
   * @param rawBody the body bytes
   * @return base64-encoded HMAC-SHA256
   */
  public String sign(byte[] rawBody) {
    return B64.encodeToString(HmacSha256.digest(key, rawBody));
  }

  /**
   * Verifies a delivery. Fails closed: a missing header or an empty body is a failure.
   *
   * @param rawBody         the body bytes exactly as received
   * @param signatureHeader the value of {@value #SIGNATURE_HEADER}
   * @throws WebhookSignatureException if the signature is missing or does not match
   */
  public void verify(byte[] rawBody, String signatureHeader) {
    if (signatureHeader == null || signatureHeader.isBlank()) {
      log.warn("Webhook rejected: missing signature header");
      throw new WebhookSignatureException("Missing webhook signature");
    }
    if (rawBody == null || rawBody.length == 0) {
      log.warn("Webhook rejected: empty body");
      throw new WebhookSignatureException("Missing webhook body");
    }
    byte[] expected = sign(rawBody).getBytes(StandardCharsets.US_ASCII);
    byte[] presented = signatureHeader.trim().getBytes(StandardCharsets.US_ASCII);
    if (!HmacSha256.constantTimeEquals(expected, presented)) {
      log.warn("Webhook rejected: signature mismatch");
      throw new WebhookSignatureException("Invalid webhook signature");
    }
  }
}
