package com.codeheadsystems.walauncher.server.auth;

import java.security.GeneralSecurityException;
import java.security.MessageDigest;
import javax.crypto.Mac;
import javax.crypto.spec.SecretKeySpec;

/**
 * HMAC-SHA256 helpers shared by the request verifiers.
 * <p>
 * {@link Mac} instances are not thread-safe, so one is created per call.
 */
final class HmacSha256 {

  private static final String ALGORITHM = "HmacSHA256";

  private HmacSha256() {
  }

  static byte[] digest(SecretKeySpec key, byte[] data) {
    try {
      Mac mac = Mac.getInstance(ALGORITHM);
      mac.init(key);
      return mac.doFinal(data);
    } catch (GeneralSecurityException e) {
      throw new IllegalStateException("HmacSHA256 unavailable", e);
    }
  }

  static SecretKeySpec key(byte[] secret) {
    if (secret == null || secret.length == 0) {
      throw new IllegalArgumentException("HMAC secret must not be empty");
    }
    return new SecretKeySpec(secret, ALGORITHM);
  }

  static boolean constantTimeEquals(byte[] expected, byte[] presented) {
    return MessageDigest.isEqual(expected, presented);
  }
}
