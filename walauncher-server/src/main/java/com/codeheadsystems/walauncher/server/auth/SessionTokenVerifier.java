package com.codeheadsystems.walauncher.server.auth;

import com.auth0.jwt.JWT;
import com.auth0.jwt.algorithms.Algorithm;
import com.auth0.jwt.exceptions.JWTDecodeException;
import com.auth0.jwt.exceptions.SignatureVerificationException;
import com.auth0.jwt.interfaces.DecodedJWT;
import com.codeheadsystems.walauncher.server.auth.SessionTokenException.Reason;
import com.codeheadsystems.walauncher.server.tenant.ShopDomain;
import java.time.Clock;
import java.time.Instant;
import java.util.List;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Verifies the session tokens the embedded frontend attaches to every API call.
 * <p>
 * Tokens are HS256 JWTs signed with the app's shared secret. Checks run in a fixed order and the
 * first failing check decides the {@link Reason}:
 * <ol>
 *   <li>structure (three base64url segments of JSON): {@link Reason#MALFORMED_TOKEN}</li>
 *   <li>algorithm and signature: {@link Reason#INVALID_SIGNATURE}</li>
 *   <li>{@code exp} and {@code nbf} against the clock, no leeway: {@link Reason#EXPIRED_TOKEN}</li>
 *   <li>{@code aud} contains the app client id: {@link Reason#AUDIENCE_MISMATCH}</li>
 * </ol>
 * The tenant is taken from the {@code dest} claim, falling back to {@code iss}. Verification is a
 * pure computation; it performs no I/O.
 */
public class SessionTokenVerifier {

  private static final Logger log = LoggerFactory.getLogger(SessionTokenVerifier.class);
  private static final String EXPECTED_ALGORITHM = "HS256";

  private final Algorithm algorithm;
  private final String clientId;
  private final Clock clock;

  /**
   * Creates a new SessionTokenVerifier.
   *
   * @param secret   the app's shared secret
   * @param clientId the app's public client identifier, the required audience
   * @param clock    time source for expiry checks
   */
  public SessionTokenVerifier(byte[] secret, String clientId, Clock clock) {
    if (clientId == null || clientId.isBlank()) {
      throw new IllegalArgumentException("clientId must not be blank");
    }
    this.algorithm = Algorithm.HMAC256(secret);
    this.clientId = clientId;
    this.clock = clock;
  }

  /**
   * Result of a successful verification.
   *
   * @param shop      the tenant the token was issued for
   * @param subject   the platform user id ({@code sub}), may be null
   * @param tokenId   the token id ({@code jti}), may be null
   * @param expiresAt the token expiry
   */
  public record VerifyResult(ShopDomain shop, String subject, String tokenId, Instant expiresAt) {
  }

  /**
   * Verifies a session token.
   *
   * @param token the raw token, without the {@code Bearer } prefix
   * @return the verified session
   * @throws SessionTokenException if any check fails
   */
  public VerifyResult verify(String token) {
    if (token == null || token.isBlank()) {
      throw reject(Reason.MALFORMED_TOKEN, "Session token is missing", null);
    }

    final DecodedJWT decoded;
    try {
      decoded = JWT.decode(token);
    } catch (JWTDecodeException e) {
      throw reject(Reason.MALFORMED_TOKEN, "Session token is not a well-formed JWT", e);
    }

    if (!EXPECTED_ALGORITHM.equals(decoded.getAlgorithm())) {
      throw reject(Reason.INVALID_SIGNATURE, "Unexpected signing algorithm", null);
    }
    try {
      algorithm.verify(decoded);
    } catch (SignatureVerificationException e) {
      throw reject(Reason.INVALID_SIGNATURE, "Session token signature is invalid", e);
    }

    Instant now = clock.instant();
    Instant expiresAt = decoded.getExpiresAtAsInstant();
    if (expiresAt == null) {
      throw reject(Reason.MALFORMED_TOKEN, "Session token has no expiry", null);
    }
    if (!now.isBefore(expiresAt)) {
      throw reject(Reason.EXPIRED_TOKEN, "Session token has expired", null);
    }
    Instant notBefore = decoded.getNotBeforeAsInstant();
    if (notBefore != null && now.isBefore(notBefore)) {
      throw reject(Reason.EXPIRED_TOKEN, "Session token is not yet valid", null);
    }

    List<String> audience = decoded.getAudience();
    if (audience == null || !audience.contains(clientId)) {
      throw reject(Reason.AUDIENCE_MISMATCH, "Session token audience does not match", null);
    }

    String destination = decoded.getClaim("dest").asString();
    String source = (destination != null && !destination.isBlank()) ? destination : decoded.getIssuer();
    final ShopDomain shop;
    try {
      shop = ShopDomain.of(source);
    } catch (IllegalArgumentException e) {
      throw reject(Reason.MALFORMED_TOKEN, "Session token does not name a shop", e);
    }
    log.debug("Verified session token for shop={}", shop);
    return new VerifyResult(shop, decoded.getSubject(), decoded.getId(), expiresAt);
  }

  private static SessionTokenException reject(Reason reason, String message, Throwable cause) {
    log.warn("Session token rejected: {}", reason);
    return new SessionTokenException(reason, message, cause);
  }
}
