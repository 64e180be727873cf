package com.codeheadsystems.walauncher.server.auth;

import java.nio.charset.StandardCharsets;
import java.time.Clock;
import java.time.DateTimeException;
import java.time.Duration;
import java.time.Instant;
import java.util.HexFormat;
import java.util.Locale;
import java.util.Map;
import java.util.TreeMap;
import java.util.stream.Collectors;
import javax.crypto.spec.SecretKeySpec;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Verifies the {@code hmac} query parameter the platform adds to app launch and OAuth callback
 * redirects.
 * <p>
 * The signed message is every parameter except {@code hmac} and {@code signature}, sorted by
 * name and joined as {@code name=value&name=value}. The signature is the lower-case hex
 * HMAC-SHA256 of that message keyed with the app's shared secret.
 * <p>
 * A correctly signed request must also carry a {@code timestamp} (epoch seconds) no further than
 * the configured maximum age from now, in either direction.
 */
public class LaunchRequestVerifier {

  public static final String HMAC_PARAM = "hmac";
  public static final String TIMESTAMP_PARAM = "timestamp";

  private static final Logger log = LoggerFactory.getLogger(LaunchRequestVerifier.class);
  private static final HexFormat HEX = HexFormat.of();

  private final SecretKeySpec key;
  private final Clock clock;
  private final Duration maxAge;

  public LaunchRequestVerifier(byte[] secret, Clock clock, Duration maxAge) {
    if (maxAge == null || maxAge.isNegative() || maxAge.isZero()) {
      throw new IllegalArgumentException("maxAge must be positive");
    }
    this.key = HmacSha256.key(secret);
    this.clock = clock;
    this.maxAge = maxAge;
  }

  public String sign(Map<String, String> queryParams) {
    return HEX.formatHex(HmacSha256.digest(key, message(queryParams).getBytes(StandardCharsets.UTF_8)));
  }

  /**
   * Verifies the query parameters of a launch or callback request.
   *
   * @param queryParams decoded, single-valued query parameters including {@code hmac}
   * @throws LaunchRequestException if {@code hmac} is missing or wrong, or {@code timestamp} is
   *                                missing, unparsable or outside the allowed age
   */
  public void verify(Map<String, String> queryParams) {
    String presented = queryParams == null ? null : queryParams.get(HMAC_PARAM);
    if (presented == null || presented.isBlank()) {
      log.warn("Launch request rejected: missing hmac");
      throw new LaunchRequestException("Missing request signature");
    }
    byte[] expected = sign(queryParams).getBytes(StandardCharsets.US_ASCII);
    if (!HmacSha256.constantTimeEquals(expected,
        presented.trim().toLowerCase(Locale.ROOT).getBytes(StandardCharsets.US_ASCII))) {
      log.warn("Launch request rejected: hmac mismatch");
      throw new LaunchRequestException("Invalid request signature");
    }
    requireFresh(queryParams.get(TIMESTAMP_PARAM));
  }

  private void requireFresh(String timestamp) {
    final Instant signedAt;
    try {
      signedAt = Instant.ofEpochSecond(Long.parseLong(timestamp == null ? "" : timestamp.trim()));
    } catch (NumberFormatException | DateTimeException e) {
      log.warn("Launch request rejected: missing or malformed timestamp");
      throw new LaunchRequestException("Invalid request timestamp");
    }
    Duration age = Duration.between(signedAt, clock.instant()).abs();
    if (age.compareTo(maxAge) > 0) {
      log.warn("Launch request rejected: timestamp {}s away from now", age.toSeconds());
      throw new LaunchRequestException("Stale request");
    }
  }

  private static String message(Map<String, String> queryParams) {
    return new TreeMap<>(queryParams).entrySet().stream()
        .filter(e -> !HMAC_PARAM.equals(e.getKey()) && !"signature".equals(e.getKey()))
        .map(e -> e.getKey() + "=" + (e.getValue() == null ? "" : e.getValue()))
        .collect(Collectors.joining("&"));
  }
}
