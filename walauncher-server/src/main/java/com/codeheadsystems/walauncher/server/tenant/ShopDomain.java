package com.codeheadsystems.walauncher.server.tenant;

import java.util.Locale;
import java.util.Objects;
import java.util.regex.Pattern;

/**
 * Normalized storefront domain; the sole key of every tenant-scoped record.
 * <p>
 * Instances are always lower case, carry no scheme, path or trailing dot, and consist of at
 * least two DNS labels. {@link #of(String)} strips a scheme, a path and a trailing dot; a value
 * carrying a port is rejected. Use {@link #of(String)} for anything that arrives from outside (query
 * parameters, token claims, webhook bodies); the canonical constructor only accepts values that
 * are already normalized.
 *
 * @param value the normalized domain, e.g. {@code test-store.myshopify.com}
 */
public record ShopDomain(String value) {

  private static final Pattern VALID = Pattern.compile(
      "^[a-z0-9](?:[a-z0-9-]*[a-z0-9])?(?:\\.[a-z0-9](?:[a-z0-9-]*[a-z0-9])?)+$");
  private static final int MAX_LENGTH = 255;

  public ShopDomain {
    Objects.requireNonNull(value, "value");
    if (value.length() > MAX_LENGTH || !VALID.matcher(value).matches()) {
      throw new IllegalArgumentException("Invalid shop domain");
    }
  }

  /**
   * Normalizes a raw shop reference. Accepts bare domains as well as URLs such as
   * {@code https://test-store.myshopify.com/admin}.
   *
   * @param raw the raw value
   * @return the normalized domain
   * @throws IllegalArgumentException if the value is missing or is not a domain
   */
  public static ShopDomain of(String raw) {
    if (raw == null || raw.isBlank()) {
      throw new IllegalArgumentException("Missing shop domain");
    }
    String candidate = raw.trim().toLowerCase(Locale.ROOT);
    if (candidate.startsWith("https://")) {
      candidate = candidate.substring("https://".length());
    } else if (candidate.startsWith("http://")) {
      candidate = candidate.substring("http://".length());
    }
    int slash = candidate.indexOf('/');
    if (slash >= 0) {
      candidate = candidate.substring(0, slash);
    }
    if (candidate.endsWith(".")) {
      candidate = candidate.substring(0, candidate.length() - 1);
    }
    return new ShopDomain(candidate);
  }

  @Override
  public String toString() {
    return value;
  }
}
