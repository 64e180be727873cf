package com.codeheadsystems.walauncher.server.store;

import com.codeheadsystems.walauncher.server.tenant.ShopDomain;
import java.time.Instant;
import java.util.Objects;

/**
 * Merchant-configured widget settings for one tenant.
 * <p>
 * The phone number is kept as the merchant entered it (trimmed). It is valid when, after
 * removing {@code +}, {@code -}, spaces and parentheses, 7 to 15 digits remain.
 *
 * @param shop           the tenant
 * @param phoneNumber    the WhatsApp number
 * @param initialMessage the prefilled chat message, at most {@value #MAX_MESSAGE_LENGTH} chars
 * @param updatedAt      last modification time
 */
public record WidgetConfig(ShopDomain shop, String phoneNumber, String initialMessage, Instant updatedAt) {

  public static final int MAX_MESSAGE_LENGTH = 1000;
  private static final int MIN_DIGITS = 7;
  private static final int MAX_DIGITS = 15;

  public WidgetConfig {
    Objects.requireNonNull(shop, "shop");
    Objects.requireNonNull(updatedAt, "updatedAt");
    if (phoneNumber == null || phoneNumber.isBlank()) {
      throw new IllegalArgumentException("Phone number is required");
    }
    phoneNumber = phoneNumber.trim();
    String digits = digitsOf(phoneNumber);
    if (!digits.chars().allMatch(Character::isDigit)
        || digits.length() < MIN_DIGITS || digits.length() > MAX_DIGITS) {
      throw new IllegalArgumentException("Invalid phone number format");
    }
    if (initialMessage == null || initialMessage.isBlank()) {
      throw new IllegalArgumentException("Initial message is required");
    }
    if (initialMessage.length() > MAX_MESSAGE_LENGTH) {
      throw new IllegalArgumentException("Initial message is too long");
    }
  }

  /**
   * The phone number reduced to its digits, as used in chat deep links.
   *
   * @return digits only
   */
  public String phoneDigits() {
    return digitsOf(phoneNumber);
  }

  private static String digitsOf(String phoneNumber) {
    return phoneNumber.replaceAll("[+\\-\\s()]", "");
  }
}
