package com.codeheadsystems.walauncher.server.store;

import com.codeheadsystems.walauncher.server.tenant.ShopDomain;
import java.time.Instant;

/**
 * A pending authorization: the single-use nonce sent to the platform's consent screen.
 *
 * @param nonce     opaque random value echoed back as {@code state}
 * @param shop      the tenant the install was started for
 * @param issuedAt  when the install was started
 * @param expiresAt after this instant the nonce is no longer accepted
 */
public record OAuthState(String nonce, ShopDomain shop, Instant issuedAt, Instant expiresAt) {

  public boolean isExpired(Instant now) {
    return !now.isBefore(expiresAt);
  }
}
