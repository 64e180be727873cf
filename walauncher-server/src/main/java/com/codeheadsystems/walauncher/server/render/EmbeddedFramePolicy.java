package com.codeheadsystems.walauncher.server.render;

import com.codeheadsystems.walauncher.server.tenant.ShopDomain;

/**
 * Content-Security-Policy for pages rendered inside the platform admin iframe: only the
 * shop's own admin and the platform admin origin may frame them.
 */
public final class EmbeddedFramePolicy {

  private EmbeddedFramePolicy() {
  }

  public static String contentSecurityPolicy(String adminOrigin, ShopDomain shop) {
    return "frame-ancestors https://" + shop.value() + " " + adminOrigin + ";";
  }
}
