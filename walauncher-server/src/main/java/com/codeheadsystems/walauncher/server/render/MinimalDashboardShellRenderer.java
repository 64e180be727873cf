package com.codeheadsystems.walauncher.server.render;

import java.net.URLEncoder;
import java.nio.charset.StandardCharsets;

/**
 * Bare HTML shell. Installed shops get a page that loads the frontend bridge and exposes the
 * launch context; shops without an installation get a link to start the install.
 */
public class MinimalDashboardShellRenderer implements DashboardShellRenderer {

  @Override
  public String render(DashboardView view) {
    StringBuilder html = new StringBuilder(1024)
        .append("<!DOCTYPE html>\n<html lang=\"en\">\n<head>\n<meta charset=\"utf-8\">\n")
        .append("<meta name=\"shopify-api-key\" content=\"").append(escape(view.clientId())).append("\">\n")
        .append("<title>WhatsApp Launcher</title>\n");
    if (view.installed()) {
      html.append("<script src=\"https://cdn.shopify.com/shopifycloud/app-bridge.js\"></script>\n")
          .append("</head>\n<body>\n")
          .append("<main id=\"dashboard\" data-shop=\"").append(escape(view.shop().value()))
          .append("\" data-host=\"").append(escape(view.host() == null ? "" : view.host()))
          .append("\" data-configured=\"").append(view.config() != null && view.config().configured())
          .append("\">\n<h1>WhatsApp Launcher</h1>\n</main>\n");
    } else {
      String installUrl = view.appUrl() + "/install?shop="
          + URLEncoder.encode(view.shop().value(), StandardCharsets.UTF_8);
      html.append("</head>\n<body>\n<main id=\"install\">\n<h1>WhatsApp Launcher</h1>\n")
          .append("<p>This app is not installed on ").append(escape(view.shop().value())).append(".</p>\n")
          .append("<a href=\"").append(escape(installUrl)).append("\" target=\"_top\">Install</a>\n</main>\n");
    }
    return html.append("</body>\n</html>\n").toString();
  }

  static String escape(String value) {
    StringBuilder out = new StringBuilder(value.length());
    for (char c : value.toCharArray()) {
      switch (c) {
        case '&' -> out.append("&amp;");
        case '<' -> out.append("&lt;");
        case '>' -> out.append("&gt;");
        case '"' -> out.append("&quot;");
        case '\'' -> out.append("&#39;");
        default -> out.append(c);
      }
    }
    return out.toString();
  }
}
