package com.codeheadsystems.walauncher.server.render;

import com.codeheadsystems.walauncher.server.store.WidgetConfig;
import com.fasterxml.jackson.core.io.JsonStringEncoder;

/**
 * Floating chat button pinned to the bottom right of the storefront. A click opens a
 * {@code wa.me} deep link to the configured number with the initial message prefilled.
 */
public class MinimalWidgetScriptRenderer implements WidgetScriptRenderer {

  private static final String CHAT_BASE = "https://wa.me/";

  @Override
  public String render(WidgetConfig config) {
    String message = new String(JsonStringEncoder.getInstance().quoteAsString(config.initialMessage()));
    return "(function() {\n"
        + "  function mount() {\n"
        + "    if (document.getElementById('whatsapp-widget')) { return; }\n"
        + "    var button = document.createElement('div');\n"
        + "    button.id = 'whatsapp-widget';\n"
        + "    button.setAttribute('role', 'button');\n"
        + "    button.setAttribute('aria-label', 'Chat on WhatsApp');\n"
        + "    button.style.cssText = 'position:fixed;bottom:20px;right:20px;width:60px;height:60px;"
        + "background-color:#25D366;border-radius:50%;cursor:pointer;z-index:9999;"
        + "box-shadow:0 4px 12px rgba(0,0,0,0.15);';\n"
        + "    button.onclick = function() {\n"
        + "      var text = encodeURIComponent(\"" + message + "\");\n"
        + "      window.open('" + CHAT_BASE + config.phoneDigits() + "?text=' + text, '_blank');\n"
        + "    };\n"
        + "    document.body.appendChild(button);\n"
        + "  }\n"
        + "  if (document.readyState === 'loading') {\n"
        + "    document.addEventListener('DOMContentLoaded', mount);\n"
        + "  } else {\n"
        + "    mount();\n"
        + "  }\n"
        + "})();\n";
  }
}
