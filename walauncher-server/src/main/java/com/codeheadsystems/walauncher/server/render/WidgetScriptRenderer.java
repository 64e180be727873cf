package com.codeheadsystems.walauncher.server.render;

import com.codeheadsystems.walauncher.server.store.WidgetConfig;

/**
 * Produces the storefront loader script for a configured shop. Applications that ship their own
 * widget provide their own implementation.
 */
public interface WidgetScriptRenderer {

  String render(WidgetConfig config);
}
