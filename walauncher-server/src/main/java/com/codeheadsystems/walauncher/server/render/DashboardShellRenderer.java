package com.codeheadsystems.walauncher.server.render;

/**
 * Produces the HTML document served at the embedded entry point. Applications that ship a real
 * frontend provide their own implementation.
 */
public interface DashboardShellRenderer {

  String render(DashboardView view);
}
