package com.codeheadsystems.walauncher.springboot.controller;

import com.codeheadsystems.walauncher.server.auth.LaunchRequestVerifier;
import com.codeheadsystems.walauncher.server.manager.InstallationManager;
import com.codeheadsystems.walauncher.server.manager.WidgetManager;
import com.codeheadsystems.walauncher.server.render.DashboardShellRenderer;
import com.codeheadsystems.walauncher.server.render.DashboardView;
import com.codeheadsystems.walauncher.server.render.EmbeddedFramePolicy;
import com.codeheadsystems.walauncher.server.tenant.ShopDomain;
import com.codeheadsystems.walauncher.springboot.config.WaLauncherProperties;
import java.util.Map;
import org.springframework.http.HttpHeaders;
import org.springframework.http.MediaType;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

/**
 * The embedded entry point the platform admin loads in its iframe.
 */
@RestController
public class EmbeddedController {

  private final LaunchRequestVerifier launchRequestVerifier;
  private final InstallationManager installationManager;
  private final WidgetManager widgetManager;
  private final DashboardShellRenderer renderer;
  private final WaLauncherProperties props;

  public EmbeddedController(LaunchRequestVerifier launchRequestVerifier,
                            InstallationManager installationManager,
                            WidgetManager widgetManager,
                            DashboardShellRenderer renderer,
                            WaLauncherProperties props) {
    this.launchRequestVerifier = launchRequestVerifier;
    this.installationManager = installationManager;
    this.widgetManager = widgetManager;
    this.renderer = renderer;
    this.props = props;
  }

  @GetMapping(value = "/embedded", produces = MediaType.TEXT_HTML_VALUE)
  public ResponseEntity<String> embedded(@RequestParam Map<String, String> params) {
    launchRequestVerifier.verify(params);
    ShopDomain shop = ShopDomain.of(params.get("shop"));
    boolean installed = installationManager.isInstalled(shop);
    DashboardView view = new DashboardView(shop, params.get("host"), props.getClientId(), props.getAppUrl(),
        installed, widgetManager.currentConfiguration(shop));
    return ResponseEntity.ok()
        .header("Content-Security-Policy", EmbeddedFramePolicy.contentSecurityPolicy(props.getAdminOrigin(), shop))
        .header(HttpHeaders.CACHE_CONTROL, "no-store")
        .contentType(MediaType.TEXT_HTML)
        .body(renderer.render(view));
  }
}
