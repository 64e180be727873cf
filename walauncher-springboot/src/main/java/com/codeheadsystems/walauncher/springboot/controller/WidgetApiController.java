package com.codeheadsystems.walauncher.springboot.controller;

import com.codeheadsystems.walauncher.model.analytics.AnalyticsResponse;
import com.codeheadsystems.walauncher.model.config.ConfigureResponse;
import com.codeheadsystems.walauncher.model.config.WidgetConfigRequest;
import com.codeheadsystems.walauncher.model.config.WidgetConfigResponse;
import com.codeheadsystems.walauncher.server.manager.WidgetManager;
import com.codeheadsystems.walauncher.springboot.security.ShopPrincipal;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.security.core.annotation.AuthenticationPrincipal;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

/**
 * Dashboard API. The tenant always comes from the authenticated principal.
 */
@RestController
@RequestMapping("/api")
public class WidgetApiController {

  private static final Logger log = LoggerFactory.getLogger(WidgetApiController.class);

  private final WidgetManager widgetManager;

  public WidgetApiController(WidgetManager widgetManager) {
    this.widgetManager = widgetManager;
  }

  @GetMapping("/config")
  public WidgetConfigResponse config(@AuthenticationPrincipal ShopPrincipal principal) {
    log.debug("config(shop={})", principal.shop());
    return widgetManager.currentConfiguration(principal.shop());
  }

  @PostMapping("/configure-whatsapp")
  public ConfigureResponse configure(@AuthenticationPrincipal ShopPrincipal principal,
                                     @RequestBody WidgetConfigRequest request) {
    log.debug("configure(shop={})", principal.shop());
    return widgetManager.saveConfiguration(principal.shop(), request);
  }

  @GetMapping("/analytics")
  public AnalyticsResponse analytics(@AuthenticationPrincipal ShopPrincipal principal) {
    return widgetManager.analytics(principal.shop());
  }

  @PostMapping("/widget-click")
  public AnalyticsResponse widgetClick(@AuthenticationPrincipal ShopPrincipal principal) {
    return widgetManager.recordClick(principal.shop());
  }
}
