package com.codeheadsystems.walauncher.springboot.controller;

import com.codeheadsystems.walauncher.server.manager.WidgetManager;
import com.codeheadsystems.walauncher.server.render.WidgetScriptRenderer;
import com.codeheadsystems.walauncher.server.tenant.ShopDomain;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.CacheControl;
import org.springframework.http.MediaType;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

/**
 * The storefront loader registered as a script tag. Public: storefront visitors carry no
 * session. Shops without a saved configuration get an empty script.
 */
@RestController
public class WidgetScriptController {

  private static final Logger log = LoggerFactory.getLogger(WidgetScriptController.class);
  static final MediaType JAVASCRIPT = MediaType.parseMediaType("application/javascript;charset=UTF-8");

  private final WidgetManager widgetManager;
  private final WidgetScriptRenderer renderer;

  public WidgetScriptController(WidgetManager widgetManager, WidgetScriptRenderer renderer) {
    this.widgetManager = widgetManager;
    this.renderer = renderer;
  }

  @GetMapping("/whatsapp-widget.js")
  public ResponseEntity<String> loader(@RequestParam(value = "shop", required = false) String rawShop) {
    ShopDomain shop = ShopDomain.of(rawShop);
    log.debug("loader(shop={})", shop);
    String script = widgetManager.storefrontConfiguration(shop).map(renderer::render).orElse("");
    return ResponseEntity.ok()
        .contentType(JAVASCRIPT)
        .cacheControl(CacheControl.noCache())
        .body(script);
  }
}
