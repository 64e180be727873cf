package com.codeheadsystems.walauncher.springboot.controller;

import com.codeheadsystems.walauncher.model.webhook.AppUninstalledPayload;
import com.codeheadsystems.walauncher.server.auth.WebhookVerifier;
import com.codeheadsystems.walauncher.server.manager.InstallationManager;
import com.codeheadsystems.walauncher.server.tenant.ShopDomain;
import com.fasterxml.jackson.databind.ObjectMapper;
import java.io.IOException;
import java.util.Map;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.MediaType;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestHeader;
import org.springframework.web.bind.annotation.RestController;

/**
 * Platform webhooks. The body is taken as raw bytes so the signature is checked over exactly
 * what was sent, and parsed only afterwards.
 */
@RestController
public class WebhookController {

  private static final Logger log = LoggerFactory.getLogger(WebhookController.class);
  private static final String SHOP_DOMAIN_HEADER = "X-Shopify-Shop-Domain";

  private final WebhookVerifier webhookVerifier;
  private final InstallationManager installationManager;
  private final ObjectMapper objectMapper;

  public WebhookController(WebhookVerifier webhookVerifier,
                           InstallationManager installationManager,
                           ObjectMapper objectMapper) {
    this.webhookVerifier = webhookVerifier;
    this.installationManager = installationManager;
    this.objectMapper = objectMapper;
  }

  @PostMapping(value = "/webhooks/app/uninstalled", produces = MediaType.APPLICATION_JSON_VALUE)
  public Map<String, String> appUninstalled(
      @RequestBody(required = false) byte[] body,
      @RequestHeader(value = WebhookVerifier.SIGNATURE_HEADER, required = false) String signature,
      @RequestHeader(value = SHOP_DOMAIN_HEADER, required = false) String shopHeader) {
    webhookVerifier.verify(body, signature);

    final AppUninstalledPayload payload;
    try {
      payload = objectMapper.readValue(body, AppUninstalledPayload.class);
    } catch (IOException e) {
      throw new IllegalArgumentException("Unreadable webhook body", e);
    }
    String raw = payload.shopDomain() != null ? payload.shopDomain() : shopHeader;
    ShopDomain shop = ShopDomain.of(raw);
    installationManager.uninstall(shop);
    log.info("Processed app/uninstalled webhook for shop={}", shop);
    return Map.of("status", "ok");
  }
}
