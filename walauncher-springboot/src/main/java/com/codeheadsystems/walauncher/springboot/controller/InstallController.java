package com.codeheadsystems.walauncher.springboot.controller;

import com.codeheadsystems.walauncher.server.auth.LaunchRequestVerifier;
import com.codeheadsystems.walauncher.server.manager.InstallationManager;
import com.codeheadsystems.walauncher.server.store.Installation;
import java.net.URI;
import java.time.Clock;
import java.util.LinkedHashMap;
import java.util.Map;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.HttpHeaders;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;
import org.springframework.web.util.UriComponentsBuilder;

/**
 * The OAuth install flow: {@code /install} starts it, {@code /auth/callback} completes it.
 */
@RestController
public class InstallController {

  private static final Logger log = LoggerFactory.getLogger(InstallController.class);

  private final InstallationManager installationManager;
  private final LaunchRequestVerifier launchRequestVerifier;
  private final Clock clock;

  public InstallController(InstallationManager installationManager,
                           LaunchRequestVerifier launchRequestVerifier,
                           Clock clock) {
    this.installationManager = installationManager;
    this.launchRequestVerifier = launchRequestVerifier;
    this.clock = clock;
  }

  @GetMapping("/install")
  public ResponseEntity<Void> install(@RequestParam(value = "shop", required = false) String shop) {
    log.debug("install(shop={})", shop);
    return redirect(installationManager.beginInstall(shop));
  }

  /**
   * Completes the install and sends the merchant to the embedded entry point with a freshly
   * signed launch query.
   */
  @GetMapping("/auth/callback")
  public ResponseEntity<Void> callback(@RequestParam Map<String, String> params) {
    log.debug("callback(shop={})", params.get("shop"));
    launchRequestVerifier.verify(params);
    if (params.containsKey("error")) {
      log.warn("Authorization denied for shop={}", params.get("shop"));
      throw new IllegalArgumentException("Authorization was denied");
    }
    Installation installation = installationManager.completeAuthorization(
        params.get("shop"), params.get("code"), params.get("state"));

    Map<String, String> launch = new LinkedHashMap<>();
    launch.put("shop", installation.shop().value());
    if (params.get("host") != null) {
      launch.put("host", params.get("host"));
    }
    launch.put("timestamp", Long.toString(clock.instant().getEpochSecond()));
    launch.put(LaunchRequestVerifier.HMAC_PARAM, launchRequestVerifier.sign(launch));

    // Values go in as template variables so reserved characters such as '+' are percent-encoded.
    UriComponentsBuilder target = UriComponentsBuilder.fromPath("/embedded");
    launch.keySet().forEach(name -> target.queryParam(name, "{" + name + "}"));
    return redirect(target.encode().buildAndExpand(launch).toUri());
  }

  private static ResponseEntity<Void> redirect(URI location) {
    HttpHeaders headers = new HttpHeaders();
    headers.setLocation(location);
    return new ResponseEntity<>(headers, HttpStatus.FOUND);
  }
}
