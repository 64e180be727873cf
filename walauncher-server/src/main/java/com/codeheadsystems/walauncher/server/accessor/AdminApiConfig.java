package com.codeheadsystems.walauncher.server.accessor;

import com.codeheadsystems.walauncher.server.tenant.ShopDomain;
import java.net.URI;
import java.time.Duration;
import java.util.Objects;

/**
 * Connection settings for the platform admin API.
 *
 * @param clientId       the app's public client identifier
 * @param clientSecret   the app's shared secret
 * @param apiVersion     admin API version segment, e.g. {@code 2023-10}
 * @param requestTimeout per-request timeout for outbound calls
 */
public record AdminApiConfig(String clientId, String clientSecret, String apiVersion, Duration requestTimeout) {

  public AdminApiConfig {
    Objects.requireNonNull(clientId, "clientId");
    Objects.requireNonNull(clientSecret, "clientSecret");
    Objects.requireNonNull(apiVersion, "apiVersion");
    Objects.requireNonNull(requestTimeout, "requestTimeout");
  }

  /**
   * Base URI of a shop's admin, e.g. {@code https://test-store.myshopify.com/admin}.
   *
   * @param shop the tenant
   * @return the admin base URI
   */
  public URI adminBase(ShopDomain shop) {
    return URI.create("https://" + shop.value() + "/admin");
  }

  @Override
  public String toString() {
    return "AdminApiConfig[clientId=" + clientId + ", clientSecret=***, apiVersion=" + apiVersion
        + ", requestTimeout=" + requestTimeout + "]";
  }
}
