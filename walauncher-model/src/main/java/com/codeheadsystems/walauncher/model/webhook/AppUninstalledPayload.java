package com.codeheadsystems.walauncher.model.webhook;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * The subset of the {@code app/uninstalled} webhook body the app reads.
 * <p>
 * The platform sends the full shop object; only the domain fields are needed to find the tenant.
 *
 * @param domain         the shop's primary domain as reported by the platform
 * @param myshopifyDomain the permanent platform domain of the shop, preferred when present
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public record AppUninstalledPayload(
    @JsonProperty("domain") String domain,
    @JsonProperty("myshopify_domain") String myshopifyDomain) {

  /**
   * The domain identifying the tenant, preferring the permanent platform domain.
   *
   * @return the raw shop domain, or null if the payload carries neither field
   */
  public String shopDomain() {
    if (myshopifyDomain != null && !myshopifyDomain.isBlank()) {
      return myshopifyDomain;
    }
    return domain;
  }
}
