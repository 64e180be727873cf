package com.codeheadsystems.walauncher.server.accessor;

import com.codeheadsystems.walauncher.model.platform.AccessTokenRequest;
import com.codeheadsystems.walauncher.model.platform.AccessTokenResponse;
import com.codeheadsystems.walauncher.model.platform.ScriptTag;
import com.codeheadsystems.walauncher.model.platform.ScriptTagEnvelope;
import com.codeheadsystems.walauncher.model.platform.ScriptTagList;
import com.codeheadsystems.walauncher.server.exceptions.AdminApiException;
import com.codeheadsystems.walauncher.server.tenant.ShopDomain;
import com.fasterxml.jackson.databind.ObjectMapper;
import java.io.IOException;
import java.net.URI;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.net.http.HttpTimeoutException;
import java.util.List;
import javax.inject.Inject;
import javax.inject.Singleton;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Client for the platform admin API calls the app makes: the authorization code exchange and
 * script tag management.
 * <p>
 * Every request carries the configured timeout. Failures of any kind surface as
 * {@link AdminApiException}; access tokens and the client secret are never logged.
 */
@Singleton
public class ShopifyAdminAccessor {

  /**
   * Header carrying the per-shop access token on admin API calls.
   */
  public static final String ACCESS_TOKEN_HEADER = "X-Shopify-Access-Token";

  private static final Logger log = LoggerFactory.getLogger(ShopifyAdminAccessor.class);

  private final AdminApiConfig config;
  private final HttpClient httpClient;
  private final ObjectMapper objectMapper;

  /**
   * Instantiates a new Shopify admin accessor.
   *
   * @param config       the admin api config
   * @param httpClient   the http client
   * @param objectMapper the object mapper
   */
  @Inject
  public ShopifyAdminAccessor(final AdminApiConfig config,
                              final HttpClient httpClient,
                              final ObjectMapper objectMapper) {
    log.info("ShopifyAdminAccessor({})", config);
    this.config = config;
    this.httpClient = httpClient;
    this.objectMapper = objectMapper;
  }

  /**
   * Exchanges an authorization code for the shop's offline access token.
   *
   * @param shop the tenant
   * @param code the authorization code from the callback
   * @return the access token
   */
  public String exchangeAuthorizationCode(final ShopDomain shop, final String code) {
    log.trace("exchangeAuthorizationCode(shop={})", shop);
    final URI uri = URI.create(config.adminBase(shop) + "/oauth/access_token");
    final AccessTokenRequest body = new AccessTokenRequest(config.clientId(), config.clientSecret(), code);
    final AccessTokenResponse response = send(shop, jsonRequest(uri, null, body), AccessTokenResponse.class);
    if (response == null || response.accessToken() == null || response.accessToken().isBlank()) {
      throw new AdminApiException("Token exchange returned no access token for shop: " + shop, 200, null);
    }
    return response.accessToken();
  }

  /**
   * Lists the script tags registered on a storefront.
   *
   * @param shop        the tenant
   * @param accessToken the shop's access token
   * @return registered tags, possibly empty
   */
  public List<ScriptTag> listScriptTags(final ShopDomain shop, final String accessToken) {
    log.trace("listScriptTags(shop={})", shop);
    final HttpRequest request = baseRequest(scriptTagsUri(shop), accessToken).GET().build();
    final ScriptTagList list = send(shop, request, ScriptTagList.class);
    return list == null ? List.of() : list.scriptTags();
  }

  /**
   * Registers a script tag that loads {@code src} on every storefront page.
   *
   * @param shop        the tenant
   * @param accessToken the shop's access token
   * @param src         the loader URL
   * @return the created tag
   */
  public ScriptTag createScriptTag(final ShopDomain shop, final String accessToken, final String src) {
    log.trace("createScriptTag(shop={}, src={})", shop, src);
    final HttpRequest request = jsonRequest(scriptTagsUri(shop), accessToken,
        new ScriptTagEnvelope(ScriptTag.onload(src)));
    final ScriptTagEnvelope created = send(shop, request, ScriptTagEnvelope.class);
    return created == null ? null : created.scriptTag();
  }

  private URI scriptTagsUri(final ShopDomain shop) {
    return URI.create(config.adminBase(shop) + "/api/" + config.apiVersion() + "/script_tags.json");
  }

  private HttpRequest.Builder baseRequest(final URI uri, final String accessToken) {
    final HttpRequest.Builder builder = HttpRequest.newBuilder()
        .uri(uri)
        .timeout(config.requestTimeout())
        .header("Accept", "application/json");
    if (accessToken != null) {
      builder.header(ACCESS_TOKEN_HEADER, accessToken);
    }
    return builder;
  }

  private HttpRequest jsonRequest(final URI uri, final String accessToken, final Object body) {
    try {
      return baseRequest(uri, accessToken)
          .header("Content-Type", "application/json")
          .POST(HttpRequest.BodyPublishers.ofString(objectMapper.writeValueAsString(body)))
          .build();
    } catch (IOException e) {
      throw new AdminApiException("Unable to serialize admin API request", -1, e);
    }
  }

  private <T> T send(final ShopDomain shop, final HttpRequest request, final Class<T> responseType) {
    final HttpResponse<String> response;
    try {
      response = httpClient.send(request, HttpResponse.BodyHandlers.ofString());
    } catch (HttpTimeoutException e) {
      throw new AdminApiException("Admin API request timed out for shop: " + shop, -1, e);
    } catch (IOException e) {
      throw new AdminApiException("Admin API request failed for shop: " + shop, -1, e);
    } catch (InterruptedException e) {
      Thread.currentThread().interrupt();
      throw new AdminApiException("Admin API request interrupted for shop: " + shop, -1, e);
    }
    final int status = response.statusCode();
    if (status >= 300) {
      log.warn("Admin API {} {} returned HTTP {} for shop={}", request.method(), request.uri().getPath(), status, shop);
      throw new AdminApiException("Admin API returned HTTP " + status + " for shop: " + shop, status, null);
    }
    final String body = response.body();
    if (body == null || body.isBlank()) {
      return null;
    }
    try {
      return objectMapper.readValue(body, responseType);
    } catch (IOException e) {
      throw new AdminApiException("Unreadable admin API response for shop: " + shop, status, e);
    }
  }
}
