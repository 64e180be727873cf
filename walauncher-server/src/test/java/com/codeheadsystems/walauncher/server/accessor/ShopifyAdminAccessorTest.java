package com.codeheadsystems.walauncher.server.accessor;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

import com.codeheadsystems.walauncher.model.platform.ScriptTag;
import com.codeheadsystems.walauncher.server.exceptions.AdminApiException;
import com.codeheadsystems.walauncher.server.tenant.ShopDomain;
import com.fasterxml.jackson.databind.ObjectMapper;
import java.io.IOException;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.net.http.HttpTimeoutException;
import java.time.Duration;
import java.util.List;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.Captor;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

@ExtendWith(MockitoExtension.class)
class ShopifyAdminAccessorTest {

  private static final ShopDomain SHOP = new ShopDomain("test-store.example");
  private static final AdminApiConfig CONFIG =
      new AdminApiConfig("test-client-id", "test-secret", "2023-10", Duration.ofSeconds(5));

  @Mock private HttpClient httpClient;
  @Mock private HttpResponse<String> httpResponse;
  @Captor private ArgumentCaptor<HttpRequest> requestCaptor;

  private ShopifyAdminAccessor accessor;

  @BeforeEach
  void setUp() {
    accessor = new ShopifyAdminAccessor(CONFIG, httpClient, new ObjectMapper());
  }

  @SuppressWarnings("unchecked")
  private void respond(int status, String body) throws Exception {
    when(httpClient.send(requestCaptor.capture(), any(HttpResponse.BodyHandler.class))).thenReturn(httpResponse);
    when(httpResponse.statusCode()).thenReturn(status);
    if (body != null) {
      when(httpResponse.body()).thenReturn(body);
    }
  }

  @Test
  void exchangeAuthorizationCode_postsToShopAndReturnsToken() throws Exception {
    respond(200, "{\"access_token\":\"shpat_abc\",\"scope\":\"write_script_tags\"}");

    assertThat(accessor.exchangeAuthorizationCode(SHOP, "auth-code")).isEqualTo("shpat_abc");

    HttpRequest request = requestCaptor.getValue();
    assertThat(request.method()).isEqualTo("POST");
    assertThat(request.uri().toString()).isEqualTo("https://test-store.example/admin/oauth/access_token");
    assertThat(request.timeout()).contains(Duration.ofSeconds(5));
    assertThat(request.headers().firstValue(ShopifyAdminAccessor.ACCESS_TOKEN_HEADER)).isEmpty();
  }

  @Test
  void exchangeAuthorizationCode_errorStatus_throws() throws Exception {
    respond(400, null);

    assertThatThrownBy(() -> accessor.exchangeAuthorizationCode(SHOP, "bad"))
        .isInstanceOf(AdminApiException.class)
        .satisfies(e -> assertThat(((AdminApiException) e).statusCode()).isEqualTo(400));
  }

  @Test
  void exchangeAuthorizationCode_noToken_throws() throws Exception {
    respond(200, "{\"scope\":\"write_script_tags\"}");

    assertThatThrownBy(() -> accessor.exchangeAuthorizationCode(SHOP, "auth-code"))
        .isInstanceOf(AdminApiException.class);
  }

  @Test
  void listScriptTags_sendsAccessTokenAndParses() throws Exception {
    respond(200, "{\"script_tags\":[{\"id\":7,\"event\":\"onload\",\"src\":\"https://app.example/w.js\","
        + "\"display_scope\":\"online_store\"}]}");

    List<ScriptTag> tags = accessor.listScriptTags(SHOP, "shpat_abc");

    assertThat(tags).containsExactly(new ScriptTag(7L, "onload", "https://app.example/w.js"));
    HttpRequest request = requestCaptor.getValue();
    assertThat(request.method()).isEqualTo("GET");
    assertThat(request.uri().toString())
        .isEqualTo("https://test-store.example/admin/api/2023-10/script_tags.json");
    assertThat(request.headers().firstValue(ShopifyAdminAccessor.ACCESS_TOKEN_HEADER)).contains("shpat_abc");
  }

  @Test
  void createScriptTag_postsEnvelope() throws Exception {
    respond(201, "{\"script_tag\":{\"id\":9,\"event\":\"onload\",\"src\":\"https://app.example/w.js\"}}");

    ScriptTag created = accessor.createScriptTag(SHOP, "shpat_abc", "https://app.example/w.js");

    assertThat(created.id()).isEqualTo(9L);
    assertThat(requestCaptor.getValue().method()).isEqualTo("POST");
    verify(httpResponse).statusCode();
  }

  @Test
  void unreadableBody_throws() throws Exception {
    respond(200, "<html>oops</html>");

    assertThatThrownBy(() -> accessor.listScriptTags(SHOP, "shpat_abc"))
        .isInstanceOf(AdminApiException.class)
        .hasCauseInstanceOf(IOException.class);
  }

  @Test
  @SuppressWarnings("unchecked")
  void timeout_throwsAdminApiException() throws Exception {
    when(httpClient.send(any(HttpRequest.class), any(HttpResponse.BodyHandler.class)))
        .thenThrow(new HttpTimeoutException("request timed out"));

    assertThatThrownBy(() -> accessor.listScriptTags(SHOP, "shpat_abc"))
        .isInstanceOf(AdminApiException.class)
        .hasMessageContaining("timed out")
        .hasCauseInstanceOf(HttpTimeoutException.class);
  }

  @Test
  @SuppressWarnings("unchecked")
  void interrupted_throwsAndKeepsInterruptFlag() throws Exception {
    when(httpClient.send(any(HttpRequest.class), any(HttpResponse.BodyHandler.class)))
        .thenThrow(new InterruptedException("interrupted"));

    assertThatThrownBy(() -> accessor.createScriptTag(SHOP, "shpat_abc", "https://app.example/w.js"))
        .isInstanceOf(AdminApiException.class)
        .hasCauseInstanceOf(InterruptedException.class);

    assertThat(Thread.currentThread().isInterrupted()).isTrue();
    Thread.interrupted();
  }

  @Test
  void config_toStringMasksSecret() {
    assertThat(CONFIG.toString()).doesNotContain("test-secret");
  }
}
