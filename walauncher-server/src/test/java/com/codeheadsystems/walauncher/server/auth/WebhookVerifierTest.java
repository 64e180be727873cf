package com.codeheadsystems.walauncher.server.auth;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatCode;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import java.nio.charset.StandardCharsets;
import java.util.Base64;
import java.util.HexFormat;
import javax.crypto.Mac;
import javax.crypto.spec.SecretKeySpec;
import org.junit.jupiter.api.Test;

class WebhookVerifierTest {

  private static final byte[] SECRET = "webhook-secret".getBytes(StandardCharsets.UTF_8);
  private static final byte[] BODY =
      "{\"id\": 1, \"domain\": \"test-store.example\",\n  \"name\": \"Test Store\"}".getBytes(StandardCharsets.UTF_8);

  private final WebhookVerifier verifier = new WebhookVerifier(SECRET);

  private static String platformSignature(byte[] body, byte[] secret) throws Exception {
    Mac mac = Mac.getInstance("HmacSHA256");
    mac.init(new SecretKeySpec(secret, "HmacSHA256"));
    return Base64.getEncoder().encodeToString(mac.doFinal(body));
  }

  @Test
  void sign_matchesPlatformSignature() throws Exception {
    assertThat(verifier.sign(BODY)).isEqualTo(platformSignature(BODY, SECRET));
  }

  @Test
  void verify_exactBody_accepted() throws Exception {
    String header = platformSignature(BODY, SECRET);

    assertThatCode(() -> verifier.verify(BODY, header)).doesNotThrowAnyException();
  }

  /**
   * The same JSON re-serialized (different whitespace, same content) no longer verifies.
   */
  @Test
  void verify_reserializedBody_rejected() throws Exception {
    String header = platformSignature(BODY, SECRET);
    ObjectMapper mapper = new ObjectMapper();
    JsonNode parsed = mapper.readTree(BODY);
    byte[] reserialized = mapper.writeValueAsBytes(parsed);

    assertThat(mapper.readTree(reserialized)).isEqualTo(parsed);
    assertThat(reserialized).isNotEqualTo(BODY);
    assertThatThrownBy(() -> verifier.verify(reserialized, header))
        .isInstanceOf(WebhookSignatureException.class);
  }

  @Test
  void verify_wrongSecret_rejected() throws Exception {
    String header = platformSignature(BODY, "other-secret".getBytes(StandardCharsets.UTF_8));

    assertThatThrownBy(() -> verifier.verify(BODY, header))
        .isInstanceOf(WebhookSignatureException.class)
        .isInstanceOf(SecurityException.class);
  }

  @Test
  void verify_missingHeader_rejected() {
    assertThatThrownBy(() -> verifier.verify(BODY, null)).isInstanceOf(WebhookSignatureException.class);
    assertThatThrownBy(() -> verifier.verify(BODY, "  ")).isInstanceOf(WebhookSignatureException.class);
  }

  @Test
  void verify_emptyBody_rejected() throws Exception {
    String header = platformSignature(new byte[0], SECRET);

    assertThatThrownBy(() -> verifier.verify(new byte[0], header)).isInstanceOf(WebhookSignatureException.class);
    assertThatThrownBy(() -> verifier.verify(null, header)).isInstanceOf(WebhookSignatureException.class);
  }

  @Test
  void verify_hexInsteadOfBase64_rejected() throws Exception {
    Mac mac = Mac.getInstance("HmacSHA256");
    mac.init(new SecretKeySpec(SECRET, "HmacSHA256"));
    String hex = HexFormat.of().formatHex(mac.doFinal(BODY));

    assertThatThrownBy(() -> verifier.verify(BODY, hex)).isInstanceOf(WebhookSignatureException.class);
  }

  @Test
  void constructor_emptySecret_throws() {
    assertThatThrownBy(() -> new WebhookVerifier(new byte[0])).isInstanceOf(IllegalArgumentException.class);
  }
}
