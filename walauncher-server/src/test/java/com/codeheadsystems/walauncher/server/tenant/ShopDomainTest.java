package com.codeheadsystems.walauncher.server.tenant;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.NullAndEmptySource;
import org.junit.jupiter.params.provider.ValueSource;

class ShopDomainTest {

  @ParameterizedTest
  @ValueSource(strings = {
      "test-store.example",
      "Test-Store.Example",
      "https://test-store.example",
      "http://test-store.example/",
      "https://test-store.example/admin",
      "  test-store.example.  "
  })
  void of_normalizesVariants(String raw) {
    assertThat(ShopDomain.of(raw)).isEqualTo(new ShopDomain("test-store.example"));
  }

  @ParameterizedTest
  @NullAndEmptySource
  @ValueSource(strings = {" ", "localhost", "bad_domain.example", "-store.example", "store.example:8443",
      "javascript:alert(1)", "store..example"})
  void of_rejectsInvalid(String raw) {
    assertThatThrownBy(() -> ShopDomain.of(raw)).isInstanceOf(IllegalArgumentException.class);
  }

  @Test
  void constructor_rejectsUnnormalizedValue() {
    assertThatThrownBy(() -> new ShopDomain("https://test-store.example"))
        .isInstanceOf(IllegalArgumentException.class);
  }

  @Test
  void toString_isTheDomain() {
    assertThat(ShopDomain.of("shop.myshopify.com").toString()).isEqualTo("shop.myshopify.com");
  }
}
