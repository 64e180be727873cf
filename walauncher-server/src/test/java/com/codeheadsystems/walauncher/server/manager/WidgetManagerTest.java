package com.codeheadsystems.walauncher.server.manager;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.verifyNoInteractions;
import static org.mockito.Mockito.when;

import com.codeheadsystems.walauncher.model.analytics.AnalyticsResponse;
import com.codeheadsystems.walauncher.model.config.ConfigureResponse;
import com.codeheadsystems.walauncher.model.config.WidgetConfigRequest;
import com.codeheadsystems.walauncher.model.config.WidgetConfigResponse;
import com.codeheadsystems.walauncher.model.config.WidgetRegistrationStatus;
import com.codeheadsystems.walauncher.server.exceptions.ScriptTagInstallException;
import com.codeheadsystems.walauncher.server.store.InMemoryInstallationStore;
import com.codeheadsystems.walauncher.server.store.Installation;
import com.codeheadsystems.walauncher.server.store.UnknownTenantException;
import com.codeheadsystems.walauncher.server.store.WidgetConfig;
import com.codeheadsystems.walauncher.server.tenant.ShopDomain;
import java.time.Clock;
import java.time.Instant;
import java.time.ZoneOffset;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.ValueSource;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

@ExtendWith(MockitoExtension.class)
class WidgetManagerTest {

  private static final ShopDomain SHOP = new ShopDomain("test-store.example");
  private static final Instant NOW = Instant.parse("2026-01-15T12:00:00Z");
  private static final String LOADER = "https://app.example/whatsapp-widget.js?shop=test-store.example";

  @Mock private ScriptTagInstaller scriptTagInstaller;

  private InMemoryInstallationStore store;
  private WidgetManager manager;

  @BeforeEach
  void setUp() {
    store = new InMemoryInstallationStore();
    manager = new WidgetManager(store, scriptTagInstaller, "https://app.example", Clock.fixed(NOW, ZoneOffset.UTC));
  }

  private void install() {
    store.storeInstallation(new Installation(SHOP, "shpat_token", NOW));
  }

  @Test
  void storefrontConfiguration_onlyForConfiguredShops() {
    assertThat(manager.storefrontConfiguration(SHOP)).isEmpty();
    install();
    assertThat(manager.storefrontConfiguration(SHOP)).isEmpty();
    store.storeWidgetConfig(new WidgetConfig(SHOP, "+15551234567", "Hi", NOW));

    assertThat(manager.storefrontConfiguration(SHOP)).contains(new WidgetConfig(SHOP, "+15551234567", "Hi", NOW));
  }

  @Test
  void loaderUrl_pointsAtWidgetScript() {
    assertThat(manager.loaderUrl(SHOP)).isEqualTo(LOADER);
  }

  @Test
  void saveConfiguration_savesAndRegisters() {
    install();
    when(scriptTagInstaller.ensureRegistered(any(), any())).thenReturn(WidgetRegistrationStatus.REGISTERED);

    ConfigureResponse response = manager.saveConfiguration(SHOP, new WidgetConfigRequest("+15551234567", "Hi"));

    assertThat(response.success()).isTrue();
    assertThat(response.degraded()).isFalse();
    assertThat(response.widgetRegistration()).isEqualTo(WidgetRegistrationStatus.REGISTERED);
    assertThat(manager.currentConfiguration(SHOP))
        .isEqualTo(WidgetConfigResponse.of("+15551234567", "Hi", NOW));
  }

  /**
   * A failed registration still keeps the saved configuration.
   */
  @Test
  void saveConfiguration_registrationFails_degradedSuccess() {
    install();
    when(scriptTagInstaller.ensureRegistered(any(), any()))
        .thenThrow(new ScriptTagInstallException("down", null));

    ConfigureResponse response = manager.saveConfiguration(SHOP, new WidgetConfigRequest("+15551234567", "Hi"));

    assertThat(response.success()).isTrue();
    assertThat(response.degraded()).isTrue();
    assertThat(response.warning()).isNotBlank();
    assertThat(manager.currentConfiguration(SHOP).configured()).isTrue();
  }

  @ParameterizedTest
  @ValueSource(strings = {"", "12345", "+1 555 CALL NOW", "1234567890123456"})
  void saveConfiguration_invalidPhone_rejectedAndNothingSaved(String phone) {
    install();

    assertThatThrownBy(() -> manager.saveConfiguration(SHOP, new WidgetConfigRequest(phone, "Hi")))
        .isInstanceOf(IllegalArgumentException.class);
    assertThat(manager.currentConfiguration(SHOP).configured()).isFalse();
    verifyNoInteractions(scriptTagInstaller);
  }

  @Test
  void saveConfiguration_formattedPhone_accepted() {
    install();
    when(scriptTagInstaller.ensureRegistered(any(), any())).thenReturn(WidgetRegistrationStatus.ALREADY_PRESENT);

    manager.saveConfiguration(SHOP, new WidgetConfigRequest(" +1 (555) 123-4567 ", "Hello there"));

    assertThat(manager.currentConfiguration(SHOP).phoneNumber()).isEqualTo("+1 (555) 123-4567");
  }

  @Test
  void saveConfiguration_blankOrLongMessage_rejected() {
    install();

    assertThatThrownBy(() -> manager.saveConfiguration(SHOP, new WidgetConfigRequest("+15551234567", " ")))
        .isInstanceOf(IllegalArgumentException.class);
    assertThatThrownBy(() -> manager.saveConfiguration(SHOP, new WidgetConfigRequest("+15551234567", "x".repeat(1001))))
        .isInstanceOf(IllegalArgumentException.class);
    assertThatThrownBy(() -> manager.saveConfiguration(SHOP, null))
        .isInstanceOf(IllegalArgumentException.class);
  }

  @Test
  void saveConfiguration_notInstalled_unknownTenant() {
    assertThatThrownBy(() -> manager.saveConfiguration(SHOP, new WidgetConfigRequest("+15551234567", "Hi")))
        .isInstanceOf(UnknownTenantException.class);
  }

  @Test
  void currentConfiguration_notConfigured() {
    assertThat(manager.currentConfiguration(SHOP)).isEqualTo(WidgetConfigResponse.notConfigured());
    install();
    assertThat(manager.currentConfiguration(SHOP)).isEqualTo(WidgetConfigResponse.notConfigured());
  }

  @Test
  void analytics_defaults() {
    assertThat(manager.analytics(SHOP)).isEqualTo(AnalyticsResponse.notConfigured());
    install();
    assertThat(manager.analytics(SHOP)).isEqualTo(AnalyticsResponse.of(0, null, null));
  }

  @Test
  void recordClick_increments() {
    install();

    manager.recordClick(SHOP);
    AnalyticsResponse response = manager.recordClick(SHOP);

    assertThat(response).isEqualTo(AnalyticsResponse.of(2, NOW, NOW));
    assertThat(manager.analytics(SHOP)).isEqualTo(response);
  }

  @Test
  void recordClick_notInstalled_unknownTenant() {
    assertThatThrownBy(() -> manager.recordClick(SHOP)).isInstanceOf(UnknownTenantException.class);
  }
}
