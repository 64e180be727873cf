package com.codeheadsystems.walauncher.server.manager;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.times;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

import com.codeheadsystems.walauncher.model.config.WidgetRegistrationStatus;
import com.codeheadsystems.walauncher.model.platform.ScriptTag;
import com.codeheadsystems.walauncher.server.accessor.ShopifyAdminAccessor;
import com.codeheadsystems.walauncher.server.exceptions.AdminApiException;
import com.codeheadsystems.walauncher.server.exceptions.ScriptTagInstallException;
import com.codeheadsystems.walauncher.server.store.Installation;
import com.codeheadsystems.walauncher.server.tenant.ShopDomain;
import java.time.Instant;
import java.util.List;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

@ExtendWith(MockitoExtension.class)
class ScriptTagInstallerTest {

  private static final ShopDomain SHOP = new ShopDomain("test-store.example");
  private static final Installation INSTALLATION = new Installation(SHOP, "shpat_token", Instant.EPOCH);
  private static final String LOADER = "https://app.example/whatsapp-widget.js?shop=test-store.example";

  @Mock private ShopifyAdminAccessor accessor;

  private ScriptTagInstaller installer;

  @BeforeEach
  void setUp() {
    installer = new ScriptTagInstaller(accessor);
  }

  @Test
  void ensureRegistered_absent_creates() {
    when(accessor.listScriptTags(SHOP, "shpat_token"))
        .thenReturn(List.of(new ScriptTag(1L, "onload", "https://elsewhere.example/other.js")));

    assertThat(installer.ensureRegistered(INSTALLATION, LOADER)).isEqualTo(WidgetRegistrationStatus.REGISTERED);
    verify(accessor).createScriptTag(SHOP, "shpat_token", LOADER);
  }

  @Test
  void ensureRegistered_present_noop() {
    when(accessor.listScriptTags(SHOP, "shpat_token")).thenReturn(List.of(new ScriptTag(7L, "onload", LOADER)));

    assertThat(installer.ensureRegistered(INSTALLATION, LOADER)).isEqualTo(WidgetRegistrationStatus.ALREADY_PRESENT);
    verify(accessor, never()).createScriptTag(SHOP, "shpat_token", LOADER);
  }

  @Test
  void ensureRegistered_comparesExactUrl() {
    when(accessor.listScriptTags(SHOP, "shpat_token"))
        .thenReturn(List.of(new ScriptTag(7L, "onload", LOADER + "&v=2")));

    assertThat(installer.ensureRegistered(INSTALLATION, LOADER)).isEqualTo(WidgetRegistrationStatus.REGISTERED);
  }

  @Test
  void ensureRegistered_firstAttemptFails_retriesOnce() {
    when(accessor.listScriptTags(SHOP, "shpat_token"))
        .thenThrow(new AdminApiException("timed out", -1, null))
        .thenReturn(List.of());

    assertThat(installer.ensureRegistered(INSTALLATION, LOADER)).isEqualTo(WidgetRegistrationStatus.REGISTERED);
    verify(accessor, times(2)).listScriptTags(SHOP, "shpat_token");
  }

  @Test
  void ensureRegistered_allAttemptsFail_throws() {
    AdminApiException failure = new AdminApiException("Admin API returned HTTP 503", 503, null);
    when(accessor.listScriptTags(SHOP, "shpat_token")).thenThrow(failure);

    assertThatThrownBy(() -> installer.ensureRegistered(INSTALLATION, LOADER))
        .isInstanceOf(ScriptTagInstallException.class)
        .hasCause(failure);
    verify(accessor, times(ScriptTagInstaller.MAX_ATTEMPTS)).listScriptTags(SHOP, "shpat_token");
  }

  @Test
  void ensureRegistered_slowShop_doesNotBlockOtherShop() throws Exception {
    ShopDomain other = new ShopDomain("other-store.example");
    Installation otherInstallation = new Installation(other, "shpat_other", Instant.EPOCH);
    String otherLoader = "https://app.example/whatsapp-widget.js?shop=other-store.example";
    CountDownLatch entered = new CountDownLatch(1);
    CountDownLatch release = new CountDownLatch(1);
    when(accessor.listScriptTags(SHOP, "shpat_token")).thenAnswer(invocation -> {
      entered.countDown();
      release.await(10, TimeUnit.SECONDS);
      return List.of(new ScriptTag(7L, "onload", LOADER));
    });
    when(accessor.listScriptTags(other, "shpat_other")).thenReturn(List.of(new ScriptTag(8L, "onload", otherLoader)));

    ExecutorService executor = Executors.newFixedThreadPool(2);
    try {
      Future<WidgetRegistrationStatus> slow = executor.submit(() -> installer.ensureRegistered(INSTALLATION, LOADER));
      assertThat(entered.await(5, TimeUnit.SECONDS)).isTrue();

      Future<WidgetRegistrationStatus> fast = executor.submit(() -> installer.ensureRegistered(otherInstallation, otherLoader));

      assertThat(fast.get(5, TimeUnit.SECONDS)).isEqualTo(WidgetRegistrationStatus.ALREADY_PRESENT);
      assertThat(slow.isDone()).isFalse();
      release.countDown();
      assertThat(slow.get(5, TimeUnit.SECONDS)).isEqualTo(WidgetRegistrationStatus.ALREADY_PRESENT);
    } finally {
      release.countDown();
      executor.shutdownNow();
    }
  }
}
