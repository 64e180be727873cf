package com.codeheadsystems.walauncher.springboot.config;

import com.codeheadsystems.walauncher.server.accessor.AdminApiConfig;
import com.codeheadsystems.walauncher.server.accessor.ShopifyAdminAccessor;
import com.codeheadsystems.walauncher.server.auth.LaunchRequestVerifier;
import com.codeheadsystems.walauncher.server.auth.SessionTokenVerifier;
import com.codeheadsystems.walauncher.server.auth.WebhookVerifier;
import com.codeheadsystems.walauncher.server.manager.InstallConfig;
import com.codeheadsystems.walauncher.server.manager.InstallationManager;
import com.codeheadsystems.walauncher.server.manager.ScriptTagInstaller;
import com.codeheadsystems.walauncher.server.manager.WidgetManager;
import com.codeheadsystems.walauncher.server.render.DashboardShellRenderer;
import com.codeheadsystems.walauncher.server.render.MinimalDashboardShellRenderer;
import com.codeheadsystems.walauncher.server.render.MinimalWidgetScriptRenderer;
import com.codeheadsystems.walauncher.server.render.WidgetScriptRenderer;
import com.codeheadsystems.walauncher.server.store.FileInstallationStore;
import com.codeheadsystems.walauncher.server.store.InMemoryInstallationStore;
import com.codeheadsystems.walauncher.server.store.InstallationStore;
import com.codeheadsystems.walauncher.springboot.security.DevTenantFallback;
import com.codeheadsystems.walauncher.springboot.store.JdbcInstallationStore;
import com.fasterxml.jackson.databind.ObjectMapper;
import java.net.http.HttpClient;
import java.nio.charset.StandardCharsets;
import java.nio.file.Path;
import java.security.SecureRandom;
import java.time.Clock;
import java.time.Duration;
import java.util.Locale;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.ObjectProvider;
import org.springframework.boot.autoconfigure.AutoConfiguration;
import org.springframework.boot.autoconfigure.condition.ConditionalOnMissingBean;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.core.env.Environment;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.transaction.PlatformTransactionManager;

@AutoConfiguration
@EnableConfigurationProperties(WaLauncherProperties.class)
public class WaLauncherAutoConfiguration {

  private static final Logger log = LoggerFactory.getLogger(WaLauncherAutoConfiguration.class);
  private static final String DATA_FILE = "app_data.json";

  private static String clientId(WaLauncherProperties props) {
    String clientId = props.getClientId();
    if (clientId == null || clientId.isBlank()) {
      throw new IllegalStateException(
          "walauncher.client-id must be configured (WALAUNCHER_CLIENT_ID).");
    }
    return clientId;
  }

  private static byte[] clientSecret(WaLauncherProperties props) {
    String secret = props.getClientSecret();
    if (secret == null || secret.isBlank()) {
      throw new IllegalStateException(
          "walauncher.client-secret must be configured (WALAUNCHER_CLIENT_SECRET).");
    }
    return secret.getBytes(StandardCharsets.UTF_8);
  }

  @Bean
  @ConditionalOnMissingBean
  public Clock clock() {
    return Clock.systemUTC();
  }

  /**
   * Default {@link SecureRandom} used for OAuth state nonces. Override to supply a custom
   * provider.
   */
  @Bean
  @ConditionalOnMissingBean
  public SecureRandom secureRandom() {
    return new SecureRandom();
  }

  @Bean
  @ConditionalOnMissingBean
  public HttpClient httpClient(WaLauncherProperties props) {
    return HttpClient.newBuilder()
        .connectTimeout(Duration.ofMillis(props.getOutboundTimeoutMillis()))
        .followRedirects(HttpClient.Redirect.NEVER)
        .build();
  }

  /**
   * The tenant store selected by {@code walauncher.store-backend}: {@code memory}, {@code file}
   * or {@code jdbc}.
   */
  @Bean(destroyMethod = "shutdown")
  @ConditionalOnMissingBean
  public InstallationStore installationStore(WaLauncherProperties props,
                                             ObjectMapper objectMapper,
                                             ObjectProvider<JdbcTemplate> jdbcTemplate,
                                             ObjectProvider<PlatformTransactionManager> transactionManager) {
    String backend = props.getStoreBackend() == null ? "" : props.getStoreBackend().trim().toLowerCase(Locale.ROOT);
    return switch (backend) {
      case "memory" -> {
        log.warn("Using in-memory installation store. All data will be lost on restart. Do not use in production.");
        yield new InMemoryInstallationStore();
      }
      case "file" -> {
        Path file = Path.of(props.getDataDir()).resolve(DATA_FILE);
        log.info("Using file installation store at {}", file.toAbsolutePath());
        yield new FileInstallationStore(file, objectMapper);
      }
      case "jdbc" -> {
        log.info("Using JDBC installation store");
        yield new JdbcInstallationStore(jdbcTemplate.getObject(), transactionManager.getObject());
      }
      default -> throw new IllegalStateException(
          "Unknown walauncher.store-backend '" + props.getStoreBackend() + "'; expected memory, file or jdbc");
    };
  }

  @Bean
  @ConditionalOnMissingBean
  public SessionTokenVerifier sessionTokenVerifier(WaLauncherProperties props, Clock clock) {
    return new SessionTokenVerifier(clientSecret(props), clientId(props), clock);
  }

  @Bean
  @ConditionalOnMissingBean
  public WebhookVerifier webhookVerifier(WaLauncherProperties props) {
    return new WebhookVerifier(clientSecret(props));
  }

  @Bean
  @ConditionalOnMissingBean
  public LaunchRequestVerifier launchRequestVerifier(WaLauncherProperties props, Clock clock) {
    return new LaunchRequestVerifier(clientSecret(props), clock,
        Duration.ofSeconds(props.getLaunchRequestMaxAgeSeconds()));
  }

  @Bean
  @ConditionalOnMissingBean
  public AdminApiConfig adminApiConfig(WaLauncherProperties props) {
    return new AdminApiConfig(clientId(props), new String(clientSecret(props), StandardCharsets.UTF_8),
        props.getAdminApiVersion(), Duration.ofMillis(props.getOutboundTimeoutMillis()));
  }

  @Bean
  @ConditionalOnMissingBean
  public ShopifyAdminAccessor shopifyAdminAccessor(AdminApiConfig config, HttpClient httpClient,
                                                   ObjectMapper objectMapper) {
    return new ShopifyAdminAccessor(config, httpClient, objectMapper);
  }

  @Bean(destroyMethod = "shutdown")
  @ConditionalOnMissingBean
  public InstallationManager installationManager(WaLauncherProperties props,
                                                 InstallationStore store,
                                                 ShopifyAdminAccessor accessor,
                                                 SecureRandom secureRandom,
                                                 Clock clock) {
    InstallConfig config = new InstallConfig(clientId(props), props.getAppUrl(), props.getScopes(),
        Duration.ofSeconds(props.getOauthStateTtlSeconds()));
    return new InstallationManager(store, accessor, config, secureRandom, clock);
  }

  @Bean
  @ConditionalOnMissingBean
  public ScriptTagInstaller scriptTagInstaller(ShopifyAdminAccessor accessor) {
    return new ScriptTagInstaller(accessor);
  }

  @Bean
  @ConditionalOnMissingBean
  public WidgetManager widgetManager(WaLauncherProperties props, InstallationStore store,
                                     ScriptTagInstaller scriptTagInstaller, Clock clock) {
    return new WidgetManager(store, scriptTagInstaller, props.getAppUrl(), clock);
  }

  /**
   * Default dashboard shell. Override with a renderer that serves the real frontend.
   */
  @Bean
  @ConditionalOnMissingBean
  public DashboardShellRenderer dashboardShellRenderer() {
    return new MinimalDashboardShellRenderer();
  }

  /**
   * Default storefront loader. Override to serve a different widget.
   */
  @Bean
  @ConditionalOnMissingBean
  public WidgetScriptRenderer widgetScriptRenderer() {
    return new MinimalWidgetScriptRenderer();
  }

  @Bean
  @ConditionalOnMissingBean
  public DevTenantFallback devTenantFallback(WaLauncherProperties props, Environment environment,
                                             InstallationStore store) {
    return DevTenantFallback.create(props.isDevQueryParamAuth(), props.getAppUrl(),
        environment.getActiveProfiles(), store);
  }
}
