package com.codeheadsystems.walauncher.server.store;

import com.codeheadsystems.walauncher.server.tenant.ShopDomain;
import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;
import java.io.IOException;
import java.nio.file.AtomicMoveNotSupportedException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.TreeMap;
import java.util.function.Supplier;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * {@link InstallationStore} that keeps tenant records in a single JSON document on disk.
 * <p>
 * The document holds three maps keyed by shop domain: {@code installations}, {@code configs}
 * and {@code analytics}. Every committed change rewrites the whole document to a temporary file
 * in the same directory and moves it over the old one, so a crash leaves either the previous or
 * the new document, never a torn one. Mutations are serialized with the write, and a change
 * whose write fails is rolled back in memory before the {@link PersistenceException} reaches
 * the caller, so reads never see state that is not on disk.
 * <p>
 * A document that exists but cannot be parsed fails construction with a
 * {@link PersistenceException} rather than starting empty. Pending OAuth states are not
 * persisted; an install in flight during a restart has to be started again.
 */
public class FileInstallationStore extends InMemoryInstallationStore {

  private static final Logger log = LoggerFactory.getLogger(FileInstallationStore.class);

  private final Path file;
  private final ObjectMapper objectMapper;
  private final Object writeLock = new Object();

  /**
   * Creates the store and loads the existing document, if any.
   *
   * @param file         path of the JSON document
   * @param objectMapper base mapper; a configured copy is used
   * @throws PersistenceException if the document exists but cannot be read
   */
  public FileInstallationStore(Path file, ObjectMapper objectMapper) {
    this.file = file.toAbsolutePath();
    this.objectMapper = objectMapper.copy()
        .registerModule(new JavaTimeModule())
        .disable(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS)
        .enable(SerializationFeature.INDENT_OUTPUT);
    load();
  }

  public Path file() {
    return file;
  }

  @Override
  protected void afterMutation() {
    write(toDocument());
  }

  @Override
  protected <T> T serialized(Supplier<T> work) {
    synchronized (writeLock) {
      return work.get();
    }
  }

  @Override
  public void shutdown() {
    synchronized (writeLock) {
      write(toDocument());
    }
    log.info("File store flushed to {}", file);
  }

  private void load() {
    if (!Files.exists(file)) {
      log.info("No store file at {}, starting empty", file);
      return;
    }
    final StoreDocument document;
    try {
      document = objectMapper.readValue(file.toFile(), StoreDocument.class);
    } catch (IOException e) {
      throw new PersistenceException("Unable to read store file " + file, e);
    }
    try {
      restore(
          document.installations().values().stream().map(InstallationDocument::toInstallation).toList(),
          document.configs().values().stream().map(WidgetConfigDocument::toWidgetConfig).toList(),
          document.analytics().values().stream().map(AnalyticsDocument::toRecord).toList());
    } catch (IllegalArgumentException | NullPointerException e) {
      throw new PersistenceException("Store file " + file + " contains invalid records", e);
    }
    log.info("Loaded {} installation(s) from {}", document.installations().size(), file);
  }

  private StoreDocument toDocument() {
    Map<String, InstallationDocument> installations = new TreeMap<>();
    installationSnapshot().forEach((shop, i) -> installations.put(shop.value(), InstallationDocument.of(i)));
    Map<String, WidgetConfigDocument> configs = new TreeMap<>();
    configSnapshot().forEach((shop, c) -> configs.put(shop.value(), WidgetConfigDocument.of(c)));
    Map<String, AnalyticsDocument> analytics = new TreeMap<>();
    analyticsSnapshot().forEach((shop, a) -> analytics.put(shop.value(), AnalyticsDocument.of(a)));
    return new StoreDocument(installations, configs, analytics);
  }

  private void write(StoreDocument document) {
    try {
      Path parent = file.getParent();
      if (parent != null) {
        Files.createDirectories(parent);
      }
      Path temp = Files.createTempFile(parent, file.getFileName().toString(), ".tmp");
      try {
        objectMapper.writeValue(temp.toFile(), document);
        try {
          Files.move(temp, file, StandardCopyOption.ATOMIC_MOVE, StandardCopyOption.REPLACE_EXISTING);
        } catch (AtomicMoveNotSupportedException e) {
          log.warn("Atomic move not supported for {}, replacing in place", file);
          Files.move(temp, file, StandardCopyOption.REPLACE_EXISTING);
        }
      } finally {
        Files.deleteIfExists(temp);
      }
    } catch (IOException e) {
      log.error("Unable to write store file {}", file, e);
      throw new PersistenceException("Unable to write store file " + file, e);
    }
  }

  @JsonIgnoreProperties(ignoreUnknown = true)
  record StoreDocument(
      @JsonProperty("installations") Map<String, InstallationDocument> installations,
      @JsonProperty("configs") Map<String, WidgetConfigDocument> configs,
      @JsonProperty("analytics") Map<String, AnalyticsDocument> analytics) {

    StoreDocument {
      installations = installations == null ? Map.of() : new LinkedHashMap<>(installations);
      configs = configs == null ? Map.of() : new LinkedHashMap<>(configs);
      analytics = analytics == null ? Map.of() : new LinkedHashMap<>(analytics);
    }
  }

  record InstallationDocument(
      @JsonProperty("shop") String shop,
      @JsonProperty("access_token") String accessToken,
      @JsonProperty("installed_at") Instant installedAt) {

    static InstallationDocument of(Installation i) {
      return new InstallationDocument(i.shop().value(), i.accessToken(), i.installedAt());
    }

    Installation toInstallation() {
      return new Installation(ShopDomain.of(shop), accessToken, installedAt);
    }
  }

  record WidgetConfigDocument(
      @JsonProperty("shop") String shop,
      @JsonProperty("phone_number") String phoneNumber,
      @JsonProperty("initial_message") String initialMessage,
      @JsonProperty("updated_at") Instant updatedAt) {

    static WidgetConfigDocument of(WidgetConfig c) {
      return new WidgetConfigDocument(c.shop().value(), c.phoneNumber(), c.initialMessage(), c.updatedAt());
    }

    WidgetConfig toWidgetConfig() {
      return new WidgetConfig(ShopDomain.of(shop), phoneNumber, initialMessage, updatedAt);
    }
  }

  record AnalyticsDocument(
      @JsonProperty("shop") String shop,
      @JsonProperty("widget_clicks") long widgetClicks,
      @JsonProperty("first_click") Instant firstClick,
      @JsonProperty("last_click") Instant lastClick) {

    static AnalyticsDocument of(AnalyticsRecord a) {
      return new AnalyticsDocument(a.shop().value(), a.widgetClicks(), a.firstClick(), a.lastClick());
    }

    AnalyticsRecord toRecord() {
      return new AnalyticsRecord(ShopDomain.of(shop), widgetClicks, firstClick, lastClick);
    }
  }
}
