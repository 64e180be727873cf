package com.codeheadsystems.walauncher.springboot.store;

import static org.assertj.core.api.Assertions.assertThat;

import com.codeheadsystems.walauncher.server.store.InstallationStore;
import com.codeheadsystems.walauncher.server.store.InstallationStoreContract;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.Test;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.jdbc.datasource.DataSourceTransactionManager;
import org.springframework.jdbc.datasource.embedded.EmbeddedDatabase;
import org.springframework.jdbc.datasource.embedded.EmbeddedDatabaseBuilder;
import org.springframework.jdbc.datasource.embedded.EmbeddedDatabaseType;

/**
 * Runs the shared store behaviour against an in-process H2 database.
 */
class JdbcInstallationStoreTest extends InstallationStoreContract {

  private EmbeddedDatabase database;

  @Override
  protected InstallationStore newStore() {
    database = new EmbeddedDatabaseBuilder()
        .setType(EmbeddedDatabaseType.H2)
        .generateUniqueName(true)
        .build();
    return new JdbcInstallationStore(new JdbcTemplate(database), new DataSourceTransactionManager(database));
  }

  @AfterEach
  void shutdownDatabase() {
    database.shutdown();
  }

  @Test
  void schema_isIdempotent() {
    store.storeInstallation(installation(SHOP));

    InstallationStore second = new JdbcInstallationStore(new JdbcTemplate(database),
        new DataSourceTransactionManager(database));

    assertThat(second.loadInstallation(SHOP)).contains(installation(SHOP));
  }
}
