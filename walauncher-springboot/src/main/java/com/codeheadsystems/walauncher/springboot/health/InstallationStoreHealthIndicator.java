package com.codeheadsystems.walauncher.springboot.health;

import com.codeheadsystems.walauncher.server.store.InstallationStore;
import org.springframework.boot.actuate.health.Health;
import org.springframework.boot.actuate.health.HealthIndicator;
import org.springframework.stereotype.Component;

@Component
public class InstallationStoreHealthIndicator implements HealthIndicator {

  private final InstallationStore store;

  public InstallationStoreHealthIndicator(InstallationStore store) {
    this.store = store;
  }

  @Override
  public Health health() {
    try {
      return Health.up()
          .withDetail("backend", store.getClass().getSimpleName())
          .withDetail("installedShops", store.installedShops().size())
          .build();
    } catch (RuntimeException e) {
      return Health.down(e).withDetail("backend", store.getClass().getSimpleName()).build();
    }
  }
}
