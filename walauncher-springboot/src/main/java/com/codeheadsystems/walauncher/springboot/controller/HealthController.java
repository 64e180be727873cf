package com.codeheadsystems.walauncher.springboot.controller;

import com.codeheadsystems.walauncher.model.HealthResponse;
import java.time.Clock;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RestController;

@RestController
public class HealthController {

  private final Clock clock;

  public HealthController(Clock clock) {
    this.clock = clock;
  }

  @GetMapping("/health")
  public HealthResponse health() {
    return HealthResponse.healthy(clock.instant());
  }
}
