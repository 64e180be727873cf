package com.codeheadsystems.walauncher.model;

import com.fasterxml.jackson.annotation.JsonProperty;
import java.time.Instant;

/**
 * Liveness body for {@code GET /health}.
 *
 * @param status    always {@code healthy} while the process serves requests
 * @param timestamp server time of the response
 */
public record HealthResponse(
    @JsonProperty("status") String status,
    @JsonProperty("timestamp") Instant timestamp) {

  public static HealthResponse healthy(Instant now) {
    return new HealthResponse("healthy", now);
  }
}
