package com.codeheadsystems.walauncher.model;

import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * Error body returned by every failing endpoint.
 * <p>
 * The message is always a fixed, human-readable sentence chosen by the server; it never carries
 * upstream diagnostics, token contents or cryptographic detail.
 *
 * @param error   short machine-readable code (e.g. {@code unauthorized}, {@code not_installed})
 * @param message human-readable description
 */
public record ErrorResponse(
    @JsonProperty("error") String error,
    @JsonProperty("message") String message) {
}
