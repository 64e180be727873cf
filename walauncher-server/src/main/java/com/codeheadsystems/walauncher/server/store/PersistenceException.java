package com.codeheadsystems.walauncher.server.store;

/**
 * Thrown when the durable medium behind an {@link InstallationStore} cannot be read or written.
 */
public class PersistenceException extends RuntimeException {

  public PersistenceException(String message, Throwable cause) {
    super(message, cause);
  }
}
