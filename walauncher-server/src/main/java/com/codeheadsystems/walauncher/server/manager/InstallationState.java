package com.codeheadsystems.walauncher.server.manager;

/**
 * Where a shop is in the install lifecycle.
 */
public enum InstallationState {
  /** No installation and no pending authorization. */
  UNAUTHENTICATED,
  /** An authorization was started and has not completed or expired. */
  PENDING_AUTHORIZATION,
  /** An installation with an access token exists. */
  AUTHORIZED
}
