package com.streamfirst.cidmapper.domain;

import java.util.UUID;
import lombok.NonNull;

/**
 * Identity of an account or registry on the ledger. Callers, owners, holders and registry
 * addresses are all principals; naming a principal proves nothing about controlling it.
 *
 * @param id the ledger address (e.g., "GA7Q...", "registry-ipcm")
 */
public record Principal(@NonNull String id) {

  public Principal {
    if (id.trim().isEmpty()) {
      throw new IllegalArgumentException("Principal id cannot be empty");
    }
  }

  /** Creates a Principal from a string value. */
  public static Principal of(String id) {
    return new Principal(id);
  }

  /** Generates a new random principal. Handy for test accounts and fresh registry addresses. */
  public static Principal generate() {
    return new Principal("acct-" + UUID.randomUUID());
  }

  @Override
  public @NonNull String toString() {
    return id;
  }
}
