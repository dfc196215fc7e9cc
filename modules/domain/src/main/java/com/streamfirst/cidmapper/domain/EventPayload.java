package com.streamfirst.cidmapper.domain;

import java.util.Optional;

/**
 * Typed body of a registry event. Each state-changing operation produces exactly one payload,
 * which the ledger wraps into a {@link LedgerEvent} when the call commits.
 */
public interface EventPayload {

  /** Operation name the event is published under (e.g., "UPDATE_MAP", "MINT"). */
  String topic();

  /** Identifier the event is about, usually the token id. Empty for registry-level events. */
  Optional<String> subject();
}
