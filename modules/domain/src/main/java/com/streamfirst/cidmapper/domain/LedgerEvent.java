package com.streamfirst.cidmapper.domain;

import java.time.Instant;
import java.util.Optional;
import lombok.AccessLevel;
import lombok.EqualsAndHashCode;
import lombok.Getter;
import lombok.NonNull;
import lombok.Value;

/**
 * A committed registry event as recorded in the append-only event log. Events are the only
 * history the registries keep: current-state storage holds just the latest values.
 */
@Value
@EqualsAndHashCode(of = "sequence")
public class LedgerEvent {
  /** Ledger-wide position, strictly increasing in commit order */
  long sequence;

  /** Address of the registry that emitted the event */
  @NonNull Principal contract;

  /** Operation name (e.g., "UPDATE_MAP", "MINT") */
  @NonNull String topic;

  /** Identifier the event is about; null for registry-level events */
  @Getter(AccessLevel.NONE)
  String subject;

  /** Typed event body */
  @NonNull EventPayload payload;

  /** When the emitting call committed */
  @NonNull Instant emittedAt;

  /** Wraps a payload staged by a registry call into a committed event. */
  public static LedgerEvent committed(
      long sequence, Principal contract, EventPayload payload, Instant emittedAt) {
    return new LedgerEvent(
        sequence, contract, payload.topic(), payload.subject().orElse(null), payload, emittedAt);
  }

  public Optional<String> getSubject() {
    return Optional.ofNullable(subject);
  }

  /** Returns the payload cast to the expected type. */
  public <T extends EventPayload> T payloadAs(Class<T> type) {
    if (!type.isInstance(payload)) {
      throw new IllegalStateException(
          "Event " + sequence + " carries " + payload.getClass().getSimpleName()
              + ", not " + type.getSimpleName());
    }
    return type.cast(payload);
  }

  @Override
  public String toString() {
    return "LedgerEvent{"
        + "sequence="
        + sequence
        + ", contract="
        + contract
        + ", topic='"
        + topic
        + '\''
        + ", subject="
        + subject
        + '}';
  }
}
