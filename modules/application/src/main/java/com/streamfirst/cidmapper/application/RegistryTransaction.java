package com.streamfirst.cidmapper.application;

import com.streamfirst.cidmapper.domain.CallContext;
import com.streamfirst.cidmapper.domain.EventPayload;
import com.streamfirst.cidmapper.domain.Principal;
import com.streamfirst.cidmapper.ports.LedgerStoragePort;
import com.streamfirst.cidmapper.ports.LedgerStoragePort.StorageKey;
import com.streamfirst.cidmapper.ports.LedgerStoragePort.StorageWrite;
import com.streamfirst.cidmapper.ports.LedgerStoragePort.WriteBatch;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import lombok.extern.slf4j.Slf4j;

/**
 * Staging area for one registry call. Reads fall through to committed storage unless the call has
 * already staged a write for the key. Nothing reaches the ledger until the whole batch is
 * committed, so a call that aborts halfway leaves every index untouched.
 */
@Slf4j
final class RegistryTransaction {

  private final Principal contract;
  private final LedgerStoragePort ledger;
  private final Map<StorageKey, StorageWrite> staged = new LinkedHashMap<>();
  private final List<EventPayload> events = new ArrayList<>();
  private final List<VerifiedProof> proofs = new ArrayList<>();

  RegistryTransaction(Principal contract, LedgerStoragePort ledger) {
    this.contract = contract;
    this.ledger = ledger;
  }

  <T> Optional<T> get(StorageKey key, Class<T> type) {
    StorageWrite write = staged.get(key);
    if (write == null) {
      return ledger.get(key, type);
    }
    if (write.isRemoval()) {
      return Optional.empty();
    }
    if (!type.isInstance(write.value())) {
      throw new IllegalStateException(
          "Staged value for " + key + " is not a " + type.getSimpleName());
    }
    return Optional.of(type.cast(write.value()));
  }

  boolean has(StorageKey key) {
    StorageWrite write = staged.get(key);
    return write == null ? ledger.has(key) : !write.isRemoval();
  }

  void put(StorageKey key, Object value) {
    Objects.requireNonNull(value, "Use remove() to delete " + key);
    stage(new StorageWrite(key, value));
  }

  void remove(StorageKey key) {
    stage(new StorageWrite(key, null));
  }

  void emit(EventPayload payload) {
    events.add(Objects.requireNonNull(payload, "Event payload cannot be null"));
  }

  /** Records a proof the call was verified with, to be spent once the batch commits. */
  void verified(Principal principal, CallContext context) {
    proofs.add(new VerifiedProof(principal, context));
  }

  List<VerifiedProof> verifiedProofs() {
    return List.copyOf(proofs);
  }

  WriteBatch toBatch() {
    return new WriteBatch(contract, List.copyOf(staged.values()), events);
  }

  private void stage(StorageWrite write) {
    if (!write.key().contract().equals(contract)) {
      throw new IllegalArgumentException("Registry " + contract + " cannot stage " + write.key());
    }
    // a later write to the same key replaces the earlier one but keeps its position
    staged.put(write.key(), write);
    log.trace("Staged {}", write.key());
  }

  record VerifiedProof(Principal principal, CallContext context) {}
}
