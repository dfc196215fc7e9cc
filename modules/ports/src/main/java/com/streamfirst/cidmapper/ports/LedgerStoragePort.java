package com.streamfirst.cidmapper.ports;

import com.streamfirst.cidmapper.domain.EventPayload;
import com.streamfirst.cidmapper.domain.LedgerEvent;
import com.streamfirst.cidmapper.domain.Principal;
import java.util.List;
import java.util.Objects;
import java.util.Optional;

/**
 * Port for the ledger's key-value storage. Each registry owns the keys under its own address.
 * Writes are never applied one by one: a call stages them in a {@link WriteBatch} together with
 * its event and hands the batch over in a single {@link #commit}.
 */
public interface LedgerStoragePort {

  /**
   * Reads a committed value.
   *
   * @param key the storage key
   * @param type the expected value type
   * @return the value, or empty if the key is absent
   * @throws IllegalStateException if the stored value is not of the expected type
   */
  <T> Optional<T> get(StorageKey key, Class<T> type);

  /**
   * Checks whether a key holds a committed value.
   *
   * @param key the storage key
   * @return true if present, false otherwise
   */
  boolean has(StorageKey key);

  /**
   * Atomically applies every write of the batch and appends its events to the event log. Either
   * all of it becomes visible or none of it does.
   *
   * @param batch the staged writes and events of one registry call
   * @return the committed events, with their assigned sequence numbers
   * @throws IllegalArgumentException if a write targets a key outside the batch's registry
   */
  List<LedgerEvent> commit(WriteBatch batch);

  /** Storage tiers: a small singleton record per registry, and unbounded per-key entries. */
  enum Tier {
    INSTANCE,
    PERSISTENT
  }

  /**
   * Address of a stored value.
   *
   * @param contract the registry owning the key
   * @param tier the storage tier
   * @param namespace the key family (e.g., "OWNER", "MAP", "OWNERS")
   * @param id the key within the family; empty for instance entries
   */
  record StorageKey(Principal contract, Tier tier, String namespace, String id) {
    public StorageKey {
      Objects.requireNonNull(contract, "Contract cannot be null");
      Objects.requireNonNull(tier, "Tier cannot be null");
      Objects.requireNonNull(namespace, "Namespace cannot be null");
      Objects.requireNonNull(id, "Key id cannot be null");
    }

    public static StorageKey instance(Principal contract, String namespace) {
      return new StorageKey(contract, Tier.INSTANCE, namespace, "");
    }

    public static StorageKey persistent(Principal contract, String namespace, String id) {
      return new StorageKey(contract, Tier.PERSISTENT, namespace, id);
    }

    @Override
    public String toString() {
      return contract + ":" + tier + ":" + namespace + (id.isEmpty() ? "" : "/" + id);
    }
  }

  /**
   * One staged write. A null value removes the key.
   *
   * @param key the storage key
   * @param value the new value, or null to remove
   */
  record StorageWrite(StorageKey key, Object value) {
    public StorageWrite {
      Objects.requireNonNull(key, "Key cannot be null");
    }

    public boolean isRemoval() {
      return value == null;
    }
  }

  /**
   * Everything one registry call changes.
   *
   * @param contract the registry that made the call
   * @param writes staged writes in staging order, at most one per key
   * @param events staged event payloads in emission order
   */
  record WriteBatch(Principal contract, List<StorageWrite> writes, List<EventPayload> events) {
    public WriteBatch {
      Objects.requireNonNull(contract, "Contract cannot be null");
      writes = List.copyOf(writes);
      events = List.copyOf(events);
    }

    public boolean isEmpty() {
      return writes.isEmpty() && events.isEmpty();
    }
  }
}
