package com.streamfirst.cidmapper.adapters;

import com.streamfirst.cidmapper.domain.EventPayload;
import com.streamfirst.cidmapper.domain.LedgerEvent;
import com.streamfirst.cidmapper.domain.Principal;
import com.streamfirst.cidmapper.ports.EventLogPort;
import com.streamfirst.cidmapper.ports.LedgerStoragePort;
import java.time.Clock;
import java.time.Instant;
import java.util.*;
import java.util.concurrent.locks.ReadWriteLock;
import java.util.concurrent.locks.ReentrantReadWriteLock;
import java.util.function.Predicate;
import lombok.extern.slf4j.Slf4j;

/**
 * In-memory implementation of LedgerStoragePort and EventLogPort for testing and development.
 * Keeps current state and the event log side by side so a batch can be applied to both under one
 * lock. Data is lost when the application stops - not suitable for production use.
 */
@Slf4j
public class InMemoryLedgerAdapter implements LedgerStoragePort, EventLogPort {

  private final Map<StorageKey, Object> entries = new HashMap<>();
  private final List<LedgerEvent> eventLog = new ArrayList<>();
  private final ReadWriteLock lock = new ReentrantReadWriteLock();
  private final Clock clock;
  private long sequence;

  public InMemoryLedgerAdapter() {
    this(Clock.systemUTC());
  }

  public InMemoryLedgerAdapter(Clock clock) {
    this.clock = Objects.requireNonNull(clock, "Clock cannot be null");
  }

  @Override
  public <T> Optional<T> get(StorageKey key, Class<T> type) {
    lock.readLock().lock();
    try {
      Object value = entries.get(key);
      if (value == null) {
        log.debug("No entry for {}", key);
        return Optional.empty();
      }
      if (!type.isInstance(value)) {
        throw new IllegalStateException(
            "Entry " + key + " holds " + value.getClass().getSimpleName()
                + ", expected " + type.getSimpleName());
      }
      return Optional.of(type.cast(value));
    } finally {
      lock.readLock().unlock();
    }
  }

  @Override
  public boolean has(StorageKey key) {
    lock.readLock().lock();
    try {
      return entries.containsKey(key);
    } finally {
      lock.readLock().unlock();
    }
  }

  @Override
  public List<LedgerEvent> commit(WriteBatch batch) {
    for (StorageWrite write : batch.writes()) {
      if (!write.key().contract().equals(batch.contract())) {
        throw new IllegalArgumentException(
            "Registry " + batch.contract() + " cannot write foreign key " + write.key());
      }
    }

    lock.writeLock().lock();
    try {
      for (StorageWrite write : batch.writes()) {
        if (write.isRemoval()) {
          entries.remove(write.key());
        } else {
          entries.put(write.key(), write.value());
        }
      }

      Instant now = clock.instant();
      List<LedgerEvent> committed = new ArrayList<>(batch.events().size());
      for (EventPayload payload : batch.events()) {
        LedgerEvent event = LedgerEvent.committed(++sequence, batch.contract(), payload, now);
        eventLog.add(event);
        committed.add(event);
      }

      log.debug(
          "Committed batch for {}: {} writes, {} events (latest sequence {})",
          batch.contract(),
          batch.writes().size(),
          committed.size(),
          sequence);
      return committed;
    } finally {
      lock.writeLock().unlock();
    }
  }

  @Override
  public List<LedgerEvent> getEvents(Predicate<LedgerEvent> criteria) {
    lock.readLock().lock();
    try {
      List<LedgerEvent> result = eventLog.stream().filter(criteria).toList();
      log.debug("Found {} events matching criteria", result.size());
      return result;
    } finally {
      lock.readLock().unlock();
    }
  }

  @Override
  public long getLatestSequence() {
    lock.readLock().lock();
    try {
      return sequence;
    } finally {
      lock.readLock().unlock();
    }
  }

  /** Gets the number of live entries a registry holds. */
  public int getEntryCount(Principal contract) {
    lock.readLock().lock();
    try {
      return (int) entries.keySet().stream().filter(key -> key.contract().equals(contract)).count();
    } finally {
      lock.readLock().unlock();
    }
  }

  /** Gets storage statistics for monitoring. */
  public Map<String, Integer> getLedgerStats() {
    lock.readLock().lock();
    try {
      Map<String, Integer> stats = new HashMap<>();
      stats.put("instance_entries", countTier(Tier.INSTANCE));
      stats.put("persistent_entries", countTier(Tier.PERSISTENT));
      stats.put("events", eventLog.size());
      stats.put(
          "registries",
          (int) entries.keySet().stream().map(StorageKey::contract).distinct().count());
      return stats;
    } finally {
      lock.readLock().unlock();
    }
  }

  /** Clears all state and the event log. Useful for testing. */
  public void clear() {
    lock.writeLock().lock();
    try {
      log.info("Clearing all ledger data");
      entries.clear();
      eventLog.clear();
      sequence = 0;
    } finally {
      lock.writeLock().unlock();
    }
  }

  private int countTier(Tier tier) {
    return (int) entries.keySet().stream().filter(key -> key.tier() == tier).count();
  }
}
