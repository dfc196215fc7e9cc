package com.streamfirst.cidmapper.application;

import com.streamfirst.cidmapper.domain.CallContext;
import com.streamfirst.cidmapper.domain.LedgerEvent;
import com.streamfirst.cidmapper.domain.Principal;
import com.streamfirst.cidmapper.domain.RegistryException;
import com.streamfirst.cidmapper.domain.RegistryState;
import com.streamfirst.cidmapper.ports.AuthorizationPort;
import com.streamfirst.cidmapper.ports.EventPort;
import com.streamfirst.cidmapper.ports.LedgerStoragePort;
import com.streamfirst.cidmapper.ports.LedgerStoragePort.StorageKey;
import java.util.List;
import java.util.Objects;
import java.util.concurrent.locks.ReentrantLock;
import java.util.function.Consumer;
import java.util.function.Function;
import lombok.extern.slf4j.Slf4j;

/**
 * Call machinery shared by both registries. Serializes calls, runs each mutating call in its own
 * {@link RegistryTransaction}, commits the staged batch in one step and publishes the committed
 * events afterwards.
 *
 * <p>Subclasses must perform every identity and authorization check before staging any write.
 */
@Slf4j
public abstract class AbstractRegistry {

  private final Principal address;
  private final LedgerStoragePort ledger;
  private final AuthorizationPort authorizationPort;
  private final EventPort eventPort;
  private final ReentrantLock callLock = new ReentrantLock(true);

  protected AbstractRegistry(
      Principal address,
      LedgerStoragePort ledger,
      AuthorizationPort authorizationPort,
      EventPort eventPort) {
    this.address = Objects.requireNonNull(address, "Registry address cannot be null");
    this.ledger = Objects.requireNonNull(ledger, "Ledger storage cannot be null");
    this.authorizationPort =
        Objects.requireNonNull(authorizationPort, "Authorization port cannot be null");
    this.eventPort = Objects.requireNonNull(eventPort, "Event port cannot be null");
  }

  /** Gets the ledger address this registry stores its state under. */
  public Principal getAddress() {
    return address;
  }

  /** Gets the lifecycle state, derived from the presence of the instance record. */
  public RegistryState getState() {
    return query(tx -> tx.has(initializationKey()))
        ? RegistryState.READY
        : RegistryState.UNINITIALIZED;
  }

  /** The instance entry whose presence marks the registry as initialized. */
  protected abstract StorageKey initializationKey();

  /**
   * Runs a state-changing call. The body stages writes and exactly one event; they are committed
   * together once the body returns, and the proofs the call was verified with are spent. If the
   * body throws, nothing is committed and no proof is spent.
   *
   * <p>Committed events are published after the call lock is released, so subscribers may call
   * back into any registry.
   */
  protected void execute(String function, Consumer<RegistryTransaction> body) {
    List<LedgerEvent> committed;
    callLock.lock();
    try {
      RegistryTransaction tx = new RegistryTransaction(address, ledger);
      body.accept(tx);
      committed = ledger.commit(tx.toBatch());
      tx.verifiedProofs()
          .forEach(proof -> authorizationPort.consume(proof.principal(), proof.context()));
    } catch (RegistryException e) {
      log.warn("{} on {} rejected ({}): {}", function, address, e.getKind(), e.getMessage());
      throw e;
    } finally {
      callLock.unlock();
    }

    committed.forEach(this::publish);
  }

  /** Runs a read-only call against committed state. */
  protected <T> T query(Function<RegistryTransaction, T> body) {
    callLock.lock();
    try {
      return body.apply(new RegistryTransaction(address, ledger));
    } finally {
      callLock.unlock();
    }
  }

  protected void requireInitialized(RegistryTransaction tx) {
    if (!tx.has(initializationKey())) {
      throw RegistryException.notInitialized(address);
    }
  }

  protected void requireUninitialized(RegistryTransaction tx) {
    if (tx.has(initializationKey())) {
      throw RegistryException.alreadyInitialized(address);
    }
  }

  /**
   * Demands a valid authorization proof from the principal for this call. The proof is spent
   * only if the call commits.
   */
  protected void requireAuth(
      RegistryTransaction tx, Principal principal, String function, Object... arguments) {
    CallContext context = CallContext.of(address, function, arguments);
    if (!authorizationPort.verify(principal, context)) {
      throw RegistryException.notAuthorized(principal);
    }
    tx.verified(principal, context);
  }

  protected StorageKey instanceKey(String namespace) {
    return StorageKey.instance(address, namespace);
  }

  protected StorageKey persistentKey(String namespace, String id) {
    return StorageKey.persistent(address, namespace, id);
  }

  /** The event is already committed; a failure here must not look like an aborted call. */
  private void publish(LedgerEvent event) {
    if (!eventPort.isConnected()) {
      log.warn("Event port closed - event {} committed but not published", event.getSequence());
      return;
    }
    try {
      eventPort.publish(event);
    } catch (RuntimeException e) {
      log.error("Event {} committed but publishing failed", event.getSequence(), e);
    }
  }
}
