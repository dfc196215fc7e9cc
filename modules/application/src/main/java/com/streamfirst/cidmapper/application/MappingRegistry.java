package com.streamfirst.cidmapper.application;

import com.streamfirst.cidmapper.domain.MappingUpdated;
import com.streamfirst.cidmapper.domain.OwnershipTransferred;
import com.streamfirst.cidmapper.domain.Principal;
import com.streamfirst.cidmapper.domain.RegistryException;
import com.streamfirst.cidmapper.domain.TokenId;
import com.streamfirst.cidmapper.ports.AuthorizationPort;
import com.streamfirst.cidmapper.ports.EventPort;
import com.streamfirst.cidmapper.ports.LedgerStoragePort;
import com.streamfirst.cidmapper.ports.LedgerStoragePort.StorageKey;
import java.util.Objects;
import lombok.extern.slf4j.Slf4j;

/**
 * Registry of mutable content pointers: token id to content hash (CID). Only the registry owner
 * may move a pointer. Every update publishes the value it replaced, so the event log holds the
 * complete history of each pointer while storage keeps only the latest value.
 *
 * <p>Reads never fail on an unknown token id; they return the empty string instead.
 */
@Slf4j
public class MappingRegistry extends AbstractRegistry {

  static final String OWNER = "OWNER";
  static final String MAPPING = "MAP";

  public MappingRegistry(
      Principal address,
      LedgerStoragePort ledger,
      AuthorizationPort authorizationPort,
      EventPort eventPort) {
    super(address, ledger, authorizationPort, eventPort);
  }

  /**
   * Sets the owner. Can only ever succeed once.
   *
   * @param owner the principal allowed to update mappings
   * @throws RegistryException with ALREADY_INITIALIZED if an owner is already set
   */
  public void initialize(Principal owner) {
    Objects.requireNonNull(owner, "Owner cannot be null");

    execute(
        "initialize",
        tx -> {
          requireUninitialized(tx);
          tx.put(ownerKey(), owner);
        });

    log.info("Initialized mapping registry {} with owner {}", getAddress(), owner);
  }

  /**
   * Points a token id at new content, replacing the previous value.
   *
   * @param caller the principal making the call; must be the owner and prove it
   * @param tokenId the token whose pointer moves
   * @param newCid the new content hash; not validated
   * @throws RegistryException with NOT_OWNER or NOT_AUTHORIZED if the caller fails the owner check
   */
  public void updateMapping(Principal caller, TokenId tokenId, String newCid) {
    Objects.requireNonNull(caller, "Caller cannot be null");
    Objects.requireNonNull(tokenId, "Token ID cannot be null");
    Objects.requireNonNull(newCid, "CID cannot be null");

    execute(
        "update_mapping",
        tx -> {
          requireOwner(tx, caller, "update_mapping", caller, tokenId, newCid);

          String oldCid = tx.get(mappingKey(tokenId), String.class).orElse("");
          tx.put(mappingKey(tokenId), newCid);
          tx.emit(new MappingUpdated(tokenId, oldCid, newCid, caller));

          log.debug("Staged mapping {}: '{}' -> '{}'", tokenId, oldCid, newCid);
        });

    log.info("Updated mapping for {} to {}", tokenId, newCid);
  }

  /**
   * Gets the current content hash of a token id.
   *
   * @param tokenId the token to look up
   * @return the current CID, or "" if it was never set
   */
  public String getMapping(TokenId tokenId) {
    Objects.requireNonNull(tokenId, "Token ID cannot be null");

    return query(
        tx -> {
          requireInitialized(tx);
          return tx.get(mappingKey(tokenId), String.class).orElse("");
        });
  }

  /**
   * Hands the registry over to a new owner.
   *
   * @param caller the current owner, with proof
   * @param newOwner the principal taking over
   */
  public void transferOwnership(Principal caller, Principal newOwner) {
    Objects.requireNonNull(caller, "Caller cannot be null");
    Objects.requireNonNull(newOwner, "New owner cannot be null");

    execute(
        "transfer_ownership",
        tx -> {
          requireOwner(tx, caller, "transfer_ownership", caller, newOwner);

          tx.put(ownerKey(), newOwner);
          tx.emit(new OwnershipTransferred(caller, newOwner));
        });

    log.info("Transferred ownership of {} from {} to {}", getAddress(), caller, newOwner);
  }

  /** Gets the current owner. */
  public Principal getOwner() {
    return query(
        tx ->
            tx.get(ownerKey(), Principal.class)
                .orElseThrow(() -> RegistryException.notInitialized(getAddress())));
  }

  @Override
  protected StorageKey initializationKey() {
    return ownerKey();
  }

  /**
   * The single authorization rule of this registry: the caller must be the stored owner and must
   * present proof for it. Both checks are required; the identity check comes first.
   */
  private void requireOwner(
      RegistryTransaction tx, Principal caller, String function, Object... arguments) {
    Principal owner =
        tx.get(ownerKey(), Principal.class)
            .orElseThrow(() -> RegistryException.notInitialized(getAddress()));
    if (!caller.equals(owner)) {
      throw RegistryException.notOwner(caller);
    }
    requireAuth(tx, caller, function, arguments);
  }

  private StorageKey ownerKey() {
    return instanceKey(OWNER);
  }

  private StorageKey mappingKey(TokenId tokenId) {
    return persistentKey(MAPPING, tokenId.value());
  }
}
