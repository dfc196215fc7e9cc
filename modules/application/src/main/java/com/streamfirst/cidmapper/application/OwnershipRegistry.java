package com.streamfirst.cidmapper.application;

import com.streamfirst.cidmapper.domain.Principal;
import com.streamfirst.cidmapper.domain.RegistryException;
import com.streamfirst.cidmapper.domain.TokenBurned;
import com.streamfirst.cidmapper.domain.TokenHoldings;
import com.streamfirst.cidmapper.domain.TokenId;
import com.streamfirst.cidmapper.domain.TokenMinted;
import com.streamfirst.cidmapper.domain.TokenTransferred;
import com.streamfirst.cidmapper.ports.AuthorizationPort;
import com.streamfirst.cidmapper.ports.EventPort;
import com.streamfirst.cidmapper.ports.LedgerStoragePort;
import com.streamfirst.cidmapper.ports.LedgerStoragePort.StorageKey;
import java.util.List;
import java.util.Objects;
import lombok.extern.slf4j.Slf4j;

/**
 * Registry of token holders. Maintains three indexes that must agree after every call:
 *
 * <ul>
 *   <li>{@code TOKENS}: token id to holder, presence means the token is live
 *   <li>{@code OWNERS}: holder to the ordered ids they hold
 *   <li>{@code IPCMREF}: token id to its key in the linked mapping registry
 * </ul>
 *
 * <p>All three are staged in one transaction per call and committed together with the event, so a
 * rejected call leaves none of them touched. Only the admin may mint; only the current holder may
 * transfer or burn.
 *
 * <p>The mapping registry address is stored for reference. This registry never calls it.
 */
@Slf4j
public class OwnershipRegistry extends AbstractRegistry {

  static final String ADMIN = "ADMIN";
  static final String MAPPING_REGISTRY = "IPCM";
  static final String TOKENS = "TOKENS";
  static final String OWNERS = "OWNERS";
  static final String MAPPING_REF = "IPCMREF";

  public OwnershipRegistry(
      Principal address,
      LedgerStoragePort ledger,
      AuthorizationPort authorizationPort,
      EventPort eventPort) {
    super(address, ledger, authorizationPort, eventPort);
  }

  /**
   * Sets the admin and the linked mapping registry. Can only ever succeed once.
   *
   * @throws RegistryException with ALREADY_INITIALIZED on a second call
   */
  public void initialize(Principal admin, Principal mappingRegistry) {
    Objects.requireNonNull(admin, "Admin cannot be null");
    Objects.requireNonNull(mappingRegistry, "Mapping registry address cannot be null");

    execute(
        "initialize",
        tx -> {
          requireUninitialized(tx);
          tx.put(adminKey(), admin);
          tx.put(mappingRegistryKey(), mappingRegistry);
        });

    log.info(
        "Initialized ownership registry {} with admin {} linked to {}",
        getAddress(),
        admin,
        mappingRegistry);
  }

  /**
   * Creates a token and hands it to a holder.
   *
   * @param caller must be the admin and prove it
   * @param tokenId id of the new token; must not be live
   * @param holder the first holder
   * @param mappingKey the token's key in the mapping registry
   * @throws RegistryException with NOT_ADMIN, NOT_AUTHORIZED or TOKEN_ALREADY_EXISTS
   */
  public void mint(Principal caller, TokenId tokenId, Principal holder, String mappingKey) {
    Objects.requireNonNull(caller, "Caller cannot be null");
    Objects.requireNonNull(tokenId, "Token ID cannot be null");
    Objects.requireNonNull(holder, "Holder cannot be null");
    Objects.requireNonNull(mappingKey, "Mapping key cannot be null");

    execute(
        "mint",
        tx -> {
          requireInitialized(tx);
          Principal admin = tx.get(adminKey(), Principal.class).orElseThrow();
          if (!caller.equals(admin)) {
            throw RegistryException.notAdmin(caller);
          }
          requireAuth(tx, caller, "mint", caller, tokenId, holder, mappingKey);

          if (tx.has(tokenKey(tokenId))) {
            throw RegistryException.tokenAlreadyExists(tokenId);
          }

          tx.put(tokenKey(tokenId), holder);
          tx.put(holdingsKey(holder), holdings(tx, holder).append(tokenId));
          tx.put(mappingRefKey(tokenId), mappingKey);
          tx.emit(new TokenMinted(tokenId, holder, mappingKey));
        });

    log.info("Minted {} to {} (mapping key {})", tokenId, holder, mappingKey);
  }

  /**
   * Moves a token to a new holder. The mapping reference is left as is. A transfer to the current
   * holder moves the id to the end of that holder's sequence.
   *
   * @param caller must be the current holder and prove it
   * @throws RegistryException with TOKEN_NOT_FOUND, NOT_OWNER or NOT_AUTHORIZED
   */
  public void transfer(Principal caller, TokenId tokenId, Principal to) {
    Objects.requireNonNull(caller, "Caller cannot be null");
    Objects.requireNonNull(tokenId, "Token ID cannot be null");
    Objects.requireNonNull(to, "Recipient cannot be null");

    execute(
        "transfer",
        tx -> {
          Principal from = requireHolder(tx, caller, tokenId, "transfer", caller, tokenId, to);

          // remove first so a self-transfer re-appends at the end
          putHoldings(tx, from, holdings(tx, from).without(tokenId));
          tx.put(holdingsKey(to), holdings(tx, to).append(tokenId));
          tx.put(tokenKey(tokenId), to);
          tx.emit(new TokenTransferred(tokenId, from, to));
        });

    log.info("Transferred {} from {} to {}", tokenId, caller, to);
  }

  /**
   * Destroys a token, purging it from every index. The id may be minted again afterwards.
   *
   * @param caller must be the current holder and prove it
   * @throws RegistryException with TOKEN_NOT_FOUND, NOT_OWNER or NOT_AUTHORIZED
   */
  public void burn(Principal caller, TokenId tokenId) {
    Objects.requireNonNull(caller, "Caller cannot be null");
    Objects.requireNonNull(tokenId, "Token ID cannot be null");

    execute(
        "burn",
        tx -> {
          Principal holder = requireHolder(tx, caller, tokenId, "burn", caller, tokenId);

          putHoldings(tx, holder, holdings(tx, holder).without(tokenId));
          tx.remove(tokenKey(tokenId));
          tx.remove(mappingRefKey(tokenId));
          tx.emit(new TokenBurned(tokenId, holder));
        });

    log.info("Burned {} held by {}", tokenId, caller);
  }

  /**
   * Gets the current holder of a token.
   *
   * @throws RegistryException with TOKEN_NOT_FOUND if the token is not live
   */
  public Principal ownerOf(TokenId tokenId) {
    Objects.requireNonNull(tokenId, "Token ID cannot be null");

    return query(
        tx -> {
          requireInitialized(tx);
          return tx.get(tokenKey(tokenId), Principal.class)
              .orElseThrow(() -> RegistryException.tokenNotFound(tokenId));
        });
  }

  /**
   * Gets the mapping key recorded for a token at mint time.
   *
   * @throws RegistryException with TOKEN_NOT_FOUND if the token is not live
   */
  public String getIpcmKey(TokenId tokenId) {
    Objects.requireNonNull(tokenId, "Token ID cannot be null");

    return query(
        tx -> {
          requireInitialized(tx);
          return tx.get(mappingRefKey(tokenId), String.class)
              .orElseThrow(() -> RegistryException.tokenNotFound(tokenId));
        });
  }

  /** Gets the ids a principal holds, in the order they were received. Empty if none. */
  public List<TokenId> tokensOf(Principal holder) {
    Objects.requireNonNull(holder, "Holder cannot be null");

    return query(
        tx -> {
          requireInitialized(tx);
          return holdings(tx, holder).tokens();
        });
  }

  public Principal getAdmin() {
    return readInstance(adminKey());
  }

  public Principal getMappingRegistry() {
    return readInstance(mappingRegistryKey());
  }

  @Override
  protected StorageKey initializationKey() {
    return adminKey();
  }

  /**
   * Checks shared by transfer and burn, in order: the token exists, the caller holds it, the
   * caller proves it.
   *
   * @return the current holder
   */
  private Principal requireHolder(
      RegistryTransaction tx,
      Principal caller,
      TokenId tokenId,
      String function,
      Object... arguments) {
    requireInitialized(tx);
    Principal holder =
        tx.get(tokenKey(tokenId), Principal.class)
            .orElseThrow(() -> RegistryException.tokenNotFound(tokenId));
    if (!caller.equals(holder)) {
      throw RegistryException.notOwner(caller);
    }
    requireAuth(tx, caller, function, arguments);
    return holder;
  }

  private Principal readInstance(StorageKey key) {
    return query(
        tx ->
            tx.get(key, Principal.class)
                .orElseThrow(() -> RegistryException.notInitialized(getAddress())));
  }

  private TokenHoldings holdings(RegistryTransaction tx, Principal holder) {
    return tx.get(holdingsKey(holder), TokenHoldings.class).orElse(TokenHoldings.empty());
  }

  /** An empty sequence is stored as no entry at all. */
  private void putHoldings(RegistryTransaction tx, Principal holder, TokenHoldings holdings) {
    if (holdings.isEmpty()) {
      tx.remove(holdingsKey(holder));
    } else {
      tx.put(holdingsKey(holder), holdings);
    }
  }

  private StorageKey adminKey() {
    return instanceKey(ADMIN);
  }

  private StorageKey mappingRegistryKey() {
    return instanceKey(MAPPING_REGISTRY);
  }

  private StorageKey tokenKey(TokenId tokenId) {
    return persistentKey(TOKENS, tokenId.value());
  }

  private StorageKey holdingsKey(Principal holder) {
    return persistentKey(OWNERS, holder.id());
  }

  private StorageKey mappingRefKey(TokenId tokenId) {
    return persistentKey(MAPPING_REF, tokenId.value());
  }
}
