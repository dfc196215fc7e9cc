package com.streamfirst.cidmapper.application;

import com.streamfirst.cidmapper.domain.Principal;
import com.streamfirst.cidmapper.domain.TokenId;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;

/**
 * Follows a token to its current content: the ownership registry gives the token's mapping key,
 * the linked mapping registry gives the content hash stored under it. Neither registry calls the
 * other; they are only composed here.
 */
@Slf4j
@RequiredArgsConstructor
public class TokenContentResolver {

  private final OwnershipRegistry ownershipRegistry;
  private final MappingRegistry mappingRegistry;

  /**
   * Gets the current content hash of a live token.
   *
   * @return the CID, or "" if the mapping key was never given a value
   * @throws com.streamfirst.cidmapper.domain.RegistryException with TOKEN_NOT_FOUND if the token
   *     is not live
   * @throws IllegalStateException if the mapping registry is not the one the ownership registry
   *     is linked to
   */
  public String contentOf(TokenId tokenId) {
    Principal linked = ownershipRegistry.getMappingRegistry();
    if (!linked.equals(mappingRegistry.getAddress())) {
      throw new IllegalStateException(
          "Ownership registry "
              + ownershipRegistry.getAddress()
              + " is linked to "
              + linked
              + ", not "
              + mappingRegistry.getAddress());
    }

    String mappingKey = ownershipRegistry.getIpcmKey(tokenId);
    String cid = mappingRegistry.getMapping(TokenId.of(mappingKey));
    log.debug("Resolved {} via mapping key {} to '{}'", tokenId, mappingKey, cid);
    return cid;
  }
}
