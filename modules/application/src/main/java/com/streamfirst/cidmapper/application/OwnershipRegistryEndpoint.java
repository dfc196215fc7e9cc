package com.streamfirst.cidmapper.application;

import com.streamfirst.cidmapper.domain.Principal;
import com.streamfirst.cidmapper.domain.TokenId;

/**
 * Call surface of an {@link OwnershipRegistry}. Principals are returned as their ids and
 * {@code tokens_of} as a list of token id strings.
 */
public class OwnershipRegistryEndpoint extends AbstractRegistryEndpoint {

  public OwnershipRegistryEndpoint(OwnershipRegistry registry) {
    super(registry.getAddress());

    command(
        "initialize",
        2,
        args -> registry.initialize(Principal.of(args.get(0)), Principal.of(args.get(1))));
    command(
        "mint",
        4,
        args ->
            registry.mint(
                Principal.of(args.get(0)),
                TokenId.of(args.get(1)),
                Principal.of(args.get(2)),
                args.get(3)));
    command(
        "transfer",
        3,
        args ->
            registry.transfer(
                Principal.of(args.get(0)), TokenId.of(args.get(1)), Principal.of(args.get(2))));
    command(
        "burn", 2, args -> registry.burn(Principal.of(args.get(0)), TokenId.of(args.get(1))));
    query("owner_of", 1, args -> registry.ownerOf(TokenId.of(args.get(0))).id());
    query("get_ipcm_key", 1, args -> registry.getIpcmKey(TokenId.of(args.get(0))));
    query(
        "tokens_of",
        1,
        args ->
            registry.tokensOf(Principal.of(args.get(0))).stream().map(TokenId::value).toList());
    query("admin", 0, args -> registry.getAdmin().id());
    query("mapping_registry", 0, args -> registry.getMappingRegistry().id());
  }
}
