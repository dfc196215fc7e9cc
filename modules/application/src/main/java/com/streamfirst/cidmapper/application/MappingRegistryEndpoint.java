package com.streamfirst.cidmapper.application;

import com.streamfirst.cidmapper.domain.Principal;
import com.streamfirst.cidmapper.domain.TokenId;

/** Call surface of a {@link MappingRegistry}. */
public class MappingRegistryEndpoint extends AbstractRegistryEndpoint {

  public MappingRegistryEndpoint(MappingRegistry registry) {
    super(registry.getAddress());

    command("initialize", 1, args -> registry.initialize(Principal.of(args.get(0))));
    command(
        "update_mapping",
        3,
        args ->
            registry.updateMapping(
                Principal.of(args.get(0)), TokenId.of(args.get(1)), args.get(2)));
    query("get_mapping", 1, args -> registry.getMapping(TokenId.of(args.get(0))));
    command(
        "transfer_ownership",
        2,
        args -> registry.transferOwnership(Principal.of(args.get(0)), Principal.of(args.get(1))));
    query("owner", 0, args -> registry.getOwner().id());
  }
}
