package com.streamfirst.cidmapper.boot;

import com.streamfirst.cidmapper.adapters.InMemoryAuthorizationAdapter;
import com.streamfirst.cidmapper.adapters.InMemoryEventAdapter;
import com.streamfirst.cidmapper.adapters.InMemoryLedgerAdapter;
import com.streamfirst.cidmapper.application.MappingHistory;
import com.streamfirst.cidmapper.application.MappingRegistry;
import com.streamfirst.cidmapper.application.MappingRegistryEndpoint;
import com.streamfirst.cidmapper.application.OwnershipRegistry;
import com.streamfirst.cidmapper.application.OwnershipRegistryEndpoint;
import com.streamfirst.cidmapper.application.TokenContentResolver;
import com.streamfirst.cidmapper.domain.Principal;
import com.streamfirst.cidmapper.domain.RegistryState;
import com.streamfirst.cidmapper.domain.TokenId;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.CommandLineRunner;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

/** Wires both registries over the in-memory ledger and optionally runs a demo flow. */
@Slf4j
@Configuration
public class CidMapperConfiguration {

  // --- Adapter beans ---

  @Bean
  public InMemoryLedgerAdapter ledger() {
    log.info("Creating in-memory ledger");
    return new InMemoryLedgerAdapter();
  }

  @Bean(destroyMethod = "close")
  public InMemoryEventAdapter eventPort() {
    return new InMemoryEventAdapter();
  }

  @Bean
  public InMemoryAuthorizationAdapter authorizationPort() {
    return new InMemoryAuthorizationAdapter();
  }

  // --- Registry beans ---

  @Bean
  public MappingRegistry mappingRegistry(
      CidMapperProperties properties,
      InMemoryLedgerAdapter ledger,
      InMemoryAuthorizationAdapter authorizationPort,
      InMemoryEventAdapter eventPort) {
    MappingRegistry registry =
        new MappingRegistry(
            Principal.of(properties.getMapping().getAddress()),
            ledger,
            authorizationPort,
            eventPort);
    if (properties.isAutoInitialize() && registry.getState() == RegistryState.UNINITIALIZED) {
      registry.initialize(Principal.of(required(properties.getMapping().getOwner(), "owner")));
    }
    return registry;
  }

  @Bean
  public OwnershipRegistry ownershipRegistry(
      CidMapperProperties properties,
      InMemoryLedgerAdapter ledger,
      InMemoryAuthorizationAdapter authorizationPort,
      InMemoryEventAdapter eventPort,
      MappingRegistry mappingRegistry) {
    OwnershipRegistry registry =
        new OwnershipRegistry(
            Principal.of(properties.getOwnership().getAddress()),
            ledger,
            authorizationPort,
            eventPort);
    if (properties.isAutoInitialize() && registry.getState() == RegistryState.UNINITIALIZED) {
      registry.initialize(
          Principal.of(required(properties.getOwnership().getAdmin(), "admin")),
          mappingRegistry.getAddress());
    }
    return registry;
  }

  // --- Services ---

  @Bean
  public MappingHistory mappingHistory(
      InMemoryLedgerAdapter ledger, MappingRegistry mappingRegistry) {
    return new MappingHistory(ledger, mappingRegistry.getAddress());
  }

  @Bean
  public TokenContentResolver tokenContentResolver(
      OwnershipRegistry ownershipRegistry, MappingRegistry mappingRegistry) {
    return new TokenContentResolver(ownershipRegistry, mappingRegistry);
  }

  @Bean
  public MappingRegistryEndpoint mappingRegistryEndpoint(MappingRegistry mappingRegistry) {
    return new MappingRegistryEndpoint(mappingRegistry);
  }

  @Bean
  public OwnershipRegistryEndpoint ownershipRegistryEndpoint(OwnershipRegistry ownershipRegistry) {
    return new OwnershipRegistryEndpoint(ownershipRegistry);
  }

  // --- Demo runner ---

  @Bean
  @ConditionalOnProperty(prefix = "cidmapper.demo", name = "enabled", havingValue = "true")
  public CommandLineRunner demo(
      MappingRegistry mappingRegistry,
      OwnershipRegistry ownershipRegistry,
      MappingHistory history,
      TokenContentResolver resolver,
      InMemoryAuthorizationAdapter authorizationPort,
      InMemoryEventAdapter eventPort) {
    return args -> {
      log.info("--- Starting CID mapper demo ---");
      eventPort.subscribeAll(event -> log.info("Event: {}", event));

      Principal owner = mappingRegistry.getOwner();
      Principal admin = ownershipRegistry.getAdmin();
      Principal holder = Principal.generate();
      Principal buyer = Principal.generate();
      authorizationPort.authorize(owner);
      authorizationPort.authorize(admin);
      authorizationPort.authorize(holder);

      TokenId token = TokenId.of("demo-token");
      ownershipRegistry.mint(admin, token, holder, token.value());
      mappingRegistry.updateMapping(owner, token, "bafy-demo-v1");
      mappingRegistry.updateMapping(owner, token, "bafy-demo-v2");
      log.info("Content of {}: {}", token, resolver.contentOf(token));

      ownershipRegistry.transfer(holder, token, buyer);
      log.info("{} now held by {}", token, ownershipRegistry.ownerOf(token));
      log.info("History of {}: {}", token, history.revisions(token));

      authorizationPort.revoke(holder);
      log.info("--- Demo finished ---");
    };
  }

  private static String required(String value, String name) {
    if (value == null || value.isBlank()) {
      throw new IllegalStateException(
          "cidmapper " + name + " must be configured when auto-initialize is enabled");
    }
    return value;
  }
}
