package com.streamfirst.cidmapper.application;

import static org.assertj.core.api.Assertions.assertThat;

import com.streamfirst.cidmapper.adapters.InMemoryAuthorizationAdapter;
import com.streamfirst.cidmapper.adapters.InMemoryEventAdapter;
import com.streamfirst.cidmapper.adapters.InMemoryLedgerAdapter;
import com.streamfirst.cidmapper.domain.MappingUpdated;
import com.streamfirst.cidmapper.domain.Principal;
import com.streamfirst.cidmapper.domain.TokenId;
import com.streamfirst.cidmapper.domain.TokenMinted;
import java.util.ArrayList;
import java.util.List;
import java.util.Queue;
import java.util.concurrent.ConcurrentLinkedQueue;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.atomic.AtomicInteger;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

/** Both registries share one ledger and one event port, as the boot module wires them. */
class RegistryConcurrencyTest {

  private static final Principal MAPPING_ADDRESS = Principal.of("registry-ipcm");
  private static final Principal OWNERSHIP_ADDRESS = Principal.of("registry-tokens");
  private static final Principal ADMIN = Principal.of("admin-a");
  private static final Principal U = Principal.of("user-u");
  private static final int ROUNDS = 200;

  private InMemoryLedgerAdapter ledger;
  private InMemoryEventAdapter events;
  private MappingRegistry mappingRegistry;
  private OwnershipRegistry ownershipRegistry;
  private Queue<Throwable> failures;

  @BeforeEach
  void setUp() {
    ledger = new InMemoryLedgerAdapter();
    events = new InMemoryEventAdapter();
    InMemoryAuthorizationAdapter auth = new InMemoryAuthorizationAdapter();
    mappingRegistry = new MappingRegistry(MAPPING_ADDRESS, ledger, auth, events);
    ownershipRegistry = new OwnershipRegistry(OWNERSHIP_ADDRESS, ledger, auth, events);
    mappingRegistry.initialize(ADMIN);
    ownershipRegistry.initialize(ADMIN, MAPPING_ADDRESS);
    auth.authorize(ADMIN);
    failures = new ConcurrentLinkedQueue<>();
  }

  @Test
  void testSubscribersMayReadTheOtherRegistry() throws InterruptedException {
    AtomicInteger mappingReads = new AtomicInteger();
    AtomicInteger ownershipReads = new AtomicInteger();
    events.subscribe(
        MappingUpdated.TOPIC,
        event -> {
          ownershipRegistry.tokensOf(U);
          ownershipReads.incrementAndGet();
        });
    events.subscribe(
        TokenMinted.TOPIC,
        event -> {
          mappingRegistry.getMapping(TokenId.of("t1"));
          mappingReads.incrementAndGet();
        });

    CountDownLatch start = new CountDownLatch(1);
    Thread updater =
        worker(
            start,
            () -> {
              for (int i = 0; i < ROUNDS; i++) {
                mappingRegistry.updateMapping(ADMIN, TokenId.of("t1"), "cid" + i);
              }
            });
    Thread minter =
        worker(
            start,
            () -> {
              for (int i = 0; i < ROUNDS; i++) {
                ownershipRegistry.mint(ADMIN, TokenId.of("tok" + i), U, "t1");
              }
            });
    start.countDown();
    updater.join(10_000);
    minter.join(10_000);

    assertThat(updater.isAlive()).isFalse();
    assertThat(minter.isAlive()).isFalse();
    assertThat(failures).isEmpty();
    assertThat(ownershipReads).hasValue(ROUNDS);
    assertThat(mappingReads).hasValue(ROUNDS);
    assertThat(ownershipRegistry.tokensOf(U)).hasSize(ROUNDS);
  }

  @Test
  void testConcurrentUpdatesOfOneTokenFormAnUnbrokenChain() throws InterruptedException {
    TokenId token = TokenId.of("shared");
    int threads = 8;
    CountDownLatch start = new CountDownLatch(1);
    List<Thread> workers = new ArrayList<>();
    for (int t = 0; t < threads; t++) {
      String prefix = "w" + t + "-";
      workers.add(
          worker(
              start,
              () -> {
                for (int i = 0; i < ROUNDS; i++) {
                  mappingRegistry.updateMapping(ADMIN, token, prefix + i);
                }
              }));
    }
    start.countDown();
    for (Thread worker : workers) {
      worker.join(10_000);
      assertThat(worker.isAlive()).isFalse();
    }

    assertThat(failures).isEmpty();
    MappingHistory history = new MappingHistory(ledger, MAPPING_ADDRESS);
    assertThat(history.revisions(token)).hasSize(threads * ROUNDS);
    assertThat(history.isConsistent(token)).isTrue();
    assertThat(history.valueAt(token, threads * ROUNDS))
        .contains(mappingRegistry.getMapping(token));
  }

  private Thread worker(CountDownLatch start, Runnable body) {
    Thread thread =
        new Thread(
            () -> {
              try {
                start.await();
                body.run();
              } catch (Throwable e) {
                failures.add(e);
              }
            });
    thread.setDaemon(true);
    thread.start();
    return thread;
  }
}
