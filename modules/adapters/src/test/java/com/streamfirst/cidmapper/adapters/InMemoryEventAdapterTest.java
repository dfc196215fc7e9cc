package com.streamfirst.cidmapper.adapters;

import static org.assertj.core.api.Assertions.assertThat;
import static org.junit.jupiter.api.Assertions.assertThrows;

import com.streamfirst.cidmapper.domain.EventPayload;
import com.streamfirst.cidmapper.domain.LedgerEvent;
import com.streamfirst.cidmapper.domain.Principal;
import com.streamfirst.cidmapper.domain.TokenBurned;
import com.streamfirst.cidmapper.domain.TokenId;
import com.streamfirst.cidmapper.domain.TokenTransferred;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

class InMemoryEventAdapterTest {

  private static final Principal REGISTRY = Principal.of("registry-tokens");
  private static final Principal ALICE = Principal.of("alice");

  private InMemoryEventAdapter events;

  @BeforeEach
  void setUp() {
    events = new InMemoryEventAdapter();
  }

  @Test
  void testDeliversByTopicAndToCatchAllSubscribers() {
    List<LedgerEvent> burns = new ArrayList<>();
    List<LedgerEvent> all = new ArrayList<>();
    events.subscribe(TokenBurned.TOPIC, burns::add);
    events.subscribeAll(all::add);

    LedgerEvent burn = event(1, new TokenBurned(TokenId.of("t1"), ALICE));
    LedgerEvent transfer =
        event(2, new TokenTransferred(TokenId.of("t2"), ALICE, Principal.of("bob")));
    events.publish(burn);
    events.publish(transfer);

    assertThat(burns).containsExactly(burn);
    assertThat(all).containsExactly(burn, transfer);
  }

  @Test
  void testFailingSubscriberDoesNotBlockOthers() {
    List<LedgerEvent> received = new ArrayList<>();
    events.subscribe(
        TokenBurned.TOPIC,
        e -> {
          throw new IllegalStateException("boom");
        });
    events.subscribe(TokenBurned.TOPIC, received::add);

    events.publish(event(1, new TokenBurned(TokenId.of("t1"), ALICE)));

    assertThat(received).hasSize(1);
  }

  @Test
  void testUnsubscribe() {
    List<LedgerEvent> received = new ArrayList<>();
    String id = events.subscribe(TokenBurned.TOPIC, received::add);

    assertThat(events.unsubscribe(id)).isTrue();
    assertThat(events.unsubscribe(id)).isFalse();
    events.publish(event(1, new TokenBurned(TokenId.of("t1"), ALICE)));

    assertThat(received).isEmpty();
    assertThat(events.getSubscriptionStats()).containsEntry(TokenBurned.TOPIC, 0);
  }

  @Test
  void testPublishAfterCloseFails() {
    events.close();

    assertThat(events.isConnected()).isFalse();
    assertThrows(
        IllegalStateException.class,
        () -> events.publish(event(1, new TokenBurned(TokenId.of("t1"), ALICE))));
  }

  private static LedgerEvent event(long sequence, EventPayload payload) {
    return LedgerEvent.committed(sequence, REGISTRY, payload, Instant.EPOCH);
  }
}
