package com.streamfirst.cidmapper.adapters;

import com.streamfirst.cidmapper.domain.LedgerEvent;
import com.streamfirst.cidmapper.ports.EventPort;
import java.util.*;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.atomic.AtomicLong;
import java.util.function.Consumer;
import lombok.extern.slf4j.Slf4j;

/**
 * In-memory implementation of EventPort for testing and development. Delivers committed events
 * synchronously within the same JVM. A failing subscriber is logged and skipped; it never affects
 * other subscribers or the call that produced the event.
 */
@Slf4j
public class InMemoryEventAdapter implements EventPort {

  private static final String ALL_TOPICS = "*";

  private final Map<String, List<Consumer<LedgerEvent>>> topicSubscribers =
      new ConcurrentHashMap<>();
  private final Map<String, String> subscriptionToTopic = new ConcurrentHashMap<>();
  private final Map<String, Consumer<LedgerEvent>> subscriptionToHandler =
      new ConcurrentHashMap<>();
  private final AtomicLong subscriptionCounter = new AtomicLong(1);
  private volatile boolean connected = true;

  @Override
  public void publish(LedgerEvent event) {
    if (!connected) {
      throw new IllegalStateException("Event port is not connected");
    }

    log.debug("Publishing event {} to topic '{}'", event.getSequence(), event.getTopic());

    int delivered = deliver(event.getTopic(), event) + deliver(ALL_TOPICS, event);

    log.debug("Published event {} - delivered to {} subscribers", event.getSequence(), delivered);
  }

  @Override
  public String subscribe(String topic, Consumer<LedgerEvent> handler) {
    Objects.requireNonNull(topic, "Topic cannot be null");
    Objects.requireNonNull(handler, "Handler cannot be null");

    String subscriptionId = "sub-" + subscriptionCounter.getAndIncrement();

    topicSubscribers.computeIfAbsent(topic, k -> new CopyOnWriteArrayList<>()).add(handler);
    subscriptionToTopic.put(subscriptionId, topic);
    subscriptionToHandler.put(subscriptionId, handler);

    log.info(
        "Subscribed to topic '{}' with ID {} - total subscribers: {}",
        topic,
        subscriptionId,
        topicSubscribers.get(topic).size());

    return subscriptionId;
  }

  @Override
  public String subscribeAll(Consumer<LedgerEvent> handler) {
    return subscribe(ALL_TOPICS, handler);
  }

  @Override
  public boolean unsubscribe(String subscriptionId) {
    String topic = subscriptionToTopic.remove(subscriptionId);
    Consumer<LedgerEvent> handler = subscriptionToHandler.remove(subscriptionId);
    if (topic == null || handler == null) {
      log.debug("Subscription '{}' not found", subscriptionId);
      return false;
    }

    List<Consumer<LedgerEvent>> subscribers = topicSubscribers.get(topic);
    if (subscribers != null) {
      subscribers.remove(handler);
    }

    log.info("Unsubscribed subscription '{}' from topic '{}'", subscriptionId, topic);
    return true;
  }

  @Override
  public boolean isConnected() {
    return connected;
  }

  @Override
  public void close() {
    log.info("Closing event port");
    connected = false;
    topicSubscribers.clear();
    subscriptionToTopic.clear();
    subscriptionToHandler.clear();
  }

  /** Gets subscriber counts per topic for monitoring. */
  public Map<String, Integer> getSubscriptionStats() {
    Map<String, Integer> stats = new HashMap<>();
    topicSubscribers.forEach((topic, subscribers) -> stats.put(topic, subscribers.size()));
    return stats;
  }

  private int deliver(String topic, LedgerEvent event) {
    List<Consumer<LedgerEvent>> subscribers = topicSubscribers.getOrDefault(topic, List.of());
    for (Consumer<LedgerEvent> subscriber : subscribers) {
      try {
        subscriber.accept(event);
      } catch (Exception e) {
        log.error(
            "Error delivering event {} to subscriber for '{}'", event.getSequence(), topic, e);
      }
    }
    return subscribers.size();
  }
}
