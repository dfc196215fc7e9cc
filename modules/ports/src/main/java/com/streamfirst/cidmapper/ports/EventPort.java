package com.streamfirst.cidmapper.ports;

import com.streamfirst.cidmapper.domain.LedgerEvent;
import java.util.function.Consumer;

/**
 * Port for notifying interested parties of committed registry events. Publishing happens only
 * after a call has committed, so subscribers never see an event that could still be rolled back.
 */
public interface EventPort {

  /**
   * Delivers a committed event to every subscriber of its topic.
   *
   * @param event the committed event
   * @throws IllegalStateException if the port has been closed
   */
  void publish(LedgerEvent event);

  /**
   * Subscribes to one topic.
   *
   * @param topic the event topic (e.g., "MINT")
   * @param handler the handler to process delivered events
   * @return subscription ID for managing this specific subscription
   */
  String subscribe(String topic, Consumer<LedgerEvent> handler);

  /**
   * Subscribes to every topic.
   *
   * @param handler the handler to process delivered events
   * @return subscription ID for managing this specific subscription
   */
  String subscribeAll(Consumer<LedgerEvent> handler);

  /**
   * Unsubscribes a specific subscription by its ID.
   *
   * @param subscriptionId the subscription ID to remove
   * @return true if subscription was found and removed, false otherwise
   */
  boolean unsubscribe(String subscriptionId);

  /**
   * Checks if the port still accepts events.
   *
   * @return true if open, false once closed
   */
  boolean isConnected();

  /** Closes the port and drops all subscriptions. */
  void close();
}
