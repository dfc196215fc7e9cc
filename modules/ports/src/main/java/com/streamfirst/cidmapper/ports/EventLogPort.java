package com.streamfirst.cidmapper.ports;

import com.streamfirst.cidmapper.domain.LedgerEvent;
import com.streamfirst.cidmapper.domain.Principal;
import java.util.List;
import java.util.function.Predicate;

/**
 * Port for reading the append-only event log. The log is kept apart from current-state storage
 * and is the only source for questions about past values.
 */
public interface EventLogPort {

  /**
   * Gets committed events matching the criteria.
   *
   * @param criteria predicate to filter events
   * @return matching events in commit order
   */
  List<LedgerEvent> getEvents(Predicate<LedgerEvent> criteria);

  /**
   * Gets all events a registry emitted under a topic for one subject.
   *
   * @param contract the emitting registry
   * @param topic the event topic
   * @param subject the subject, usually a token id
   * @return matching events in commit order
   */
  default List<LedgerEvent> getEvents(Principal contract, String topic, String subject) {
    return getEvents(
        event ->
            event.getContract().equals(contract)
                && event.getTopic().equals(topic)
                && event.getSubject().filter(subject::equals).isPresent());
  }

  /**
   * Gets all events emitted by a registry.
   *
   * @param contract the emitting registry
   * @return its events in commit order
   */
  default List<LedgerEvent> getEvents(Principal contract) {
    return getEvents(event -> event.getContract().equals(contract));
  }

  /**
   * Gets the sequence of the last committed event.
   *
   * @return the latest sequence, or 0 if the log is empty
   */
  long getLatestSequence();
}
