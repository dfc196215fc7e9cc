package com.streamfirst.cidmapper.application;

import com.streamfirst.cidmapper.domain.LedgerEvent;
import com.streamfirst.cidmapper.domain.MappingRevision;
import com.streamfirst.cidmapper.domain.MappingUpdated;
import com.streamfirst.cidmapper.domain.Principal;
import com.streamfirst.cidmapper.domain.TokenId;
import com.streamfirst.cidmapper.ports.EventLogPort;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.Optional;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;

/**
 * Rebuilds the value history of content pointers from the event log of one mapping registry.
 * Never reads current-state storage: the log alone is the history store.
 */
@Slf4j
@RequiredArgsConstructor
public class MappingHistory {

  private final EventLogPort eventLog;
  private final Principal mappingRegistry;

  /**
   * Gets every update of a token's pointer in emission order.
   *
   * @param tokenId the token to trace
   * @return revisions numbered from 1, empty if the pointer was never set
   */
  public List<MappingRevision> revisions(TokenId tokenId) {
    Objects.requireNonNull(tokenId, "Token ID cannot be null");

    List<LedgerEvent> events =
        eventLog.getEvents(mappingRegistry, MappingUpdated.TOPIC, tokenId.value());

    List<MappingRevision> revisions = new ArrayList<>(events.size());
    for (LedgerEvent event : events) {
      MappingUpdated update = event.payloadAs(MappingUpdated.class);
      revisions.add(
          new MappingRevision(
              revisions.size() + 1,
              update.oldCid(),
              update.newCid(),
              update.caller(),
              event.getSequence(),
              event.getEmittedAt()));
    }

    log.debug("Rebuilt {} revisions of {} from {}", revisions.size(), tokenId, mappingRegistry);
    return revisions;
  }

  /**
   * Gets the value a token pointed to after a given revision.
   *
   * @param revision 0 for the initial state, k for the value written by the k-th update
   * @return the value, "" for revision 0, empty if the revision does not exist yet
   */
  public Optional<String> valueAt(TokenId tokenId, int revision) {
    if (revision < 0) {
      throw new IllegalArgumentException("Revision cannot be negative: " + revision);
    }
    if (revision == 0) {
      return Optional.of("");
    }

    List<MappingRevision> revisions = revisions(tokenId);
    if (revision > revisions.size()) {
      return Optional.empty();
    }
    return Optional.of(revisions.get(revision - 1).cid());
  }

  /**
   * Checks that the recorded updates chain together: each revision replaced exactly the value the
   * revision before it wrote, starting from "".
   */
  public boolean isConsistent(TokenId tokenId) {
    String expected = "";
    for (MappingRevision revision : revisions(tokenId)) {
      if (!revision.previousCid().equals(expected)) {
        log.warn(
            "History of {} breaks at revision {}: expected previous '{}', found '{}'",
            tokenId,
            revision.revision(),
            expected,
            revision.previousCid());
        return false;
      }
      expected = revision.cid();
    }
    return true;
  }
}
