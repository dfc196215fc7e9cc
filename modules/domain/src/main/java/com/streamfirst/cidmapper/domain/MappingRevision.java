package com.streamfirst.cidmapper.domain;

import java.time.Instant;
import lombok.NonNull;

/**
 * One step in the value history of a token's content pointer, rebuilt from an
 * {@link MappingUpdated} event.
 *
 * @param revision 1-based position in the token's history
 * @param previousCid the value this revision replaced
 * @param cid the value this revision wrote
 * @param updatedBy the owner that performed the update
 * @param sequence ledger sequence of the underlying event
 * @param updatedAt commit time of the underlying event
 */
public record MappingRevision(
    int revision,
    @NonNull String previousCid,
    @NonNull String cid,
    @NonNull Principal updatedBy,
    long sequence,
    @NonNull Instant updatedAt) {

  public MappingRevision {
    if (revision < 1) {
      throw new IllegalArgumentException("Revision must be positive: " + revision);
    }
  }
}
