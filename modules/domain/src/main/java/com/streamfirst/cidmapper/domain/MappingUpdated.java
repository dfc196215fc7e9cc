package com.streamfirst.cidmapper.domain;

import java.util.Optional;
import lombok.NonNull;

/**
 * A content pointer was overwritten. Carries both the previous and the new value so the full
 * value sequence of a token can be replayed from the event log.
 *
 * @param tokenId the token whose pointer changed
 * @param oldCid the value before the update, "" if there was none
 * @param newCid the value after the update
 * @param caller the owner that performed the update
 */
public record MappingUpdated(
    @NonNull TokenId tokenId,
    @NonNull String oldCid,
    @NonNull String newCid,
    @NonNull Principal caller)
    implements EventPayload {

  public static final String TOPIC = "UPDATE_MAP";

  @Override
  public String topic() {
    return TOPIC;
  }

  @Override
  public Optional<String> subject() {
    return Optional.of(tokenId.value());
  }
}
