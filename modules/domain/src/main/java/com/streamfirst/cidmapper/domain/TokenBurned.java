package com.streamfirst.cidmapper.domain;

import java.util.Optional;
import lombok.NonNull;

/** A token was destroyed by its last holder. */
public record TokenBurned(@NonNull TokenId tokenId, @NonNull Principal holder)
    implements EventPayload {

  public static final String TOPIC = "BURN";

  @Override
  public String topic() {
    return TOPIC;
  }

  @Override
  public Optional<String> subject() {
    return Optional.of(tokenId.value());
  }
}
