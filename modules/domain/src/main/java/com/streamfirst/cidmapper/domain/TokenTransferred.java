package com.streamfirst.cidmapper.domain;

import java.util.Optional;
import lombok.NonNull;

/** A token moved from one holder to another. */
public record TokenTransferred(
    @NonNull TokenId tokenId, @NonNull Principal from, @NonNull Principal to)
    implements EventPayload {

  public static final String TOPIC = "TRANSFER";

  @Override
  public String topic() {
    return TOPIC;
  }

  @Override
  public Optional<String> subject() {
    return Optional.of(tokenId.value());
  }
}
