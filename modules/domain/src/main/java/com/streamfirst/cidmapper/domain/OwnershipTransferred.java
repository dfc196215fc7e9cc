package com.streamfirst.cidmapper.domain;

import java.util.Optional;
import lombok.NonNull;

/** The mapping registry changed hands. */
public record OwnershipTransferred(@NonNull Principal oldOwner, @NonNull Principal newOwner)
    implements EventPayload {

  public static final String TOPIC = "TRANSFER_OWNER";

  @Override
  public String topic() {
    return TOPIC;
  }

  @Override
  public Optional<String> subject() {
    return Optional.empty();
  }
}
