package com.streamfirst.cidmapper.domain;

import java.util.Optional;
import lombok.NonNull;

/**
 * A token was created.
 *
 * @param tokenId the new token
 * @param holder the principal receiving it
 * @param mappingKey key of the token's entry in the linked mapping registry
 */
public record TokenMinted(
    @NonNull TokenId tokenId, @NonNull Principal holder, @NonNull String mappingKey)
    implements EventPayload {

  public static final String TOPIC = "MINT";

  @Override
  public String topic() {
    return TOPIC;
  }

  @Override
  public Optional<String> subject() {
    return Optional.of(tokenId.value());
  }
}
