package com.streamfirst.cidmapper.domain;

import java.util.Objects;

/**
 * Opaque identifier of an item tracked by both registries. The ownership registry enforces
 * uniqueness; the mapping registry uses it as the key of a content pointer. Any string is a valid
 * identifier, the empty string included.
 *
 * @param value the identifier (e.g., "token123")
 */
public record TokenId(String value) {
  public TokenId {
    Objects.requireNonNull(value, "Token ID cannot be null");
  }

  public static TokenId of(String value) {
    return new TokenId(value);
  }

  @Override
  public String toString() {
    return value;
  }
}
