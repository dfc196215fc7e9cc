package com.streamfirst.cidmapper.domain;

import java.util.Arrays;
import java.util.List;
import lombok.NonNull;

/**
 * What an authorization proof is checked against: the registry being called, the function, and
 * its arguments in call order.
 *
 * @param contract address of the registry receiving the call
 * @param function the registry operation (e.g., "update_mapping")
 * @param arguments the call arguments rendered as strings
 */
public record CallContext(
    @NonNull Principal contract, @NonNull String function, @NonNull List<String> arguments) {

  public CallContext {
    arguments = List.copyOf(arguments);
  }

  public static CallContext of(Principal contract, String function, Object... arguments) {
    return new CallContext(
        contract, function, Arrays.stream(arguments).map(String::valueOf).toList());
  }
}
