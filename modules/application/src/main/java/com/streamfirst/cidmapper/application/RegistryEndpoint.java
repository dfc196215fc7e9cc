package com.streamfirst.cidmapper.application;

import com.streamfirst.cidmapper.domain.Principal;
import com.streamfirst.cidmapper.domain.Result;
import java.util.List;
import java.util.Set;

/**
 * Untyped call surface of a registry: functions are invoked by name with positional string
 * arguments, the way a ledger client submits them. Mutating functions take the caller as their
 * first argument. No call ever throws; every abort comes back as a failed {@link Result}.
 */
public interface RegistryEndpoint {

  /** Error code for an unknown function or a wrong number of arguments. */
  String INVALID_CALL = "INVALID_CALL";

  /** Error code for arguments that cannot be turned into principals or token ids. */
  String INVALID_ARGUMENT = "INVALID_ARGUMENT";

  /** Gets the address of the registry behind this endpoint. */
  Principal getAddress();

  /** Gets the names of the functions this endpoint accepts. */
  Set<String> getFunctions();

  /**
   * Invokes a registry function.
   *
   * @param function the function name (e.g., "update_mapping")
   * @param arguments positional arguments
   * @return the function's return value, null for functions without one, or the failure
   */
  Result<Object> call(String function, List<String> arguments);

  default Result<Object> call(String function, String... arguments) {
    return call(function, List.of(arguments));
  }
}
