package com.streamfirst.cidmapper.application;

import com.streamfirst.cidmapper.domain.Principal;
import com.streamfirst.cidmapper.domain.RegistryException;
import com.streamfirst.cidmapper.domain.Result;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Set;
import java.util.function.Consumer;
import java.util.function.Function;
import lombok.extern.slf4j.Slf4j;

/**
 * Dispatch table shared by the registry endpoints. Subclasses register each function with its
 * arity; this class resolves the name, checks the argument count and turns every abort into a
 * failed {@link Result}.
 */
@Slf4j
public abstract class AbstractRegistryEndpoint implements RegistryEndpoint {

  private final Principal address;
  private final Map<String, Registration> functions = new LinkedHashMap<>();

  protected AbstractRegistryEndpoint(Principal address) {
    this.address = Objects.requireNonNull(address, "Registry address cannot be null");
  }

  @Override
  public Principal getAddress() {
    return address;
  }

  @Override
  public Set<String> getFunctions() {
    return Set.copyOf(functions.keySet());
  }

  @Override
  public Result<Object> call(String function, List<String> arguments) {
    Registration target = functions.get(function);
    if (target == null) {
      log.debug("Unknown function '{}' on {}", function, address);
      return Result.failure("Unknown function: " + function, INVALID_CALL);
    }
    if (arguments == null || arguments.size() != target.arity()) {
      int given = arguments == null ? 0 : arguments.size();
      return Result.failure(
          function + " expects " + target.arity() + " arguments, got " + given, INVALID_CALL);
    }

    try {
      return Result.success(target.body().apply(arguments));
    } catch (RegistryException e) {
      return Result.failure(e);
    } catch (IllegalArgumentException | NullPointerException e) {
      log.debug("Rejected arguments {} for {} on {}", arguments, function, address, e);
      return Result.failure(e.getMessage(), INVALID_ARGUMENT);
    }
  }

  /** Registers a function that returns a value. */
  protected void query(String name, int arity, Function<List<String>, ?> body) {
    functions.put(name, new Registration(arity, body::apply));
  }

  /** Registers a function without a return value. */
  protected void command(String name, int arity, Consumer<List<String>> body) {
    functions.put(
        name,
        new Registration(
            arity,
            arguments -> {
              body.accept(arguments);
              return null;
            }));
  }

  private record Registration(int arity, Function<List<String>, Object> body) {}
}
