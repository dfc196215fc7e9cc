package com.streamfirst.cidmapper.domain;

import java.util.Arrays;
import java.util.Optional;
import java.util.function.Function;
import lombok.EqualsAndHashCode;
import lombok.Value;

/**
 * Outcome of a registry call made through an endpoint: either the returned value or the reason
 * the call aborted. Failures of registry rules carry the {@link ErrorKind} name as error code.
 *
 * @param <T> the type of value returned on success
 */
@Value
@EqualsAndHashCode
public class Result<T> {

  boolean success;
  T data;
  String errorMessage;
  String errorCode;

  private Result(boolean success, T data, String errorMessage, String errorCode) {
    this.success = success;
    this.data = data;
    this.errorMessage = errorMessage;
    this.errorCode = errorCode;
  }

  /** Creates a successful result; data may be null for operations with no return value. */
  public static <T> Result<T> success(T data) {
    return new Result<>(true, data, null, null);
  }

  /** Creates a successful result for an operation with no return value. */
  public static Result<Void> success() {
    return new Result<>(true, null, null, null);
  }

  /** Creates a failure result with error message and code. */
  public static <T> Result<T> failure(String errorMessage, String errorCode) {
    return new Result<>(false, null, errorMessage, errorCode);
  }

  /** Creates a failure result from an aborted registry call. */
  public static <T> Result<T> failure(RegistryException e) {
    return failure(e.getMessage(), e.getKind().name());
  }

  /**
   * Returns the data if successful. Otherwise throws: a {@link RegistryException} when the code
   * names an {@link ErrorKind}, an {@link IllegalStateException} for anything else.
   */
  public T orElseThrow() {
    if (success) {
      return data;
    }
    Optional<ErrorKind> kind = getErrorKind();
    if (kind.isPresent()) {
      throw new RegistryException(kind.get(), errorMessage);
    }
    throw new IllegalStateException(errorMessage + " (code: " + errorCode + ")");
  }

  /** Maps the data to another type if successful, preserves failure if failed. */
  public <U> Result<U> map(Function<T, U> mapper) {
    if (success) {
      return Result.success(mapper.apply(data));
    }
    return Result.failure(errorMessage, errorCode);
  }

  public boolean isFailure() {
    return !success;
  }

  /** Gets the data if successful and present, empty otherwise. */
  public Optional<T> getData() {
    return success ? Optional.ofNullable(data) : Optional.empty();
  }

  public Optional<String> getErrorMessage() {
    return Optional.ofNullable(errorMessage);
  }

  public Optional<String> getErrorCode() {
    return Optional.ofNullable(errorCode);
  }

  /** Gets the registry error kind if this failure came from a registry rule. */
  public Optional<ErrorKind> getErrorKind() {
    return Arrays.stream(ErrorKind.values())
        .filter(kind -> kind.name().equals(errorCode))
        .findFirst();
  }

  @Override
  public String toString() {
    if (success) {
      return "Result.success(" + data + ")";
    }
    return "Result.failure(" + errorMessage + ", code=" + errorCode + ")";
  }
}
