package com.streamfirst.cidmapper.domain;

import lombok.Getter;
import lombok.NonNull;

/**
 * Aborts a registry call. Thrown before anything is committed, so a failed call leaves no trace
 * in storage or in the event log.
 */
@Getter
public class RegistryException extends RuntimeException {

  private final ErrorKind kind;

  public RegistryException(@NonNull ErrorKind kind, String message) {
    super(message);
    this.kind = kind;
  }

  public static RegistryException notInitialized(Principal registry) {
    return new RegistryException(
        ErrorKind.NOT_INITIALIZED, "Registry " + registry + " is not initialized");
  }

  public static RegistryException alreadyInitialized(Principal registry) {
    return new RegistryException(
        ErrorKind.ALREADY_INITIALIZED, "Registry " + registry + " already initialized");
  }

  public static RegistryException notAuthorized(Principal principal) {
    return new RegistryException(
        ErrorKind.NOT_AUTHORIZED, "Missing authorization for " + principal);
  }

  public static RegistryException notOwner(Principal caller) {
    return new RegistryException(ErrorKind.NOT_OWNER, "Caller " + caller + " is not the owner");
  }

  public static RegistryException notAdmin(Principal caller) {
    return new RegistryException(ErrorKind.NOT_ADMIN, "Caller " + caller + " is not the admin");
  }

  public static RegistryException tokenAlreadyExists(TokenId tokenId) {
    return new RegistryException(
        ErrorKind.TOKEN_ALREADY_EXISTS, "Token " + tokenId + " already exists");
  }

  public static RegistryException tokenNotFound(TokenId tokenId) {
    return new RegistryException(ErrorKind.TOKEN_NOT_FOUND, "Token " + tokenId + " does not exist");
  }
}
