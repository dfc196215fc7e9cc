package com.streamfirst.cidmapper.domain;

/** Reasons a registry call aborts. Each one is distinguishable by callers. */
public enum ErrorKind {
  /** Any call against a registry that has not been initialized yet */
  NOT_INITIALIZED,
  /** Initialization invoked on a registry that is already initialized */
  ALREADY_INITIALIZED,
  /** The caller did not present a valid authorization proof for the required principal */
  NOT_AUTHORIZED,
  /** The caller is not the registry owner, or not the token holder */
  NOT_OWNER,
  /** The caller is not the registry admin */
  NOT_ADMIN,
  /** Mint with a token id that is already live */
  TOKEN_ALREADY_EXISTS,
  /** The addressed token id does not exist */
  TOKEN_NOT_FOUND
}
