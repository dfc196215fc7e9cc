package com.streamfirst.cidmapper.domain;

/**
 * Lifecycle of a registry. A registry starts {@code UNINITIALIZED}, moves to {@code READY} with
 * its one and only successful {@code initialize} call, and never goes back.
 */
public enum RegistryState {
  /** Deployed but not initialized; every operation except initialize is rejected */
  UNINITIALIZED,
  /** Instance record written; the registry serves calls */
  READY
}
