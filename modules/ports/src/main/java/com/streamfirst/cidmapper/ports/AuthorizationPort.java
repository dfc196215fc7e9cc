package com.streamfirst.cidmapper.ports;

import com.streamfirst.cidmapper.domain.CallContext;
import com.streamfirst.cidmapper.domain.Principal;

/**
 * Port for verifying that a caller really controls the principal it names. Registries ask this
 * port before any write is staged; naming a principal as an argument is never enough.
 *
 * <p>Verification has no side effects. A proof that can only be used once is spent through
 * {@link #consume}, which registries call only after the call's batch has been committed, so an
 * aborted call leaves its proof usable.
 */
public interface AuthorizationPort {

  /**
   * Checks the authorization proof presented for a principal in the current call.
   *
   * @param principal the principal whose control must be proven
   * @param context the call the proof must cover
   * @return true if a valid proof was presented, false otherwise
   */
  boolean verify(Principal principal, CallContext context);

  /**
   * Spends the proof a committed call was verified with. Proofs that stay valid, such as
   * sessions, need no consumption.
   *
   * @param principal the principal that was verified
   * @param context the committed call
   */
  default void consume(Principal principal, CallContext context) {}
}
