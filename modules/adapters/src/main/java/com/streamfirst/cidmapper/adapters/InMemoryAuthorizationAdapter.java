package com.streamfirst.cidmapper.adapters;

import com.streamfirst.cidmapper.domain.CallContext;
import com.streamfirst.cidmapper.domain.Principal;
import com.streamfirst.cidmapper.ports.AuthorizationPort;
import java.util.*;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.CopyOnWriteArrayList;
import lombok.extern.slf4j.Slf4j;

/**
 * In-memory implementation of AuthorizationPort for testing and development. Stands in for a
 * signing or session mechanism: tests and the demo record which principals have presented proof,
 * either for every call (a session) or for exactly one matching call (a signed invocation).
 */
@Slf4j
public class InMemoryAuthorizationAdapter implements AuthorizationPort {

  private final Set<Principal> sessions = ConcurrentHashMap.newKeySet();
  private final Map<Principal, List<CallContext>> signedCalls = new ConcurrentHashMap<>();
  private final List<VerifiedCall> verifiedCalls = new CopyOnWriteArrayList<>();
  private volatile boolean trustAll;

  @Override
  public boolean verify(Principal principal, CallContext context) {
    boolean verified =
        trustAll || sessions.contains(principal) || hasSignedCall(principal, context);

    if (verified) {
      verifiedCalls.add(new VerifiedCall(principal, context));
      log.debug("Verified {} for {} on {}", principal, context.function(), context.contract());
    } else {
      log.debug("No proof from {} for {} on {}", principal, context.function(), context.contract());
    }
    return verified;
  }

  /**
   * Spends one single-use proof matching the call. Sessions and trust-all are not affected, and
   * a call verified through them has nothing to spend.
   */
  @Override
  public void consume(Principal principal, CallContext context) {
    if (trustAll || sessions.contains(principal)) {
      return;
    }
    signedCalls.computeIfPresent(
        principal,
        (k, proofs) -> {
          if (proofs.remove(context)) {
            log.debug("Spent proof from {} for {}", principal, context.function());
          }
          return proofs.isEmpty() ? null : proofs;
        });
  }

  /** Opens a session: every call made as this principal is authorized until revoked. */
  public void authorize(Principal principal) {
    log.info("Opening authorization session for {}", principal);
    sessions.add(principal);
  }

  /** Records a proof covering exactly one committed call matching the context. */
  public void authorizeCall(Principal principal, CallContext context) {
    log.debug("Recording single-use proof from {} for {}", principal, context.function());
    signedCalls.compute(
        principal,
        (k, proofs) -> {
          List<CallContext> next = proofs == null ? new CopyOnWriteArrayList<>() : proofs;
          next.add(context);
          return next;
        });
  }

  /** Closes the principal's session and drops any unused single-call proofs. */
  public void revoke(Principal principal) {
    log.info("Revoking authorization for {}", principal);
    sessions.remove(principal);
    signedCalls.remove(principal);
  }

  /** Accepts every proof. Only for demos and tests that do not exercise authorization. */
  public void setTrustAll(boolean trustAll) {
    if (trustAll) {
      log.warn("Authorization checks disabled - every caller is trusted");
    }
    this.trustAll = trustAll;
  }

  /** Gets every successful verification in order. Lets tests assert that a call required auth. */
  public List<VerifiedCall> getVerifiedCalls() {
    return List.copyOf(verifiedCalls);
  }

  /** Clears all sessions, proofs and recorded verifications. Useful for testing. */
  public void clear() {
    sessions.clear();
    signedCalls.clear();
    verifiedCalls.clear();
    trustAll = false;
  }

  /** Gets the number of principals holding unspent single-use proofs. */
  public int getPendingProofHolders() {
    return signedCalls.size();
  }

  private boolean hasSignedCall(Principal principal, CallContext context) {
    List<CallContext> proofs = signedCalls.get(principal);
    return proofs != null && proofs.contains(context);
  }

  /** A principal whose proof was accepted for a call. */
  public record VerifiedCall(Principal principal, CallContext context) {}
}
