package com.streamfirst.cidmapper.domain;

import java.util.ArrayList;
import java.util.List;
import lombok.NonNull;

/**
 * Ordered, duplicate-free sequence of tokens held by one principal. Order is the insertion order
 * of still-held tokens. Instances are immutable so a stored value can never be changed behind the
 * ledger's back.
 *
 * <p>Removal rebuilds the list with a linear scan. Holdings are expected to stay small.
 */
public record TokenHoldings(@NonNull List<TokenId> tokens) {

  private static final TokenHoldings EMPTY = new TokenHoldings(List.of());

  public TokenHoldings {
    tokens = List.copyOf(tokens);
    if (tokens.stream().distinct().count() != tokens.size()) {
      throw new IllegalArgumentException("Token holdings cannot contain duplicates: " + tokens);
    }
  }

  public static TokenHoldings empty() {
    return EMPTY;
  }

  /** Returns holdings with the token appended at the end, moving it there if already present. */
  public TokenHoldings append(TokenId tokenId) {
    List<TokenId> next = new ArrayList<>(without(tokenId).tokens);
    next.add(tokenId);
    return new TokenHoldings(next);
  }

  /** Returns holdings without the token, keeping the relative order of the rest. */
  public TokenHoldings without(TokenId tokenId) {
    List<TokenId> next = new ArrayList<>(tokens.size());
    for (TokenId held : tokens) {
      if (!held.equals(tokenId)) {
        next.add(held);
      }
    }
    return next.size() == tokens.size() ? this : new TokenHoldings(next);
  }

  public boolean contains(TokenId tokenId) {
    return tokens.contains(tokenId);
  }

  public boolean isEmpty() {
    return tokens.isEmpty();
  }

  public int size() {
    return tokens.size();
  }
}
