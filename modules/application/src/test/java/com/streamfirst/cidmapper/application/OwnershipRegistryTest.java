package com.streamfirst.cidmapper.application;

import static org.assertj.core.api.Assertions.assertThat;
import static org.junit.jupiter.api.Assertions.assertThrows;

import com.streamfirst.cidmapper.adapters.InMemoryAuthorizationAdapter;
import com.streamfirst.cidmapper.adapters.InMemoryEventAdapter;
import com.streamfirst.cidmapper.adapters.InMemoryLedgerAdapter;
import com.streamfirst.cidmapper.domain.CallContext;
import com.streamfirst.cidmapper.domain.ErrorKind;
import com.streamfirst.cidmapper.domain.LedgerEvent;
import com.streamfirst.cidmapper.domain.Principal;
import com.streamfirst.cidmapper.domain.RegistryException;
import com.streamfirst.cidmapper.domain.TokenBurned;
import com.streamfirst.cidmapper.domain.TokenId;
import com.streamfirst.cidmapper.domain.TokenMinted;
import com.streamfirst.cidmapper.domain.TokenTransferred;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.Random;
import java.util.Set;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.function.Executable;

class OwnershipRegistryTest {

  private static final Principal ADDRESS = Principal.of("registry-tokens");
  private static final Principal MAPPING = Principal.of("registry-ipcm");
  private static final Principal ADMIN = Principal.of("admin-a");
  private static final Principal U = Principal.of("user-u");
  private static final Principal V = Principal.of("user-v");
  private static final Principal W = Principal.of("user-w");
  private static final TokenId TOK1 = TokenId.of("tok1");

  private InMemoryLedgerAdapter ledger;
  private InMemoryAuthorizationAdapter auth;
  private OwnershipRegistry registry;

  @BeforeEach
  void setUp() {
    ledger = new InMemoryLedgerAdapter();
    auth = new InMemoryAuthorizationAdapter();
    registry = new OwnershipRegistry(ADDRESS, ledger, auth, new InMemoryEventAdapter());
    registry.initialize(ADMIN, MAPPING);
    auth.authorize(ADMIN);
  }

  @Test
  void testMintTransferBurnScenario() {
    auth.authorize(U);
    auth.authorize(V);

    registry.mint(ADMIN, TOK1, U, "k1");
    assertThat(registry.ownerOf(TOK1)).isEqualTo(U);
    assertThat(registry.getIpcmKey(TOK1)).isEqualTo("k1");
    assertThat(registry.tokensOf(U)).containsExactly(TOK1);

    registry.transfer(U, TOK1, V);
    assertThat(registry.tokensOf(U)).isEmpty();
    assertThat(registry.tokensOf(V)).containsExactly(TOK1);
    assertThat(registry.getIpcmKey(TOK1)).isEqualTo("k1");

    registry.burn(V, TOK1);
    RegistryException e = assertThrows(RegistryException.class, () -> registry.ownerOf(TOK1));
    assertThat(e.getKind()).isEqualTo(ErrorKind.TOKEN_NOT_FOUND);
    assertThat(registry.tokensOf(V)).isEmpty();

    assertThat(ledger.getEvents(ADDRESS))
        .extracting(LedgerEvent::getTopic)
        .containsExactly("MINT", "TRANSFER", "BURN");
    List<LedgerEvent> log = ledger.getEvents(ADDRESS);
    assertThat(log.get(0).payloadAs(TokenMinted.class)).isEqualTo(new TokenMinted(TOK1, U, "k1"));
    assertThat(log.get(1).payloadAs(TokenTransferred.class))
        .isEqualTo(new TokenTransferred(TOK1, U, V));
    assertThat(log.get(2).payloadAs(TokenBurned.class)).isEqualTo(new TokenBurned(TOK1, V));
  }

  @Test
  void testDuplicateMintFails() {
    registry.mint(ADMIN, TokenId.of("dup"), U, "k");

    RegistryException e =
        assertThrows(
            RegistryException.class, () -> registry.mint(ADMIN, TokenId.of("dup"), U, "k2"));

    assertThat(e.getKind()).isEqualTo(ErrorKind.TOKEN_ALREADY_EXISTS);
    assertThat(registry.getIpcmKey(TokenId.of("dup"))).isEqualTo("k");
    assertThat(registry.tokensOf(U)).containsExactly(TokenId.of("dup"));
  }

  @Test
  void testTransferByNonHolderLeavesIndexesUnchanged() {
    auth.authorize(V);
    registry.mint(ADMIN, TOK1, U, "k1");
    Map<String, Integer> before = ledger.getLedgerStats();

    RegistryException e =
        assertThrows(RegistryException.class, () -> registry.transfer(V, TOK1, W));

    assertThat(e.getKind()).isEqualTo(ErrorKind.NOT_OWNER);
    assertThat(registry.ownerOf(TOK1)).isEqualTo(U);
    assertThat(registry.tokensOf(U)).containsExactly(TOK1);
    assertThat(registry.tokensOf(W)).isEmpty();
    assertThat(ledger.getLedgerStats()).isEqualTo(before);
  }

  @Test
  void testHolderWithoutProofCannotTransferOrBurn() {
    registry.mint(ADMIN, TOK1, U, "k1");
    long sequence = ledger.getLatestSequence();

    assertKind(ErrorKind.NOT_AUTHORIZED, () -> registry.transfer(U, TOK1, V));
    assertKind(ErrorKind.NOT_AUTHORIZED, () -> registry.burn(U, TOK1));

    assertThat(registry.ownerOf(TOK1)).isEqualTo(U);
    assertThat(ledger.getLatestSequence()).isEqualTo(sequence);
  }

  @Test
  void testMissingTokenIsReportedBeforeOwnership() {
    assertKind(ErrorKind.TOKEN_NOT_FOUND, () -> registry.transfer(U, TOK1, V));
    assertKind(ErrorKind.TOKEN_NOT_FOUND, () -> registry.burn(U, TOK1));
    assertKind(ErrorKind.TOKEN_NOT_FOUND, () -> registry.getIpcmKey(TOK1));
  }

  @Test
  void testOnlyAdminCanMint() {
    auth.authorize(U);

    assertKind(ErrorKind.NOT_ADMIN, () -> registry.mint(U, TOK1, U, "k1"));

    auth.revoke(ADMIN);
    assertKind(ErrorKind.NOT_AUTHORIZED, () -> registry.mint(ADMIN, TOK1, U, "k1"));
    assertKind(ErrorKind.TOKEN_NOT_FOUND, () -> registry.ownerOf(TOK1));
    assertThat(ledger.getLatestSequence()).isZero();
  }

  @Test
  void testTransferPreservesOrderOfRemainingTokens() {
    auth.authorize(U);
    TokenId a = TokenId.of("a");
    TokenId b = TokenId.of("b");
    TokenId c = TokenId.of("c");
    registry.mint(ADMIN, a, U, "ka");
    registry.mint(ADMIN, b, U, "kb");
    registry.mint(ADMIN, c, U, "kc");

    registry.transfer(U, b, V);

    assertThat(registry.tokensOf(U)).containsExactly(a, c);
    assertThat(registry.tokensOf(V)).containsExactly(b);
  }

  @Test
  void testSelfTransferMovesTokenToEnd() {
    auth.authorize(U);
    TokenId a = TokenId.of("a");
    TokenId b = TokenId.of("b");
    registry.mint(ADMIN, a, U, "ka");
    registry.mint(ADMIN, b, U, "kb");

    registry.transfer(U, a, U);

    assertThat(registry.tokensOf(U)).containsExactly(b, a);
    assertThat(registry.ownerOf(a)).isEqualTo(U);
    assertThat(ledger.getEvents(ADDRESS, TokenTransferred.TOPIC, "a")).hasSize(1);
  }

  @Test
  void testEmptyHoldingsLeaveNoEntry() {
    auth.authorize(U);
    int baseline = ledger.getEntryCount(ADDRESS);

    registry.mint(ADMIN, TOK1, U, "k1");
    assertThat(ledger.getEntryCount(ADDRESS)).isEqualTo(baseline + 3);

    registry.burn(U, TOK1);
    assertThat(ledger.getEntryCount(ADDRESS)).isEqualTo(baseline);
  }

  @Test
  void testBurnedTokenCanBeMintedAgain() {
    auth.authorize(U);
    registry.mint(ADMIN, TOK1, U, "k1");
    registry.burn(U, TOK1);

    registry.mint(ADMIN, TOK1, V, "k2");

    assertThat(registry.ownerOf(TOK1)).isEqualTo(V);
    assertThat(registry.getIpcmKey(TOK1)).isEqualTo("k2");
    assertThat(registry.tokensOf(U)).isEmpty();
  }

  @Test
  void testRejectedSignedMintKeepsItsProof() {
    TokenId dup = TokenId.of("dup");
    auth.authorize(U);
    registry.mint(ADMIN, dup, U, "k");
    auth.revoke(ADMIN);
    auth.authorizeCall(ADMIN, CallContext.of(ADDRESS, "mint", ADMIN, dup, U, "k2"));

    assertKind(ErrorKind.TOKEN_ALREADY_EXISTS, () -> registry.mint(ADMIN, dup, U, "k2"));

    registry.burn(U, dup);
    registry.mint(ADMIN, dup, U, "k2");
    assertThat(registry.getIpcmKey(dup)).isEqualTo("k2");
    assertThat(auth.getPendingProofHolders()).isZero();

    registry.burn(U, dup);
    assertKind(ErrorKind.NOT_AUTHORIZED, () -> registry.mint(ADMIN, dup, U, "k2"));
  }

  @Test
  void testEmptyTokenIdIsAnOrdinaryToken() {
    TokenId empty = TokenId.of("");
    auth.authorize(U);

    registry.mint(ADMIN, empty, U, "");

    assertThat(registry.ownerOf(empty)).isEqualTo(U);
    assertThat(registry.getIpcmKey(empty)).isEmpty();
    assertThat(registry.tokensOf(U)).containsExactly(empty);
    assertKind(ErrorKind.TOKEN_ALREADY_EXISTS, () -> registry.mint(ADMIN, empty, V, "k"));

    registry.burn(U, empty);
    assertKind(ErrorKind.TOKEN_NOT_FOUND, () -> registry.ownerOf(empty));
  }

  @Test
  void testInitializeOnlyOnceAndReadsInstanceRecord() {
    assertKind(ErrorKind.ALREADY_INITIALIZED, () -> registry.initialize(U, MAPPING));

    assertThat(registry.getAdmin()).isEqualTo(ADMIN);
    assertThat(registry.getMappingRegistry()).isEqualTo(MAPPING);
  }

  @Test
  void testUninitializedRegistryRejectsCalls() {
    OwnershipRegistry fresh =
        new OwnershipRegistry(
            Principal.of("registry-fresh"), ledger, auth, new InMemoryEventAdapter());

    assertKind(ErrorKind.NOT_INITIALIZED, () -> fresh.mint(ADMIN, TOK1, U, "k1"));
    assertKind(ErrorKind.NOT_INITIALIZED, () -> fresh.transfer(U, TOK1, V));
    assertKind(ErrorKind.NOT_INITIALIZED, () -> fresh.ownerOf(TOK1));
    assertKind(ErrorKind.NOT_INITIALIZED, () -> fresh.tokensOf(U));
    assertKind(ErrorKind.NOT_INITIALIZED, fresh::getAdmin);
  }

  @Test
  void testIndexesStayConsistentOverRandomOperations() {
    List<Principal> holders = List.of(U, V, W);
    holders.forEach(auth::authorize);
    Map<TokenId, Principal> expected = new HashMap<>();
    Random random = new Random(42);

    for (int i = 0; i < 300; i++) {
      TokenId token = TokenId.of("t" + random.nextInt(12));
      Principal actor = holders.get(random.nextInt(holders.size()));
      Principal target = holders.get(random.nextInt(holders.size()));
      try {
        switch (random.nextInt(3)) {
          case 0 -> {
            registry.mint(ADMIN, token, target, "key-" + token);
            expected.put(token, target);
          }
          case 1 -> {
            registry.transfer(actor, token, target);
            expected.put(token, target);
          }
          default -> {
            registry.burn(actor, token);
            expected.remove(token);
          }
        }
      } catch (RegistryException e) {
        assertThat(e.getKind())
            .isIn(ErrorKind.TOKEN_ALREADY_EXISTS, ErrorKind.TOKEN_NOT_FOUND, ErrorKind.NOT_OWNER);
      }
      assertConsistent(holders, expected);
    }
  }

  private void assertConsistent(List<Principal> holders, Map<TokenId, Principal> expected) {
    Set<TokenId> indexed = new HashSet<>();
    for (Principal holder : holders) {
      List<TokenId> held = registry.tokensOf(holder);
      assertThat(held).doesNotHaveDuplicates();
      List<TokenId> owned = new ArrayList<>();
      expected.forEach((token, owner) -> {
        if (owner.equals(holder)) {
          owned.add(token);
        }
      });
      assertThat(held).containsExactlyInAnyOrderElementsOf(owned);
      indexed.addAll(held);
    }
    for (int i = 0; i < 12; i++) {
      TokenId token = TokenId.of("t" + i);
      boolean live = expected.containsKey(token);
      assertThat(indexed.contains(token)).isEqualTo(live);
      if (live) {
        assertThat(registry.ownerOf(token)).isEqualTo(expected.get(token));
        assertThat(registry.getIpcmKey(token)).isEqualTo("key-" + token);
      } else {
        assertKind(ErrorKind.TOKEN_NOT_FOUND, () -> registry.ownerOf(token));
        assertKind(ErrorKind.TOKEN_NOT_FOUND, () -> registry.getIpcmKey(token));
      }
    }
  }

  private static void assertKind(ErrorKind kind, Executable call) {
    assertThat(assertThrows(RegistryException.class, call).getKind()).isEqualTo(kind);
  }
}
