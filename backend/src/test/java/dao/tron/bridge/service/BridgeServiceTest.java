package dao.tron.bridge.service;

import dao.tron.bridge.event.AuditRecord;
import dao.tron.bridge.exception.AuthorizationException;
import dao.tron.bridge.exception.BridgeErrorCode;
import dao.tron.bridge.exception.BridgeException;
import dao.tron.bridge.exception.InvalidRequestException;
import dao.tron.bridge.exception.RateLimitExceededException;
import dao.tron.bridge.exception.StateConflictException;
import dao.tron.bridge.exception.TransferFailedException;
import dao.tron.bridge.model.BridgeStats;
import dao.tron.bridge.model.BridgeTransaction;
import dao.tron.bridge.model.Direction;
import dao.tron.bridge.model.ValidationState;
import dao.tron.bridge.model.ValidationStatus;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.math.BigInteger;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.Set;
import java.util.TreeSet;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import java.util.stream.Collectors;
import java.util.stream.LongStream;

import static dao.tron.bridge.service.BridgeTestFixture.*;
import static org.junit.jupiter.api.Assertions.*;

class BridgeServiceTest {

    private BridgeTestFixture f;
    private BridgeService bridge;

    @BeforeEach
    void setUp() {
        f = new BridgeTestFixture();
        bridge = f.bridgeService;
    }

    // --- lock ---

    @Test
    @DisplayName("Lock debits the caller, records a LOCK transaction and bumps totals")
    void lockRecordsTransaction() {
        BridgeTransaction tx = bridge.lockAsset(ALICE, amount(1_000_000), "T-dest");

        assertEquals(0L, tx.nonce());
        assertEquals(Direction.LOCK, tx.direction());
        assertTrue(tx.completed());
        assertEquals("T-dest", tx.reference());
        assertEquals(amount(49_000_000), f.innerLedger.balanceOf(ALICE));
        assertEquals(amount(1_000_000), f.innerLedger.custodyBalance());

        BridgeStats stats = bridge.getBridgeStats();
        assertEquals(amount(1_000_000), stats.totalLocked());
        assertEquals(amount(1_000_000), stats.dailyVolume());
        assertEquals(1L, stats.transactionCount());
    }

    @Test
    @DisplayName("Nonces are 0..N-1 in commit order across lock and release")
    void noncesAreGapFree() {
        f.lockAndAttest(2_000_000, PROOF_A);
        bridge.release(RELAYER, BOB, amount(2_000_000), PROOF_A);
        bridge.lockAsset(BOB, amount(500), "x");

        List<BridgeTransaction> all = bridge.listTransactions(null);
        assertEquals(3, all.size());
        for (int i = 0; i < all.size(); i++) {
            assertEquals(i, all.get(i).nonce());
        }
        assertEquals(Direction.RELEASE, all.get(1).direction());
    }

    @Test
    @DisplayName("Zero amount and empty destination are rejected without state change")
    void lockValidation() {
        InvalidRequestException zero = assertThrows(InvalidRequestException.class,
                () -> bridge.lockAsset(ALICE, BigInteger.ZERO, "dest"));
        assertEquals(BridgeErrorCode.INVALID_AMOUNT, zero.getCode());

        InvalidRequestException blank = assertThrows(InvalidRequestException.class,
                () -> bridge.lockAsset(ALICE, amount(10), "  "));
        assertEquals(BridgeErrorCode.INVALID_DESTINATION, blank.getCode());

        assertEquals(0L, bridge.getBridgeStats().transactionCount());
        assertEquals(BigInteger.ZERO, bridge.getBridgeStats().dailyVolume());
    }

    @Test
    @DisplayName("Lock with insufficient balance rolls back totals, nonce and rate window")
    void lockInsufficientBalanceRollsBack() {
        bridge.lockAsset(ALICE, amount(1_000), "dest");
        BridgeStats before = bridge.getBridgeStats();

        assertThrows(TransferFailedException.class, () -> bridge.lockAsset("carol", amount(5_000), "dest"));

        BridgeStats after = bridge.getBridgeStats();
        assertEquals(before, after);
        assertTrue(bridge.listTransactions("carol").isEmpty());

        // next nonce is still 1
        assertEquals(1L, bridge.lockAsset(BOB, amount(1), "dest").nonce());
    }

    @Test
    @DisplayName("Concurrent locks get distinct, gap-free nonces and every amount is counted once")
    void concurrentLocks() throws Exception {
        int callers = 32;
        ExecutorService pool = Executors.newFixedThreadPool(8);
        CountDownLatch start = new CountDownLatch(1);
        List<Future<BridgeTransaction>> futures = new ArrayList<>();
        try {
            for (int i = 0; i < callers; i++) {
                String who = i % 2 == 0 ? ALICE : BOB;
                futures.add(pool.submit(() -> {
                    start.await();
                    return bridge.lockAsset(who, amount(1_000), "dest");
                }));
            }
            start.countDown();

            Set<Long> nonces = new TreeSet<>();
            for (Future<BridgeTransaction> future : futures) {
                nonces.add(future.get(10, TimeUnit.SECONDS).nonce());
            }
            assertEquals(LongStream.range(0, callers).boxed().collect(Collectors.toCollection(TreeSet::new)), nonces);
        } finally {
            pool.shutdownNow();
        }

        BridgeStats stats = bridge.getBridgeStats();
        assertEquals((long) callers, stats.transactionCount());
        assertEquals(amount(callers * 1_000L), stats.totalLocked());
        assertEquals(amount(callers * 1_000L), stats.dailyVolume());
        assertEquals(amount(callers * 1_000L), f.innerLedger.custodyBalance());
        assertEquals(callers, bridge.events(null).size());
    }

    @Test
    @DisplayName("Custody account can neither lock nor be the recipient of an attestation or release")
    void custodyIsNotACounterparty() {
        String custody = f.assetLedger.custodyAccount();
        List<Object> before = f.stateSnapshot();

        assertEquals(BridgeErrorCode.INVALID_COUNTERPARTY, assertThrows(InvalidRequestException.class,
                () -> bridge.lockAsset(custody, amount(1), "dest")).getCode());
        assertEquals(BridgeErrorCode.INVALID_COUNTERPARTY, assertThrows(InvalidRequestException.class,
                () -> bridge.attest(V1, " " + custody, amount(1), PROOF_A)).getCode());
        assertEquals(BridgeErrorCode.INVALID_COUNTERPARTY, assertThrows(InvalidRequestException.class,
                () -> bridge.release(RELAYER, custody, amount(1), PROOF_A)).getCode());

        assertEquals(before, f.stateSnapshot());
        assertEquals(0, f.assetLedger.getTransferCalls());
    }

    // --- rate limit ---

    @Test
    @DisplayName("Second 6,000,000 lock on the same day fails; succeeds after the day boundary")
    void dailyCeiling() {
        bridge.lockAsset(ALICE, amount(6_000_000), "dest");

        RateLimitExceededException ex = assertThrows(RateLimitExceededException.class,
                () -> bridge.lockAsset(ALICE, amount(6_000_000), "dest"));
        assertEquals(amount(4_000_000), ex.getDetails().get("remaining"));
        assertEquals(amount(6_000_000), bridge.getBridgeStats().dailyVolume());

        f.clock.advance(Duration.ofDays(1));

        BridgeTransaction tx = bridge.lockAsset(ALICE, amount(6_000_000), "dest");
        assertEquals(1L, tx.nonce());
        assertEquals(amount(6_000_000), bridge.getBridgeStats().dailyVolume());
    }

    @Test
    @DisplayName("Ceiling is shared between LOCK and RELEASE")
    void ceilingIsDirectionAgnostic() {
        f.lockAndAttest(6_000_000, PROOF_A);

        RateLimitExceededException ex = assertThrows(RateLimitExceededException.class,
                () -> bridge.release(RELAYER, BOB, amount(6_000_000), PROOF_A));
        assertEquals(BridgeErrorCode.RATE_LIMIT_EXCEEDED, ex.getCode());
        assertFalse(f.proofLedger.isConsumed(PROOF_A));

        f.clock.advance(Duration.ofDays(1));
        bridge.release(RELAYER, BOB, amount(6_000_000), PROOF_A);
        assertTrue(f.proofLedger.isConsumed(PROOF_A));
    }

    // --- attest / release ---

    @Test
    @DisplayName("One attestation leaves release failing with QuorumNotMet; a second distinct one unlocks it")
    void quorumEnforcement() {
        bridge.lockAsset(ALICE, amount(3_000_000), "dest");
        ValidationStatus first = bridge.attest(V1, BOB, amount(3_000_000), PROOF_A);
        assertEquals(ValidationState.PARTIALLY_VALIDATED, first.state());
        assertFalse(first.consumable());

        StateConflictException ex = assertThrows(StateConflictException.class,
                () -> bridge.release(RELAYER, BOB, amount(3_000_000), PROOF_A));
        assertEquals(BridgeErrorCode.QUORUM_NOT_MET, ex.getCode());
        assertEquals(1, ex.getDetails().get("signatures"));
        assertEquals(2, ex.getDetails().get("required"));

        ValidationStatus second = bridge.attest(V2, BOB, amount(3_000_000), PROOF_A);
        assertEquals(ValidationState.VALIDATED, second.state());
        assertTrue(second.consumable());

        BridgeTransaction tx = bridge.release(RELAYER, BOB, amount(3_000_000), PROOF_A);
        assertEquals(Direction.RELEASE, tx.direction());
        assertEquals(PROOF_A, tx.reference());
        assertEquals(amount(53_000_000), f.innerLedger.balanceOf(BOB));

        ValidationStatus after = bridge.getValidationStatus(BOB, amount(3_000_000), PROOF_A);
        assertEquals(ValidationState.RELEASED, after.state());
        assertTrue(after.proofConsumed());
    }

    @Test
    @DisplayName("Attestations for a different amount do not count toward the key")
    void attestationsAreKeyedByTuple() {
        bridge.lockAsset(ALICE, amount(3_000_000), "dest");
        bridge.attest(V1, BOB, amount(3_000_000), PROOF_A);
        bridge.attest(V2, BOB, amount(2_999_999), PROOF_A);

        assertThrows(StateConflictException.class, () -> bridge.release(RELAYER, BOB, amount(3_000_000), PROOF_A));
    }

    @Test
    @DisplayName("A signer can attest a key only once")
    void duplicateAttestation() {
        bridge.attest(V1, BOB, amount(100), PROOF_A);
        StateConflictException ex = assertThrows(StateConflictException.class,
                () -> bridge.attest(V1, BOB, amount(100), PROOF_A));
        assertEquals(BridgeErrorCode.DUPLICATE_ATTESTATION, ex.getCode());
        assertEquals(1, bridge.getValidationStatus(BOB, amount(100), PROOF_A).signatures());
    }

    @Test
    @DisplayName("A consumed proof fails both re-attest and re-release with AlreadyProcessed")
    void replaySafety() {
        f.lockAndAttest(1_000_000, PROOF_A);
        bridge.release(RELAYER, BOB, amount(1_000_000), PROOF_A);

        StateConflictException again = assertThrows(StateConflictException.class,
                () -> bridge.release(RELAYER, BOB, amount(1_000_000), PROOF_A));
        assertEquals(BridgeErrorCode.ALREADY_PROCESSED, again.getCode());

        StateConflictException reattest = assertThrows(StateConflictException.class,
                () -> bridge.attest(V3, BOB, amount(1_000_000), PROOF_A));
        assertEquals(BridgeErrorCode.ALREADY_PROCESSED, reattest.getCode());

        // a different recipient cannot reuse the proof either
        StateConflictException other = assertThrows(StateConflictException.class,
                () -> bridge.attest(V1, ALICE, amount(1), PROOF_A.toUpperCase().replace("0X", "0x")));
        assertEquals(BridgeErrorCode.ALREADY_PROCESSED, other.getCode());
    }

    @Test
    @DisplayName("Only validators attest and only relayers release")
    void capabilitiesAreEnforced() {
        AuthorizationException notValidator = assertThrows(AuthorizationException.class,
                () -> bridge.attest(RELAYER, BOB, amount(1), PROOF_A));
        assertEquals(BridgeErrorCode.UNAUTHORIZED, notValidator.getCode());

        f.lockAndAttest(100, PROOF_A);
        assertThrows(AuthorizationException.class, () -> bridge.release(V1, BOB, amount(100), PROOF_A));
        assertThrows(AuthorizationException.class, () -> bridge.lockAsset(" ", amount(1), "dest"));
    }

    @Test
    @DisplayName("Malformed proof is a validation error")
    void malformedProof() {
        InvalidRequestException ex = assertThrows(InvalidRequestException.class,
                () -> bridge.attest(V1, BOB, amount(1), "0x1234"));
        assertEquals(BridgeErrorCode.INVALID_PROOF, ex.getCode());
        assertTrue(f.validations.findAll().isEmpty());
    }

    @Test
    @DisplayName("Failed credit rolls back proof consumption, totals, nonce and rate window")
    void releaseTransferFailureRollsBack() {
        f.lockAndAttest(2_000_000, PROOF_A);
        BridgeStats before = bridge.getBridgeStats();
        int eventsBefore = bridge.events(null).size();

        f.assetLedger.failNextTransfer();
        TransferFailedException ex = assertThrows(TransferFailedException.class,
                () -> bridge.release(RELAYER, BOB, amount(2_000_000), PROOF_A));
        assertEquals(BridgeErrorCode.TRANSFER_FAILED, ex.getCode());

        assertEquals(before, bridge.getBridgeStats());
        assertFalse(f.proofLedger.isConsumed(PROOF_A));
        assertEquals(eventsBefore, bridge.events(null).size());
        ValidationStatus status = bridge.getValidationStatus(BOB, amount(2_000_000), PROOF_A);
        assertEquals(ValidationState.VALIDATED, status.state());

        // explicit retry goes through
        BridgeTransaction tx = bridge.release(RELAYER, BOB, amount(2_000_000), PROOF_A);
        assertEquals(1L, tx.nonce());
    }

    @Test
    @DisplayName("Re-entering the bridge from inside a transfer is rejected and the outer call rolls back")
    void reentrancyIsRejected() {
        f.lockAndAttest(2_000_000, PROOF_A);
        BridgeStats before = bridge.getBridgeStats();

        f.assetLedger.onTransfer(() -> bridge.release(RELAYER, BOB, amount(2_000_000), PROOF_A));
        TransferFailedException ex = assertThrows(TransferFailedException.class,
                () -> bridge.release(RELAYER, BOB, amount(2_000_000), PROOF_A));

        assertInstanceOf(StateConflictException.class, ex.getCause());
        assertEquals(BridgeErrorCode.REENTRANT_CALL, ((BridgeException) ex.getCause()).getCode());
        assertEquals(before, bridge.getBridgeStats());
        assertFalse(f.proofLedger.isConsumed(PROOF_A));
        assertEquals(amount(50_000_000), f.innerLedger.balanceOf(BOB));
    }

    @Test
    @DisplayName("Locked minus released equals custody after every operation")
    void conservation() {
        f.lockAndAttest(3_000_000, PROOF_A);
        assertConserved();
        bridge.lockAsset(BOB, amount(1_500_000), "dest");
        assertConserved();
        bridge.release(RELAYER, BOB, amount(3_000_000), PROOF_A);
        assertConserved();

        bridge.attest(V2, ALICE, amount(1_000_000), PROOF_B);
        bridge.attest(V3, ALICE, amount(1_000_000), PROOF_B);
        f.assetLedger.failNextTransfer();
        assertThrows(TransferFailedException.class, () -> bridge.release(RELAYER, ALICE, amount(1_000_000), PROOF_B));
        assertConserved();
        bridge.release(RELAYER, ALICE, amount(1_000_000), PROOF_B);
        assertConserved();

        BridgeStats stats = bridge.getBridgeStats();
        assertEquals(amount(4_500_000), stats.totalLocked());
        assertEquals(amount(4_000_000), stats.totalReleased());
    }

    @Test
    @DisplayName("Rejected attestations leave every piece of bridge state untouched")
    void rejectedAttestChangesNothing() {
        f.lockAndAttest(1_000_000, PROOF_A);
        bridge.release(RELAYER, BOB, amount(1_000_000), PROOF_A);
        bridge.attest(V1, BOB, amount(500), PROOF_B);
        List<Object> before = f.stateSnapshot();

        assertThrows(StateConflictException.class, () -> bridge.attest(V1, BOB, amount(500), PROOF_B));
        assertThrows(StateConflictException.class, () -> bridge.attest(V3, BOB, amount(1_000_000), PROOF_A));
        assertThrows(AuthorizationException.class, () -> bridge.attest(RELAYER, BOB, amount(500), PROOF_B));
        assertThrows(AuthorizationException.class, () -> bridge.attest(null, BOB, amount(500), PROOF_B));
        assertThrows(InvalidRequestException.class, () -> bridge.attest(V2, BOB, amount(500), "0x12"));
        assertThrows(InvalidRequestException.class, () -> bridge.attest(V2, BOB, BigInteger.ZERO, PROOF_B));
        assertThrows(InvalidRequestException.class, () -> bridge.attest(V2, " ", amount(500), PROOF_B));
        f.state.setPaused(true);
        assertThrows(StateConflictException.class, () -> bridge.attest(V2, BOB, amount(500), PROOF_B));
        f.state.setPaused(false);

        assertEquals(before, f.stateSnapshot());
    }

    @Test
    @DisplayName("Rejected releases leave every piece of bridge state untouched")
    void rejectedReleaseChangesNothing() {
        f.lockAndAttest(1_000_000, PROOF_A);
        bridge.release(RELAYER, BOB, amount(1_000_000), PROOF_A);
        bridge.lockAsset(ALICE, amount(8_000_000), "dest");
        bridge.attest(V1, BOB, amount(2_000_000), PROOF_B);
        List<Object> before = f.stateSnapshot();

        // replay, quorum, role, shape
        assertThrows(StateConflictException.class, () -> bridge.release(RELAYER, BOB, amount(1_000_000), PROOF_A));
        assertThrows(StateConflictException.class, () -> bridge.release(RELAYER, BOB, amount(2_000_000), PROOF_B));
        assertThrows(AuthorizationException.class, () -> bridge.release(V1, BOB, amount(2_000_000), PROOF_B));
        assertThrows(InvalidRequestException.class, () -> bridge.release(RELAYER, BOB, amount(-5), PROOF_B));
        assertEquals(before, f.stateSnapshot());

        // quorum reached but the day's ceiling is spent
        bridge.attest(V2, BOB, amount(2_000_000), PROOF_B);
        before = f.stateSnapshot();
        assertThrows(RateLimitExceededException.class, () -> bridge.release(RELAYER, BOB, amount(2_000_000), PROOF_B));
        assertEquals(before, f.stateSnapshot());
        assertEquals(0, bridge.reconcileUnconfirmed());
    }

    // --- pause ---

    @Test
    @DisplayName("Paused bridge rejects lock, attest and release")
    void pauseBlocksOperations() {
        f.lockAndAttest(100, PROOF_A);
        f.state.setPaused(true);

        assertEquals(BridgeErrorCode.BRIDGE_PAUSED,
                assertThrows(StateConflictException.class, () -> bridge.lockAsset(ALICE, amount(1), "d")).getCode());
        assertEquals(BridgeErrorCode.BRIDGE_PAUSED,
                assertThrows(StateConflictException.class, () -> bridge.attest(V3, BOB, amount(100), PROOF_A)).getCode());
        assertEquals(BridgeErrorCode.BRIDGE_PAUSED,
                assertThrows(StateConflictException.class, () -> bridge.release(RELAYER, BOB, amount(100), PROOF_A)).getCode());
    }

    // --- queries ---

    @Test
    @DisplayName("Transactions can be looked up by nonce and counterparty")
    void transactionQueries() {
        bridge.lockAsset(ALICE, amount(10), "d1");
        bridge.lockAsset(BOB, amount(20), "d2");
        bridge.lockAsset(ALICE, amount(30), "d3");

        List<BridgeTransaction> alice = bridge.listTransactions(ALICE);
        assertEquals(2, alice.size());
        assertEquals(amount(30), alice.get(1).amount());
        assertEquals(BOB, bridge.getTransaction(1).counterparty());

        InvalidRequestException ex = assertThrows(InvalidRequestException.class, () -> bridge.getTransaction(99));
        assertEquals(BridgeErrorCode.UNKNOWN_TRANSACTION, ex.getCode());
    }

    @Test
    @DisplayName("Audit stream is sequenced and readable from an offset")
    void auditStream() {
        f.lockAndAttest(100, PROOF_A);
        bridge.release(RELAYER, BOB, amount(100), PROOF_A);

        List<AuditRecord> all = bridge.events(null);
        assertEquals(4, all.size());
        assertEquals("LockRecorded", all.get(0).type());
        assertEquals("AttestationRecorded", all.get(1).type());
        assertEquals("ReleaseRecorded", all.get(3).type());
        assertEquals(4L, all.get(3).sequence());

        List<AuditRecord> tail = bridge.events(3L);
        assertEquals(2, tail.size());
        assertEquals(3L, tail.get(0).sequence());
        assertTrue(bridge.events(10L).isEmpty());
    }

    @Test
    @DisplayName("Pending validations list keys short of quorum only")
    void pendingValidations() {
        bridge.attest(V1, BOB, amount(100), PROOF_A);
        bridge.attest(V1, BOB, amount(200), PROOF_B);
        bridge.attest(V2, BOB, amount(200), PROOF_B);

        List<ValidationStatus> pending = bridge.pendingValidations();
        assertEquals(1, pending.size());
        assertEquals(PROOF_A, pending.get(0).proof());

        long later = f.clock.instant().getEpochSecond() + 1;
        assertEquals(1, bridge.pendingValidationsOlderThan(later).size());
        assertTrue(bridge.pendingValidationsOlderThan(later - 1).isEmpty());
    }

    private void assertConserved() {
        BridgeStats s = bridge.getBridgeStats();
        assertEquals(s.totalLocked().subtract(s.totalReleased()), s.custodyBalance());
        assertEquals(s.lockedBalance(), s.custodyBalance());
    }
}
