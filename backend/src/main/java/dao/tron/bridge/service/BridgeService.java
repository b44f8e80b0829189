package dao.tron.bridge.service;

import dao.tron.bridge.event.AttestationRecorded;
import dao.tron.bridge.event.AuditRecord;
import dao.tron.bridge.event.LockRecorded;
import dao.tron.bridge.event.ReleaseRecorded;
import dao.tron.bridge.event.TransferSettled;
import dao.tron.bridge.event.TransferUnconfirmed;
import dao.tron.bridge.exception.AuthorizationException;
import dao.tron.bridge.exception.BridgeErrorCode;
import dao.tron.bridge.exception.BridgeException;
import dao.tron.bridge.exception.InvalidRequestException;
import dao.tron.bridge.exception.StateConflictException;
import dao.tron.bridge.exception.TransferFailedException;
import dao.tron.bridge.exception.TransferOutcomeUnknownException;
import dao.tron.bridge.model.*;
import dao.tron.bridge.repository.ProofLedger;
import dao.tron.bridge.repository.TransactionRepository;
import dao.tron.bridge.repository.ValidationRepository;
import dao.tron.bridge.util.Amounts;
import dao.tron.bridge.util.ProofIds;
import dao.tron.bridge.util.ValidationKeys;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.math.BigInteger;
import java.time.Clock;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Lock accounting, attestation collection and quorum-gated release.
 * <p>
 * Every mutating call runs inside the shared {@link OperationGuard}. Internal state is
 * committed before the asset ledger is called. If the transfer definitely failed, everything
 * the call changed is put back before the error is rethrown. If its outcome is unknown, the
 * transaction stays recorded as UNCONFIRMED with its proof consumed until it is settled by
 * {@link #reconcileUnconfirmed()} or {@link #resolveTransfer}.
 */
@Slf4j
@Service
public class BridgeService {

    private final OperationGuard guard;
    private final BridgeState state;
    private final RateLimiter rateLimiter;
    private final RoleRegistry roles;
    private final ProofLedger proofLedger;
    private final TransactionRepository transactions;
    private final ValidationRepository validations;
    private final AssetLedger assetLedger;
    private final AuditEventLog auditLog;
    private final Clock clock;

    static final String RECONCILER = "reconciler";

    public BridgeService(OperationGuard guard,
                         BridgeState state,
                         RateLimiter rateLimiter,
                         RoleRegistry roles,
                         ProofLedger proofLedger,
                         TransactionRepository transactions,
                         ValidationRepository validations,
                         AssetLedger assetLedger,
                         AuditEventLog auditLog,
                         Clock clock) {
        this.guard = guard;
        this.state = state;
        this.rateLimiter = rateLimiter;
        this.roles = roles;
        this.proofLedger = proofLedger;
        this.transactions = transactions;
        this.validations = validations;
        this.assetLedger = assetLedger;
        this.auditLog = auditLog;
        this.clock = clock;
    }

    /**
     * Takes amount from the caller into custody and records a LOCK transaction.
     */
    public BridgeTransaction lockAsset(String caller, BigInteger amount, String destination) {
        return guard.execute("lockAsset", () -> {
            String who = requireCounterparty(requireCaller(caller));
            Amounts.requirePositive(amount);
            if (destination == null || destination.isBlank()) {
                throw new InvalidRequestException(BridgeErrorCode.INVALID_DESTINATION, "Destination reference is required");
            }
            requireNotPaused("lockAsset");

            RateLimitWindow windowBefore = rateLimiter.snapshot();
            rateLimiter.checkAndReserve(amount);

            long nonce = state.allocateNonce();
            BridgeTransaction tx = BridgeTransaction.pending(nonce, who, amount, Direction.LOCK,
                    now(), destination.trim());
            transactions.save(tx);
            state.addLocked(amount);

            TransferReceipt receipt;
            String unconfirmedReason = null;
            try {
                receipt = requireNotFailed(assetLedger.debit(who, amount));
            } catch (TransferOutcomeUnknownException e) {
                receipt = TransferReceipt.unconfirmed(e.getTxId());
                unconfirmedReason = e.getMessage();
            } catch (RuntimeException e) {
                transactions.delete(nonce);
                state.subtractLocked(amount);
                state.returnNonce(nonce);
                rateLimiter.restore(windowBefore);
                throw transferFailure("lockAsset", who, amount, e);
            }

            tx = recordReceipt(tx, receipt);
            auditLog.append(new LockRecorded(nonce, who, amount, tx.reference()));
            if (!tx.completed()) {
                reportUnconfirmed(tx, unconfirmedReason);
            }
            log.info("Locked: nonce={}, caller={}, amount={}, destination={}, transfer={}",
                    nonce, who, amount, tx.reference(), tx.transferStatus());
            return tx;
        });
    }

    /**
     * Adds the caller's attestation for (recipient, amount, proof).
     */
    public ValidationStatus attest(String caller, String recipient, BigInteger amount, String proof) {
        return guard.execute("attest", () -> {
            String signer = requireCapability(caller, Capability.VALIDATOR, "attest");
            String to = requireCounterparty(requireRecipient(recipient));
            Amounts.requirePositive(amount);
            String proofId = ProofIds.normalize(proof);
            requireNotPaused("attest");
            requireUnconsumed(proofId);

            String key = ValidationKeys.keyOf(to, amount, proofId);
            ValidationRecord record = validations.findByKey(key)
                    .orElseGet(() -> new ValidationRecord(key, to, amount, proofId, now()));
            if (record.hasSigned(signer)) {
                Map<String, Object> details = new LinkedHashMap<>();
                details.put("key", key);
                details.put("signer", signer);
                details.put("signatures", record.getSignatureCount());
                throw new StateConflictException(BridgeErrorCode.DUPLICATE_ATTESTATION,
                        "Signer already attested this release", details);
            }

            record.getSigners().add(signer);
            validations.save(record);

            auditLog.append(new AttestationRecorded(key, signer, record.getSignatureCount()));
            log.info("Attested: key={}, signer={}, signatures={}/{}", key, signer,
                    record.getSignatureCount(), state.getRequiredValidations());
            return toStatus(record);
        });
    }

    /**
     * Pays out a validated release. The proof is consumed for good once this returns,
     * including when the payout is still unconfirmed.
     */
    public BridgeTransaction release(String caller, String recipient, BigInteger amount, String proof) {
        return guard.execute("release", () -> {
            requireCapability(caller, Capability.RELAYER, "release");
            String to = requireCounterparty(requireRecipient(recipient));
            Amounts.requirePositive(amount);
            String proofId = ProofIds.normalize(proof);
            requireNotPaused("release");
            requireUnconsumed(proofId);

            String key = ValidationKeys.keyOf(to, amount, proofId);
            ValidationRecord record = validations.findByKey(key).orElse(null);
            int signatures = record == null ? 0 : record.getSignatureCount();
            int required = state.getRequiredValidations();
            if (signatures < required) {
                Map<String, Object> details = new LinkedHashMap<>();
                details.put("key", key);
                details.put("signatures", signatures);
                details.put("required", required);
                log.warn("Release rejected, quorum not met: key={}, signatures={}/{}", key, signatures, required);
                throw new StateConflictException(BridgeErrorCode.QUORUM_NOT_MET,
                        "Not enough validator attestations", details);
            }

            RateLimitWindow windowBefore = rateLimiter.snapshot();
            rateLimiter.checkAndReserve(amount);

            long nonce = state.allocateNonce();
            proofLedger.consume(new ProofEntry(proofId, key, nonce, now()));
            BridgeTransaction tx = BridgeTransaction.pending(nonce, to, amount, Direction.RELEASE,
                    now(), proofId);
            transactions.save(tx);
            state.addReleased(amount);
            record.setReleased(true);
            validations.save(record);

            TransferReceipt receipt;
            String unconfirmedReason = null;
            try {
                receipt = requireNotFailed(assetLedger.credit(to, amount));
            } catch (TransferOutcomeUnknownException e) {
                // funds may be out; the proof must stay consumed
                receipt = TransferReceipt.unconfirmed(e.getTxId());
                unconfirmedReason = e.getMessage();
            } catch (RuntimeException e) {
                record.setReleased(false);
                validations.save(record);
                state.subtractReleased(amount);
                transactions.delete(nonce);
                proofLedger.discard(proofId);
                state.returnNonce(nonce);
                rateLimiter.restore(windowBefore);
                throw transferFailure("release", to, amount, e);
            }

            tx = recordReceipt(tx, receipt);
            auditLog.append(new ReleaseRecorded(nonce, to, amount, proofId));
            if (!tx.completed()) {
                reportUnconfirmed(tx, unconfirmedReason);
            }
            log.info("Released: nonce={}, recipient={}, amount={}, proof={}, transfer={}",
                    nonce, to, amount, proofId, tx.transferStatus());
            return tx;
        });
    }

    /**
     * Operator decision on an UNCONFIRMED transfer. A transfer that did not land comes off
     * the totals; its nonce, rate-limit volume and proof stay spent.
     */
    public BridgeTransaction resolveTransfer(String caller, long nonce, boolean landed) {
        return guard.execute("resolveTransfer", () -> {
            String who = requireCapability(caller, Capability.ADMIN, "resolveTransfer");
            BridgeTransaction tx = transactions.findByNonce(nonce)
                    .orElseThrow(() -> unknownTransaction(nonce));
            if (tx.transferStatus() != TransferStatus.UNCONFIRMED) {
                Map<String, Object> details = new LinkedHashMap<>();
                details.put("nonce", nonce);
                details.put("transferStatus", tx.transferStatus().name());
                throw new StateConflictException(BridgeErrorCode.TRANSFER_SETTLED,
                        "Transfer already settled", details);
            }
            return settle(tx, landed ? TransferStatus.CONFIRMED : TransferStatus.FAILED, who);
        });
    }

    /**
     * Asks the asset ledger about every UNCONFIRMED transfer that has a ledger id and settles
     * the ones with a final answer. Ledger lookups happen outside the operation monitor.
     *
     * @return number of transfers settled
     */
    public int reconcileUnconfirmed() {
        List<BridgeTransaction> open = guard.read(() -> transactions.findByTransferStatus(TransferStatus.UNCONFIRMED));
        int settled = 0;
        for (BridgeTransaction tx : open) {
            if (tx.transferTxId() == null) {
                log.warn("Unconfirmed transfer without ledger id needs operator resolution: nonce={}, direction={}",
                        tx.nonce(), tx.direction());
                continue;
            }
            TransferStatus status;
            try {
                status = assetLedger.transferStatus(tx.transferTxId());
            } catch (RuntimeException e) {
                log.warn("Could not read transfer status: nonce={}, txId={}: {}", tx.nonce(), tx.transferTxId(), e.getMessage());
                continue;
            }
            if (status == TransferStatus.UNCONFIRMED) {
                continue;
            }
            boolean applied = guard.execute("reconcileUnconfirmed", () -> {
                Optional<BridgeTransaction> current = transactions.findByNonce(tx.nonce());
                if (current.isEmpty() || current.get().transferStatus() != TransferStatus.UNCONFIRMED) {
                    return false;
                }
                settle(current.get(), status, RECONCILER);
                return true;
            });
            if (applied) {
                settled++;
            }
        }
        return settled;
    }

    public List<BridgeTransaction> unconfirmedTransfers() {
        return guard.read(() -> transactions.findByTransferStatus(TransferStatus.UNCONFIRMED));
    }

    public BridgeStats getBridgeStats() {
        // asset ledger may be remote, so it is read outside the monitor
        BigInteger custody = assetLedger.custodyBalance();
        return guard.read(() -> {
            BigInteger locked = state.getTotalLocked();
            BigInteger released = state.getTotalReleased();
            return new BridgeStats(
                    locked,
                    released,
                    locked.subtract(released),
                    custody,
                    state.getNextNonce(),
                    rateLimiter.getDailyLimit(),
                    rateLimiter.currentVolume(),
                    rateLimiter.remaining(),
                    rateLimiter.snapshot().getWindowStart(),
                    state.getRequiredValidations(),
                    roles.holders(Capability.VALIDATOR).size(),
                    state.isPaused(),
                    transactions.findByTransferStatus(TransferStatus.UNCONFIRMED).size()
            );
        });
    }

    public ValidationStatus getValidationStatus(String recipient, BigInteger amount, String proof) {
        String to = requireRecipient(recipient);
        Amounts.requirePositive(amount);
        String proofId = ProofIds.normalize(proof);
        String key = ValidationKeys.keyOf(to, amount, proofId);
        return guard.read(() -> toStatus(validations.findByKey(key)
                .orElseGet(() -> new ValidationRecord(key, to, amount, proofId, 0L))));
    }

    public BridgeTransaction getTransaction(long nonce) {
        return guard.read(() -> transactions.findByNonce(nonce))
                .orElseThrow(() -> unknownTransaction(nonce));
    }

    public List<BridgeTransaction> listTransactions(String counterparty) {
        if (counterparty == null || counterparty.isBlank()) {
            return guard.read(transactions::findAll);
        }
        return guard.read(() -> transactions.findByCounterparty(counterparty.trim()));
    }

    public Optional<ProofEntry> findProof(String proof) {
        String proofId = ProofIds.normalize(proof);
        return guard.read(() -> proofLedger.find(proofId));
    }

    public List<AuditRecord> events(Long fromSequence) {
        return fromSequence == null ? auditLog.findAll() : auditLog.findFrom(fromSequence);
    }

    /**
     * Validation records still short of quorum whose proof has not been consumed.
     */
    public List<ValidationStatus> pendingValidations() {
        return guard.read(() -> {
            List<ValidationStatus> out = new ArrayList<>();
            for (ValidationRecord r : validations.findAll()) {
                if (r.isReleased() || proofLedger.isConsumed(r.getProof())) continue;
                if (r.getSignatureCount() < state.getRequiredValidations()) {
                    out.add(toStatus(r));
                }
            }
            return out;
        });
    }

    /**
     * Pending records first attested before the given unix time.
     */
    public List<ValidationRecord> pendingValidationsOlderThan(long epochSeconds) {
        return guard.read(() -> {
            List<ValidationRecord> out = new ArrayList<>();
            for (ValidationRecord r : validations.findAll()) {
                if (r.isReleased() || proofLedger.isConsumed(r.getProof())) continue;
                if (r.getSignatureCount() < state.getRequiredValidations() && r.getFirstAttestedAt() < epochSeconds) {
                    out.add(r);
                }
            }
            return out;
        });
    }

    private ValidationStatus toStatus(ValidationRecord r) {
        int required = state.getRequiredValidations();
        boolean consumed = proofLedger.isConsumed(r.getProof());
        return new ValidationStatus(
                r.getKey(),
                r.getRecipient(),
                r.getAmount(),
                r.getProof(),
                r.getSignatureCount(),
                required,
                new ArrayList<>(r.getSigners()),
                r.state(required),
                consumed,
                !consumed && !r.isReleased() && r.getSignatureCount() >= required
        );
    }

    private String requireCaller(String caller) {
        if (caller == null || caller.isBlank()) {
            throw new AuthorizationException(BridgeErrorCode.UNAUTHORIZED, "Caller identity is required", Map.of());
        }
        return caller.trim();
    }

    private String requireCapability(String caller, Capability capability, String operation) {
        String who = requireCaller(caller);
        if (!roles.can(who, capability)) {
            log.warn("Rejected {}: caller {} lacks {}", operation, who, capability);
            throw new AuthorizationException(BridgeErrorCode.UNAUTHORIZED,
                    "Caller lacks " + capability + " capability",
                    Map.of("caller", who, "required", capability.name()));
        }
        return who;
    }

    private String requireRecipient(String recipient) {
        if (recipient == null || recipient.isBlank()) {
            throw new InvalidRequestException(BridgeErrorCode.INVALID_RECIPIENT, "Recipient is required");
        }
        return recipient.trim();
    }

    private String requireCounterparty(String account) {
        if (account.equals(assetLedger.custodyAccount())) {
            throw new InvalidRequestException(BridgeErrorCode.INVALID_COUNTERPARTY,
                    "Custody account cannot lock or receive releases", Map.of("account", account));
        }
        return account;
    }

    private void requireNotPaused(String operation) {
        if (state.isPaused()) {
            log.warn("Rejected {}: bridge is paused", operation);
            throw new StateConflictException(BridgeErrorCode.BRIDGE_PAUSED, "Bridge is paused",
                    Map.of("operation", operation));
        }
    }

    private void requireUnconsumed(String proofId) {
        Optional<ProofEntry> entry = proofLedger.find(proofId);
        if (entry.isPresent()) {
            Map<String, Object> details = new LinkedHashMap<>();
            details.put("proof", proofId);
            details.put("releaseNonce", entry.get().releaseNonce());
            details.put("consumedAt", entry.get().consumedAt());
            throw new StateConflictException(BridgeErrorCode.ALREADY_PROCESSED, "Proof already consumed", details);
        }
    }

    private TransferReceipt requireNotFailed(TransferReceipt receipt) {
        if (receipt.status() == TransferStatus.FAILED) {
            Map<String, Object> details = new LinkedHashMap<>();
            details.put("txId", receipt.txId());
            throw new TransferFailedException("Asset ledger rejected the transfer", details);
        }
        return receipt;
    }

    private BridgeTransaction recordReceipt(BridgeTransaction tx, TransferReceipt receipt) {
        BridgeTransaction updated = tx.withTransfer(receipt.status(), receipt.txId());
        transactions.update(updated);
        return updated;
    }

    private void reportUnconfirmed(BridgeTransaction tx, String reason) {
        String why = reason == null ? "awaiting ledger confirmation" : reason;
        auditLog.append(new TransferUnconfirmed(tx.nonce(), tx.direction(), tx.counterparty(), tx.transferTxId(), why));
        if (reason != null) {
            log.error("Transfer outcome unknown, kept as UNCONFIRMED: nonce={}, direction={}, counterparty={}, amount={}: {}",
                    tx.nonce(), tx.direction(), tx.counterparty(), tx.amount(), reason);
        }
    }

    private BridgeTransaction settle(BridgeTransaction tx, TransferStatus status, String settledBy) {
        BridgeTransaction updated = tx.withTransfer(status, tx.transferTxId());
        transactions.update(updated);
        if (status == TransferStatus.FAILED) {
            if (tx.direction() == Direction.LOCK) {
                state.subtractLocked(tx.amount());
            } else {
                state.subtractReleased(tx.amount());
            }
        }
        auditLog.append(new TransferSettled(tx.nonce(), tx.direction(), status, tx.transferTxId(), settledBy));
        if (status == TransferStatus.FAILED) {
            log.warn("Transfer settled as FAILED: nonce={}, direction={}, amount={}, by={}",
                    tx.nonce(), tx.direction(), tx.amount(), settledBy);
        } else {
            log.info("Transfer settled: nonce={}, direction={}, status={}, by={}", tx.nonce(), tx.direction(), status, settledBy);
        }
        return updated;
    }

    private InvalidRequestException unknownTransaction(long nonce) {
        return new InvalidRequestException(BridgeErrorCode.UNKNOWN_TRANSACTION,
                "Unknown transaction nonce: " + nonce, Map.of("nonce", nonce));
    }

    private BridgeException transferFailure(String operation, String account, BigInteger amount, RuntimeException e) {
        log.error("{} rolled back: asset transfer failed for account={}, amount={}", operation, account, amount, e);
        if (e instanceof TransferFailedException) {
            return (TransferFailedException) e;
        }
        Map<String, Object> details = new LinkedHashMap<>();
        details.put("operation", operation);
        details.put("account", account);
        details.put("amount", amount);
        if (e instanceof BridgeException) {
            details.put("cause", ((BridgeException) e).getCode().name());
        }
        return new TransferFailedException("Asset transfer failed: " + e.getMessage(), details, e);
    }

    private long now() {
        return clock.instant().getEpochSecond();
    }
}
