package dao.tron.bridge.scheduler;

import dao.tron.bridge.config.SchedulerProperties;
import dao.tron.bridge.model.BridgeProposal;
import dao.tron.bridge.model.BridgeStats;
import dao.tron.bridge.model.ValidationRecord;
import dao.tron.bridge.service.BridgeService;
import dao.tron.bridge.service.GovernanceService;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.context.event.ApplicationReadyEvent;
import org.springframework.context.event.EventListener;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.util.List;

/**
 * Reports attestations stuck short of quorum and approved proposals nobody executed.
 * Attestations and proposals never expire, so this job only logs; operators decide.
 * Also settles unconfirmed transfers once the asset ledger has an answer for them.
 */
@Slf4j
@Component
public class PendingWorkScheduler {

    private final BridgeService bridgeService;
    private final GovernanceService governanceService;
    private final SchedulerProperties schedulerProps;
    private final Clock clock;

    public PendingWorkScheduler(BridgeService bridgeService,
                                GovernanceService governanceService,
                                SchedulerProperties schedulerProps,
                                Clock clock) {
        this.bridgeService = bridgeService;
        this.governanceService = governanceService;
        this.schedulerProps = schedulerProps;
        this.clock = clock;
    }

    @EventListener(ApplicationReadyEvent.class)
    public void logStartupState() {
        try {
            BridgeStats stats = bridgeService.getBridgeStats();
            log.info("Bridge ready: locked={}, released={}, custody={}, dailyLimit={}, requiredValidations={}, validators={}, paused={}, unconfirmed={}",
                    stats.totalLocked(), stats.totalReleased(), stats.custodyBalance(), stats.dailyLimit(),
                    stats.requiredValidations(), stats.validatorCount(), stats.paused(), stats.unconfirmedTransfers());
            if (stats.requiredValidations() > stats.validatorCount()) {
                log.warn("Fewer validators ({}) than required validations ({}); no release can reach quorum",
                        stats.validatorCount(), stats.requiredValidations());
            }
        } catch (Exception e) {
            log.warn("Could not read bridge state on startup: {}", e.getMessage());
        }
    }

    @Scheduled(fixedDelayString = "${scheduler.pending-report.check-interval-ms:60000}")
    public void reportStaleWork() {
        if (!schedulerProps.getPendingReport().isEnabled()) {
            return;
        }
        reportOnce();
    }

    @Scheduled(fixedDelayString = "${scheduler.reconcile.check-interval-ms:15000}")
    public void reconcileTransfers() {
        if (!schedulerProps.getReconcile().isEnabled()) {
            return;
        }
        try {
            int settled = bridgeService.reconcileUnconfirmed();
            if (settled > 0) {
                log.info("Reconciled {} unconfirmed transfer(s)", settled);
            }
        } catch (Exception e) {
            log.error("Transfer reconciliation failed: {}", e.getMessage(), e);
        }
    }

    /**
     * @return number of stale items reported
     */
    public int reportOnce() {
        long cutoff = clock.instant().getEpochSecond() - schedulerProps.getPendingReport().getStaleAfterSeconds();

        List<ValidationRecord> staleQuorums = bridgeService.pendingValidationsOlderThan(cutoff);
        for (ValidationRecord r : staleQuorums) {
            log.warn("Stale attestation: key={}, recipient={}, amount={}, signatures={}, firstAttestedAt={}",
                    r.getKey(), r.getRecipient(), r.getAmount(), r.getSignatureCount(), r.getFirstAttestedAt());
        }

        List<BridgeProposal> staleProposals = governanceService.approvedUnexecutedOlderThan(cutoff);
        for (BridgeProposal p : staleProposals) {
            log.warn("Approved proposal not executed: id={}, kind={}, proposer={}, approvedAt={}",
                    p.getId(), p.getKind(), p.getProposer(), p.getDecidedAt());
        }

        int total = staleQuorums.size() + staleProposals.size();
        if (total > 0) {
            log.info("Pending work report: {} stale attestation key(s), {} unexecuted proposal(s)",
                    staleQuorums.size(), staleProposals.size());
        }
        return total;
    }
}
