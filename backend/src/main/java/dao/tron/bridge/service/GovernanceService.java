package dao.tron.bridge.service;

import dao.tron.bridge.event.ProposalApproved;
import dao.tron.bridge.event.ProposalCreated;
import dao.tron.bridge.event.ProposalExecuted;
import dao.tron.bridge.event.ProposalRejected;
import dao.tron.bridge.exception.AuthorizationException;
import dao.tron.bridge.exception.BridgeErrorCode;
import dao.tron.bridge.exception.InvalidRequestException;
import dao.tron.bridge.exception.StateConflictException;
import dao.tron.bridge.model.BridgeProposal;
import dao.tron.bridge.model.Capability;
import dao.tron.bridge.model.ProposalKind;
import dao.tron.bridge.repository.ProposalRepository;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.math.BigInteger;
import java.time.Clock;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Propose / approve-or-reject / execute workflow for bridge parameter changes.
 * Executing a proposal is the only way limits, quorum, validator and relayer sets,
 * and the pause switch change at runtime.
 */
@Slf4j
@Service
public class GovernanceService {

    private final OperationGuard guard;
    private final ProposalRepository proposals;
    private final RoleRegistry roles;
    private final BridgeState state;
    private final RateLimiter rateLimiter;
    private final AuditEventLog auditLog;
    private final Clock clock;

    public GovernanceService(OperationGuard guard,
                             ProposalRepository proposals,
                             RoleRegistry roles,
                             BridgeState state,
                             RateLimiter rateLimiter,
                             AuditEventLog auditLog,
                             Clock clock) {
        this.guard = guard;
        this.proposals = proposals;
        this.roles = roles;
        this.state = state;
        this.rateLimiter = rateLimiter;
        this.auditLog = auditLog;
        this.clock = clock;
    }

    public BridgeProposal propose(String caller, ProposalKind kind, String target, BigInteger value, String rationale) {
        return guard.execute("propose", () -> {
            String proposer = requireCapability(caller, Capability.PROPOSER, "propose");
            checkShape(kind, target, value, rationale);

            BridgeProposal saved = proposals.save(BridgeProposal.builder()
                    .proposer(proposer)
                    .kind(kind)
                    .target(kind.needsTarget() ? target.trim() : null)
                    .value(kind.needsValue() ? value : null)
                    .rationale(rationale.trim())
                    .createdAt(now())
                    .build());

            auditLog.append(new ProposalCreated(saved.getId(), proposer, kind));
            log.info("Proposal created: id={}, kind={}, proposer={}, target={}, value={}",
                    saved.getId(), kind, proposer, saved.getTarget(), saved.getValue());
            return saved;
        });
    }

    public BridgeProposal approve(String caller, long id) {
        return guard.execute("approve", () -> {
            String approver = requireCapability(caller, Capability.APPROVER, "approve");
            BridgeProposal p = load(id);
            requireUndecided(p);
            if (approver.equals(p.getProposer())) {
                throw new AuthorizationException(BridgeErrorCode.SELF_APPROVAL,
                        "Proposer cannot approve their own proposal",
                        Map.of("id", id, "caller", approver));
            }
            p.setApproved(true);
            p.setDecidedBy(approver);
            p.setDecidedAt(now());
            BridgeProposal saved = proposals.save(p);

            auditLog.append(new ProposalApproved(id));
            log.info("Proposal approved: id={}, approver={}", id, approver);
            return saved;
        });
    }

    public BridgeProposal reject(String caller, long id) {
        return guard.execute("reject", () -> {
            String approver = requireCapability(caller, Capability.APPROVER, "reject");
            BridgeProposal p = load(id);
            requireUndecided(p);
            p.setRejected(true);
            p.setDecidedBy(approver);
            p.setDecidedAt(now());
            BridgeProposal saved = proposals.save(p);

            auditLog.append(new ProposalRejected(id));
            log.info("Proposal rejected: id={}, approver={}", id, approver);
            return saved;
        });
    }

    /**
     * Applies an approved proposal. If the change cannot be applied the proposal stays
     * approved and un-executed, and nothing was changed.
     */
    public BridgeProposal execute(String caller, long id) {
        return guard.execute("execute", () -> {
            String who = requireCaller(caller);
            boolean admin = roles.can(who, Capability.ADMIN);
            if (!admin && !roles.can(who, Capability.PROPOSER)) {
                throw unauthorized("execute", who, "ADMIN or proposer");
            }
            BridgeProposal p = load(id);
            if (!admin && !who.equals(p.getProposer())) {
                throw unauthorized("execute", who, "ADMIN or proposer");
            }
            if (p.isExecuted()) {
                throw new StateConflictException(BridgeErrorCode.ALREADY_EXECUTED, "Proposal already executed",
                        Map.of("id", id, "executedAt", p.getExecutedAt()));
            }
            if (!p.isApproved()) {
                throw new StateConflictException(BridgeErrorCode.NOT_APPROVED, "Proposal is not approved",
                        Map.of("id", id, "status", p.getStatus().name()));
            }

            apply(p);

            p.setExecuted(true);
            p.setExecutedBy(who);
            p.setExecutedAt(now());
            BridgeProposal saved = proposals.save(p);

            auditLog.append(new ProposalExecuted(id));
            log.info("Proposal executed: id={}, kind={}, by={}", id, p.getKind(), who);
            return saved;
        });
    }

    public BridgeProposal getProposal(long id) {
        return guard.read(() -> load(id));
    }

    public List<BridgeProposal> listProposals() {
        return guard.read(proposals::findAll);
    }

    /**
     * Approved proposals not yet executed that were decided before the given unix time.
     */
    public List<BridgeProposal> approvedUnexecutedOlderThan(long epochSeconds) {
        return guard.read(() -> {
            List<BridgeProposal> out = new ArrayList<>();
            for (BridgeProposal p : proposals.findAll()) {
                if (p.isApproved() && !p.isExecuted() && p.getDecidedAt() < epochSeconds) {
                    out.add(p);
                }
            }
            return out;
        });
    }

    private void apply(BridgeProposal p) {
        switch (p.getKind()) {
            case UPDATE_RATE_LIMIT:
                rateLimiter.setDailyLimit(p.getValue());
                break;
            case ADD_RELAYER:
                grant(p, Capability.RELAYER);
                break;
            case REMOVE_RELAYER:
                revoke(p, Capability.RELAYER);
                break;
            case ADD_VALIDATOR:
                grant(p, Capability.VALIDATOR);
                break;
            case REMOVE_VALIDATOR: {
                int remaining = roles.holders(Capability.VALIDATOR).size() - 1;
                if (roles.can(p.getTarget(), Capability.VALIDATOR) && remaining < state.getRequiredValidations()) {
                    throw invalidChange(p, "Removing validator would leave fewer validators than required",
                            "validators", remaining);
                }
                revoke(p, Capability.VALIDATOR);
                break;
            }
            case UPDATE_REQUIRED_VALIDATIONS: {
                int validators = roles.holders(Capability.VALIDATOR).size();
                int required = p.getValue().intValueExact();
                if (required > validators) {
                    throw invalidChange(p, "Required validations exceed validator count", "validators", validators);
                }
                log.info("Required validations updated: {} -> {}", state.getRequiredValidations(), required);
                state.setRequiredValidations(required);
                break;
            }
            case PAUSE_BRIDGE:
                if (state.isPaused()) {
                    throw new StateConflictException(BridgeErrorCode.BRIDGE_PAUSED, "Bridge is already paused",
                            Map.of("id", p.getId()));
                }
                state.setPaused(true);
                log.warn("Bridge paused by proposal {}", p.getId());
                break;
            case UNPAUSE_BRIDGE:
                if (!state.isPaused()) {
                    throw new StateConflictException(BridgeErrorCode.BRIDGE_NOT_PAUSED, "Bridge is not paused",
                            Map.of("id", p.getId()));
                }
                state.setPaused(false);
                log.info("Bridge unpaused by proposal {}", p.getId());
                break;
            default:
                throw new IllegalStateException("Unhandled proposal kind: " + p.getKind());
        }
    }

    private void grant(BridgeProposal p, Capability capability) {
        if (roles.can(p.getTarget(), capability)) {
            throw invalidChange(p, p.getTarget() + " already holds " + capability, "target", p.getTarget());
        }
        roles.grant(p.getTarget(), capability);
    }

    private void revoke(BridgeProposal p, Capability capability) {
        if (!roles.can(p.getTarget(), capability)) {
            throw invalidChange(p, p.getTarget() + " does not hold " + capability, "target", p.getTarget());
        }
        roles.revoke(p.getTarget(), capability);
    }

    private void checkShape(ProposalKind kind, String target, BigInteger value, String rationale) {
        if (kind == null) {
            throw new InvalidRequestException(BridgeErrorCode.INVALID_PROPOSAL, "Proposal kind is required");
        }
        if (rationale == null || rationale.isBlank()) {
            throw new InvalidRequestException(BridgeErrorCode.INVALID_PROPOSAL, "Rationale is required",
                    Map.of("kind", kind.name()));
        }
        boolean hasTarget = target != null && !target.isBlank();
        if (kind.needsTarget() != hasTarget) {
            throw new InvalidRequestException(BridgeErrorCode.INVALID_PROPOSAL,
                    kind + (kind.needsTarget() ? " requires a target account" : " takes no target"),
                    Map.of("kind", kind.name()));
        }
        if (kind.needsValue() != (value != null)) {
            throw new InvalidRequestException(BridgeErrorCode.INVALID_PROPOSAL,
                    kind + (kind.needsValue() ? " requires a value" : " takes no value"),
                    Map.of("kind", kind.name()));
        }
        if (value == null) return;

        if (value.signum() <= 0) {
            throw new InvalidRequestException(BridgeErrorCode.INVALID_PROPOSAL, "Value must be greater than zero",
                    Map.of("kind", kind.name(), "value", value));
        }
        // quorum must fit an int, limits a uint256
        int maxBits = kind == ProposalKind.UPDATE_REQUIRED_VALIDATIONS ? 31 : 256;
        if (value.bitLength() > maxBits) {
            throw new InvalidRequestException(BridgeErrorCode.INVALID_PROPOSAL, "Value out of range",
                    Map.of("kind", kind.name(), "value", value));
        }
    }

    private BridgeProposal load(long id) {
        return proposals.findById(id)
                .orElseThrow(() -> new InvalidRequestException(BridgeErrorCode.UNKNOWN_PROPOSAL,
                        "Unknown proposal id: " + id, Map.of("id", id)));
    }

    private void requireUndecided(BridgeProposal p) {
        if (p.isDecided()) {
            throw new StateConflictException(BridgeErrorCode.ALREADY_DECIDED, "Proposal already decided",
                    Map.of("id", p.getId(), "status", p.getStatus().name()));
        }
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
            throw unauthorized(operation, who, capability.name());
        }
        return who;
    }

    private AuthorizationException unauthorized(String operation, String caller, String required) {
        log.warn("Rejected {}: caller {} lacks {}", operation, caller, required);
        return new AuthorizationException(BridgeErrorCode.UNAUTHORIZED, "Caller lacks " + required + " capability",
                Map.of("caller", caller, "required", required));
    }

    private StateConflictException invalidChange(BridgeProposal p, String message, String field, Object value) {
        Map<String, Object> details = new LinkedHashMap<>();
        details.put("id", p.getId());
        details.put("kind", p.getKind().name());
        details.put("requiredValidations", state.getRequiredValidations());
        details.put(field, value);
        log.warn("Proposal {} not applied: {}", p.getId(), message);
        return new StateConflictException(BridgeErrorCode.INVALID_PARAMETER_CHANGE, message, details);
    }

    private long now() {
        return clock.instant().getEpochSecond();
    }
}
