package dao.tron.bridge.model;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.math.BigInteger;

@Data
@Builder(toBuilder = true)
@NoArgsConstructor
@AllArgsConstructor
public class BridgeProposal {

    private long id;
    private String proposer;
    private ProposalKind kind;
    private String target;     // account for role changes, null otherwise
    private BigInteger value;  // new limit or quorum, null otherwise
    private String rationale;
    private boolean approved;
    private boolean rejected;
    private boolean executed;
    private long createdAt;    // unix seconds
    private String decidedBy;
    private long decidedAt;
    private String executedBy;
    private long executedAt;

    public ProposalStatus getStatus() {
        if (executed) return ProposalStatus.EXECUTED;
        if (approved) return ProposalStatus.APPROVED;
        if (rejected) return ProposalStatus.REJECTED;
        return ProposalStatus.PROPOSED;
    }

    public boolean isDecided() {
        return approved || rejected;
    }

    public BridgeProposal copy() {
        return toBuilder().build();
    }
}
