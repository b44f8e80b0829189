package dao.tron.bridge.model;

public enum ProposalStatus {
    PROPOSED,
    APPROVED,
    REJECTED,
    EXECUTED
}
