package dao.tron.bridge.model;

public enum Capability {
    ADMIN,
    PROPOSER,
    APPROVER,
    VALIDATOR,
    RELAYER
}
