package dao.tron.bridge.model;

/**
 * Parameter and capability changes that governance can make to a live bridge.
 * Ordinals match the numeric proposal types the operator tooling submits.
 */
public enum ProposalKind {
    UPDATE_RATE_LIMIT(false, true),
    ADD_RELAYER(true, false),
    REMOVE_RELAYER(true, false),
    ADD_VALIDATOR(true, false),
    REMOVE_VALIDATOR(true, false),
    UPDATE_REQUIRED_VALIDATIONS(false, true),
    PAUSE_BRIDGE(false, false),
    UNPAUSE_BRIDGE(false, false);

    private final boolean needsTarget;
    private final boolean needsValue;

    ProposalKind(boolean needsTarget, boolean needsValue) {
        this.needsTarget = needsTarget;
        this.needsValue = needsValue;
    }

    public boolean needsTarget() {
        return needsTarget;
    }

    public boolean needsValue() {
        return needsValue;
    }
}
