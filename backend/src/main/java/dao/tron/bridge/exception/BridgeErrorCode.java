package dao.tron.bridge.exception;

public enum BridgeErrorCode {
    UNAUTHORIZED(ErrorCategory.AUTHORIZATION),
    SELF_APPROVAL(ErrorCategory.AUTHORIZATION),

    INVALID_AMOUNT(ErrorCategory.VALIDATION),
    INVALID_DESTINATION(ErrorCategory.VALIDATION),
    INVALID_RECIPIENT(ErrorCategory.VALIDATION),
    INVALID_PROOF(ErrorCategory.VALIDATION),
    INVALID_PROPOSAL(ErrorCategory.VALIDATION),
    UNKNOWN_PROPOSAL(ErrorCategory.VALIDATION),
    UNKNOWN_TRANSACTION(ErrorCategory.VALIDATION),
    INVALID_COUNTERPARTY(ErrorCategory.VALIDATION),

    ALREADY_PROCESSED(ErrorCategory.STATE_CONFLICT),
    DUPLICATE_ATTESTATION(ErrorCategory.STATE_CONFLICT),
    QUORUM_NOT_MET(ErrorCategory.STATE_CONFLICT),
    ALREADY_DECIDED(ErrorCategory.STATE_CONFLICT),
    NOT_APPROVED(ErrorCategory.STATE_CONFLICT),
    ALREADY_EXECUTED(ErrorCategory.STATE_CONFLICT),
    BRIDGE_PAUSED(ErrorCategory.STATE_CONFLICT),
    BRIDGE_NOT_PAUSED(ErrorCategory.STATE_CONFLICT),
    INVALID_PARAMETER_CHANGE(ErrorCategory.STATE_CONFLICT),
    REENTRANT_CALL(ErrorCategory.STATE_CONFLICT),
    TRANSFER_SETTLED(ErrorCategory.STATE_CONFLICT),

    RATE_LIMIT_EXCEEDED(ErrorCategory.LIMIT_EXCEEDED),

    TRANSFER_FAILED(ErrorCategory.RESOURCE),
    TRANSFER_UNCONFIRMED(ErrorCategory.RESOURCE);

    private final ErrorCategory category;

    BridgeErrorCode(ErrorCategory category) {
        this.category = category;
    }

    public ErrorCategory getCategory() {
        return category;
    }
}
