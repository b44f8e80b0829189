package dao.tron.bridge.exception;

public enum ErrorCategory {
    /** Caller lacks the capability. Checked before any state is read. */
    AUTHORIZATION,
    /** Malformed input. Rejected before any state is touched. */
    VALIDATION,
    /** Input is fine but the current state forbids the operation. */
    STATE_CONFLICT,
    /** Daily ceiling would be breached; retry after the window resets. */
    LIMIT_EXCEEDED,
    /** The asset transfer failed; everything the operation did was rolled back. */
    RESOURCE
}
