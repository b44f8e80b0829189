package dao.tron.bridge.model;

/**
 * Outcome of the asset movement behind a lock or release.
 */
public enum TransferStatus {
    /** Funds moved. */
    CONFIRMED,
    /** Submitted to the asset ledger, outcome not known yet. */
    UNCONFIRMED,
    /** Submitted, and the asset ledger reports it did not go through. */
    FAILED
}
