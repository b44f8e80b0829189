package dao.tron.bridge.model;

/**
 * Progress of one (recipient, amount, proof) key. Never moves backwards.
 */
public enum ValidationState {
    UNVALIDATED,
    PARTIALLY_VALIDATED,
    VALIDATED,
    RELEASED
}
