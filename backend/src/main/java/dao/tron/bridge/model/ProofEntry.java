package dao.tron.bridge.model;

/**
 * @param consumedAt unix seconds
 */
public record ProofEntry(String proof, String validationKey, long releaseNonce, long consumedAt) {}
