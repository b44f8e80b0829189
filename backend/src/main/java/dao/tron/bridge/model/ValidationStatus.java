package dao.tron.bridge.model;

import java.math.BigInteger;
import java.util.List;

/**
 * Read view over one validation key, as returned to relays and operators.
 *
 * @param consumable true when a release for this key would pass the quorum and replay checks
 */
public record ValidationStatus(
        String key,
        String recipient,
        BigInteger amount,
        String proof,
        int signatures,
        int required,
        List<String> signers,
        ValidationState state,
        boolean proofConsumed,
        boolean consumable
) {}
