package dao.tron.bridge.util;

import dao.tron.bridge.exception.BridgeErrorCode;
import dao.tron.bridge.exception.InvalidRequestException;
import org.web3j.crypto.Hash;

import java.util.Locale;
import java.util.Map;
import java.util.regex.Pattern;

/**
 * Proofs identify a destination-side burn/lock event as a bytes32 value.
 */
public final class ProofIds {
    private ProofIds() {}

    private static final Pattern BYTES32_HEX = Pattern.compile("^0[xX][0-9a-fA-F]{64}$");

    /**
     * Canonical form: 0x-prefixed, lower case, 64 hex chars.
     */
    public static String normalize(String proof) {
        if (proof == null || proof.isBlank()) {
            throw new InvalidRequestException(BridgeErrorCode.INVALID_PROOF, "Proof is required");
        }
        String p = proof.trim();
        if (!BYTES32_HEX.matcher(p).matches()) {
            throw new InvalidRequestException(BridgeErrorCode.INVALID_PROOF,
                    "Proof must be bytes32 hex (0x + 64 hex chars)", Map.of("proof", p));
        }
        return "0x" + p.substring(2).toLowerCase(Locale.ROOT);
    }

    /**
     * Relay-compatible proof for a destination-side transaction signature:
     * keccak256(utf8(signature)).
     */
    public static String fromSourceTxSignature(String signature) {
        if (signature == null || signature.isBlank()) {
            throw new InvalidRequestException(BridgeErrorCode.INVALID_PROOF, "Source transaction signature is required");
        }
        return Hash.sha3String(signature.trim()).toLowerCase(Locale.ROOT);
    }

    /**
     * Picks whichever of the two proof inputs is present.
     */
    public static String resolve(String proof, String sourceTxSignature) {
        if (proof != null && !proof.isBlank()) {
            return normalize(proof);
        }
        return fromSourceTxSignature(sourceTxSignature);
    }
}
