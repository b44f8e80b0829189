package dao.tron.bridge.model;

import lombok.Data;
import lombok.NoArgsConstructor;

import java.math.BigInteger;
import java.util.LinkedHashSet;
import java.util.Set;

@Data
@NoArgsConstructor
public class ValidationRecord {

    /** keccak256(recipient, amount, proof), 0x-prefixed. */
    private String key;
    private String recipient;
    private BigInteger amount;
    private String proof;
    /** Insertion order is attestation order. */
    private Set<String> signers = new LinkedHashSet<>();
    private long firstAttestedAt; // unix seconds
    private boolean released;

    public ValidationRecord(String key, String recipient, BigInteger amount, String proof, long firstAttestedAt) {
        this.key = key;
        this.recipient = recipient;
        this.amount = amount;
        this.proof = proof;
        this.firstAttestedAt = firstAttestedAt;
    }

    public int getSignatureCount() {
        return signers.size();
    }

    public boolean hasSigned(String signer) {
        return signers.contains(signer);
    }

    public ValidationState state(int required) {
        if (released) return ValidationState.RELEASED;
        if (signers.isEmpty()) return ValidationState.UNVALIDATED;
        return signers.size() >= required ? ValidationState.VALIDATED : ValidationState.PARTIALLY_VALIDATED;
    }

    public ValidationRecord copy() {
        ValidationRecord c = new ValidationRecord(key, recipient, amount, proof, firstAttestedAt);
        c.setSigners(new LinkedHashSet<>(signers));
        c.setReleased(released);
        return c;
    }
}
