package dao.tron.bridge.model;

import jakarta.validation.constraints.AssertTrue;
import jakarta.validation.constraints.NotBlank;
import lombok.Data;

/**
 * Body for both attestations and releases: the two steps address the same key.
 */
@Data
public class ReleaseRequest {

    @NotBlank
    private String recipient;

    @NotBlank
    private String amount;             // string decimal, base units

    private String proof;              // bytes32 hex (0x + 64 chars)

    private String sourceTxSignature;  // alternative: raw destination-side tx signature

    @AssertTrue(message = "exactly one of proof or sourceTxSignature is required")
    public boolean isProofReferencePresent() {
        boolean hasProof = proof != null && !proof.isBlank();
        boolean hasSignature = sourceTxSignature != null && !sourceTxSignature.isBlank();
        return hasProof ^ hasSignature;
    }
}
