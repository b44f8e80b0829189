package dao.tron.bridge.util;

import dao.tron.bridge.exception.BridgeErrorCode;
import dao.tron.bridge.exception.InvalidRequestException;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.web3j.crypto.Hash;

import static org.junit.jupiter.api.Assertions.*;

class ProofIdsTest {

    @Test
    @DisplayName("Proofs are normalized to lower-case 0x-prefixed bytes32")
    void normalize() {
        String upper = "0X" + "AB".repeat(32);
        assertEquals("0x" + "ab".repeat(32), ProofIds.normalize("  " + upper + " "));
    }

    @Test
    @DisplayName("Anything but 32 bytes of hex is rejected")
    void rejectsMalformed() {
        for (String bad : new String[]{null, "", "0x", "0x1234", "ab".repeat(32), "0x" + "zz".repeat(32), "0x" + "ab".repeat(33)}) {
            InvalidRequestException ex = assertThrows(InvalidRequestException.class, () -> ProofIds.normalize(bad));
            assertEquals(BridgeErrorCode.INVALID_PROOF, ex.getCode());
        }
    }

    @Test
    @DisplayName("Source transaction signature hashes to keccak256 of its UTF-8 bytes")
    void fromSignature() {
        String sig = "5VERv8NMvzbJMEkV8xnrLkEaWRtSz9CosKDYjCJjBRnbJLgp8uirBgmQpjKhoR4tjF3ZpRzrFmBV6UjKdiSZkQUW";
        String proof = ProofIds.fromSourceTxSignature(sig);

        assertEquals(Hash.sha3String(sig), proof);
        assertEquals(66, proof.length());
        assertEquals(proof, ProofIds.normalize(proof));
    }

    @Test
    @DisplayName("Explicit proof wins over signature")
    void resolve() {
        String proof = "0x" + "11".repeat(32);
        assertEquals(proof, ProofIds.resolve(proof, "sig"));
        assertEquals(Hash.sha3String("sig"), ProofIds.resolve(null, "sig"));
        assertThrows(InvalidRequestException.class, () -> ProofIds.resolve(" ", null));
    }
}
