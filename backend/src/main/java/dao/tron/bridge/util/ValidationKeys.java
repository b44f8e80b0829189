package dao.tron.bridge.util;

import org.bouncycastle.jcajce.provider.digest.Keccak;
import org.tron.trident.utils.Numeric;

import java.math.BigInteger;
import java.nio.charset.StandardCharsets;

/**
 * Key under which attestations for one release accumulate.
 */
public final class ValidationKeys {
    private ValidationKeys() {}

    /**
     * keccak256(utf8(recipient) || uint256(amount) || bytes32(proof)).
     * Expects a recipient already trimmed, a positive amount and a normalized proof.
     */
    public static String keyOf(String recipient, BigInteger amount, String proof) {
        byte[] recipientBytes = recipient.getBytes(StandardCharsets.UTF_8);
        byte[] amountBytes = uint256ToBytes(amount);
        byte[] proofBytes = Numeric.hexStringToByteArray(proof.substring(2));

        byte[] packed = new byte[recipientBytes.length + amountBytes.length + proofBytes.length];
        System.arraycopy(recipientBytes, 0, packed, 0, recipientBytes.length);
        System.arraycopy(amountBytes, 0, packed, recipientBytes.length, amountBytes.length);
        System.arraycopy(proofBytes, 0, packed, recipientBytes.length + amountBytes.length, proofBytes.length);

        return "0x" + Numeric.toHexStringNoPrefix(keccak256(packed));
    }

    private static byte[] keccak256(byte[] data) {
        Keccak.Digest256 digest = new Keccak.Digest256();
        digest.update(data, 0, data.length);
        return digest.digest();
    }

    private static byte[] uint256ToBytes(BigInteger value) {
        if (value == null || value.signum() < 0) {
            throw new IllegalArgumentException("uint256 cannot be null or negative");
        }
        byte[] raw = value.toByteArray();
        // toByteArray may carry a leading sign byte
        int offset = (raw.length > 1 && raw[0] == 0) ? 1 : 0;
        int len = raw.length - offset;
        if (len > 32) {
            throw new IllegalArgumentException("uint256 value too large");
        }
        byte[] out = new byte[32];
        System.arraycopy(raw, offset, out, 32 - len, len);
        return out;
    }
}
