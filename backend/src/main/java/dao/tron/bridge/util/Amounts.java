package dao.tron.bridge.util;

import dao.tron.bridge.exception.BridgeErrorCode;
import dao.tron.bridge.exception.InvalidRequestException;

import java.math.BigInteger;
import java.util.Map;

/**
 * Token amounts are unsigned 256-bit integers in base units, carried as BigInteger.
 */
public final class Amounts {
    private Amounts() {}

    private static final int UINT256_BITS = 256;

    public static BigInteger parse(String decimal) {
        if (decimal == null || decimal.isBlank()) {
            throw new InvalidRequestException(BridgeErrorCode.INVALID_AMOUNT, "Amount is required");
        }
        try {
            return requirePositive(new BigInteger(decimal.trim()));
        } catch (NumberFormatException e) {
            throw new InvalidRequestException(BridgeErrorCode.INVALID_AMOUNT,
                    "Amount is not a base-10 integer: " + decimal, Map.of("amount", decimal));
        }
    }

    public static BigInteger requirePositive(BigInteger amount) {
        if (amount == null || amount.signum() <= 0) {
            throw new InvalidRequestException(BridgeErrorCode.INVALID_AMOUNT,
                    "Amount must be greater than zero", Map.of("amount", String.valueOf(amount)));
        }
        if (amount.bitLength() > UINT256_BITS) {
            throw new InvalidRequestException(BridgeErrorCode.INVALID_AMOUNT,
                    "Amount does not fit in uint256", Map.of("amount", amount.toString()));
        }
        return amount;
    }

    /** Parses an optional value; null or blank yields null. */
    public static BigInteger parseOptional(String decimal) {
        if (decimal == null || decimal.isBlank()) return null;
        try {
            return new BigInteger(decimal.trim());
        } catch (NumberFormatException e) {
            throw new InvalidRequestException(BridgeErrorCode.INVALID_PROPOSAL,
                    "Value is not a base-10 integer: " + decimal, Map.of("value", decimal));
        }
    }
}
