package dao.tron.bridge.model;

import java.math.BigInteger;
import java.time.Instant;

/**
 * @param lockedBalance    totalLocked - totalReleased, what custody should hold
 * @param custodyBalance   what the asset ledger reports custody actually holds
 * @param transactionCount next nonce to be allocated
 * @param unconfirmedTransfers transactions whose asset movement is not settled yet
 */
public record BridgeStats(
        BigInteger totalLocked,
        BigInteger totalReleased,
        BigInteger lockedBalance,
        BigInteger custodyBalance,
        long transactionCount,
        BigInteger dailyLimit,
        BigInteger dailyVolume,
        BigInteger remainingDailyLimit,
        Instant windowStart,
        int requiredValidations,
        int validatorCount,
        boolean paused,
        int unconfirmedTransfers
) {}
