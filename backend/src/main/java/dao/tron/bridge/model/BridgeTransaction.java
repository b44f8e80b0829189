package dao.tron.bridge.model;

import java.math.BigInteger;

/**
 * A committed lock or release. Only the transfer outcome changes after it is recorded,
 * and only away from UNCONFIRMED.
 *
 * @param nonce          position in the bridge-wide sequence, starting at 0
 * @param counterparty   depositor for LOCK, recipient for RELEASE
 * @param timestamp      unix seconds
 * @param completed      true once the asset movement is confirmed
 * @param reference      destination reference for LOCK, consumed proof for RELEASE
 * @param transferStatus outcome of the asset movement
 * @param transferTxId   asset-ledger transaction id, when there is one
 */
public record BridgeTransaction(
        long nonce,
        String counterparty,
        BigInteger amount,
        Direction direction,
        long timestamp,
        boolean completed,
        String reference,
        TransferStatus transferStatus,
        String transferTxId
) {

    public static BridgeTransaction pending(long nonce, String counterparty, BigInteger amount,
                                            Direction direction, long timestamp, String reference) {
        return new BridgeTransaction(nonce, counterparty, amount, direction, timestamp, false, reference,
                TransferStatus.UNCONFIRMED, null);
    }

    public BridgeTransaction withTransfer(TransferStatus status, String txId) {
        return new BridgeTransaction(nonce, counterparty, amount, direction, timestamp,
                status == TransferStatus.CONFIRMED, reference, status, txId);
    }
}
