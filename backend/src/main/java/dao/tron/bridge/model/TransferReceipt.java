package dao.tron.bridge.model;

/**
 * What the asset ledger knows about a transfer right after submitting it.
 *
 * @param txId ledger transaction id, null when the ledger has none or it is not known
 */
public record TransferReceipt(TransferStatus status, String txId) {

    public static TransferReceipt confirmed(String txId) {
        return new TransferReceipt(TransferStatus.CONFIRMED, txId);
    }

    public static TransferReceipt unconfirmed(String txId) {
        return new TransferReceipt(TransferStatus.UNCONFIRMED, txId);
    }
}
