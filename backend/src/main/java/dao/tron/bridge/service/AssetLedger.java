package dao.tron.bridge.service;

import dao.tron.bridge.model.TransferReceipt;
import dao.tron.bridge.model.TransferStatus;

import java.math.BigInteger;

/**
 * Fungible-asset transfer primitive. The bridge calls it only after its own state is updated.
 * A {@link dao.tron.bridge.exception.TransferOutcomeUnknownException} means the transfer may
 * still land; any other exception means it definitely did not.
 */
public interface AssetLedger {

    /**
     * Moves amount from account into bridge custody.
     */
    TransferReceipt debit(String account, BigInteger amount);

    /**
     * Moves amount from bridge custody to account.
     */
    TransferReceipt credit(String account, BigInteger amount);

    /**
     * Current outcome of a previously submitted transfer. Never blocks waiting for it.
     */
    TransferStatus transferStatus(String txId);

    BigInteger custodyBalance();

    BigInteger balanceOf(String account);

    String custodyAccount();
}
