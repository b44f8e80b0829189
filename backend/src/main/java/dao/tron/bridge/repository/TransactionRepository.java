package dao.tron.bridge.repository;

import dao.tron.bridge.model.BridgeTransaction;
import dao.tron.bridge.model.TransferStatus;

import java.util.List;
import java.util.Optional;

public interface TransactionRepository {

    void save(BridgeTransaction tx);

    /**
     * Replaces the transaction with the same nonce. Fails if none is recorded.
     */
    void update(BridgeTransaction tx);

    /**
     * Removes the transaction recorded by an operation that is rolling back.
     */
    void delete(long nonce);

    List<BridgeTransaction> findAll();

    Optional<BridgeTransaction> findByNonce(long nonce);

    List<BridgeTransaction> findByCounterparty(String counterparty);

    List<BridgeTransaction> findByTransferStatus(TransferStatus status);
}
