package dao.tron.bridge.repository;

import dao.tron.bridge.model.BridgeTransaction;
import dao.tron.bridge.model.TransferStatus;
import org.springframework.stereotype.Repository;

import java.util.*;

@Repository
public class InMemoryTransactionRepository implements TransactionRepository {

    // key: nonce
    private final Map<Long, BridgeTransaction> txByNonce = new TreeMap<>();

    // key: counterparty -> nonces in commit order
    private final Map<String, List<Long>> noncesByCounterparty = new HashMap<>();

    @Override
    public synchronized void save(BridgeTransaction tx) {
        if (txByNonce.putIfAbsent(tx.nonce(), tx) != null) {
            throw new IllegalStateException("Nonce already recorded: " + tx.nonce());
        }
        noncesByCounterparty.computeIfAbsent(tx.counterparty(), k -> new ArrayList<>()).add(tx.nonce());
    }

    @Override
    public synchronized void update(BridgeTransaction tx) {
        if (txByNonce.replace(tx.nonce(), tx) == null) {
            throw new IllegalStateException("Nonce not recorded: " + tx.nonce());
        }
    }

    @Override
    public synchronized void delete(long nonce) {
        BridgeTransaction removed = txByNonce.remove(nonce);
        if (removed == null) return;
        List<Long> nonces = noncesByCounterparty.get(removed.counterparty());
        if (nonces != null) {
            nonces.remove(Long.valueOf(nonce));
            if (nonces.isEmpty()) noncesByCounterparty.remove(removed.counterparty());
        }
    }

    @Override
    public synchronized List<BridgeTransaction> findAll() {
        return new ArrayList<>(txByNonce.values());
    }

    @Override
    public synchronized Optional<BridgeTransaction> findByNonce(long nonce) {
        return Optional.ofNullable(txByNonce.get(nonce));
    }

    @Override
    public synchronized List<BridgeTransaction> findByCounterparty(String counterparty) {
        List<Long> nonces = noncesByCounterparty.get(counterparty);
        if (nonces == null) return List.of();
        List<BridgeTransaction> out = new ArrayList<>(nonces.size());
        for (Long n : nonces) out.add(txByNonce.get(n));
        return out;
    }

    @Override
    public synchronized List<BridgeTransaction> findByTransferStatus(TransferStatus status) {
        List<BridgeTransaction> out = new ArrayList<>();
        for (BridgeTransaction tx : txByNonce.values()) {
            if (tx.transferStatus() == status) out.add(tx);
        }
        return out;
    }
}
