package dao.tron.bridge.repository;

import dao.tron.bridge.model.ProofEntry;

import java.util.List;
import java.util.Optional;

/**
 * Append-only record of consumed destination-side proofs. A proof is consumed at most once, ever.
 */
public interface ProofLedger {

    boolean isConsumed(String proof);

    /**
     * @throws IllegalStateException if the proof was already consumed
     */
    void consume(ProofEntry entry);

    /**
     * Drops an entry recorded by the operation currently in flight, when that operation
     * rolls back. Never used on a committed entry.
     */
    void discard(String proof);

    Optional<ProofEntry> find(String proof);

    List<ProofEntry> findAll();
}
