package dao.tron.bridge.repository;

import dao.tron.bridge.model.ProofEntry;
import org.springframework.stereotype.Repository;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

@Repository
public class InMemoryProofLedger implements ProofLedger {

    // key: normalized proof, in consumption order
    private final Map<String, ProofEntry> entries = new LinkedHashMap<>();

    @Override
    public synchronized boolean isConsumed(String proof) {
        return entries.containsKey(proof);
    }

    @Override
    public synchronized void consume(ProofEntry entry) {
        if (entries.putIfAbsent(entry.proof(), entry) != null) {
            throw new IllegalStateException("Proof already consumed: " + entry.proof());
        }
    }

    @Override
    public synchronized void discard(String proof) {
        entries.remove(proof);
    }

    @Override
    public synchronized Optional<ProofEntry> find(String proof) {
        return Optional.ofNullable(entries.get(proof));
    }

    @Override
    public synchronized List<ProofEntry> findAll() {
        return new ArrayList<>(entries.values());
    }
}
