package dao.tron.bridge.repository;

import dao.tron.bridge.model.BridgeProposal;
import org.springframework.stereotype.Repository;

import java.util.*;
import java.util.concurrent.atomic.AtomicLong;

@Repository
public class InMemoryProposalRepository implements ProposalRepository {

    // key: proposal id
    private final Map<Long, BridgeProposal> proposalsById = new TreeMap<>();

    private final AtomicLong idSeq = new AtomicLong(1);

    @Override
    public synchronized BridgeProposal save(BridgeProposal proposal) {
        // assign id if new
        if (proposal.getId() == 0L) {
            proposal.setId(idSeq.getAndIncrement());
        }
        proposalsById.put(proposal.getId(), proposal.copy());
        return proposal.copy();
    }

    @Override
    public synchronized Optional<BridgeProposal> findById(long id) {
        BridgeProposal p = proposalsById.get(id);
        return p == null ? Optional.empty() : Optional.of(p.copy());
    }

    @Override
    public synchronized List<BridgeProposal> findAll() {
        List<BridgeProposal> out = new ArrayList<>(proposalsById.size());
        for (BridgeProposal p : proposalsById.values()) out.add(p.copy());
        return out;
    }
}
