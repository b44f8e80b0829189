package dao.tron.bridge.repository;

import dao.tron.bridge.model.BridgeProposal;

import java.util.List;
import java.util.Optional;

public interface ProposalRepository {

    /**
     * Assigns the next id when the proposal has none (id == 0).
     */
    BridgeProposal save(BridgeProposal proposal);

    Optional<BridgeProposal> findById(long id);

    List<BridgeProposal> findAll();
}
