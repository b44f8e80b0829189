package dao.tron.bridge.event;

import dao.tron.bridge.model.ProposalKind;

public record ProposalCreated(long id, String proposer, ProposalKind kind) implements BridgeEvent {}
