package dao.tron.bridge.event;

public record ProposalApproved(long id) implements BridgeEvent {}
