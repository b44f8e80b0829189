package dao.tron.bridge.event;

public record ProposalRejected(long id) implements BridgeEvent {}
