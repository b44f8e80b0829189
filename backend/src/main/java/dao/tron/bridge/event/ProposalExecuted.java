package dao.tron.bridge.event;

public record ProposalExecuted(long id) implements BridgeEvent {}
