package dao.tron.bridge.event;

import dao.tron.bridge.model.Direction;

/**
 * The transaction is recorded but its asset movement has not been confirmed.
 */
public record TransferUnconfirmed(long nonce, Direction direction, String counterparty, String txId,
                                  String reason) implements BridgeEvent {}
