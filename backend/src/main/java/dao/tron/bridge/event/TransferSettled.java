package dao.tron.bridge.event;

import dao.tron.bridge.model.Direction;
import dao.tron.bridge.model.TransferStatus;

/**
 * An unconfirmed transfer reached its final outcome.
 *
 * @param settledBy operator who resolved it, or "reconciler"
 */
public record TransferSettled(long nonce, Direction direction, TransferStatus status, String txId,
                              String settledBy) implements BridgeEvent {}
