package dao.tron.bridge.event;

import java.math.BigInteger;

public record LockRecorded(long nonce, String caller, BigInteger amount, String destination) implements BridgeEvent {}
