package dao.tron.bridge.event;

import java.math.BigInteger;

public record ReleaseRecorded(long nonce, String recipient, BigInteger amount, String proof) implements BridgeEvent {}
