package dao.tron.bridge.event;

public record AttestationRecorded(String key, String signer, int signatures) implements BridgeEvent {}
