package dao.tron.bridge.event;

/**
 * @param sequence  position in the stream, starting at 1
 * @param timestamp unix seconds
 */
public record AuditRecord(long sequence, long timestamp, String type, BridgeEvent event) {}
