package dao.tron.bridge.event;

/**
 * Entry in the append-only audit stream. Operators, auditors and the relay observe the
 * bridge only through these and the read endpoints.
 */
public interface BridgeEvent {

    /** Stable event name, e.g. "LockRecorded". */
    default String type() {
        return getClass().getSimpleName();
    }
}
