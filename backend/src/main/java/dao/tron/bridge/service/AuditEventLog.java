package dao.tron.bridge.service;

import dao.tron.bridge.event.AuditRecord;
import dao.tron.bridge.event.BridgeEvent;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.util.ArrayList;
import java.util.List;

/**
 * Append-only stream of committed bridge events.
 */
@Slf4j
@Component
public class AuditEventLog {

    private final Clock clock;
    private final List<AuditRecord> records = new ArrayList<>();

    public AuditEventLog(Clock clock) {
        this.clock = clock;
    }

    public synchronized AuditRecord append(BridgeEvent event) {
        AuditRecord record = new AuditRecord(records.size() + 1L, clock.instant().getEpochSecond(), event.type(), event);
        records.add(record);
        log.info("Audit #{} {}: {}", record.sequence(), record.type(), event);
        return record;
    }

    public synchronized List<AuditRecord> findAll() {
        return new ArrayList<>(records);
    }

    /**
     * Records with sequence >= fromSequence.
     */
    public synchronized List<AuditRecord> findFrom(long fromSequence) {
        int start = (int) Math.max(0, Math.min(records.size(), fromSequence - 1));
        return new ArrayList<>(records.subList(start, records.size()));
    }
}
