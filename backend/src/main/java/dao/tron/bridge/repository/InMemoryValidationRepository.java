package dao.tron.bridge.repository;

import dao.tron.bridge.model.ValidationRecord;
import org.springframework.stereotype.Repository;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

@Repository
public class InMemoryValidationRepository implements ValidationRepository {

    // key: validation key
    private final Map<String, ValidationRecord> records = new LinkedHashMap<>();

    @Override
    public synchronized void save(ValidationRecord record) {
        records.put(record.getKey(), record.copy());
    }

    @Override
    public synchronized void delete(String key) {
        records.remove(key);
    }

    @Override
    public synchronized Optional<ValidationRecord> findByKey(String key) {
        ValidationRecord r = records.get(key);
        return r == null ? Optional.empty() : Optional.of(r.copy());
    }

    @Override
    public synchronized List<ValidationRecord> findAll() {
        List<ValidationRecord> out = new ArrayList<>(records.size());
        for (ValidationRecord r : records.values()) out.add(r.copy());
        return out;
    }
}
