package dao.tron.bridge.repository;

import dao.tron.bridge.model.ValidationRecord;

import java.util.List;
import java.util.Optional;

/**
 * Records are stored and handed out as copies; callers save() to persist a change.
 */
public interface ValidationRepository {

    void save(ValidationRecord record);

    void delete(String key);

    Optional<ValidationRecord> findByKey(String key);

    List<ValidationRecord> findAll();
}
