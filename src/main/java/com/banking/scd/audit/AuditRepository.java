package com.banking.scd.audit;

import com.banking.scd.core.model.DimensionId;

import java.time.Instant;
import java.util.List;

/**
 * Repository interface for audit entry persistence.
 */
public interface AuditRepository {

    AuditEntry save(AuditEntry entry);

    List<AuditEntry> findAll();

    /**
     * Gets audit entries for one natural key, oldest first.
     */
    List<AuditEntry> findByNaturalKey(DimensionId dimension, String naturalKey);

    List<AuditEntry> findByAction(AuditAction action);

    List<AuditEntry> findBetween(Instant start, Instant end);

    int count();

    /**
     * Gets the most recent entries, up to the specified limit.
     */
    List<AuditEntry> findRecent(int limit);
}
