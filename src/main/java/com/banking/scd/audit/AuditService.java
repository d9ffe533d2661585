package com.banking.scd.audit;

import com.banking.scd.core.model.DimensionId;
import com.banking.scd.core.model.DimensionVersion;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.List;
import java.util.Map;

/**
 * Service for recording and querying the audit trail of version chain changes.
 * Append-only.
 */
public class AuditService {
    private static final Logger log = LoggerFactory.getLogger(AuditService.class);

    private final AuditRepository repository;

    public AuditService() {
        this(new InMemoryAuditRepository());
    }

    public AuditService(AuditRepository repository) {
        this.repository = repository;
    }

    /**
     * Records an audit entry.
     */
    public AuditEntry record(AuditEntry entry) {
        repository.save(entry);
        log.debug("Audit entry recorded: {} for {}/{} sk={} by {}",
                entry.action(), entry.dimension(), entry.naturalKey(), entry.surrogateKey(), entry.sourceSystem());
        return entry;
    }

    /**
     * Records an action on a specific version.
     */
    public AuditEntry record(AuditAction action, DimensionVersion version, String sourceSystem,
                             Map<String, Object> details) {
        return record(AuditEntry.builder()
                .action(action)
                .dimension(version.getDimension())
                .naturalKey(version.getNaturalKey())
                .surrogateKey(version.getSurrogateKey())
                .sourceSystem(sourceSystem)
                .details(details)
                .build());
    }

    /**
     * Records an action on a natural key that did not touch any version.
     */
    public AuditEntry record(AuditAction action, DimensionId dimension, String naturalKey, String sourceSystem,
                             Map<String, Object> details) {
        return record(AuditEntry.builder()
                .action(action)
                .dimension(dimension)
                .naturalKey(naturalKey)
                .sourceSystem(sourceSystem)
                .details(details)
                .build());
    }

    public List<AuditEntry> getAllEntries() {
        return repository.findAll();
    }

    public List<AuditEntry> getEntriesFor(DimensionId dimension, String naturalKey) {
        return repository.findByNaturalKey(dimension, naturalKey);
    }

    public List<AuditEntry> getEntriesByAction(AuditAction action) {
        return repository.findByAction(action);
    }

    public List<AuditEntry> getRecentEntries(int limit) {
        return repository.findRecent(limit);
    }

    public int size() {
        return repository.count();
    }
}
