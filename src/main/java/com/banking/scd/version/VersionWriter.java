package com.banking.scd.version;

import com.banking.scd.api.LoadOptions;
import com.banking.scd.audit.AuditAction;
import com.banking.scd.audit.AuditService;
import com.banking.scd.cache.CurrentVersionCache;
import com.banking.scd.cache.NoOpCurrentVersionCache;
import com.banking.scd.core.exception.ConcurrentVersionModificationException;
import com.banking.scd.core.exception.InvalidAsOfDateException;
import com.banking.scd.core.model.AsOfRecord;
import com.banking.scd.core.model.ChangeType;
import com.banking.scd.core.model.DimensionVersion;
import com.banking.scd.core.model.TrackingPolicy;
import com.banking.scd.detect.AttributeChange;
import com.banking.scd.detect.ChangeSet;
import com.banking.scd.key.SurrogateKeyAllocator;
import com.banking.scd.metrics.MetricsService;
import com.banking.scd.metrics.NoOpMetricsService;
import com.banking.scd.store.DimensionStore;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.LocalDate;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Optional;

/**
 * Turns a detected change into store writes.
 *
 * <p>Every write is conditional on the version it was computed from still being
 * current. When that no longer holds the store raises
 * {@link ConcurrentVersionModificationException}, nothing is written, and the
 * caller is expected to re-resolve and retry.</p>
 */
public class VersionWriter {
    private static final Logger log = LoggerFactory.getLogger(VersionWriter.class);

    private final DimensionStore store;
    private final SurrogateKeyAllocator keyAllocator;
    private final AuditService auditService;
    private final CurrentVersionCache cache;
    private final MetricsService metricsService;

    public VersionWriter(DimensionStore store, SurrogateKeyAllocator keyAllocator, AuditService auditService) {
        this(store, keyAllocator, auditService, new NoOpCurrentVersionCache(), new NoOpMetricsService());
    }

    public VersionWriter(DimensionStore store, SurrogateKeyAllocator keyAllocator, AuditService auditService,
                         CurrentVersionCache cache, MetricsService metricsService) {
        this.store = store;
        this.keyAllocator = keyAllocator;
        this.auditService = auditService;
        this.cache = cache;
        this.metricsService = metricsService;
    }

    /**
     * Applies a change set.
     *
     * @param record  the incoming record
     * @param current the version the change set was computed against
     * @param changes the detected change
     * @param options lineage and audit options
     * @return the write outcome; for {@code NO_CHANGE} the untouched current version
     * @throws InvalidAsOfDateException if the record is dated before the current version
     * @throws ConcurrentVersionModificationException if {@code current} was changed concurrently
     */
    public VersionWriteResult write(AsOfRecord record, Optional<DimensionVersion> current, ChangeSet changes,
                                    LoadOptions options) {
        current.ifPresent(version -> checkAsOfDate(record, version));

        return switch (changes.changeType()) {
            case NEW_ENTITY -> insertNew(record, changes, options);
            case NO_CHANGE -> new VersionWriteResult(ChangeType.NO_CHANGE, requireCurrent(current, changes),
                    null, changes.changedAttributeNames());
            case TYPE1_UPDATE -> overwrite(requireCurrent(current, changes), changes, options);
            case TYPE2_VERSION -> supersede(record, requireCurrent(current, changes), changes, options);
        };
    }

    /**
     * Rejects records dated before the current version's effective-from date.
     * A record dated on that day is accepted.
     */
    public static void checkAsOfDate(AsOfRecord record, DimensionVersion current) {
        if (record.asOfDate().isBefore(current.getEffectiveFrom())) {
            throw new InvalidAsOfDateException(record.dimension(), record.naturalKey(),
                    record.asOfDate(), current.getEffectiveFrom());
        }
    }

    private VersionWriteResult insertNew(AsOfRecord record, ChangeSet changes, LoadOptions options) {
        DimensionVersion version = DimensionVersion.builder()
                .surrogateKey(keyAllocator.next(record.dimension()))
                .dimension(record.dimension())
                .naturalKey(record.naturalKey())
                .attributes(changes.attributes())
                .effectiveFrom(record.asOfDate())
                .build();
        try {
            store.insertFirst(version);
        } finally {
            cache.invalidate(record.dimension(), record.naturalKey());
        }
        metricsService.incrementVersionCreated(record.dimension());
        log.info("version.created dimension={} naturalKey={} sk={} effectiveFrom={}",
                record.dimension(), record.naturalKey(), version.getSurrogateKey(), version.getEffectiveFrom());

        if (options.isAuditEnabled()) {
            auditService.record(AuditAction.VERSION_CREATED, version, options.getSourceSystem(),
                    Map.of("changeType", ChangeType.NEW_ENTITY.name(),
                            "effectiveFrom", version.getEffectiveFrom().toString()));
        }
        return new VersionWriteResult(ChangeType.NEW_ENTITY, version, null, changes.changedAttributeNames());
    }

    private VersionWriteResult overwrite(DimensionVersion current, ChangeSet changes, LoadOptions options) {
        Map<String, Object> type1Values = new LinkedHashMap<>();
        for (AttributeChange change : changes.changesOf(TrackingPolicy.TYPE1)) {
            type1Values.put(change.attribute(), change.after());
        }
        DimensionVersion updated;
        try {
            updated = store.overwrite(current, type1Values);
        } finally {
            cache.invalidate(current.getDimension(), current.getNaturalKey());
        }
        metricsService.incrementType1Update(current.getDimension());
        log.info("version.overwritten dimension={} naturalKey={} sk={} attributes={}",
                current.getDimension(), current.getNaturalKey(), current.getSurrogateKey(), type1Values.keySet());

        if (options.isAuditEnabled()) {
            Map<String, Object> details = new LinkedHashMap<>();
            details.put("changeType", ChangeType.TYPE1_UPDATE.name());
            details.put("attributes", changes.changedAttributeNames());
            auditService.record(AuditAction.ATTRIBUTES_OVERWRITTEN, updated, options.getSourceSystem(), details);
        }
        return new VersionWriteResult(ChangeType.TYPE1_UPDATE, updated, null, changes.changedAttributeNames());
    }

    private VersionWriteResult supersede(AsOfRecord record, DimensionVersion current, ChangeSet changes,
                                         LoadOptions options) {
        LocalDate asOfDate = record.asOfDate();
        DimensionVersion successor = DimensionVersion.builder()
                .surrogateKey(keyAllocator.next(record.dimension()))
                .dimension(record.dimension())
                .naturalKey(record.naturalKey())
                .attributes(changes.attributes())
                .effectiveFrom(asOfDate)
                .build();
        DimensionVersion closed;
        try {
            closed = store.supersede(current, asOfDate, successor);
        } finally {
            cache.invalidate(record.dimension(), record.naturalKey());
        }
        metricsService.incrementVersionClosed(record.dimension());
        metricsService.incrementVersionCreated(record.dimension());
        log.info("version.superseded dimension={} naturalKey={} closedSk={} newSk={} asOf={}",
                record.dimension(), record.naturalKey(), closed.getSurrogateKey(),
                successor.getSurrogateKey(), asOfDate);

        if (options.isAuditEnabled()) {
            auditService.record(AuditAction.VERSION_CLOSED, closed, options.getSourceSystem(),
                    Map.of("effectiveTo", asOfDate.toString(),
                            "supersededBy", successor.getSurrogateKey()));
            Map<String, Object> details = new LinkedHashMap<>();
            details.put("changeType", ChangeType.TYPE2_VERSION.name());
            details.put("effectiveFrom", asOfDate.toString());
            details.put("attributes", changes.changedAttributeNames());
            auditService.record(AuditAction.VERSION_CREATED, successor, options.getSourceSystem(), details);
        }
        return new VersionWriteResult(ChangeType.TYPE2_VERSION, successor, closed, changes.changedAttributeNames());
    }

    private static DimensionVersion requireCurrent(Optional<DimensionVersion> current, ChangeSet changes) {
        return current.orElseThrow(() -> new IllegalArgumentException(
                changes.changeType() + " requires a current version"));
    }
}
