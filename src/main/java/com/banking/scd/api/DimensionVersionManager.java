package com.banking.scd.api;

import com.banking.scd.audit.AuditAction;
import com.banking.scd.audit.AuditService;
import com.banking.scd.cache.CurrentVersionCache;
import com.banking.scd.core.exception.AmbiguousCurrentVersionException;
import com.banking.scd.core.exception.ConcurrentVersionModificationException;
import com.banking.scd.core.exception.InvalidAsOfDateException;
import com.banking.scd.core.model.AsOfRecord;
import com.banking.scd.core.model.DimensionDefinition;
import com.banking.scd.core.model.DimensionId;
import com.banking.scd.core.model.DimensionVersion;
import com.banking.scd.detect.ChangeDetector;
import com.banking.scd.detect.ChangeSet;
import com.banking.scd.lock.NaturalKeyLock;
import com.banking.scd.logging.LogContext;
import com.banking.scd.metrics.MetricsService;
import com.banking.scd.resolve.NaturalKeyResolver;
import com.banking.scd.store.DimensionStore;
import com.banking.scd.store.InputSanitizer;
import com.banking.scd.tracing.Span;
import com.banking.scd.tracing.TracingService;
import com.banking.scd.version.VersionWriteResult;
import com.banking.scd.version.VersionWriter;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.time.LocalDate;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Applies as-of records to dimension version chains and answers point-in-time queries.
 *
 * <p>Each record goes through resolve, detect and write. Loads of the same natural key
 * are serialized by the optional {@link NaturalKeyLock} and, regardless of the lock, by
 * the store's conditional writes: a write that loses a race raises
 * {@link ConcurrentVersionModificationException} and the whole sequence is re-run
 * against the new current version, up to {@link LoadOptions#getMaxAttempts()} times.</p>
 */
public class DimensionVersionManager {
    private static final Logger log = LoggerFactory.getLogger(DimensionVersionManager.class);

    private final Map<DimensionId, DimensionDefinition> definitions;
    private final DimensionStore store;
    private final NaturalKeyResolver resolver;
    private final ChangeDetector detector;
    private final VersionWriter writer;
    private final NaturalKeyLock lock;
    private final CurrentVersionCache cache;
    private final AuditService auditService;
    private final MetricsService metricsService;
    private final TracingService tracingService;
    private final LoadOptions defaultOptions;

    public DimensionVersionManager(
            Map<DimensionId, DimensionDefinition> definitions,
            DimensionStore store,
            NaturalKeyResolver resolver,
            ChangeDetector detector,
            VersionWriter writer,
            NaturalKeyLock lock,
            CurrentVersionCache cache,
            AuditService auditService,
            MetricsService metricsService,
            TracingService tracingService,
            LoadOptions defaultOptions) {
        this.definitions = Map.copyOf(definitions);
        this.store = store;
        this.resolver = resolver;
        this.detector = detector;
        this.writer = writer;
        this.lock = lock;
        this.cache = cache;
        this.auditService = auditService;
        this.metricsService = metricsService;
        this.tracingService = tracingService;
        this.defaultOptions = defaultOptions;
    }

    // ========== Load API ==========

    public LoadResult apply(AsOfRecord record) {
        return apply(record, defaultOptions);
    }

    /**
     * Applies one as-of record.
     *
     * @throws InvalidAsOfDateException if the record is dated before the current version
     * @throws AmbiguousCurrentVersionException if the natural key has more than one current version
     * @throws ConcurrentVersionModificationException if every attempt lost a race with another writer
     * @throws IllegalArgumentException if the natural key or an attribute is invalid
     */
    public LoadResult apply(AsOfRecord record, LoadOptions options) {
        InputSanitizer.validateNaturalKey(record.naturalKey());
        DimensionDefinition definition = definitionOf(record.dimension());
        DimensionId dimension = record.dimension();
        String naturalKey = record.naturalKey();
        long start = System.nanoTime();

        try (LogContext ctx = LogContext.forLoad(LogContext.generateCorrelationId(), dimension, naturalKey);
             Span span = tracingService.startLoad(record)) {
            try {
                LoadResult result = applyWithRetry(record, definition, options, span);
                metricsService.recordLoadDuration(dimension, result.changeType(),
                        Duration.ofNanos(System.nanoTime() - start));
                span.recordOutcome(result.changeType(), result.current().getSurrogateKey(), result.attempts());
                log.info("load.applied asOf={} changeType={} sk={} attempts={}",
                        record.asOfDate(), result.changeType(),
                        result.current().getSurrogateKey(), result.attempts());
                return result;
            } catch (RuntimeException e) {
                span.recordFailure(e);
                throw e;
            }
        }
    }

    /**
     * Applies records one after the other. A record that fails is reported and
     * the batch carries on with the next one.
     */
    public BatchLoadResult applyAll(List<AsOfRecord> records) {
        return applyAll(records, defaultOptions);
    }

    public BatchLoadResult applyAll(List<AsOfRecord> records, LoadOptions options) {
        String batchId = LogContext.generateCorrelationId();
        List<LoadResult> results = new ArrayList<>();
        List<BatchLoadResult.RecordFailure> failures = new ArrayList<>();

        try (LogContext ctx = LogContext.forBatch(batchId)) {
            log.info("batch.started size={}", records.size());
            for (int i = 0; i < records.size(); i++) {
                AsOfRecord record = records.get(i);
                try {
                    results.add(apply(record, options));
                } catch (RuntimeException e) {
                    log.warn("batch.recordFailed index={} naturalKey={} error={}",
                            i, record.naturalKey(), e.getMessage());
                    failures.add(new BatchLoadResult.RecordFailure(
                            i, record.naturalKey(), e.getClass().getSimpleName(), e.getMessage()));
                }
            }
            metricsService.recordBatchSize(records.size());
            BatchLoadResult result = new BatchLoadResult(results, failures);
            log.info("batch.completed {}", result);
            return result;
        }
    }

    // ========== Query API ==========

    /**
     * Gets the current version of a natural key.
     *
     * @return the current version, or empty if the natural key is unknown
     * @throws AmbiguousCurrentVersionException if more than one version is current
     */
    public Optional<DimensionVersion> currentVersion(DimensionId dimension, String naturalKey) {
        definitionOf(dimension);
        try (Span span = tracingService.startQuery("currentVersion", dimension, naturalKey)) {
            try {
                Optional<DimensionVersion> current = resolver.resolveCurrent(dimension, naturalKey);
                span.recordVersionsRead(current.isPresent() ? 1 : 0);
                return current;
            } catch (RuntimeException e) {
                span.recordFailure(e);
                throw e;
            }
        }
    }

    /**
     * Gets the version that was in effect on a date, {@code effectiveFrom <= date < effectiveTo}.
     *
     * @return the version, or empty if the natural key is unknown or the date precedes its first version
     */
    public Optional<DimensionVersion> versionAsOf(DimensionId dimension, String naturalKey, LocalDate date) {
        if (date == null) {
            throw new IllegalArgumentException("date is required");
        }
        VersionHistory history = allVersions(dimension, naturalKey);
        try (Span span = tracingService.startQuery("versionAsOf", dimension, naturalKey)) {
            int read = 0;
            Optional<DimensionVersion> found = Optional.empty();
            for (DimensionVersion version : history) {
                read++;
                if (version.getEffectiveFrom().isAfter(date)) {
                    break;
                }
                if (version.covers(date)) {
                    found = Optional.of(version);
                    break;
                }
            }
            span.recordVersionsRead(read);
            return found;
        }
    }

    /**
     * Gets every version of a natural key ordered by effective-from date.
     * Nothing is read until the history is iterated.
     */
    public VersionHistory allVersions(DimensionId dimension, String naturalKey) {
        InputSanitizer.validateNaturalKey(naturalKey);
        definitionOf(dimension);
        return new VersionHistory(store, dimension, naturalKey);
    }

    /**
     * Checks the version chain of a natural key: ranges contiguous and non-overlapping,
     * only the last version open, exactly one current version.
     */
    public ChainReport verifyChain(DimensionId dimension, String naturalKey) {
        List<DimensionVersion> chain;
        try (Span span = tracingService.startQuery("verifyChain", dimension, naturalKey)) {
            chain = allVersions(dimension, naturalKey).toList();
            span.recordVersionsRead(chain.size());
        }
        List<String> violations = new ArrayList<>();

        int currentCount = 0;
        for (int i = 0; i < chain.size(); i++) {
            DimensionVersion version = chain.get(i);
            if (version.isCurrent()) {
                currentCount++;
                if (i < chain.size() - 1) {
                    violations.add("Version " + version.getSurrogateKey()
                            + " is open-ended but is followed by version " + chain.get(i + 1).getSurrogateKey());
                }
            }
            if (i > 0) {
                DimensionVersion previous = chain.get(i - 1);
                LocalDate previousTo = previous.getEffectiveTo();
                if (previousTo != null && previousTo.isBefore(version.getEffectiveFrom())) {
                    violations.add("Gap between version " + previous.getSurrogateKey() + " ending " + previousTo
                            + " and version " + version.getSurrogateKey()
                            + " starting " + version.getEffectiveFrom());
                } else if (previousTo != null && previousTo.isAfter(version.getEffectiveFrom())) {
                    violations.add("Version " + previous.getSurrogateKey() + " ending " + previousTo
                            + " overlaps version " + version.getSurrogateKey()
                            + " starting " + version.getEffectiveFrom());
                }
            }
        }
        if (!chain.isEmpty() && currentCount != 1) {
            violations.add("Expected exactly one current version, found " + currentCount);
        }

        ChainReport report = new ChainReport(dimension, naturalKey, chain.size(), currentCount, violations);
        if (!report.isValid()) {
            log.warn("chain.invalid dimension={} naturalKey={} violations={}", dimension, naturalKey, violations);
        }
        return report;
    }

    public Map<DimensionId, DimensionDefinition> getDefinitions() {
        return definitions;
    }

    public LoadOptions getDefaultOptions() {
        return defaultOptions;
    }

    // ========== Internal ==========

    private LoadResult applyWithRetry(AsOfRecord record, DimensionDefinition definition, LoadOptions options,
                                      Span span) {
        DimensionId dimension = record.dimension();
        String naturalKey = record.naturalKey();
        int attempt = 0;

        while (true) {
            attempt++;
            lock.lock(dimension, naturalKey);
            try {
                VersionWriteResult written = attemptOnce(record, definition, options);
                return new LoadResult(dimension, naturalKey, record.asOfDate(), written.changeType(),
                        written.current(), written.closed(), written.changedAttributes(), attempt);
            } catch (ConcurrentVersionModificationException e) {
                cache.invalidate(dimension, naturalKey);
                if (attempt >= options.getMaxAttempts()) {
                    log.warn("load.conflict.exhausted attempts={} asOf={}", attempt, record.asOfDate());
                    metricsService.incrementLoadRejected(dimension, "concurrent_modification");
                    throw e;
                }
                log.info("load.conflict.retrying attempt={} reason={}", attempt, e.getMessage());
                span.recordRetry(attempt, String.valueOf(e.getMessage()));
                metricsService.incrementRetry(dimension);
            } catch (InvalidAsOfDateException e) {
                log.warn("load.rejected asOf={} currentEffectiveFrom={}",
                        e.getAsOfDate(), e.getCurrentEffectiveFrom());
                metricsService.incrementLoadRejected(dimension, "invalid_as_of_date");
                if (options.isAuditEnabled()) {
                    Map<String, Object> details = new LinkedHashMap<>();
                    details.put("reason", "invalid_as_of_date");
                    details.put("asOfDate", e.getAsOfDate().toString());
                    details.put("currentEffectiveFrom", e.getCurrentEffectiveFrom().toString());
                    auditService.record(AuditAction.LOAD_REJECTED, dimension, naturalKey,
                            options.getSourceSystem(), details);
                }
                throw e;
            } catch (AmbiguousCurrentVersionException e) {
                metricsService.incrementLoadRejected(dimension, "ambiguous_current_version");
                if (options.isAuditEnabled()) {
                    auditService.record(AuditAction.INTEGRITY_VIOLATION, dimension, naturalKey,
                            options.getSourceSystem(), Map.of("surrogateKeys", e.getSurrogateKeys()));
                }
                throw e;
            } catch (IllegalArgumentException e) {
                metricsService.incrementLoadRejected(dimension, "invalid_attributes");
                throw e;
            } finally {
                lock.unlock(dimension, naturalKey);
            }
            backOff(record, attempt, options);
        }
    }

    private VersionWriteResult attemptOnce(AsOfRecord record, DimensionDefinition definition, LoadOptions options) {
        Optional<DimensionVersion> current = resolver.resolveFromStore(record.dimension(), record.naturalKey());
        ChangeSet changes = detector.detect(definition, current, record.attributes());
        return writer.write(record, current, changes, options);
    }

    private static void backOff(AsOfRecord record, int attempt, LoadOptions options) {
        long delay = attempt * options.getRetryDelayMs();
        if (delay <= 0) {
            return;
        }
        try {
            Thread.sleep(delay);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new ConcurrentVersionModificationException(record.dimension(), record.naturalKey(),
                    "Interrupted while waiting to retry " + record.dimension() + "/" + record.naturalKey(), e);
        }
    }

    private DimensionDefinition definitionOf(DimensionId dimension) {
        DimensionDefinition definition = definitions.get(dimension);
        if (definition == null) {
            throw new IllegalArgumentException("No definition registered for dimension " + dimension);
        }
        return definition;
    }
}
