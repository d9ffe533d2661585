package com.banking.scd.api;

import com.banking.scd.audit.AuditRepository;
import com.banking.scd.audit.AuditService;
import com.banking.scd.cache.CacheConfig;
import com.banking.scd.cache.CacheStats;
import com.banking.scd.cache.CaffeineCurrentVersionCache;
import com.banking.scd.cache.CurrentVersionCache;
import com.banking.scd.cache.NoOpCurrentVersionCache;
import com.banking.scd.core.model.AsOfRecord;
import com.banking.scd.core.model.BankingDimensions;
import com.banking.scd.core.model.DimensionDefinition;
import com.banking.scd.core.model.DimensionId;
import com.banking.scd.core.model.DimensionVersion;
import com.banking.scd.detect.ChangeDetector;
import com.banking.scd.key.InMemorySurrogateKeyAllocator;
import com.banking.scd.key.SequenceSurrogateKeyAllocator;
import com.banking.scd.key.SurrogateKeyAllocator;
import com.banking.scd.lock.NaturalKeyLock;
import com.banking.scd.lock.NoOpNaturalKeyLock;
import com.banking.scd.metrics.MetricsService;
import com.banking.scd.metrics.NoOpMetricsService;
import com.banking.scd.resolve.NaturalKeyResolver;
import com.banking.scd.rules.DefaultNormalizationRules;
import com.banking.scd.rules.NormalizationEngine;
import com.banking.scd.store.DimensionStore;
import com.banking.scd.store.InMemoryDimensionStore;
import com.banking.scd.store.JdbcDimensionStore;
import com.banking.scd.tracing.NoOpTracingService;
import com.banking.scd.tracing.TracingService;
import com.banking.scd.version.VersionWriter;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import javax.sql.DataSource;
import java.time.LocalDate;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Main entry point of the library: wires the resolver, detector, writer and key
 * allocator around a dimension store and exposes the load and query API.
 *
 * <h2>Example usage:</h2>
 * <pre>
 * ScdEngine engine = ScdEngine.builder()
 *     .dataSource(dataSource)
 *     .build();
 *
 * engine.apply(AsOfRecord.of(DimensionId.CUSTOMER, "C001", LocalDate.of(2024, 1, 1),
 *         Map.of("risk_rating", "LOW")));
 * engine.apply(AsOfRecord.of(DimensionId.CUSTOMER, "C001", LocalDate.of(2024, 6, 1),
 *         Map.of("risk_rating", "HIGH")));
 *
 * Optional&lt;DimensionVersion&gt; march = engine.versionAsOf(DimensionId.CUSTOMER, "C001",
 *         LocalDate.of(2024, 3, 1));
 * </pre>
 */
public class ScdEngine {
    private static final Logger log = LoggerFactory.getLogger(ScdEngine.class);

    private final DimensionVersionManager manager;
    private final DimensionStore store;
    private final SurrogateKeyAllocator keyAllocator;
    private final AuditService auditService;
    private final CurrentVersionCache cache;

    private ScdEngine(Builder builder) {
        Map<DimensionId, DimensionDefinition> definitions = builder.definitions;

        if (builder.store != null) {
            this.store = builder.store;
        } else if (builder.dataSource != null) {
            this.store = new JdbcDimensionStore(builder.dataSource, definitions, builder.schema);
        } else {
            this.store = new InMemoryDimensionStore();
        }

        if (builder.keyAllocator != null) {
            this.keyAllocator = builder.keyAllocator;
        } else if (builder.dataSource != null) {
            this.keyAllocator = new SequenceSurrogateKeyAllocator(builder.dataSource, builder.schema);
        } else {
            this.keyAllocator = new InMemorySurrogateKeyAllocator();
        }

        if (builder.advanceKeysPastStore) {
            for (DimensionId dimension : definitions.keySet()) {
                long highWater = store.maxSurrogateKey(dimension);
                if (highWater > 0) {
                    keyAllocator.advancePast(dimension, highWater);
                }
            }
        }

        if (builder.auditService != null) {
            this.auditService = builder.auditService;
        } else if (builder.auditRepository != null) {
            this.auditService = new AuditService(builder.auditRepository);
        } else {
            this.auditService = new AuditService();
        }

        if (builder.cache != null) {
            this.cache = builder.cache;
        } else if (builder.cacheConfig != null) {
            this.cache = new CaffeineCurrentVersionCache(builder.cacheConfig);
        } else {
            this.cache = new NoOpCurrentVersionCache();
        }

        MetricsService metricsService = builder.metricsService != null
                ? builder.metricsService : new NoOpMetricsService();
        TracingService tracingService = builder.tracingService != null
                ? builder.tracingService : new NoOpTracingService();
        NaturalKeyLock lock = builder.lock != null ? builder.lock : new NoOpNaturalKeyLock();
        NormalizationEngine normalizationEngine = builder.normalizationEngine != null
                ? builder.normalizationEngine : DefaultNormalizationRules.createDefaultEngine();

        NaturalKeyResolver resolver = new NaturalKeyResolver(store, cache, metricsService);
        ChangeDetector detector = new ChangeDetector(normalizationEngine);
        VersionWriter writer = new VersionWriter(store, keyAllocator, auditService, cache, metricsService);

        this.manager = new DimensionVersionManager(definitions, store, resolver, detector, writer,
                lock, cache, auditService, metricsService, tracingService, builder.options);

        log.info("engine.initialized store={} dimensions={} options={}",
                store.getClass().getSimpleName(), definitions.keySet(), builder.options);
    }

    // ========== Load API ==========

    public LoadResult apply(AsOfRecord record) {
        return manager.apply(record);
    }

    public LoadResult apply(AsOfRecord record, LoadOptions options) {
        return manager.apply(record, options);
    }

    public BatchLoadResult applyAll(List<AsOfRecord> records) {
        return manager.applyAll(records);
    }

    public BatchLoadResult applyAll(List<AsOfRecord> records, LoadOptions options) {
        return manager.applyAll(records, options);
    }

    // ========== Query API ==========

    public Optional<DimensionVersion> currentVersion(DimensionId dimension, String naturalKey) {
        return manager.currentVersion(dimension, naturalKey);
    }

    public Optional<DimensionVersion> versionAsOf(DimensionId dimension, String naturalKey, LocalDate date) {
        return manager.versionAsOf(dimension, naturalKey, date);
    }

    public VersionHistory allVersions(DimensionId dimension, String naturalKey) {
        return manager.allVersions(dimension, naturalKey);
    }

    public ChainReport verifyChain(DimensionId dimension, String naturalKey) {
        return manager.verifyChain(dimension, naturalKey);
    }

    // ========== Accessors ==========

    public DimensionVersionManager getManager() {
        return manager;
    }

    public DimensionStore getStore() {
        return store;
    }

    public SurrogateKeyAllocator getKeyAllocator() {
        return keyAllocator;
    }

    public AuditService getAuditService() {
        return auditService;
    }

    public CacheStats getCacheStats() {
        return cache.getStats();
    }

    public static Builder builder() {
        return new Builder();
    }

    public static class Builder {
        private Map<DimensionId, DimensionDefinition> definitions = BankingDimensions.all();
        private DimensionStore store;
        private DataSource dataSource;
        private String schema = JdbcDimensionStore.DEFAULT_SCHEMA;
        private SurrogateKeyAllocator keyAllocator;
        private boolean advanceKeysPastStore = true;
        private NormalizationEngine normalizationEngine;
        private AuditService auditService;
        private AuditRepository auditRepository;
        private CurrentVersionCache cache;
        private CacheConfig cacheConfig;
        private NaturalKeyLock lock;
        private MetricsService metricsService;
        private TracingService tracingService;
        private LoadOptions options = LoadOptions.defaults();

        /**
         * Replaces the default banking dimension definitions.
         */
        public Builder definitions(Map<DimensionId, DimensionDefinition> definitions) {
            this.definitions = new EnumMap<>(definitions);
            return this;
        }

        /**
         * Registers or replaces the definition of one dimension.
         */
        public Builder definition(DimensionDefinition definition) {
            Map<DimensionId, DimensionDefinition> updated = new EnumMap<>(DimensionId.class);
            updated.putAll(definitions);
            updated.put(definition.getDimension(), definition);
            this.definitions = updated;
            return this;
        }

        /**
         * Sets the dimension store. Takes precedence over {@link #dataSource(DataSource)}.
         */
        public Builder store(DimensionStore store) {
            this.store = store;
            return this;
        }

        /**
         * Stores versions in PostgreSQL and allocates keys from the tables' serial sequences.
         */
        public Builder dataSource(DataSource dataSource) {
            this.dataSource = dataSource;
            return this;
        }

        public Builder dataSource(DataSource dataSource, String schema) {
            this.dataSource = dataSource;
            this.schema = schema;
            return this;
        }

        public Builder keyAllocator(SurrogateKeyAllocator keyAllocator) {
            this.keyAllocator = keyAllocator;
            return this;
        }

        /**
         * Controls whether the key allocator is moved past the store's highest keys on startup.
         * Defaults to true.
         */
        public Builder advanceKeysPastStore(boolean advanceKeysPastStore) {
            this.advanceKeysPastStore = advanceKeysPastStore;
            return this;
        }

        public Builder normalizationEngine(NormalizationEngine normalizationEngine) {
            this.normalizationEngine = normalizationEngine;
            return this;
        }

        public Builder auditService(AuditService auditService) {
            this.auditService = auditService;
            return this;
        }

        /**
         * Sets a custom audit repository.
         * Ignored when an audit service is set.
         */
        public Builder auditRepository(AuditRepository auditRepository) {
            this.auditRepository = auditRepository;
            return this;
        }

        public Builder cache(CurrentVersionCache cache) {
            this.cache = cache;
            return this;
        }

        /**
         * Enables a Caffeine current-version cache. Only coherent when this engine
         * is the single writer of its store.
         */
        public Builder cacheConfig(CacheConfig cacheConfig) {
            this.cacheConfig = cacheConfig;
            return this;
        }

        /**
         * Sets a natural key lock taken around each load attempt.
         * Defaults to {@link NoOpNaturalKeyLock}.
         */
        public Builder lock(NaturalKeyLock lock) {
            this.lock = lock;
            return this;
        }

        /**
         * Defaults to {@link NoOpMetricsService} if not set.
         */
        public Builder metricsService(MetricsService metricsService) {
            this.metricsService = metricsService;
            return this;
        }

        /**
         * Defaults to {@link NoOpTracingService} if not set.
         */
        public Builder tracingService(TracingService tracingService) {
            this.tracingService = tracingService;
            return this;
        }

        public Builder options(LoadOptions options) {
            this.options = options;
            return this;
        }

        public ScdEngine build() {
            if (definitions == null || definitions.isEmpty()) {
                throw new IllegalStateException("At least one dimension definition is required");
            }
            if (options == null) {
                throw new IllegalStateException("LoadOptions are required");
            }
            return new ScdEngine(this);
        }
    }
}
