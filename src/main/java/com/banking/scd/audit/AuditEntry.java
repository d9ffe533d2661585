package com.banking.scd.audit;

import com.banking.scd.core.model.DimensionId;

import java.time.Instant;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;
import java.util.UUID;

/**
 * Immutable record of an auditable operation.
 *
 * @param surrogateKey the version affected, or null when the action concerns the natural key only
 * @param sourceSystem the feed that supplied the record ({@code dw_source_system})
 */
public record AuditEntry(
        String id,
        AuditAction action,
        DimensionId dimension,
        String naturalKey,
        Long surrogateKey,
        String sourceSystem,
        Map<String, Object> details,
        Instant timestamp
) {
    public AuditEntry {
        Objects.requireNonNull(id, "id is required");
        Objects.requireNonNull(action, "action is required");
        Objects.requireNonNull(dimension, "dimension is required");
        Objects.requireNonNull(timestamp, "timestamp is required");
        details = details != null ? Collections.unmodifiableMap(new LinkedHashMap<>(details)) : Map.of();
    }

    public static Builder builder() {
        return new Builder();
    }

    public static class Builder {
        private String id = UUID.randomUUID().toString();
        private AuditAction action;
        private DimensionId dimension;
        private String naturalKey;
        private Long surrogateKey;
        private String sourceSystem;
        private Map<String, Object> details;
        private Instant timestamp = Instant.now();

        public Builder id(String id) {
            this.id = id;
            return this;
        }

        public Builder action(AuditAction action) {
            this.action = action;
            return this;
        }

        public Builder dimension(DimensionId dimension) {
            this.dimension = dimension;
            return this;
        }

        public Builder naturalKey(String naturalKey) {
            this.naturalKey = naturalKey;
            return this;
        }

        public Builder surrogateKey(Long surrogateKey) {
            this.surrogateKey = surrogateKey;
            return this;
        }

        public Builder sourceSystem(String sourceSystem) {
            this.sourceSystem = sourceSystem;
            return this;
        }

        public Builder details(Map<String, Object> details) {
            this.details = details;
            return this;
        }

        public Builder timestamp(Instant timestamp) {
            this.timestamp = timestamp;
            return this;
        }

        public AuditEntry build() {
            return new AuditEntry(id, action, dimension, naturalKey, surrogateKey, sourceSystem, details, timestamp);
        }
    }
}
