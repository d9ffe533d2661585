package com.banking.scd.core.model;

import java.time.LocalDate;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;

/**
 * One materialized version of one real-world entity over a date range.
 * Immutable; closing or overwriting a version produces a copy.
 *
 * <p>The range is half-open, {@code [effectiveFrom, effectiveTo)}. A version whose
 * {@code effectiveTo} is null is open-ended and therefore the current one; the
 * current flag is derived from that and cannot disagree with it.</p>
 */
public final class DimensionVersion {
    private final long surrogateKey;
    private final DimensionId dimension;
    private final String naturalKey;
    private final Map<String, Object> attributes;
    private final LocalDate effectiveFrom;
    private final LocalDate effectiveTo;

    private DimensionVersion(Builder builder) {
        this.surrogateKey = builder.surrogateKey;
        this.dimension = builder.dimension;
        this.naturalKey = builder.naturalKey;
        this.attributes = Collections.unmodifiableMap(new LinkedHashMap<>(builder.attributes));
        this.effectiveFrom = builder.effectiveFrom;
        this.effectiveTo = builder.effectiveTo;
    }

    public long getSurrogateKey() {
        return surrogateKey;
    }

    public DimensionId getDimension() {
        return dimension;
    }

    public String getNaturalKey() {
        return naturalKey;
    }

    /**
     * Tracked attribute values. May contain null values.
     */
    public Map<String, Object> getAttributes() {
        return attributes;
    }

    public Object getAttribute(String name) {
        return attributes.get(name);
    }

    public LocalDate getEffectiveFrom() {
        return effectiveFrom;
    }

    public LocalDate getEffectiveTo() {
        return effectiveTo;
    }

    public boolean isCurrent() {
        return effectiveTo == null;
    }

    /**
     * Whether this version was in effect on the given date.
     */
    public boolean covers(LocalDate date) {
        return !date.isBefore(effectiveFrom) && (effectiveTo == null || date.isBefore(effectiveTo));
    }

    /**
     * Returns a closed copy of this version ending on {@code effectiveTo}.
     */
    public DimensionVersion closedAt(LocalDate effectiveTo) {
        Objects.requireNonNull(effectiveTo, "effectiveTo is required");
        return builder(this).effectiveTo(effectiveTo).build();
    }

    /**
     * Returns a copy with the given attributes replacing the current values.
     */
    public DimensionVersion withAttributes(Map<String, Object> replacements) {
        Map<String, Object> merged = new LinkedHashMap<>(attributes);
        merged.putAll(replacements);
        return builder(this).attributes(merged).build();
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        DimensionVersion that = (DimensionVersion) o;
        return surrogateKey == that.surrogateKey
                && dimension == that.dimension
                && Objects.equals(naturalKey, that.naturalKey)
                && Objects.equals(attributes, that.attributes)
                && Objects.equals(effectiveFrom, that.effectiveFrom)
                && Objects.equals(effectiveTo, that.effectiveTo);
    }

    @Override
    public int hashCode() {
        return Objects.hash(surrogateKey, dimension, naturalKey, effectiveFrom, effectiveTo);
    }

    @Override
    public String toString() {
        return "DimensionVersion{" +
                "dimension=" + dimension +
                ", surrogateKey=" + surrogateKey +
                ", naturalKey='" + naturalKey + '\'' +
                ", effectiveFrom=" + effectiveFrom +
                ", effectiveTo=" + effectiveTo +
                ", attributes=" + attributes +
                '}';
    }

    public static Builder builder() {
        return new Builder();
    }

    public static Builder builder(DimensionVersion version) {
        return new Builder()
                .surrogateKey(version.surrogateKey)
                .dimension(version.dimension)
                .naturalKey(version.naturalKey)
                .attributes(version.attributes)
                .effectiveFrom(version.effectiveFrom)
                .effectiveTo(version.effectiveTo);
    }

    public static class Builder {
        private long surrogateKey;
        private DimensionId dimension;
        private String naturalKey;
        private Map<String, Object> attributes = Map.of();
        private LocalDate effectiveFrom;
        private LocalDate effectiveTo;

        public Builder surrogateKey(long surrogateKey) {
            this.surrogateKey = surrogateKey;
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

        public Builder attributes(Map<String, Object> attributes) {
            this.attributes = attributes != null ? attributes : Map.of();
            return this;
        }

        public Builder effectiveFrom(LocalDate effectiveFrom) {
            this.effectiveFrom = effectiveFrom;
            return this;
        }

        public Builder effectiveTo(LocalDate effectiveTo) {
            this.effectiveTo = effectiveTo;
            return this;
        }

        public DimensionVersion build() {
            Objects.requireNonNull(dimension, "dimension is required");
            Objects.requireNonNull(naturalKey, "naturalKey is required");
            Objects.requireNonNull(effectiveFrom, "effectiveFrom is required");
            if (surrogateKey <= 0) {
                throw new IllegalArgumentException("surrogateKey must be positive");
            }
            if (effectiveTo != null && effectiveTo.isBefore(effectiveFrom)) {
                throw new IllegalArgumentException(
                        "effectiveTo " + effectiveTo + " is before effectiveFrom " + effectiveFrom);
            }
            return new DimensionVersion(this);
        }
    }
}
