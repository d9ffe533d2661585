package com.banking.scd.core.model;

import java.time.LocalDate;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;

/**
 * The "current truth" about one entity as extracted from the source system on a given date.
 *
 * @param dimension  the dimension the entity belongs to
 * @param naturalKey the entity's stable source-system identifier
 * @param asOfDate   the date from which the attribute values hold
 * @param attributes tracked attribute values; missing attributes are treated as null
 */
public record AsOfRecord(DimensionId dimension, String naturalKey, LocalDate asOfDate,
                         Map<String, Object> attributes) {

    public AsOfRecord {
        Objects.requireNonNull(dimension, "dimension is required");
        Objects.requireNonNull(naturalKey, "naturalKey is required");
        Objects.requireNonNull(asOfDate, "asOfDate is required");
        // values may be null, so Map.copyOf is not usable here
        attributes = attributes != null
                ? Collections.unmodifiableMap(new LinkedHashMap<>(attributes))
                : Map.of();
    }

    public static AsOfRecord of(DimensionId dimension, String naturalKey, LocalDate asOfDate,
                                Map<String, Object> attributes) {
        return new AsOfRecord(dimension, naturalKey, asOfDate, attributes);
    }
}
