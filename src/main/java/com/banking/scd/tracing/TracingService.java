package com.banking.scd.tracing;

import com.banking.scd.core.model.AsOfRecord;
import com.banking.scd.core.model.DimensionId;

/**
 * Opens spans for the engine's loads and queries. Every span carries the dimension
 * and natural key it concerns.
 */
public interface TracingService {

    Span startLoad(AsOfRecord record);

    /**
     * @param operation query name, e.g. {@code versionAsOf}
     */
    Span startQuery(String operation, DimensionId dimension, String naturalKey);
}
