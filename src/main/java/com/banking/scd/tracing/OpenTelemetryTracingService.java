package com.banking.scd.tracing;

import com.banking.scd.core.model.AsOfRecord;
import com.banking.scd.core.model.ChangeType;
import com.banking.scd.core.model.DimensionId;
import io.opentelemetry.api.common.AttributeKey;
import io.opentelemetry.api.common.Attributes;
import io.opentelemetry.api.trace.SpanBuilder;
import io.opentelemetry.api.trace.SpanKind;
import io.opentelemetry.api.trace.StatusCode;
import io.opentelemetry.api.trace.Tracer;

/**
 * OpenTelemetry spans for loads ({@code scd.load}) and queries ({@code scd.query.<operation>}).
 * Span names stay low-cardinality; the dimension table and natural key go into attributes.
 */
public class OpenTelemetryTracingService implements TracingService {

    static final AttributeKey<String> DIMENSION = AttributeKey.stringKey("scd.dimension");
    static final AttributeKey<String> NATURAL_KEY = AttributeKey.stringKey("scd.natural_key");
    static final AttributeKey<String> AS_OF_DATE = AttributeKey.stringKey("scd.as_of_date");
    static final AttributeKey<String> CHANGE_TYPE = AttributeKey.stringKey("scd.change_type");
    static final AttributeKey<Long> SURROGATE_KEY = AttributeKey.longKey("scd.surrogate_key");
    static final AttributeKey<Long> ATTEMPTS = AttributeKey.longKey("scd.attempts");
    static final AttributeKey<Long> VERSIONS_READ = AttributeKey.longKey("scd.versions_read");
    static final AttributeKey<String> ERROR_TYPE = AttributeKey.stringKey("scd.error_type");
    static final AttributeKey<Long> ATTEMPT = AttributeKey.longKey("scd.attempt");
    static final AttributeKey<String> REASON = AttributeKey.stringKey("scd.reason");

    private final Tracer tracer;

    public OpenTelemetryTracingService(Tracer tracer) {
        this.tracer = tracer;
    }

    @Override
    public Span startLoad(AsOfRecord record) {
        SpanBuilder builder = spanFor("scd.load", record.dimension(), record.naturalKey());
        builder.setAttribute(AS_OF_DATE, record.asOfDate().toString());
        return new OTelSpanAdapter(builder.startSpan());
    }

    @Override
    public Span startQuery(String operation, DimensionId dimension, String naturalKey) {
        return new OTelSpanAdapter(spanFor("scd.query." + operation, dimension, naturalKey).startSpan());
    }

    private SpanBuilder spanFor(String name, DimensionId dimension, String naturalKey) {
        SpanBuilder builder = tracer.spanBuilder(name);
        builder.setSpanKind(SpanKind.INTERNAL);
        builder.setAttribute(DIMENSION, dimension.getTableName());
        builder.setAttribute(NATURAL_KEY, naturalKey);
        return builder;
    }

    private static class OTelSpanAdapter implements Span {

        private final io.opentelemetry.api.trace.Span otelSpan;

        OTelSpanAdapter(io.opentelemetry.api.trace.Span otelSpan) {
            this.otelSpan = otelSpan;
        }

        @Override
        public void recordOutcome(ChangeType changeType, long surrogateKey, int attempts) {
            otelSpan.setAttribute(CHANGE_TYPE, changeType.name());
            otelSpan.setAttribute(SURROGATE_KEY, surrogateKey);
            otelSpan.setAttribute(ATTEMPTS, (long) attempts);
            otelSpan.setStatus(StatusCode.OK);
        }

        @Override
        public void recordRetry(int attempt, String reason) {
            otelSpan.addEvent("scd.retry", Attributes.of(ATTEMPT, (long) attempt, REASON, reason));
        }

        @Override
        public void recordVersionsRead(int versionsRead) {
            otelSpan.setAttribute(VERSIONS_READ, (long) versionsRead);
            otelSpan.setStatus(StatusCode.OK);
        }

        @Override
        public void recordFailure(Throwable failure) {
            otelSpan.recordException(failure);
            otelSpan.setAttribute(ERROR_TYPE, failure.getClass().getSimpleName());
            otelSpan.setStatus(StatusCode.ERROR, failure.getClass().getSimpleName());
        }

        @Override
        public void close() {
            otelSpan.end();
        }
    }
}
