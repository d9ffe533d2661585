package com.banking.scd.key;

import com.banking.scd.core.model.DimensionId;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.atomic.AtomicLong;

/**
 * Process-local allocator backed by one {@link AtomicLong} per dimension.
 * The first key of every dimension is 1.
 */
public class InMemorySurrogateKeyAllocator implements SurrogateKeyAllocator {
    private static final Logger log = LoggerFactory.getLogger(InMemorySurrogateKeyAllocator.class);

    private final Map<DimensionId, AtomicLong> counters = new ConcurrentHashMap<>();

    @Override
    public long next(DimensionId dimension) {
        return counter(dimension).incrementAndGet();
    }

    @Override
    public void advancePast(DimensionId dimension, long highWater) {
        long previous = counter(dimension).getAndAccumulate(highWater, Math::max);
        if (highWater > previous) {
            log.info("key.advanced dimension={} from={} to={}", dimension, previous, highWater);
        }
    }

    /**
     * Last key allocated (or advanced past) for the dimension, 0 if none.
     */
    public long peek(DimensionId dimension) {
        return counter(dimension).get();
    }

    private AtomicLong counter(DimensionId dimension) {
        return counters.computeIfAbsent(dimension, d -> new AtomicLong());
    }
}
