package com.banking.scd.store;

import com.banking.scd.core.exception.ConcurrentVersionModificationException;
import com.banking.scd.core.model.DimensionId;
import com.banking.scd.core.model.DimensionVersion;

import java.time.LocalDate;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.atomic.AtomicReference;
import java.util.function.UnaryOperator;

/**
 * In-memory implementation of DimensionStore.
 * Each chain is an immutable list replaced inside {@link ConcurrentHashMap#compute},
 * so writes to one natural key are atomic and readers always see a complete chain.
 */
public class InMemoryDimensionStore implements DimensionStore {

    private final ConcurrentHashMap<ChainKey, List<DimensionVersion>> chains = new ConcurrentHashMap<>();

    @Override
    public List<DimensionVersion> findCurrent(DimensionId dimension, String naturalKey) {
        return chain(dimension, naturalKey).stream()
                .filter(DimensionVersion::isCurrent)
                .toList();
    }

    @Override
    public VersionPage findVersionsPage(DimensionId dimension, String naturalKey, VersionCursor after, int limit) {
        if (limit <= 0) {
            throw new IllegalArgumentException("limit must be > 0");
        }
        List<DimensionVersion> fetched = chain(dimension, naturalKey).stream()
                .filter(v -> after == null || after.precedes(v))
                .limit(limit + 1L)
                .toList();
        return VersionPage.fromLookahead(fetched, limit);
    }

    @Override
    public void insertFirst(DimensionVersion version) {
        chains.compute(ChainKey.of(version), (key, chain) -> {
            List<DimensionVersion> existing = chain != null ? chain : List.of();
            if (existing.stream().anyMatch(DimensionVersion::isCurrent)) {
                throw new ConcurrentVersionModificationException(key.dimension(), key.naturalKey(),
                        "Natural key " + key + " already has a current version");
            }
            return append(existing, version);
        });
    }

    @Override
    public DimensionVersion supersede(DimensionVersion current, LocalDate closeDate, DimensionVersion successor) {
        AtomicReference<DimensionVersion> closed = new AtomicReference<>();
        chains.compute(ChainKey.of(current), (key, chain) -> {
            List<DimensionVersion> updated = replaceCurrent(key, chain, current.getSurrogateKey(),
                    stored -> stored.closedAt(closeDate), closed);
            return append(updated, successor);
        });
        return closed.get();
    }

    @Override
    public DimensionVersion overwrite(DimensionVersion current, Map<String, Object> attributes) {
        AtomicReference<DimensionVersion> updated = new AtomicReference<>();
        chains.compute(ChainKey.of(current), (key, chain) -> replaceCurrent(key, chain, current.getSurrogateKey(),
                stored -> stored.withAttributes(attributes), updated));
        return updated.get();
    }

    @Override
    public long maxSurrogateKey(DimensionId dimension) {
        return chains.entrySet().stream()
                .filter(e -> e.getKey().dimension() == dimension)
                .flatMap(e -> e.getValue().stream())
                .mapToLong(DimensionVersion::getSurrogateKey)
                .max()
                .orElse(0L);
    }

    /**
     * Loads an existing version without any checks, the way a bulk seed load
     * writes history the engine did not produce.
     */
    public void seed(DimensionVersion version) {
        chains.compute(ChainKey.of(version), (key, chain) -> append(chain != null ? chain : List.of(), version));
    }

    /**
     * Removes all chains.
     */
    public void clear() {
        chains.clear();
    }

    private List<DimensionVersion> chain(DimensionId dimension, String naturalKey) {
        return chains.getOrDefault(new ChainKey(dimension, naturalKey), List.of());
    }

    private static List<DimensionVersion> replaceCurrent(ChainKey key, List<DimensionVersion> chain,
                                                         long expectedSurrogateKey,
                                                         UnaryOperator<DimensionVersion> change,
                                                         AtomicReference<DimensionVersion> result) {
        List<DimensionVersion> updated = new ArrayList<>(chain != null ? chain : List.of());
        for (int i = 0; i < updated.size(); i++) {
            DimensionVersion stored = updated.get(i);
            if (stored.getSurrogateKey() == expectedSurrogateKey) {
                if (!stored.isCurrent()) {
                    break;
                }
                DimensionVersion replacement = change.apply(stored);
                updated.set(i, replacement);
                result.set(replacement);
                return List.copyOf(updated);
            }
        }
        throw new ConcurrentVersionModificationException(key.dimension(), key.naturalKey(),
                "Version " + expectedSurrogateKey + " of " + key + " is no longer current");
    }

    private static List<DimensionVersion> append(List<DimensionVersion> chain, DimensionVersion version) {
        List<DimensionVersion> updated = new ArrayList<>(chain);
        updated.add(version);
        updated.sort(VersionCursor.CHAIN_ORDER);
        return List.copyOf(updated);
    }

    private record ChainKey(DimensionId dimension, String naturalKey) {
        static ChainKey of(DimensionVersion version) {
            return new ChainKey(version.getDimension(), version.getNaturalKey());
        }

        @Override
        public String toString() {
            return dimension + "/" + naturalKey;
        }
    }
}
