package com.banking.scd.store;

import com.banking.scd.core.exception.ConcurrentVersionModificationException;
import com.banking.scd.core.model.DimensionId;
import com.banking.scd.core.model.DimensionVersion;

import java.time.LocalDate;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;

/**
 * Persistence of dimension version chains.
 * Implementations provide different storage backends (in-memory, PostgreSQL).
 *
 * <p>Every write is conditional on the state it was computed from and atomic:
 * a caller never observes a closed version without its successor. A failed
 * condition raises {@link ConcurrentVersionModificationException} and leaves the
 * store unchanged.</p>
 */
public interface DimensionStore {

    /**
     * Gets every version of the natural key flagged current. More than one
     * element means the chain is corrupt.
     */
    List<DimensionVersion> findCurrent(DimensionId dimension, String naturalKey);

    /**
     * Gets versions of a natural key ordered by {@code (effectiveFrom, surrogateKey)}
     * using cursor-based pagination.
     *
     * @param after position of the last version seen, or null for the first page
     * @param limit maximum number of versions to return
     */
    VersionPage findVersionsPage(DimensionId dimension, String naturalKey, VersionCursor after, int limit);

    /**
     * Gets the whole chain of a natural key in order.
     */
    default List<DimensionVersion> findAllVersions(DimensionId dimension, String naturalKey) {
        List<DimensionVersion> all = new ArrayList<>();
        VersionPage page = findVersionsPage(dimension, naturalKey, null, 500);
        all.addAll(page.versions());
        while (page.hasMore()) {
            page = findVersionsPage(dimension, naturalKey, page.next(), 500);
            all.addAll(page.versions());
        }
        return all;
    }

    /**
     * Inserts the first version of a natural key.
     *
     * @throws ConcurrentVersionModificationException if the key already has a current version
     */
    void insertFirst(DimensionVersion version);

    /**
     * Closes {@code current} on {@code closeDate} and inserts {@code successor} as one atomic write.
     *
     * @return the closed version
     * @throws ConcurrentVersionModificationException if {@code current} is no longer current
     */
    DimensionVersion supersede(DimensionVersion current, LocalDate closeDate, DimensionVersion successor);

    /**
     * Overwrites attributes of {@code current} in place.
     *
     * @return the updated version
     * @throws ConcurrentVersionModificationException if {@code current} is no longer current
     */
    DimensionVersion overwrite(DimensionVersion current, Map<String, Object> attributes);

    /**
     * Highest surrogate key stored for the dimension, 0 if empty.
     */
    long maxSurrogateKey(DimensionId dimension);
}
