package com.banking.scd.api;

import com.banking.scd.core.model.DimensionId;
import com.banking.scd.core.model.DimensionVersion;
import com.banking.scd.store.DimensionStore;
import com.banking.scd.store.VersionCursor;
import com.banking.scd.store.VersionPage;

import java.util.Iterator;
import java.util.List;
import java.util.NoSuchElementException;
import java.util.Spliterator;
import java.util.Spliterators;
import java.util.stream.Stream;
import java.util.stream.StreamSupport;

/**
 * The version chain of one natural key, ordered by effective-from date.
 *
 * <p>Lazy and restartable: nothing is read until iteration starts, each call to
 * {@link #iterator()} starts again from the first version, and versions are fetched
 * from the store one page at a time. Each page reflects the store at the time it
 * is read.</p>
 */
public class VersionHistory implements Iterable<DimensionVersion> {

    static final int DEFAULT_PAGE_SIZE = 100;

    private final DimensionStore store;
    private final DimensionId dimension;
    private final String naturalKey;
    private final int pageSize;

    public VersionHistory(DimensionStore store, DimensionId dimension, String naturalKey) {
        this(store, dimension, naturalKey, DEFAULT_PAGE_SIZE);
    }

    public VersionHistory(DimensionStore store, DimensionId dimension, String naturalKey, int pageSize) {
        if (pageSize <= 0) {
            throw new IllegalArgumentException("pageSize must be > 0");
        }
        this.store = store;
        this.dimension = dimension;
        this.naturalKey = naturalKey;
        this.pageSize = pageSize;
    }

    public DimensionId getDimension() {
        return dimension;
    }

    public String getNaturalKey() {
        return naturalKey;
    }

    @Override
    public Iterator<DimensionVersion> iterator() {
        return new PagingIterator();
    }

    public Stream<DimensionVersion> stream() {
        return StreamSupport.stream(
                Spliterators.spliteratorUnknownSize(iterator(), Spliterator.ORDERED | Spliterator.NONNULL),
                false);
    }

    /**
     * Reads the whole chain into a list.
     */
    public List<DimensionVersion> toList() {
        return stream().toList();
    }

    private class PagingIterator implements Iterator<DimensionVersion> {
        private Iterator<DimensionVersion> page;
        private VersionCursor after;
        private boolean lastPage;

        @Override
        public boolean hasNext() {
            while (page == null || !page.hasNext()) {
                if (lastPage) {
                    return false;
                }
                VersionPage next = store.findVersionsPage(dimension, naturalKey, after, pageSize);
                page = next.versions().iterator();
                after = next.next();
                lastPage = !next.hasMore();
            }
            return true;
        }

        @Override
        public DimensionVersion next() {
            if (!hasNext()) {
                throw new NoSuchElementException();
            }
            return page.next();
        }
    }
}
