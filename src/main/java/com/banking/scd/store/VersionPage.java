package com.banking.scd.store;

import com.banking.scd.core.model.DimensionVersion;

import java.util.List;

/**
 * One page of a version chain.
 *
 * @param versions versions in chain order
 * @param next     position of the last version on this page when more follow, otherwise null
 */
public record VersionPage(List<DimensionVersion> versions, VersionCursor next) {

    public VersionPage {
        versions = versions != null ? List.copyOf(versions) : List.of();
    }

    public boolean hasMore() {
        return next != null;
    }

    /**
     * Builds a page from rows fetched with a look-ahead of one: {@code limit + 1} rows
     * were requested, and an extra row only signals that the chain continues.
     */
    static VersionPage fromLookahead(List<DimensionVersion> fetched, int limit) {
        if (fetched.size() <= limit) {
            return new VersionPage(fetched, null);
        }
        List<DimensionVersion> page = fetched.subList(0, limit);
        return new VersionPage(page, VersionCursor.of(page.get(limit - 1)));
    }

    public static VersionPage empty() {
        return new VersionPage(List.of(), null);
    }
}
