package com.banking.scd.core.model;

/**
 * Classification of an incoming record against the current version of its entity.
 */
public enum ChangeType {
    /**
     * All attributes equal the current version after normalization.
     */
    NO_CHANGE,

    /**
     * Only Type-1 attributes differ; the current version is overwritten in place.
     */
    TYPE1_UPDATE,

    /**
     * At least one Type-2 attribute differs; a new version supersedes the current one.
     */
    TYPE2_VERSION,

    /**
     * The natural key has no current version yet.
     */
    NEW_ENTITY;

    public boolean isWrite() {
        return this != NO_CHANGE;
    }
}
