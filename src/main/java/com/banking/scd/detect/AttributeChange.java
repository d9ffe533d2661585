package com.banking.scd.detect;

import com.banking.scd.core.model.TrackingPolicy;

import java.util.Objects;

/**
 * One attribute whose incoming value differs from the current version.
 *
 * @param attribute the attribute name
 * @param policy    the attribute's tracking policy
 * @param before    value held by the current version, may be null
 * @param after     normalized incoming value, may be null
 */
public record AttributeChange(String attribute, TrackingPolicy policy, Object before, Object after) {

    public AttributeChange {
        Objects.requireNonNull(attribute, "attribute is required");
        Objects.requireNonNull(policy, "policy is required");
    }
}
