package com.banking.scd.detect;

import com.banking.scd.core.model.ChangeType;
import com.banking.scd.core.model.TrackingPolicy;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * Verdict of comparing an incoming record with the current version.
 *
 * @param changeType the classification
 * @param attributes the full normalized incoming attribute set, in declaration order
 * @param changes    attributes that differ from the current version; empty for new entities
 */
public record ChangeSet(ChangeType changeType, Map<String, Object> attributes, List<AttributeChange> changes) {

    public ChangeSet {
        Objects.requireNonNull(changeType, "changeType is required");
        attributes = attributes != null
                ? Collections.unmodifiableMap(new LinkedHashMap<>(attributes))
                : Map.of();
        changes = changes != null ? List.copyOf(changes) : List.of();
    }

    public boolean hasChanges() {
        return !changes.isEmpty();
    }

    public List<AttributeChange> changesOf(TrackingPolicy policy) {
        return changes.stream()
                .filter(c -> c.policy() == policy)
                .toList();
    }

    public List<String> changedAttributeNames() {
        return changes.stream()
                .map(AttributeChange::attribute)
                .toList();
    }
}
