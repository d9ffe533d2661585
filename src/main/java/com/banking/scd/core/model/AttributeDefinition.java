package com.banking.scd.core.model;

import java.util.Objects;
import java.util.regex.Pattern;

/**
 * A tracked attribute of a dimension: its column name, value type and change policy.
 *
 * @param name   column name, lower snake case
 * @param type   value type
 * @param policy how changes are recorded
 */
public record AttributeDefinition(String name, AttributeType type, TrackingPolicy policy) {

    private static final Pattern NAME_PATTERN = Pattern.compile("^[a-z][a-z0-9_]*$");

    public AttributeDefinition {
        Objects.requireNonNull(name, "name is required");
        Objects.requireNonNull(type, "type is required");
        Objects.requireNonNull(policy, "policy is required");
        if (!NAME_PATTERN.matcher(name).matches()) {
            throw new IllegalArgumentException(
                    "Attribute name must be lower snake case, got: '" + name + "'");
        }
    }

    public static AttributeDefinition type1(String name, AttributeType type) {
        return new AttributeDefinition(name, type, TrackingPolicy.TYPE1);
    }

    public static AttributeDefinition type2(String name, AttributeType type) {
        return new AttributeDefinition(name, type, TrackingPolicy.TYPE2);
    }
}
