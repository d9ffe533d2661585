package com.banking.scd.core.model;

import java.util.Collection;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;

/**
 * Describes the tracked attributes of one dimension and the policy that applies to each.
 * Attribute order is preserved (it is the column order used by stores and importers).
 */
public class DimensionDefinition {

    private static final Set<String> RESERVED_COLUMNS = Set.of(
            "effective_from_date", "effective_to_date", "is_current_record",
            "dw_insert_datetime", "dw_source_system");

    private final DimensionId dimension;
    private final Map<String, AttributeDefinition> attributes;

    private DimensionDefinition(Builder builder) {
        this.dimension = builder.dimension;
        this.attributes = Collections.unmodifiableMap(new LinkedHashMap<>(builder.attributes));
    }

    public DimensionId getDimension() {
        return dimension;
    }

    /**
     * Attribute definitions in declaration order.
     */
    public Collection<AttributeDefinition> getAttributes() {
        return attributes.values();
    }

    public Set<String> getAttributeNames() {
        return attributes.keySet();
    }

    public Optional<AttributeDefinition> find(String attributeName) {
        return Optional.ofNullable(attributes.get(attributeName));
    }

    /**
     * Gets the definition of an attribute.
     *
     * @throws IllegalArgumentException if the dimension does not track the attribute
     */
    public AttributeDefinition get(String attributeName) {
        AttributeDefinition definition = attributes.get(attributeName);
        if (definition == null) {
            throw new IllegalArgumentException(
                    "Attribute '" + attributeName + "' is not tracked by dimension " + dimension);
        }
        return definition;
    }

    public TrackingPolicy policyOf(String attributeName) {
        return get(attributeName).policy();
    }

    public AttributeType typeOf(String attributeName) {
        return get(attributeName).type();
    }

    public List<AttributeDefinition> type1Attributes() {
        return attributes.values().stream()
                .filter(a -> a.policy() == TrackingPolicy.TYPE1)
                .toList();
    }

    public List<AttributeDefinition> type2Attributes() {
        return attributes.values().stream()
                .filter(a -> a.policy() == TrackingPolicy.TYPE2)
                .toList();
    }

    @Override
    public String toString() {
        return "DimensionDefinition{" +
                "dimension=" + dimension +
                ", attributes=" + attributes.keySet() +
                '}';
    }

    public static Builder builder(DimensionId dimension) {
        return new Builder(dimension);
    }

    public static class Builder {
        private final DimensionId dimension;
        private final Map<String, AttributeDefinition> attributes = new LinkedHashMap<>();

        private Builder(DimensionId dimension) {
            this.dimension = Objects.requireNonNull(dimension, "dimension is required");
        }

        public Builder attribute(AttributeDefinition attribute) {
            String name = attribute.name();
            if (RESERVED_COLUMNS.contains(name)
                    || name.equals(dimension.getSurrogateKeyColumn())
                    || name.equals(dimension.getNaturalKeyColumn())) {
                throw new IllegalArgumentException(
                        "Attribute name '" + name + "' is reserved for dimension " + dimension);
            }
            if (attributes.putIfAbsent(name, attribute) != null) {
                throw new IllegalArgumentException("Duplicate attribute '" + name + "'");
            }
            return this;
        }

        public Builder type1(String name, AttributeType type) {
            return attribute(AttributeDefinition.type1(name, type));
        }

        public Builder type2(String name, AttributeType type) {
            return attribute(AttributeDefinition.type2(name, type));
        }

        public DimensionDefinition build() {
            if (attributes.isEmpty()) {
                throw new IllegalArgumentException("Dimension " + dimension + " must track at least one attribute");
            }
            return new DimensionDefinition(this);
        }
    }
}
