package com.banking.scd.rules;

import com.banking.scd.core.model.AttributeDefinition;
import com.banking.scd.core.model.AttributeType;
import com.banking.scd.core.model.DimensionId;

import java.util.EnumSet;
import java.util.HashSet;
import java.util.Objects;
import java.util.Set;
import java.util.regex.Pattern;

/**
 * A regex rewrite of text attribute values.
 *
 * <p>An unscoped rule applies to every {@code STRING} and {@code CODE} attribute of every
 * dimension. A rule can be narrowed to dimensions, attribute names and attribute types;
 * when several scopes are given, all of them must match. For example a rule scoped to
 * {@code BRANCH} and {@code swift_bic_code} only ever touches branch BIC codes.</p>
 */
public final class NormalizationRule {
    private final String name;
    private final Pattern pattern;
    private final String replacement;
    private final int priority;
    private final Set<DimensionId> dimensions;
    private final Set<String> attributeNames;
    private final Set<AttributeType> types;

    private NormalizationRule(Builder builder) {
        this.name = builder.name;
        this.pattern = Pattern.compile(builder.regex, Pattern.CASE_INSENSITIVE | Pattern.UNICODE_CASE);
        this.replacement = builder.replacement;
        this.priority = builder.priority;
        this.dimensions = Set.copyOf(builder.dimensions);
        this.attributeNames = Set.copyOf(builder.attributeNames);
        this.types = Set.copyOf(builder.types);
    }

    public String getName() {
        return name;
    }

    /**
     * Lower runs first.
     */
    public int getPriority() {
        return priority;
    }

    public Set<DimensionId> getDimensions() {
        return dimensions;
    }

    public Set<String> getAttributeNames() {
        return attributeNames;
    }

    public Set<AttributeType> getTypes() {
        return types;
    }

    /**
     * Whether this rule rewrites the given attribute of the given dimension.
     */
    public boolean appliesTo(DimensionId dimension, AttributeDefinition attribute) {
        if (!attribute.type().isText()) {
            return false;
        }
        return (dimensions.isEmpty() || dimensions.contains(dimension))
                && (attributeNames.isEmpty() || attributeNames.contains(attribute.name()))
                && (types.isEmpty() || types.contains(attribute.type()));
    }

    public String rewrite(String value) {
        return value == null ? null : pattern.matcher(value).replaceAll(replacement);
    }

    @Override
    public String toString() {
        return "NormalizationRule{" + name
                + ", /" + pattern.pattern() + "/ -> '" + replacement + "'"
                + ", priority=" + priority
                + (dimensions.isEmpty() ? "" : ", dimensions=" + dimensions)
                + (attributeNames.isEmpty() ? "" : ", attributes=" + attributeNames)
                + (types.isEmpty() ? "" : ", types=" + types)
                + '}';
    }

    public static Builder builder(String name) {
        return new Builder(name);
    }

    public static class Builder {
        private final String name;
        private String regex;
        private String replacement = "";
        private int priority = 100;
        private final Set<DimensionId> dimensions = EnumSet.noneOf(DimensionId.class);
        private final Set<String> attributeNames = new HashSet<>();
        private final Set<AttributeType> types = EnumSet.noneOf(AttributeType.class);

        private Builder(String name) {
            this.name = Objects.requireNonNull(name, "name is required");
        }

        /**
         * Replaces every match of {@code regex} (case-insensitive) with {@code replacement}.
         */
        public Builder replace(String regex, String replacement) {
            this.regex = regex;
            this.replacement = replacement;
            return this;
        }

        public Builder priority(int priority) {
            this.priority = priority;
            return this;
        }

        public Builder onlyDimensions(DimensionId... dimensions) {
            this.dimensions.addAll(Set.of(dimensions));
            return this;
        }

        public Builder onlyAttributes(String... attributeNames) {
            this.attributeNames.addAll(Set.of(attributeNames));
            return this;
        }

        public Builder onlyTypes(AttributeType... types) {
            for (AttributeType type : types) {
                if (!type.isText()) {
                    throw new IllegalArgumentException(
                            "Rule '" + name + "' cannot be scoped to " + type + ": only text values are rewritten");
                }
                this.types.add(type);
            }
            return this;
        }

        public NormalizationRule build() {
            Objects.requireNonNull(regex, "regex is required");
            Objects.requireNonNull(replacement, "replacement is required");
            return new NormalizationRule(this);
        }
    }
}
