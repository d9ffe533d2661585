package com.banking.scd.rules;

import com.banking.scd.core.model.AttributeDefinition;
import com.banking.scd.core.model.AttributeType;
import com.banking.scd.core.model.DimensionDefinition;
import com.banking.scd.core.model.DimensionId;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;

/**
 * Brings attribute values into the canonical form in which they are compared and stored.
 *
 * <p>Every value is first coerced to its {@link AttributeType}. Text values ({@code STRING}
 * and {@code CODE}) are then trimmed, passed through the rules scoped to their dimension and
 * attribute in priority order (lower number first), and cleaned up: internal whitespace collapsed,
 * codes upper-cased, blank results turned into {@code null}.</p>
 */
public class NormalizationEngine {
    private static final Logger log = LoggerFactory.getLogger(NormalizationEngine.class);

    private final List<NormalizationRule> rules;

    public NormalizationEngine() {
        this.rules = new ArrayList<>();
    }

    public NormalizationEngine(List<NormalizationRule> rules) {
        this.rules = new ArrayList<>(rules);
        sortRules();
    }

    /**
     * Adds a rule to the engine.
     */
    public void addRule(NormalizationRule rule) {
        rules.add(rule);
        sortRules();
    }

    /**
     * Adds multiple rules to the engine.
     */
    public void addRules(List<NormalizationRule> newRules) {
        rules.addAll(newRules);
        sortRules();
    }

    /**
     * Removes a rule by name.
     */
    public boolean removeRule(String ruleName) {
        return rules.removeIf(r -> r.getName().equals(ruleName));
    }

    /**
     * Gets all rules currently in the engine.
     */
    public List<NormalizationRule> getRules() {
        return List.copyOf(rules);
    }

    /**
     * Normalizes one attribute value of a dimension.
     *
     * @throws IllegalArgumentException if the value cannot be coerced to the attribute's type
     */
    public Object normalize(DimensionId dimension, AttributeDefinition attribute, Object raw) {
        Object value = attribute.type().coerce(raw);
        if (!(value instanceof String text)) {
            return value;
        }
        return normalizeText(dimension, attribute, text);
    }

    /**
     * Normalizes a full incoming attribute set against a dimension definition.
     * The result holds every tracked attribute in declaration order; attributes the
     * input does not mention are null.
     *
     * @throws IllegalArgumentException if the input names an attribute the dimension does not track
     */
    public Map<String, Object> normalizeAll(DimensionDefinition definition, Map<String, Object> incoming) {
        for (String name : incoming.keySet()) {
            definition.get(name);
        }
        Map<String, Object> result = new LinkedHashMap<>();
        for (AttributeDefinition attribute : definition.getAttributes()) {
            Object raw = incoming.get(attribute.name());
            result.put(attribute.name(), normalize(definition.getDimension(), attribute, raw));
        }
        return result;
    }

    /**
     * Checks if two raw values are equivalent after normalization.
     */
    public boolean areEquivalent(DimensionId dimension, AttributeDefinition attribute, Object a, Object b) {
        return attribute.type().valuesEqual(normalize(dimension, attribute, a), normalize(dimension, attribute, b));
    }

    private String normalizeText(DimensionId dimension, AttributeDefinition attribute, String text) {
        String result = text.strip();

        for (NormalizationRule rule : rules) {
            if (rule.appliesTo(dimension, attribute)) {
                String before = result;
                result = rule.rewrite(result);
                if (!before.equals(result)) {
                    log.debug("normalize.rewritten rule={} dimension={} attribute={} before='{}' after='{}'",
                            rule.getName(), dimension, attribute.name(), before, result);
                }
            }
        }

        result = result.trim().replaceAll("\\s+", " ");
        if (attribute.type() == AttributeType.CODE) {
            result = result.toUpperCase(Locale.ROOT);
        }
        return result.isEmpty() ? null : result;
    }

    private void sortRules() {
        rules.sort(Comparator.comparingInt(NormalizationRule::getPriority));
    }
}
