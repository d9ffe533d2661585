package com.banking.scd.detect;

import com.banking.scd.core.model.AttributeDefinition;
import com.banking.scd.core.model.ChangeType;
import com.banking.scd.core.model.DimensionDefinition;
import com.banking.scd.core.model.DimensionVersion;
import com.banking.scd.core.model.TrackingPolicy;
import com.banking.scd.rules.DefaultNormalizationRules;
import com.banking.scd.rules.NormalizationEngine;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Classifies an incoming record against the current version of its natural key.
 * Pure: reads nothing and writes nothing.
 *
 * <p>The incoming record is a full snapshot. Attributes it does not carry are null,
 * so dropping a value is a change like any other. A TYPE2 difference dominates
 * any number of TYPE1 differences.</p>
 */
public class ChangeDetector {
    private static final Logger log = LoggerFactory.getLogger(ChangeDetector.class);

    private final NormalizationEngine normalizationEngine;

    public ChangeDetector() {
        this(DefaultNormalizationRules.createDefaultEngine());
    }

    public ChangeDetector(NormalizationEngine normalizationEngine) {
        this.normalizationEngine = normalizationEngine;
    }

    /**
     * Detects the change an incoming attribute set represents.
     *
     * @param definition the dimension's attribute definitions
     * @param current    the current version, empty for an unknown natural key
     * @param incoming   raw incoming attribute values
     * @throws IllegalArgumentException if an attribute is unknown or a value cannot be coerced
     */
    public ChangeSet detect(DimensionDefinition definition, Optional<DimensionVersion> current,
                            Map<String, Object> incoming) {
        Map<String, Object> normalized = normalizationEngine.normalizeAll(definition, incoming);

        if (current.isEmpty()) {
            return new ChangeSet(ChangeType.NEW_ENTITY, normalized, List.of());
        }

        DimensionVersion version = current.get();
        List<AttributeChange> changes = new ArrayList<>();
        for (AttributeDefinition attribute : definition.getAttributes()) {
            Object before = normalizationEngine.normalize(
                    definition.getDimension(), attribute, version.getAttribute(attribute.name()));
            Object after = normalized.get(attribute.name());
            if (!attribute.type().valuesEqual(before, after)) {
                changes.add(new AttributeChange(attribute.name(), attribute.policy(), before, after));
            }
        }

        ChangeType changeType = classify(changes);
        log.debug("detect.classified dimension={} naturalKey={} changeType={} changed={}",
                version.getDimension(), version.getNaturalKey(), changeType,
                changes.stream().map(AttributeChange::attribute).toList());
        return new ChangeSet(changeType, normalized, changes);
    }

    private static ChangeType classify(List<AttributeChange> changes) {
        if (changes.isEmpty()) {
            return ChangeType.NO_CHANGE;
        }
        boolean type2 = changes.stream().anyMatch(c -> c.policy() == TrackingPolicy.TYPE2);
        return type2 ? ChangeType.TYPE2_VERSION : ChangeType.TYPE1_UPDATE;
    }
}
