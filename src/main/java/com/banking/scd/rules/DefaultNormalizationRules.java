package com.banking.scd.rules;

import com.banking.scd.core.model.AttributeType;
import com.banking.scd.core.model.DimensionId;

import java.util.List;

/**
 * Built-in normalization rules for values extracted from the core banking feeds.
 */
public final class DefaultNormalizationRules {

    private DefaultNormalizationRules() {
        // Utility class
    }

    /**
     * Creates a NormalizationEngine with all default rules.
     */
    public static NormalizationEngine createDefaultEngine() {
        NormalizationEngine engine = new NormalizationEngine();
        engine.addRules(getCommonRules());
        engine.addRules(getIdentifierRules());
        engine.addRules(getCodeRules());
        return engine;
    }

    /**
     * Rules applied to every text attribute.
     */
    public static List<NormalizationRule> getCommonRules() {
        return List.of(
                // Non-breaking spaces from copy-pasted source data
                NormalizationRule.builder("unicode-spaces")
                        .replace("[\\u00A0\\u2007\\u202F]", " ")
                        .priority(10)
                        .build(),
                NormalizationRule.builder("zero-width")
                        .replace("[\\u200B\\u200C\\u200D\\uFEFF]", "")
                        .priority(10)
                        .build(),
                NormalizationRule.builder("control-characters")
                        .replace("\\p{Cntrl}", " ")
                        .priority(20)
                        .build()
        );
    }

    /**
     * Rules for printed identifiers that source systems format with grouping separators:
     * {@code "DEUT DE FF"} is the BIC {@code DEUTDEFF}, {@code "0123-4567 89"} the account
     * number {@code 0123456789}.
     */
    public static List<NormalizationRule> getIdentifierRules() {
        return List.of(
                NormalizationRule.builder("bic-grouping")
                        .replace("\\s+", "")
                        .onlyDimensions(DimensionId.BRANCH)
                        .onlyAttributes("swift_bic_code")
                        .priority(40)
                        .build(),
                NormalizationRule.builder("account-number-grouping")
                        .replace("[\\s\\-.]+", "")
                        .onlyDimensions(DimensionId.ACCOUNT)
                        .onlyAttributes("account_number")
                        .priority(40)
                        .build()
        );
    }

    /**
     * Rules for categorical codes: {@code "very high"} and {@code "Very-High"} both become {@code VERY_HIGH}.
     */
    public static List<NormalizationRule> getCodeRules() {
        return List.of(
                NormalizationRule.builder("code-separators")
                        .replace("[\\s\\-]+", "_")
                        .onlyTypes(AttributeType.CODE)
                        .priority(50)
                        .build()
        );
    }
}
