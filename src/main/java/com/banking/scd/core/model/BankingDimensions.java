package com.banking.scd.core.model;

import java.util.EnumMap;
import java.util.Map;

import static com.banking.scd.core.model.AttributeType.BOOLEAN;
import static com.banking.scd.core.model.AttributeType.CODE;
import static com.banking.scd.core.model.AttributeType.DATE;
import static com.banking.scd.core.model.AttributeType.DECIMAL;
import static com.banking.scd.core.model.AttributeType.INTEGER;
import static com.banking.scd.core.model.AttributeType.STRING;

/**
 * Attribute definitions of the warehouse's Type-2 dimensions, one per {@link DimensionId}.
 *
 * <p>Columns follow the {@code banking_dw} DDL. Corrections to descriptive and
 * personal data (names, numbers, coordinates) overwrite in place; changes to
 * risk, status, segmentation, ownership and valuation open a new version.</p>
 */
public final class BankingDimensions {

    private BankingDimensions() {
        // utility class
    }

    public static DimensionDefinition customer() {
        return DimensionDefinition.builder(DimensionId.CUSTOMER)
                .type1("customer_number", STRING)
                .type1("full_name", STRING)
                .type1("first_name", STRING)
                .type1("last_name", STRING)
                .type1("date_of_birth", DATE)
                .type1("age_band", CODE)
                .type1("gender", CODE)
                .type2("nationality_country_sk", INTEGER)
                .type2("residency_country_sk", INTEGER)
                .type2("customer_type", CODE)
                .type2("customer_segment", CODE)
                .type2("customer_sub_segment", CODE)
                .type2("kyc_status", CODE)
                .type1("kyc_expiry_date", DATE)
                .type2("risk_rating", CODE)
                .type2("pep_flag", BOOLEAN)
                .type2("sanctions_flag", BOOLEAN)
                .type2("fatca_flag", BOOLEAN)
                .type2("crs_flag", BOOLEAN)
                .type1("acquisition_channel", CODE)
                .type1("acquisition_date", DATE)
                .type1("relationship_tenure_yrs", DECIMAL)
                .type2("branch_sk", INTEGER)
                .type2("relationship_mgr_sk", INTEGER)
                .type2("annual_income_band", CODE)
                .type2("employment_status", CODE)
                .build();
    }

    public static DimensionDefinition account() {
        return DimensionDefinition.builder(DimensionId.ACCOUNT)
                .type1("account_number", STRING)
                .type2("account_type", CODE)
                .type2("account_status", CODE)
                .type2("product_sk", INTEGER)
                .type2("customer_sk", INTEGER)
                .type2("branch_sk", INTEGER)
                .type2("currency_sk", INTEGER)
                .type1("open_date", DATE)
                .type2("close_date", DATE)
                .type2("interest_rate", DECIMAL)
                .type2("interest_rate_type", CODE)
                .type2("overdraft_limit", DECIMAL)
                .type2("customer_segment", CODE)
                .type2("is_salary_account", BOOLEAN)
                .type2("is_dormant", BOOLEAN)
                .type1("dormancy_date", DATE)
                .build();
    }

    public static DimensionDefinition branch() {
        return DimensionDefinition.builder(DimensionId.BRANCH)
                .type1("branch_code", CODE)
                .type1("branch_name", STRING)
                .type2("branch_type", CODE)
                .type2("channel_category", CODE)
                .type2("region_name", STRING)
                .type1("city", STRING)
                .type2("country_sk", INTEGER)
                .type1("swift_bic_code", CODE)
                .type2("branch_status", CODE)
                .type2("manager_employee_sk", INTEGER)
                .type1("latitude", DECIMAL)
                .type1("longitude", DECIMAL)
                .build();
    }

    public static DimensionDefinition employee() {
        return DimensionDefinition.builder(DimensionId.EMPLOYEE)
                .type1("employee_number", STRING)
                .type1("full_name", STRING)
                .type2("job_title", STRING)
                .type2("job_function", CODE)
                .type2("department_name", STRING)
                .type2("branch_sk", INTEGER)
                .type2("manager_employee_sk", INTEGER)
                .type1("hire_date", DATE)
                .type2("employment_status", CODE)
                .build();
    }

    public static DimensionDefinition geography() {
        return DimensionDefinition.builder(DimensionId.GEOGRAPHY)
                .type1("country_code_2", CODE)
                .type1("country_name", STRING)
                .type1("region", STRING)
                .type1("sub_region", STRING)
                .type2("aml_risk_rating", CODE)
                .type2("fatf_member", BOOLEAN)
                .type2("fatf_grey_list", BOOLEAN)
                .type2("fatf_black_list", BOOLEAN)
                .type2("eu_member", BOOLEAN)
                .type2("gdpr_adequate", BOOLEAN)
                .type2("sanctions_risk_flag", BOOLEAN)
                .type2("fatca_iga_type", CODE)
                .build();
    }

    public static DimensionDefinition collateral() {
        return DimensionDefinition.builder(DimensionId.COLLATERAL)
                .type2("collateral_type", CODE)
                .type1("collateral_description", STRING)
                .type2("owner_customer_sk", INTEGER)
                .type2("location_country_sk", INTEGER)
                .type2("nominal_value", DECIMAL)
                .type2("market_value", DECIMAL)
                .type2("eligible_value", DECIMAL)
                .type2("haircut_percentage", DECIMAL)
                .type2("legal_perfection_status", CODE)
                .type1("valuation_date", DATE)
                .type2("status", CODE)
                .build();
    }

    /**
     * All six definitions keyed by dimension.
     */
    public static Map<DimensionId, DimensionDefinition> all() {
        Map<DimensionId, DimensionDefinition> definitions = new EnumMap<>(DimensionId.class);
        definitions.put(DimensionId.CUSTOMER, customer());
        definitions.put(DimensionId.ACCOUNT, account());
        definitions.put(DimensionId.BRANCH, branch());
        definitions.put(DimensionId.EMPLOYEE, employee());
        definitions.put(DimensionId.GEOGRAPHY, geography());
        definitions.put(DimensionId.COLLATERAL, collateral());
        return definitions;
    }
}
