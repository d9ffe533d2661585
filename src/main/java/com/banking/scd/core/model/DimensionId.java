package com.banking.scd.core.model;

/**
 * The Type-2 tracked dimensions of the banking warehouse.
 * Each constant knows the physical table and key columns it is stored in.
 */
public enum DimensionId {
    CUSTOMER("dim_customer", "customer_sk", "customer_nk"),
    ACCOUNT("dim_account", "account_sk", "account_nk"),
    BRANCH("dim_branch", "branch_sk", "branch_nk"),
    EMPLOYEE("dim_employee", "employee_sk", "employee_nk"),
    /**
     * Geography has no {@code _nk} column; the ISO-3 country code is its natural key.
     */
    GEOGRAPHY("dim_geography", "geography_sk", "country_code"),
    COLLATERAL("dim_collateral", "collateral_sk", "collateral_nk");

    private final String tableName;
    private final String surrogateKeyColumn;
    private final String naturalKeyColumn;

    DimensionId(String tableName, String surrogateKeyColumn, String naturalKeyColumn) {
        this.tableName = tableName;
        this.surrogateKeyColumn = surrogateKeyColumn;
        this.naturalKeyColumn = naturalKeyColumn;
    }

    public String getTableName() {
        return tableName;
    }

    public String getSurrogateKeyColumn() {
        return surrogateKeyColumn;
    }

    public String getNaturalKeyColumn() {
        return naturalKeyColumn;
    }
}
