package com.banking.scd.audit;

/**
 * Types of auditable actions on dimension version chains.
 */
public enum AuditAction {
    VERSION_CREATED,
    VERSION_CLOSED,
    ATTRIBUTES_OVERWRITTEN,
    LOAD_REJECTED,
    INTEGRITY_VIOLATION
}
