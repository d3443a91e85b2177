package com.expensesnap.core.domain.access;

public enum TenantOperation {
    READ_EXPENSES,
    /** Upload and edit. */
    WRITE_EXPENSES,
    DELETE_EXPENSES,
    RECALCULATE,
    MANAGE_TEAM,
    MANAGE_INVITES,
    COMPANY_SETTINGS,
    MANAGE_COMPANIES
}
