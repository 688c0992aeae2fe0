package com.flagship.fund_ledger.allocation;

public enum AllocationPurpose {
    SITE_EXPENSE,
    LABOR_EXPENSE,
    MATERIAL,
    EQUIPMENT,
    OTHER
}
