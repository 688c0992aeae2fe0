package com.flagship.fund_ledger.consumption;

public enum BillType {
    MATERIAL,
    SERVICE,
    LABOR,
    EQUIPMENT,
    UTILITY,
    OTHER
}
