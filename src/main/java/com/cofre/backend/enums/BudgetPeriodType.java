package com.cofre.backend.enums;

public enum BudgetPeriodType {
    WEEKLY,
    MONTHLY,
    CUSTOM
}
