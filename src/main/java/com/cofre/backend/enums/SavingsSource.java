package com.cofre.backend.enums;

public enum SavingsSource {
    // fluxo legado por ciclo mensal (month/year)
    BUDGET_SURPLUS,
    // sobra de um orçamento por período
    BUDGET_REMAINDER,
    BUDGET_OVERRUN,
    MANUAL,
    GOAL_CONTRIBUTION,
    INTEREST
}
