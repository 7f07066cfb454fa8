package com.cofre.backend.dto.budget;

import java.math.BigDecimal;
import java.util.List;

import lombok.Data;

@Data
public class BudgetMonthlySummaryResponse {
    private int month;
    private int year;
    private List<BudgetResponse> budgets;

    private BigDecimal totalBudget;
    private BigDecimal totalSpent;
    private BigDecimal totalRemaining;
    private int overallPercentage;
    private int budgetCount;
    private int overBudgetCount;
}
