package com.cofre.backend.dto.savings;

import java.math.BigDecimal;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/** Orçado x gasto de um ciclo mensal legado, somando todas as categorias. */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class CycleBudgetSummary {
    private int month;
    private int year;
    private BigDecimal totalBudget;
    private BigDecimal totalSpent;
    private BigDecimal remaining;
    private boolean overBudget;
    private BigDecimal overrunAmount;
}
