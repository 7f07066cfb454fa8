package com.cofre.backend.dto.budget;

import java.math.BigDecimal;
import java.time.LocalDate;
import java.time.LocalDateTime;
import java.util.UUID;

import com.cofre.backend.enums.BudgetPeriodType;
import com.cofre.backend.enums.BudgetStatus;

import lombok.Data;

@Data
public class BudgetResponse {
    private UUID id;

    // Categoria
    private UUID categoryId;
    private String categoryName;
    private String categoryIcon;
    private String categoryColor;

    private BigDecimal amount;

    // Período
    private LocalDate startDate;
    private LocalDate endDate;
    private BudgetPeriodType periodType;
    private BudgetStatus status;
    private Integer month;
    private Integer year;
    private long daysRemaining;
    private long totalDays;
    private int periodProgress;

    // Gasto x orçado
    private BigDecimal spent;
    private BigDecimal remaining;
    private int percentage;
    private boolean overBudget;
    private BigDecimal overrun;

    // Poupança
    private boolean savingsTransferred;
    private BigDecimal savingsTransferAmount;
    private LocalDateTime savingsTransferDate;

    private String notes;

    // Auditoria
    private LocalDateTime createdAt;
    private LocalDateTime updatedAt;
}
