package com.cofre.backend.dto.savings;

import java.math.BigDecimal;

import lombok.Data;

@Data
public class TransferStatusResponse {
    private int month;
    private int year;

    private BigDecimal totalBudget;
    private BigDecimal totalSpent;
    private BigDecimal remaining;
    private boolean overBudget;
    private BigDecimal overrunAmount;

    private BigDecimal currentSavings;
    private boolean alreadyTransferred;
    private BigDecimal transferredAmount;

    private boolean canTransferSurplus;
    private boolean canCoverOverrun;
}
