package com.cofre.backend.dto.savings;

import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

@Data
@NoArgsConstructor
@AllArgsConstructor
public class SurplusTransferResult {
    private SavingsResponse savings;
    private SavingsTransactionResponse transaction;
    private CycleBudgetSummary budgetSummary;
}
