package com.cofre.backend.dto.savings;

import com.cofre.backend.dto.budget.BudgetResponse;

import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

@Data
@NoArgsConstructor
@AllArgsConstructor
public class BudgetTransferResult {
    private SavingsResponse savings;
    private SavingsTransactionResponse transaction;
    private BudgetResponse budget;
}
