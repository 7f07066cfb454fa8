package com.cofre.backend.dto.savings;

import java.math.BigDecimal;
import java.util.List;

import lombok.Data;

@Data
public class SavingsOverviewResponse {
    private SavingsResponse savings;
    private List<SavingsTransactionResponse> recentTransactions;

    // mês corrente
    private BigDecimal monthlyDeposits;
    private BigDecimal monthlyWithdrawals;
    private BigDecimal monthlyNet;
}
