package com.cofre.backend.dto.savings;

import java.math.BigDecimal;
import java.util.List;

import com.cofre.backend.enums.SavingsSource;
import com.cofre.backend.enums.SavingsTransactionType;

import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

@Data
public class SavingsStatisticsResponse {
    private BigDecimal currentBalance;
    private BigDecimal totalDeposits;
    private BigDecimal totalWithdrawals;
    private BigDecimal netSavings;
    private long transactionCount;
    private List<MonthlyTotal> monthlyBreakdown;
    private List<SourceTotal> sourceBreakdown;
    private List<TransferredCycleResponse> transferredCycles;

    @Data
    @NoArgsConstructor
    @AllArgsConstructor
    public static class MonthlyTotal {
        private int year;
        private int month;
        private SavingsTransactionType type;
        private BigDecimal total;
    }

    @Data
    @NoArgsConstructor
    @AllArgsConstructor
    public static class SourceTotal {
        private SavingsSource source;
        private SavingsTransactionType type;
        private BigDecimal total;
        private long count;
    }
}
