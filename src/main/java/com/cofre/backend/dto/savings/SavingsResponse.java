package com.cofre.backend.dto.savings;

import java.math.BigDecimal;
import java.time.LocalDateTime;
import java.util.List;
import java.util.UUID;

import lombok.Data;

@Data
public class SavingsResponse {
    private UUID id;
    private BigDecimal balance;
    private BigDecimal totalDeposits;
    private BigDecimal totalWithdrawals;
    private LocalDateTime lastTransactionDate;
    private List<TransferredCycleResponse> transferredCycles;
    private LocalDateTime createdAt;
    private LocalDateTime updatedAt;
}
