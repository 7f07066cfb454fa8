package com.cofre.backend.dto.savings;

import java.math.BigDecimal;
import java.time.LocalDateTime;
import java.util.UUID;

import com.cofre.backend.enums.SavingsSource;
import com.cofre.backend.enums.SavingsTransactionType;

import lombok.Data;

@Data
public class SavingsTransactionResponse {
    private UUID id;
    private SavingsTransactionType type;
    private BigDecimal amount;
    private BigDecimal signedAmount;
    private SavingsSource source;
    private String description;
    private Integer cycleMonth;
    private Integer cycleYear;
    private UUID relatedBudgetId;
    private BigDecimal balanceAfter;
    private LocalDateTime createdAt;
}
