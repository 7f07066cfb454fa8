package com.cofre.backend.dto.savings;

import java.math.BigDecimal;
import java.time.LocalDateTime;

import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

@Data
@NoArgsConstructor
@AllArgsConstructor
public class TransferredCycleResponse {
    private int month;
    private int year;
    private BigDecimal amount;
    private LocalDateTime transferredAt;
}
