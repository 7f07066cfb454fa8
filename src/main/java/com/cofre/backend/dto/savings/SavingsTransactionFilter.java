package com.cofre.backend.dto.savings;

import java.time.LocalDateTime;

import com.cofre.backend.enums.SavingsSource;
import com.cofre.backend.enums.SavingsTransactionType;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class SavingsTransactionFilter {
    private Integer page;
    private Integer limit;
    private SavingsTransactionType type;
    private SavingsSource source;
    private LocalDateTime startDate;
    private LocalDateTime endDate;
}
