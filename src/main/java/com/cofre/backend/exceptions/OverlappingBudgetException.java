package com.cofre.backend.exceptions;

import java.time.LocalDate;
import java.util.Map;
import java.util.UUID;

import lombok.Getter;

@Getter
public class OverlappingBudgetException extends BusinessException {

    private final UUID conflictingBudgetId;
    private final LocalDate conflictingStartDate;
    private final LocalDate conflictingEndDate;

    public OverlappingBudgetException(UUID conflictingBudgetId, LocalDate conflictingStartDate, LocalDate conflictingEndDate) {
        super(ErrorCode.OVERLAPPING_BUDGET,
                String.format("Já existe um orçamento para esta categoria no período de %s a %s",
                        conflictingStartDate, conflictingEndDate),
                Map.of(
                        "conflictingBudgetId", conflictingBudgetId,
                        "conflictingStartDate", conflictingStartDate,
                        "conflictingEndDate", conflictingEndDate
                ));
        this.conflictingBudgetId = conflictingBudgetId;
        this.conflictingStartDate = conflictingStartDate;
        this.conflictingEndDate = conflictingEndDate;
    }
}
