package com.cofre.backend.exceptions;

import java.math.BigDecimal;
import java.util.Map;
import java.util.UUID;

public class NotOverrunException extends BusinessException {

    public NotOverrunException(UUID budgetId, BigDecimal budgeted, BigDecimal spent) {
        super(ErrorCode.NOT_OVERRUN,
                "Orçamento não está estourado",
                Map.of("budgetId", budgetId, "budgeted", budgeted, "spent", spent));
    }
}
