package com.cofre.backend.exceptions;

import java.math.BigDecimal;
import java.util.Map;
import java.util.UUID;

public class AlreadyTransferredException extends BusinessException {

    public AlreadyTransferredException(UUID budgetId, BigDecimal transferredAmount) {
        super(ErrorCode.ALREADY_TRANSFERRED,
                "A sobra deste orçamento já foi transferida para a poupança",
                Map.of("budgetId", budgetId, "transferredAmount", transferredAmount));
    }
}
