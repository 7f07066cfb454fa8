package com.cofre.backend.exceptions;

import java.math.BigDecimal;
import java.util.HashMap;
import java.util.Map;

public class InvalidAmountException extends BusinessException {

    public InvalidAmountException(BigDecimal amount) {
        super(ErrorCode.INVALID_AMOUNT, "Valor deve ser maior que zero", details(amount));
    }

    private static Map<String, Object> details(BigDecimal amount) {
        // Map.of não aceita null
        Map<String, Object> details = new HashMap<>();
        details.put("amount", amount);
        return details;
    }
}
