package com.cofre.backend.exceptions;

import java.util.Map;
import java.util.UUID;

/**
 * Orçamento cuja sobra já foi para a poupança: não pode ser editado nem removido.
 */
public class BudgetLockedException extends BusinessException {

    private BudgetLockedException(ErrorCode code, String message, UUID budgetId) {
        super(code, message, Map.of("budgetId", budgetId));
    }

    public static BudgetLockedException immutable(UUID budgetId) {
        return new BudgetLockedException(ErrorCode.IMMUTABLE,
                "Orçamento já transferido para a poupança não pode ser alterado", budgetId);
    }

    public static BudgetLockedException transferLocked(UUID budgetId) {
        return new BudgetLockedException(ErrorCode.TRANSFER_LOCKED,
                "Orçamento já transferido para a poupança não pode ser excluído", budgetId);
    }
}
