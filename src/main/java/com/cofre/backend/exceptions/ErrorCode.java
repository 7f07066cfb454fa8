package com.cofre.backend.exceptions;

/**
 * Códigos estáveis das violações de regra de negócio, devolvidos no corpo do erro
 * para o front decidir a mensagem/ação.
 */
public enum ErrorCode {
    INVALID_CATEGORY_TYPE,
    MISSING_PERIOD,
    INVALID_PERIOD,
    OVERLAPPING_BUDGET,
    IMMUTABLE,
    TRANSFER_LOCKED,
    INVALID_AMOUNT,
    INSUFFICIENT_BALANCE,
    INSUFFICIENT_SAVINGS,
    INSUFFICIENT_AVAILABLE_BALANCE,
    DUPLICATE_TRANSFER,
    ALREADY_TRANSFERRED,
    NOTHING_TO_TRANSFER,
    NOT_OVERRUN
}
