package com.cofre.backend.exceptions;

import java.math.BigDecimal;
import java.util.Map;

import lombok.Getter;

@Getter
public class InsufficientFundsException extends BusinessException {

    private final BigDecimal available;
    private final BigDecimal required;

    private InsufficientFundsException(ErrorCode code, String label, BigDecimal available, BigDecimal required) {
        super(code,
                String.format("%s. Disponível: %s, Necessário: %s", label, available.toPlainString(), required.toPlainString()),
                Map.of("available", available, "required", required));
        this.available = available;
        this.required = required;
    }

    /** Saldo da poupança insuficiente no ledger. */
    public static InsufficientFundsException balance(BigDecimal available, BigDecimal required) {
        return new InsufficientFundsException(ErrorCode.INSUFFICIENT_BALANCE, "Saldo da poupança insuficiente", available, required);
    }

    /** Poupança não cobre o estouro pedido. */
    public static InsufficientFundsException savings(BigDecimal available, BigDecimal required) {
        return new InsufficientFundsException(ErrorCode.INSUFFICIENT_SAVINGS, "Poupança insuficiente", available, required);
    }

    /** Saldo livre (receitas - despesas - poupança) menor que a contribuição. */
    public static InsufficientFundsException availableBalance(BigDecimal available, BigDecimal required) {
        return new InsufficientFundsException(ErrorCode.INSUFFICIENT_AVAILABLE_BALANCE, "Saldo disponível insuficiente", available, required);
    }
}
