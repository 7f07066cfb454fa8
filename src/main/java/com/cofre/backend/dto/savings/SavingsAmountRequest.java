package com.cofre.backend.dto.savings;

import java.math.BigDecimal;

import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.Size;
import lombok.Data;

/** Contribuição manual ou saque manual. */
@Data
public class SavingsAmountRequest {

    @NotNull(message = "Valor é obrigatório")
    private BigDecimal amount;

    @Size(max = 500, message = "Descrição não pode passar de 500 caracteres")
    private String description;
}
