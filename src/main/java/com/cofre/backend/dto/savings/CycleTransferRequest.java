package com.cofre.backend.dto.savings;

import java.math.BigDecimal;

import jakarta.validation.constraints.Max;
import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotNull;
import lombok.Data;

/** Fluxo legado por ciclo. {@code amount} só é usado na cobertura de estouro. */
@Data
public class CycleTransferRequest {

    private BigDecimal amount;

    @NotNull(message = "Mês é obrigatório")
    @Min(value = 1, message = "Mês deve estar entre 1 e 12")
    @Max(value = 12, message = "Mês deve estar entre 1 e 12")
    private Integer month;

    @NotNull(message = "Ano é obrigatório")
    @Min(value = 2000, message = "Ano inválido")
    @Max(value = 2100, message = "Ano inválido")
    private Integer year;
}
