package com.cofre.backend.dto.budget;

import java.math.BigDecimal;
import java.time.LocalDate;
import java.util.UUID;

import com.cofre.backend.enums.BudgetPeriodType;

import jakarta.validation.constraints.Max;
import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.Size;
import lombok.Data;

/**
 * Período explícito (startDate/endDate) ou legado (month/year). Se os dois vierem,
 * o explícito vale.
 */
@Data
public class BudgetRequest {

    @NotNull(message = "Categoria é obrigatória")
    private UUID categoryId;

    @NotNull(message = "Valor é obrigatório")
    private BigDecimal amount;

    private LocalDate startDate;
    private LocalDate endDate;

    @Min(value = 1, message = "Mês deve estar entre 1 e 12")
    @Max(value = 12, message = "Mês deve estar entre 1 e 12")
    private Integer month;

    @Min(value = 2000, message = "Ano inválido")
    @Max(value = 2100, message = "Ano inválido")
    private Integer year;

    private BudgetPeriodType periodType;

    @Size(max = 500, message = "Observações não podem passar de 500 caracteres")
    private String notes;
}
