package com.cofre.backend.dto.savings;

import java.math.BigDecimal;
import java.util.UUID;

import jakarta.validation.constraints.NotNull;
import lombok.Data;

/** Transferência de sobra / cobertura de estouro de um orçamento específico. */
@Data
public class BudgetSavingsRequest {

    @NotNull(message = "Orçamento é obrigatório")
    private UUID budgetId;

    // opcional: sem valor cobre o estouro inteiro
    private BigDecimal amount;
}
