package com.cofre.backend.dto.budget;

import java.math.BigDecimal;
import java.time.LocalDate;

import com.cofre.backend.enums.BudgetPeriodType;

import jakarta.validation.constraints.Size;
import lombok.Data;

/** Campos nulos mantêm o valor atual. */
@Data
public class BudgetUpdateRequest {

    private BigDecimal amount;
    private LocalDate startDate;
    private LocalDate endDate;
    private BudgetPeriodType periodType;

    @Size(max = 500, message = "Observações não podem passar de 500 caracteres")
    private String notes;
}
