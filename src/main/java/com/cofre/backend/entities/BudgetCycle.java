package com.cofre.backend.entities;

import jakarta.persistence.Column;
import jakarta.persistence.Embeddable;
import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

@Embeddable
@Data
@NoArgsConstructor
@AllArgsConstructor
public class BudgetCycle {

    @Column(name = "cycle_month")
    private Integer month;

    @Column(name = "cycle_year")
    private Integer year;

    public static BudgetCycle of(int month, int year) {
        return new BudgetCycle(month, year);
    }
}
