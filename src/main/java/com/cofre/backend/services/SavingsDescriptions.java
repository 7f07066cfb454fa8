package com.cofre.backend.services;

import java.time.LocalDate;
import java.time.format.DateTimeFormatter;

import com.cofre.backend.entities.Budget;
import com.cofre.backend.entities.BudgetCycle;
import com.cofre.backend.enums.SavingsSource;
import com.cofre.backend.enums.SavingsTransactionType;

/**
 * Textos padrão dos lançamentos da poupança.
 */
public final class SavingsDescriptions {

    private static final String[] MONTH_NAMES = {
            "Janeiro", "Fevereiro", "Março", "Abril", "Maio", "Junho",
            "Julho", "Agosto", "Setembro", "Outubro", "Novembro", "Dezembro"
    };

    private static final DateTimeFormatter DATE_FORMAT = DateTimeFormatter.ofPattern("dd/MM/yyyy");

    private SavingsDescriptions() {
    }

    public static String defaultFor(SavingsSource source, SavingsTransactionType type, BudgetCycle cycle) {
        String cycleSuffix = cycle != null && cycle.getMonth() != null && cycle.getYear() != null
                ? " de " + cycle.getMonth() + "/" + cycle.getYear()
                : "";

        return switch (source) {
            case BUDGET_SURPLUS -> "Transferência da sobra do orçamento" + cycleSuffix;
            case BUDGET_REMAINDER -> "Sobra de orçamento transferida";
            case BUDGET_OVERRUN -> "Cobertura de estouro do orçamento" + cycleSuffix;
            case MANUAL -> type == SavingsTransactionType.CREDIT ? "Depósito manual" : "Saque manual";
            case GOAL_CONTRIBUTION -> "Contribuição para meta";
            case INTEREST -> "Rendimento";
        };
    }

    public static String monthName(int month) {
        if (month < 1 || month > 12) {
            return "Desconhecido";
        }
        return MONTH_NAMES[month - 1];
    }

    /** Ex: "Sobra do orçamento de Janeiro 2024". */
    public static String cycleSurplus(int month, int year) {
        return "Sobra do orçamento de " + monthName(month) + " " + year;
    }

    /** Ex: "Cobertura de estouro de Janeiro 2024". */
    public static String cycleOverrun(int month, int year) {
        return "Cobertura de estouro de " + monthName(month) + " " + year;
    }

    /** Ex: "Sobra do orçamento Mercado (01/01/2024 a 31/01/2024)". */
    public static String budgetRemainder(Budget budget) {
        return "Sobra do orçamento " + budget.getCategory().getName() + " " + period(budget.getStartDate(), budget.getEndDate());
    }

    public static String budgetOverrun(Budget budget) {
        return "Cobertura de estouro do orçamento " + budget.getCategory().getName() + " " + period(budget.getStartDate(), budget.getEndDate());
    }

    private static String period(LocalDate start, LocalDate end) {
        return "(" + DATE_FORMAT.format(start) + " a " + DATE_FORMAT.format(end) + ")";
    }
}
