package com.cofre.backend.services;

import java.time.Clock;
import java.time.LocalDate;
import java.time.YearMonth;
import java.time.temporal.ChronoUnit;

import org.springframework.stereotype.Component;

import com.cofre.backend.entities.Budget;
import com.cofre.backend.enums.BudgetPeriodType;
import com.cofre.backend.enums.BudgetStatus;
import com.cofre.backend.exceptions.InvalidPeriodException;
import com.cofre.backend.exceptions.MissingPeriodException;

import lombok.RequiredArgsConstructor;

/**
 * Regras de período e de status dos orçamentos, todas relativas ao {@link Clock}
 * da aplicação. Datas de início e fim são inclusivas.
 */
@Component
@RequiredArgsConstructor
public class BudgetPeriodResolver {

    private final Clock clock;

    public record ResolvedPeriod(LocalDate startDate, LocalDate endDate, BudgetPeriodType periodType) {
    }

    public LocalDate today() {
        return LocalDate.now(clock);
    }

    /**
     * Período explícito tem prioridade; sem ele, usa o mês legado inteiro.
     */
    public ResolvedPeriod resolve(
            LocalDate startDate,
            LocalDate endDate,
            Integer month,
            Integer year,
            BudgetPeriodType requestedType
    ) {
        if (startDate != null && endDate != null) {
            validate(startDate, endDate);
            BudgetPeriodType type = requestedType != null ? requestedType : BudgetPeriodType.CUSTOM;
            return new ResolvedPeriod(startDate, endDate, type);
        }

        if (month != null && year != null) {
            YearMonth cycle = YearMonth.of(year, month);
            return new ResolvedPeriod(cycle.atDay(1), cycle.atEndOfMonth(), BudgetPeriodType.MONTHLY);
        }

        throw new MissingPeriodException();
    }

    public void validate(LocalDate startDate, LocalDate endDate) {
        if (!endDate.isAfter(startDate)) {
            throw new InvalidPeriodException(startDate, endDate);
        }
    }

    public BudgetStatus statusFor(LocalDate startDate, LocalDate endDate) {
        LocalDate today = today();
        if (today.isBefore(startDate)) {
            return BudgetStatus.UPCOMING;
        }
        if (today.isAfter(endDate)) {
            return BudgetStatus.COMPLETED;
        }
        return BudgetStatus.ACTIVE;
    }

    /**
     * Status atual considerando só transições para frente (UPCOMING → ACTIVE → COMPLETED).
     * CANCELLED e COMPLETED nunca mudam aqui.
     */
    public BudgetStatus currentStatus(Budget budget) {
        BudgetStatus stored = budget.getStatus();
        if (stored.isTerminal()) {
            return stored;
        }
        BudgetStatus computed = statusFor(budget.getStartDate(), budget.getEndDate());
        return computed.ordinal() > stored.ordinal() ? computed : stored;
    }

    public long totalDays(Budget budget) {
        return ChronoUnit.DAYS.between(budget.getStartDate(), budget.getEndDate()) + 1;
    }

    public long daysRemaining(Budget budget) {
        if (budget.getStatus().isTerminal()) return 0;
        LocalDate today = today();
        if (today.isAfter(budget.getEndDate())) return 0;
        if (today.isBefore(budget.getStartDate())) return totalDays(budget);
        return ChronoUnit.DAYS.between(today, budget.getEndDate()) + 1;
    }

    public int periodProgress(Budget budget) {
        if (budget.getStatus().isTerminal()) return 100;
        LocalDate today = today();
        if (today.isBefore(budget.getStartDate())) return 0;
        if (today.isAfter(budget.getEndDate())) return 100;
        long elapsed = ChronoUnit.DAYS.between(budget.getStartDate(), today);
        return (int) Math.round(elapsed * 100.0 / totalDays(budget));
    }
}
