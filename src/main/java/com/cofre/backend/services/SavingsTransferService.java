package com.cofre.backend.services;

import java.math.BigDecimal;
import java.math.RoundingMode;
import java.time.Clock;
import java.time.LocalDateTime;
import java.time.YearMonth;
import java.util.List;
import java.util.UUID;

import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import com.cofre.backend.dto.savings.BudgetTransferResult;
import com.cofre.backend.dto.savings.CycleBudgetSummary;
import com.cofre.backend.dto.savings.SavingsOperationResult;
import com.cofre.backend.dto.savings.SurplusTransferResult;
import com.cofre.backend.dto.savings.TransferStatusResponse;
import com.cofre.backend.entities.Budget;
import com.cofre.backend.entities.BudgetCycle;
import com.cofre.backend.entities.Savings;
import com.cofre.backend.entities.TransferredCycle;
import com.cofre.backend.enums.BudgetStatus;
import com.cofre.backend.enums.SavingsSource;
import com.cofre.backend.enums.TransactionType;
import com.cofre.backend.exceptions.AlreadyTransferredException;
import com.cofre.backend.exceptions.BadRequestException;
import com.cofre.backend.exceptions.InsufficientFundsException;
import com.cofre.backend.exceptions.InvalidAmountException;
import com.cofre.backend.exceptions.NotOverrunException;
import com.cofre.backend.exceptions.NothingToTransferException;
import com.cofre.backend.exceptions.ResourceNotFoundException;
import com.cofre.backend.repositories.BudgetRepository;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;

/**
 * Movimentações entre orçamentos, saldo livre e poupança. Cada operação roda numa única
 * transação: se qualquer passo falhar, nada do que foi gravado antes permanece.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class SavingsTransferService {

    private static final BigDecimal ZERO = BigDecimal.ZERO;
    private static final int MONEY_SCALE = 2;

    private final BudgetRepository budgetRepository;
    private final BudgetService budgetService;
    private final LedgerQueryService ledgerQueryService;
    private final SavingsService savingsService;
    private final Clock clock;

    // ----- por orçamento (período explícito) -----

    /**
     * Deposita a sobra (valor - gasto) de um orçamento e marca o orçamento como
     * transferido. Depósito e marcação são atômicos.
     */
    @Transactional
    public BudgetTransferResult transferBudgetRemainder(UUID ownerId, UUID budgetId) {
        Budget budget = budgetRepository.findByIdAndOwnerIdForUpdate(budgetId, ownerId)
                .orElseThrow(() -> new ResourceNotFoundException("Orçamento não encontrado"));
        budgetService.applyCurrentStatus(budget);

        if (budget.isSavingsTransferred()) {
            throw new AlreadyTransferredException(budget.getId(), budget.getSavingsTransferAmount());
        }

        BigDecimal spent = spendingOf(ownerId, budget);
        BigDecimal remaining = money(budget.getAmount().subtract(spent));

        if (remaining.compareTo(ZERO) <= 0) {
            throw new NothingToTransferException(budget.getAmount(), spent, remaining);
        }

        SavingsOperationResult deposit = savingsService.deposit(
                ownerId,
                remaining,
                SavingsSource.BUDGET_REMAINDER,
                SavingsDescriptions.budgetRemainder(budget),
                null,
                budget.getId()
        );

        try {
            budget.setSavingsTransferred(true);
            budget.setSavingsTransferAmount(remaining);
            budget.setSavingsTransferDate(LocalDateTime.now(clock));
            budgetRepository.saveAndFlush(budget);
        } catch (RuntimeException e) {
            log.error("Falha ao marcar orçamento {} como transferido; depósito de {} será revertido", budget.getId(), remaining, e);
            throw e;
        }

        log.info("Sobra do orçamento {} transferida para a poupança de {}: {}", budget.getId(), ownerId, remaining);
        return new BudgetTransferResult(deposit.getSavings(), deposit.getTransaction(), budgetService.toResponse(budget));
    }

    /**
     * Cobre o estouro de um orçamento com a poupança. Sem valor informado, cobre o estouro
     * inteiro; com valor, cobre no máximo o estouro.
     */
    @Transactional
    public BudgetTransferResult coverBudgetOverrunById(UUID ownerId, UUID budgetId, BigDecimal requestedAmount) {
        Budget budget = budgetRepository.findByIdAndOwnerId(budgetId, ownerId)
                .orElseThrow(() -> new ResourceNotFoundException("Orçamento não encontrado"));
        budgetService.applyCurrentStatus(budget);

        BigDecimal spent = spendingOf(ownerId, budget);
        BigDecimal overrun = money(spent.subtract(budget.getAmount()));

        if (overrun.compareTo(ZERO) <= 0) {
            throw new NotOverrunException(budget.getId(), budget.getAmount(), spent);
        }

        BigDecimal cover = overrun;
        if (requestedAmount != null) {
            cover = requirePositive(requestedAmount).min(overrun);
        }

        Savings savings = savingsService.lockAccount(ownerId);
        if (savings.getBalance().compareTo(cover) < 0) {
            throw InsufficientFundsException.savings(money(savings.getBalance()), cover);
        }

        SavingsOperationResult withdrawal = savingsService.withdraw(
                ownerId,
                cover,
                SavingsSource.BUDGET_OVERRUN,
                SavingsDescriptions.budgetOverrun(budget),
                null,
                budget.getId()
        );

        log.info("Estouro do orçamento {} coberto pela poupança de {}: {}", budget.getId(), ownerId, cover);
        return new BudgetTransferResult(withdrawal.getSavings(), withdrawal.getTransaction(), budgetService.toResponse(budget));
    }

    // ----- saldo livre -----

    /**
     * Receitas - despesas (de todo o histórico) - saldo da poupança, nunca negativo.
     */
    @Transactional(readOnly = true)
    public BigDecimal getAvailableBalance(UUID ownerId) {
        return availableBalance(ownerId, savingsService.getBalance(ownerId));
    }

    @Transactional
    public SavingsOperationResult manualContribution(UUID ownerId, BigDecimal amount, String description) {
        BigDecimal value = requirePositive(amount);

        Savings savings = savingsService.lockAccount(ownerId);
        BigDecimal available = availableBalance(ownerId, savings.getBalance());
        if (value.compareTo(available) > 0) {
            throw InsufficientFundsException.availableBalance(available, value);
        }

        return savingsService.deposit(ownerId, value, SavingsSource.MANUAL, description, null, null);
    }

    @Transactional
    public SavingsOperationResult manualWithdrawal(UUID ownerId, BigDecimal amount, String description) {
        return savingsService.withdraw(ownerId, requirePositive(amount), SavingsSource.MANUAL, description, null, null);
    }

    // ----- ciclo mensal legado -----

    /**
     * Soma dos orçamentos do ciclo (exceto cancelados) contra o total de despesas do mês,
     * em todas as categorias.
     */
    @Transactional(readOnly = true)
    public CycleBudgetSummary calculateBudgetRemaining(UUID ownerId, int month, int year) {
        validateCycle(month, year);

        List<Budget> budgets = budgetRepository
                .findByOwnerIdAndMonthAndYearAndStatusNot(ownerId, month, year, BudgetStatus.CANCELLED);

        BigDecimal totalBudget = money(budgets.stream()
                .map(Budget::getAmount)
                .reduce(ZERO, BigDecimal::add));

        YearMonth cycle = YearMonth.of(year, month);
        BigDecimal totalSpent = ledgerQueryService.totalByTypeBetween(
                ownerId, TransactionType.EXPENSE, cycle.atDay(1), cycle.atEndOfMonth());

        BigDecimal remaining = money(totalBudget.subtract(totalSpent));
        boolean overBudget = remaining.compareTo(ZERO) < 0;

        return CycleBudgetSummary.builder()
                .month(month)
                .year(year)
                .totalBudget(totalBudget)
                .totalSpent(totalSpent)
                .remaining(remaining)
                .overBudget(overBudget)
                .overrunAmount(overBudget ? remaining.abs() : money(ZERO))
                .build();
    }

    /**
     * Transfere a sobra do ciclo para a poupança. Cada ciclo só pode ser transferido uma vez.
     */
    @Transactional
    public SurplusTransferResult transferBudgetSurplus(UUID ownerId, int month, int year) {
        CycleBudgetSummary summary = calculateBudgetRemaining(ownerId, month, year);

        if (summary.getRemaining().compareTo(ZERO) <= 0) {
            throw new NothingToTransferException(summary.getTotalBudget(), summary.getTotalSpent(), summary.getRemaining());
        }

        SavingsOperationResult deposit = savingsService.deposit(
                ownerId,
                summary.getRemaining(),
                SavingsSource.BUDGET_SURPLUS,
                SavingsDescriptions.cycleSurplus(month, year),
                BudgetCycle.of(month, year),
                null
        );

        log.info("Sobra do ciclo {}/{} transferida para a poupança de {}: {}", month, year, ownerId, summary.getRemaining());
        return new SurplusTransferResult(deposit.getSavings(), deposit.getTransaction(), summary);
    }

    @Transactional
    public SavingsOperationResult coverBudgetOverrun(UUID ownerId, BigDecimal amount, int month, int year) {
        validateCycle(month, year);
        BigDecimal value = requirePositive(amount);

        Savings savings = savingsService.lockAccount(ownerId);
        if (savings.getBalance().compareTo(value) < 0) {
            throw InsufficientFundsException.savings(money(savings.getBalance()), value);
        }

        SavingsOperationResult withdrawal = savingsService.withdraw(
                ownerId,
                value,
                SavingsSource.BUDGET_OVERRUN,
                SavingsDescriptions.cycleOverrun(month, year),
                BudgetCycle.of(month, year),
                null
        );

        log.info("Estouro do ciclo {}/{} coberto pela poupança de {}: {}", month, year, ownerId, value);
        return withdrawal;
    }

    @Transactional
    public TransferStatusResponse getTransferStatus(UUID ownerId, int month, int year) {
        CycleBudgetSummary summary = calculateBudgetRemaining(ownerId, month, year);
        Savings savings = savingsService.getOrCreate(ownerId);

        BigDecimal transferredAmount = savings.findTransferredCycle(month, year)
                .map(TransferredCycle::getAmount)
                .orElse(null);
        boolean alreadyTransferred = transferredAmount != null;
        BigDecimal balance = money(savings.getBalance());

        TransferStatusResponse response = new TransferStatusResponse();
        response.setMonth(month);
        response.setYear(year);
        response.setTotalBudget(summary.getTotalBudget());
        response.setTotalSpent(summary.getTotalSpent());
        response.setRemaining(summary.getRemaining());
        response.setOverBudget(summary.isOverBudget());
        response.setOverrunAmount(summary.getOverrunAmount());
        response.setCurrentSavings(balance);
        response.setAlreadyTransferred(alreadyTransferred);
        response.setTransferredAmount(transferredAmount);
        response.setCanTransferSurplus(summary.getRemaining().compareTo(ZERO) > 0 && !alreadyTransferred);
        response.setCanCoverOverrun(summary.isOverBudget() && balance.compareTo(summary.getOverrunAmount()) >= 0);
        return response;
    }

    private BigDecimal availableBalance(UUID ownerId, BigDecimal savingsBalance) {
        BigDecimal income = ledgerQueryService.totalByType(ownerId, TransactionType.INCOME);
        BigDecimal expense = ledgerQueryService.totalByType(ownerId, TransactionType.EXPENSE);
        BigDecimal available = money(income.subtract(expense).subtract(savingsBalance));
        return available.max(money(ZERO));
    }

    private BigDecimal spendingOf(UUID ownerId, Budget budget) {
        return ledgerQueryService.calculateSpending(
                ownerId, budget.getCategory().getId(), budget.getStartDate(), budget.getEndDate());
    }

    private void validateCycle(int month, int year) {
        if (month < 1 || month > 12) throw new BadRequestException("Mês deve estar entre 1 e 12");
        if (year < 2000 || year > 2100) throw new BadRequestException("Ano inválido");
    }

    private BigDecimal requirePositive(BigDecimal amount) {
        if (amount == null) throw new InvalidAmountException(null);
        BigDecimal value = money(amount);
        if (value.compareTo(ZERO) <= 0) throw new InvalidAmountException(amount);
        return value;
    }

    private BigDecimal money(BigDecimal value) {
        return value.setScale(MONEY_SCALE, RoundingMode.HALF_UP);
    }
}
