package com.cofre.backend.services;

import java.math.BigDecimal;
import java.math.RoundingMode;
import java.time.LocalDate;
import java.util.List;
import java.util.Optional;
import java.util.UUID;

import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import com.cofre.backend.dto.budget.BudgetMonthlySummaryResponse;
import com.cofre.backend.dto.budget.BudgetRequest;
import com.cofre.backend.dto.budget.BudgetResponse;
import com.cofre.backend.dto.budget.BudgetUpdateRequest;
import com.cofre.backend.entities.Budget;
import com.cofre.backend.entities.Category;
import com.cofre.backend.enums.BudgetPeriodType;
import com.cofre.backend.enums.BudgetStatus;
import com.cofre.backend.enums.CategoryType;
import com.cofre.backend.exceptions.BadRequestException;
import com.cofre.backend.exceptions.BudgetLockedException;
import com.cofre.backend.exceptions.InvalidAmountException;
import com.cofre.backend.exceptions.InvalidCategoryTypeException;
import com.cofre.backend.exceptions.OverlappingBudgetException;
import com.cofre.backend.exceptions.ResourceNotFoundException;
import com.cofre.backend.repositories.BudgetRepository;
import com.cofre.backend.repositories.CategoryRepository;
import com.cofre.backend.services.BudgetPeriodResolver.ResolvedPeriod;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;

@Slf4j
@Service
@RequiredArgsConstructor
public class BudgetService {

    private static final BigDecimal ONE_HUNDRED = new BigDecimal("100");
    private static final BigDecimal ZERO = BigDecimal.ZERO;
    private static final int MONEY_SCALE = 2;

    private final BudgetRepository budgetRepository;
    private final CategoryRepository categoryRepository;
    private final LedgerQueryService ledgerQueryService;
    private final BudgetPeriodResolver periodResolver;

    /**
     * Cria um orçamento ou, se já existir um do mesmo dono e categoria com exatamente o
     * mesmo período, atualiza o valor dele.
     */
    @Transactional
    public BudgetResponse createOrUpdate(UUID ownerId, BudgetRequest request) {
        if (request == null) throw new BadRequestException("Dados do orçamento são obrigatórios");

        BigDecimal amount = requirePositive(request.getAmount());

        // antes de qualquer leitura: o update em massa limpa o contexto de persistência
        refreshStatuses(ownerId);

        Category category = findExpenseCategoryOrThrow(ownerId, request.getCategoryId());
        ResolvedPeriod period = periodResolver.resolve(
                request.getStartDate(),
                request.getEndDate(),
                request.getMonth(),
                request.getYear(),
                request.getPeriodType()
        );

        // orçamentos encerrados (COMPLETED/CANCELLED) não restringem um novo período
        List<Budget> open = budgetRepository.findOverlapping(
                ownerId, category.getId(), period.startDate(), period.endDate(), BudgetStatus.TERMINAL);
        Optional<Budget> sameWindow = open.stream()
                .filter(b -> b.getStartDate().equals(period.startDate()) && b.getEndDate().equals(period.endDate()))
                .findFirst();

        if (sameWindow.isPresent()) {
            Budget existing = sameWindow.get();
            if (existing.isSavingsTransferred()) {
                throw BudgetLockedException.immutable(existing.getId());
            }
            rejectOverlap(open, existing.getId());

            existing.setAmount(amount);
            if (request.getPeriodType() != null) existing.setPeriodType(request.getPeriodType());
            if (request.getNotes() != null) existing.setNotes(request.getNotes().trim());

            Budget saved = budgetRepository.save(existing);
            log.info("Orçamento {} atualizado: categoria={}, valor={}", saved.getId(), category.getName(), amount);
            return toResponse(saved);
        }

        rejectOverlap(open, null);

        Budget budget = Budget.builder()
                .owner(category.getOwner())
                .category(category)
                .amount(amount)
                .startDate(period.startDate())
                .endDate(period.endDate())
                .periodType(period.periodType())
                .status(periodResolver.statusFor(period.startDate(), period.endDate()))
                .notes(request.getNotes() != null ? request.getNotes().trim() : "")
                .build();

        Budget saved = budgetRepository.save(budget);
        log.info("Orçamento {} criado: categoria={}, período={} a {}, valor={}",
                saved.getId(), category.getName(), saved.getStartDate(), saved.getEndDate(), amount);
        return toResponse(saved);
    }

    @Transactional
    public BudgetResponse getById(UUID budgetId, UUID ownerId) {
        Budget budget = findOwnedOrThrow(budgetId, ownerId);
        applyCurrentStatus(budget);
        return toResponse(budget);
    }

    /**
     * Orçamentos do dono, mais recentes primeiro. Filtros nulos são ignorados;
     * month/year filtram pelo ciclo legado (mês de início).
     */
    @Transactional
    public List<BudgetResponse> list(UUID ownerId, BudgetStatus status, Integer month, Integer year) {
        refreshStatuses(ownerId);

        List<Budget> budgets = status != null
                ? budgetRepository.findByOwnerIdAndStatusOrderByStartDateDesc(ownerId, status)
                : budgetRepository.findByOwnerIdOrderByStartDateDesc(ownerId);

        return budgets.stream()
                .filter(b -> month == null || month.equals(b.getMonth()))
                .filter(b -> year == null || year.equals(b.getYear()))
                .map(this::toResponse)
                .toList();
    }

    @Transactional
    public BudgetMonthlySummaryResponse getMonthlySummary(UUID ownerId, int month, int year) {
        if (month < 1 || month > 12) throw new BadRequestException("Mês deve estar entre 1 e 12");

        refreshStatuses(ownerId);

        List<BudgetResponse> budgets = budgetRepository
                .findByOwnerIdAndMonthAndYearAndStatusNot(ownerId, month, year, BudgetStatus.CANCELLED)
                .stream()
                .map(this::toResponse)
                .toList();

        BigDecimal totalBudget = budgets.stream().map(BudgetResponse::getAmount).reduce(ZERO, BigDecimal::add);
        BigDecimal totalSpent = budgets.stream().map(BudgetResponse::getSpent).reduce(ZERO, BigDecimal::add);

        BudgetMonthlySummaryResponse summary = new BudgetMonthlySummaryResponse();
        summary.setMonth(month);
        summary.setYear(year);
        summary.setBudgets(budgets);
        summary.setTotalBudget(money(totalBudget));
        summary.setTotalSpent(money(totalSpent));
        summary.setTotalRemaining(money(totalBudget.subtract(totalSpent)));
        summary.setOverallPercentage(percentage(totalSpent, totalBudget));
        summary.setBudgetCount(budgets.size());
        summary.setOverBudgetCount((int) budgets.stream().filter(BudgetResponse::isOverBudget).count());
        return summary;
    }

    @Transactional
    public BudgetResponse update(UUID budgetId, UUID ownerId, BudgetUpdateRequest request) {
        if (request == null) throw new BadRequestException("Dados do orçamento são obrigatórios");

        refreshStatuses(ownerId);
        Budget budget = findOwnedOrThrow(budgetId, ownerId);

        if (budget.isSavingsTransferred()) {
            throw BudgetLockedException.immutable(budget.getId());
        }

        if (request.getAmount() != null) {
            budget.setAmount(requirePositive(request.getAmount()));
        }

        LocalDate newStart = request.getStartDate() != null ? request.getStartDate() : budget.getStartDate();
        LocalDate newEnd = request.getEndDate() != null ? request.getEndDate() : budget.getEndDate();
        boolean periodChanged = !newStart.equals(budget.getStartDate()) || !newEnd.equals(budget.getEndDate());

        if (periodChanged) {
            periodResolver.validate(newStart, newEnd);
            ensureNoOverlap(ownerId, budget.getCategory().getId(), newStart, newEnd, budget.getId());

            budget.setStartDate(newStart);
            budget.setEndDate(newEnd);
            if (budget.getStatus() != BudgetStatus.CANCELLED) {
                budget.setStatus(periodResolver.statusFor(newStart, newEnd));
            }
        }

        if (request.getPeriodType() != null) {
            budget.setPeriodType(request.getPeriodType());
        } else if (periodChanged && budget.getPeriodType() == BudgetPeriodType.MONTHLY) {
            budget.setPeriodType(BudgetPeriodType.CUSTOM);
        }

        if (request.getNotes() != null) {
            budget.setNotes(request.getNotes().trim());
        }

        Budget saved = budgetRepository.save(budget);
        log.info("Orçamento {} atualizado", saved.getId());
        return toResponse(saved);
    }

    /**
     * Avança o status dos orçamentos do dono conforme a data de hoje. Só transições
     * para frente; orçamentos cancelados não mudam.
     */
    @Transactional
    public void refreshStatuses(UUID ownerId) {
        LocalDate today = periodResolver.today();
        int completed = budgetRepository.completeEnded(ownerId, today);
        int activated = budgetRepository.activateStarted(ownerId, today);
        if (completed > 0 || activated > 0) {
            log.debug("Status de orçamentos atualizados para {}: {} ativados, {} concluídos", ownerId, activated, completed);
        }
    }

    @Transactional
    public void delete(UUID budgetId, UUID ownerId) {
        Budget budget = findOwnedOrThrow(budgetId, ownerId);

        if (budget.isSavingsTransferred()) {
            throw BudgetLockedException.transferLocked(budget.getId());
        }

        budgetRepository.delete(budget);
        log.info("Orçamento {} removido", budgetId);
    }

    /** Orçamentos concluídos, ainda não transferidos e com sobra. */
    @Transactional
    public List<BudgetResponse> getEndedForTransfer(UUID ownerId) {
        refreshStatuses(ownerId);

        return budgetRepository
                .findByOwnerIdAndStatusAndSavingsTransferredFalseOrderByEndDateAsc(ownerId, BudgetStatus.COMPLETED)
                .stream()
                .map(this::toResponse)
                .filter(r -> r.getRemaining().compareTo(ZERO) > 0)
                .toList();
    }

    /** Orçamentos ativos com gasto acima do valor. */
    @Transactional
    public List<BudgetResponse> getOverrunBudgets(UUID ownerId) {
        refreshStatuses(ownerId);

        return budgetRepository
                .findByOwnerIdAndStatusOrderByStartDateDesc(ownerId, BudgetStatus.ACTIVE)
                .stream()
                .map(this::toResponse)
                .filter(BudgetResponse::isOverBudget)
                .toList();
    }

    void applyCurrentStatus(Budget budget) {
        BudgetStatus current = periodResolver.currentStatus(budget);
        if (current != budget.getStatus()) {
            log.debug("Orçamento {}: {} -> {}", budget.getId(), budget.getStatus(), current);
            budget.setStatus(current);
        }
    }

    BudgetResponse toResponse(Budget budget) {
        BigDecimal amount = budget.getAmount();
        BigDecimal spent = ledgerQueryService.calculateSpending(
                budget.getOwner().getId(),
                budget.getCategory().getId(),
                budget.getStartDate(),
                budget.getEndDate()
        );
        BigDecimal remaining = money(amount.subtract(spent));
        boolean overBudget = spent.compareTo(amount) > 0;

        BudgetResponse response = new BudgetResponse();
        response.setId(budget.getId());

        Category category = budget.getCategory();
        response.setCategoryId(category.getId());
        response.setCategoryName(category.getName());
        response.setCategoryIcon(category.getIcon());
        response.setCategoryColor(category.getColor());

        response.setAmount(amount);
        response.setStartDate(budget.getStartDate());
        response.setEndDate(budget.getEndDate());
        response.setPeriodType(budget.getPeriodType());
        response.setStatus(budget.getStatus());
        response.setMonth(budget.getStartDate().getMonthValue());
        response.setYear(budget.getStartDate().getYear());
        response.setDaysRemaining(periodResolver.daysRemaining(budget));
        response.setTotalDays(periodResolver.totalDays(budget));
        response.setPeriodProgress(periodResolver.periodProgress(budget));

        response.setSpent(spent);
        response.setRemaining(remaining);
        response.setPercentage(percentage(spent, amount));
        response.setOverBudget(overBudget);
        response.setOverrun(overBudget ? money(spent.subtract(amount)) : money(ZERO));

        response.setSavingsTransferred(budget.isSavingsTransferred());
        response.setSavingsTransferAmount(budget.getSavingsTransferAmount());
        response.setSavingsTransferDate(budget.getSavingsTransferDate());
        response.setNotes(budget.getNotes());

        response.setCreatedAt(budget.getCreatedAt());
        response.setUpdatedAt(budget.getUpdatedAt());
        return response;
    }

    private Budget findOwnedOrThrow(UUID budgetId, UUID ownerId) {
        return budgetRepository.findByIdAndOwnerId(budgetId, ownerId)
                .orElseThrow(() -> new ResourceNotFoundException("Orçamento não encontrado"));
    }

    private Category findExpenseCategoryOrThrow(UUID ownerId, UUID categoryId) {
        if (categoryId == null) throw new BadRequestException("Categoria é obrigatória");

        Category category = categoryRepository.findByIdAndOwnerId(categoryId, ownerId)
                .orElseThrow(() -> new ResourceNotFoundException("Categoria não encontrada"));

        if (category.getType() != CategoryType.EXPENSE) {
            throw new InvalidCategoryTypeException(categoryId);
        }
        return category;
    }

    private void ensureNoOverlap(UUID ownerId, UUID categoryId, LocalDate start, LocalDate end, UUID ignoredBudgetId) {
        rejectOverlap(budgetRepository.findOverlapping(ownerId, categoryId, start, end, BudgetStatus.TERMINAL), ignoredBudgetId);
    }

    private void rejectOverlap(List<Budget> candidates, UUID ignoredBudgetId) {
        candidates.stream()
                .filter(b -> !b.getId().equals(ignoredBudgetId))
                .findFirst()
                .ifPresent(conflict -> {
                    throw new OverlappingBudgetException(conflict.getId(), conflict.getStartDate(), conflict.getEndDate());
                });
    }

    private BigDecimal requirePositive(BigDecimal value) {
        if (value == null) throw new InvalidAmountException(null);
        BigDecimal rounded = money(value);
        if (rounded.compareTo(ZERO) <= 0) throw new InvalidAmountException(value);
        return rounded;
    }

    private int percentage(BigDecimal spent, BigDecimal amount) {
        if (amount.compareTo(ZERO) <= 0) return 0;
        return spent
                .multiply(ONE_HUNDRED)
                .divide(amount, 0, RoundingMode.HALF_UP)
                .intValue();
    }

    private BigDecimal money(BigDecimal value) {
        return value.setScale(MONEY_SCALE, RoundingMode.HALF_UP);
    }
}
