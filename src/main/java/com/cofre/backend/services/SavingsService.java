package com.cofre.backend.services;

import java.math.BigDecimal;
import java.math.RoundingMode;
import java.time.Clock;
import java.time.LocalDate;
import java.time.LocalDateTime;
import java.time.YearMonth;
import java.util.Comparator;
import java.util.List;
import java.util.Map;
import java.util.TreeMap;
import java.util.UUID;

import org.springframework.dao.DataIntegrityViolationException;
import org.springframework.data.domain.Page;
import org.springframework.data.domain.PageRequest;
import org.springframework.data.domain.Sort;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import com.cofre.backend.config.SavingsProperties;
import com.cofre.backend.dto.savings.SavingsOperationResult;
import com.cofre.backend.dto.savings.SavingsOverviewResponse;
import com.cofre.backend.dto.savings.SavingsResponse;
import com.cofre.backend.dto.savings.SavingsStatisticsResponse;
import com.cofre.backend.dto.savings.SavingsTransactionFilter;
import com.cofre.backend.dto.savings.SavingsTransactionPageResponse;
import com.cofre.backend.dto.savings.SavingsTransactionResponse;
import com.cofre.backend.dto.savings.TransferredCycleResponse;
import com.cofre.backend.entities.BudgetCycle;
import com.cofre.backend.entities.Savings;
import com.cofre.backend.entities.SavingsTransaction;
import com.cofre.backend.enums.SavingsSource;
import com.cofre.backend.enums.SavingsTransactionType;
import com.cofre.backend.exceptions.BadRequestException;
import com.cofre.backend.exceptions.DuplicateTransferException;
import com.cofre.backend.exceptions.InsufficientFundsException;
import com.cofre.backend.exceptions.InvalidAmountException;
import com.cofre.backend.repositories.SavingsRepository;
import com.cofre.backend.repositories.SavingsTransactionRepository;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;

/**
 * Livro-razão da poupança. Todo crédito ou débito passa por {@link #deposit} ou
 * {@link #withdraw}: saldo, acumuladores e o registro de auditoria são gravados juntos,
 * com a linha da poupança travada até o fim da transação.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class SavingsService {

    private static final BigDecimal ZERO = BigDecimal.ZERO;
    private static final int MONEY_SCALE = 2;

    private final SavingsRepository savingsRepository;
    private final SavingsTransactionRepository savingsTransactionRepository;
    private final SavingsAccountInitializer accountInitializer;
    private final SavingsProperties properties;
    private final Clock clock;

    /**
     * Devolve a poupança do dono, criando uma vazia no primeiro acesso.
     */
    @Transactional
    public Savings getOrCreate(UUID ownerId) {
        ensureAccount(ownerId);
        return savingsRepository.findByOwnerId(ownerId)
                .orElseThrow(() -> new IllegalStateException("Poupança não encontrada após criação: " + ownerId));
    }

    /**
     * Trava a linha da poupança do dono até o fim da transação corrente. Deve ser o
     * primeiro carregamento da entidade na transação, senão o estado lido pode estar velho.
     */
    @Transactional
    public Savings lockAccount(UUID ownerId) {
        ensureAccount(ownerId);
        return savingsRepository.findByOwnerIdForUpdate(ownerId)
                .orElseThrow(() -> new IllegalStateException("Poupança não encontrada após criação: " + ownerId));
    }

    @Transactional(readOnly = true)
    public BigDecimal getBalance(UUID ownerId) {
        return savingsRepository.findBalanceByOwnerId(ownerId)
                .map(this::money)
                .orElse(money(ZERO));
    }

    @Transactional
    public SavingsOperationResult deposit(
            UUID ownerId,
            BigDecimal amount,
            SavingsSource source,
            String description,
            BudgetCycle cycle,
            UUID relatedBudgetId
    ) {
        BigDecimal value = requirePositive(amount);
        Savings savings = lockAccount(ownerId);

        boolean tracksCycle = source == SavingsSource.BUDGET_SURPLUS && cycle != null;
        if (tracksCycle && savings.isCycleTransferred(cycle.getMonth(), cycle.getYear())) {
            log.warn("Sobra de {}/{} já transferida para a poupança de {}", cycle.getMonth(), cycle.getYear(), ownerId);
            throw new DuplicateTransferException(cycle.getMonth(), cycle.getYear());
        }

        LocalDateTime now = LocalDateTime.now(clock);
        savings.setBalance(money(savings.getBalance().add(value)));
        savings.setTotalDeposits(money(savings.getTotalDeposits().add(value)));
        savings.setLastTransactionDate(now);
        if (tracksCycle) {
            savings.addTransferredCycle(cycle.getMonth(), cycle.getYear(), value, now);
        }

        Savings saved = flushAccount(savings, tracksCycle ? cycle : null);
        SavingsTransaction transaction = record(saved, SavingsTransactionType.CREDIT, value, source, description, cycle, relatedBudgetId, now);

        log.info("Crédito na poupança de {}: valor={}, origem={}, saldo={}", ownerId, value, source, saved.getBalance());
        return new SavingsOperationResult(toResponse(saved), toTransactionResponse(transaction));
    }

    @Transactional
    public SavingsOperationResult withdraw(
            UUID ownerId,
            BigDecimal amount,
            SavingsSource source,
            String description,
            BudgetCycle cycle,
            UUID relatedBudgetId
    ) {
        BigDecimal value = requirePositive(amount);
        Savings savings = lockAccount(ownerId);

        if (savings.getBalance().compareTo(value) < 0) {
            throw InsufficientFundsException.balance(money(savings.getBalance()), value);
        }

        LocalDateTime now = LocalDateTime.now(clock);
        savings.setBalance(money(savings.getBalance().subtract(value)));
        savings.setTotalWithdrawals(money(savings.getTotalWithdrawals().add(value)));
        savings.setLastTransactionDate(now);

        Savings saved = flushAccount(savings, null);
        SavingsTransaction transaction = record(saved, SavingsTransactionType.DEBIT, value, source, description, cycle, relatedBudgetId, now);

        log.info("Débito na poupança de {}: valor={}, origem={}, saldo={}", ownerId, value, source, saved.getBalance());
        return new SavingsOperationResult(toResponse(saved), toTransactionResponse(transaction));
    }

    /**
     * Poupança + últimos lançamentos + movimento do mês corrente.
     */
    @Transactional
    public SavingsOverviewResponse getSavings(UUID ownerId) {
        Savings savings = getOrCreate(ownerId);

        List<SavingsTransactionResponse> recent = savingsTransactionRepository
                .findByOwnerIdOrderByCreatedAtDesc(ownerId, PageRequest.of(0, properties.recentTransactionsLimit()))
                .stream()
                .map(this::toTransactionResponse)
                .toList();

        LocalDateTime monthStart = YearMonth.now(clock).atDay(1).atStartOfDay();
        List<SavingsTransaction> thisMonth = savingsTransactionRepository
                .findByOwnerIdAndCreatedAtGreaterThanEqualOrderByCreatedAtAsc(ownerId, monthStart);

        BigDecimal deposits = sumOf(thisMonth, SavingsTransactionType.CREDIT);
        BigDecimal withdrawals = sumOf(thisMonth, SavingsTransactionType.DEBIT);

        SavingsOverviewResponse response = new SavingsOverviewResponse();
        response.setSavings(toResponse(savings));
        response.setRecentTransactions(recent);
        response.setMonthlyDeposits(deposits);
        response.setMonthlyWithdrawals(withdrawals);
        response.setMonthlyNet(money(deposits.subtract(withdrawals)));
        return response;
    }

    @Transactional(readOnly = true)
    public SavingsTransactionPageResponse getTransactions(UUID ownerId, SavingsTransactionFilter filter) {
        SavingsTransactionFilter f = filter != null ? filter : new SavingsTransactionFilter();

        int page = f.getPage() != null ? f.getPage() : 1;
        int limit = f.getLimit() != null ? f.getLimit() : properties.defaultPageSize();

        if (page < 1) throw new BadRequestException("Página deve ser maior ou igual a 1");
        if (limit < 1 || limit > properties.maxPageSize()) {
            throw new BadRequestException("Limite deve estar entre 1 e " + properties.maxPageSize());
        }
        if (f.getStartDate() != null && f.getEndDate() != null && f.getEndDate().isBefore(f.getStartDate())) {
            throw new BadRequestException("Data final deve ser posterior à data inicial");
        }

        Page<SavingsTransaction> result = savingsTransactionRepository.search(
                ownerId,
                f.getType(),
                f.getSource(),
                f.getStartDate(),
                f.getEndDate(),
                PageRequest.of(page - 1, limit, Sort.by(Sort.Direction.DESC, "createdAt"))
        );

        SavingsTransactionPageResponse response = new SavingsTransactionPageResponse();
        response.setTransactions(result.getContent().stream().map(this::toTransactionResponse).toList());
        response.setPage(page);
        response.setLimit(limit);
        response.setTotal(result.getTotalElements());
        response.setPages(result.getTotalPages());
        response.setHasMore(result.hasNext());
        return response;
    }

    /**
     * Totais da poupança, movimento mês a mês dos últimos meses e distribuição por origem.
     */
    @Transactional
    public SavingsStatisticsResponse getStatistics(UUID ownerId) {
        Savings savings = getOrCreate(ownerId);

        LocalDateTime since = LocalDate.now(clock)
                .minusMonths(properties.statisticsMonths())
                .atStartOfDay();

        // (ano, mês, tipo) -> total, em ordem cronológica
        Map<String, SavingsStatisticsResponse.MonthlyTotal> monthly = new TreeMap<>();
        for (SavingsTransaction tx : savingsTransactionRepository
                .findByOwnerIdAndCreatedAtGreaterThanEqualOrderByCreatedAtAsc(ownerId, since)) {
            LocalDateTime at = tx.getCreatedAt();
            String key = String.format("%04d-%02d-%s", at.getYear(), at.getMonthValue(), tx.getType());
            SavingsStatisticsResponse.MonthlyTotal total = monthly.computeIfAbsent(key, k ->
                    new SavingsStatisticsResponse.MonthlyTotal(at.getYear(), at.getMonthValue(), tx.getType(), money(ZERO)));
            total.setTotal(money(total.getTotal().add(tx.getAmount())));
        }

        List<SavingsStatisticsResponse.SourceTotal> bySource = savingsTransactionRepository.sumBySource(ownerId)
                .stream()
                .map(v -> new SavingsStatisticsResponse.SourceTotal(
                        v.getSource(),
                        v.getType(),
                        money(v.getTotal() != null ? v.getTotal() : ZERO),
                        v.getCount() != null ? v.getCount() : 0L))
                .sorted(Comparator.comparing(SavingsStatisticsResponse.SourceTotal::getTotal).reversed())
                .toList();

        SavingsStatisticsResponse response = new SavingsStatisticsResponse();
        response.setCurrentBalance(money(savings.getBalance()));
        response.setTotalDeposits(money(savings.getTotalDeposits()));
        response.setTotalWithdrawals(money(savings.getTotalWithdrawals()));
        response.setNetSavings(money(savings.getTotalDeposits().subtract(savings.getTotalWithdrawals())));
        response.setTransactionCount(savingsTransactionRepository.countByOwnerId(ownerId));
        response.setMonthlyBreakdown(List.copyOf(monthly.values()));
        response.setSourceBreakdown(bySource);
        response.setTransferredCycles(toCycleResponses(savings));
        return response;
    }

    public SavingsResponse toResponse(Savings savings) {
        SavingsResponse response = new SavingsResponse();
        response.setId(savings.getId());
        response.setBalance(money(savings.getBalance()));
        response.setTotalDeposits(money(savings.getTotalDeposits()));
        response.setTotalWithdrawals(money(savings.getTotalWithdrawals()));
        response.setLastTransactionDate(savings.getLastTransactionDate());
        response.setTransferredCycles(toCycleResponses(savings));
        response.setCreatedAt(savings.getCreatedAt());
        response.setUpdatedAt(savings.getUpdatedAt());
        return response;
    }

    private void ensureAccount(UUID ownerId) {
        if (!savingsRepository.existsByOwnerId(ownerId)) {
            accountInitializer.createIfAbsent(ownerId);
        }
    }

    private Savings flushAccount(Savings savings, BudgetCycle trackedCycle) {
        try {
            return savingsRepository.saveAndFlush(savings);
        } catch (DataIntegrityViolationException e) {
            if (trackedCycle == null) {
                throw e;
            }
            log.warn("Transferência concorrente da sobra de {}/{} barrada pela unique", trackedCycle.getMonth(), trackedCycle.getYear());
            throw new DuplicateTransferException(trackedCycle.getMonth(), trackedCycle.getYear());
        }
    }

    private SavingsTransaction record(
            Savings savings,
            SavingsTransactionType type,
            BigDecimal value,
            SavingsSource source,
            String description,
            BudgetCycle cycle,
            UUID relatedBudgetId,
            LocalDateTime now
    ) {
        String text = description != null && !description.isBlank()
                ? description.trim()
                : SavingsDescriptions.defaultFor(source, type, cycle);

        SavingsTransaction transaction = SavingsTransaction.builder()
                .owner(savings.getOwner())
                .type(type)
                .amount(value)
                .source(source)
                .description(text)
                .budgetCycle(cycle)
                .relatedBudgetId(relatedBudgetId)
                .balanceAfter(savings.getBalance())
                .createdAt(now)
                .build();

        return savingsTransactionRepository.save(transaction);
    }

    private BigDecimal sumOf(List<SavingsTransaction> transactions, SavingsTransactionType type) {
        return money(transactions.stream()
                .filter(t -> t.getType() == type)
                .map(SavingsTransaction::getAmount)
                .reduce(ZERO, BigDecimal::add));
    }

    private List<TransferredCycleResponse> toCycleResponses(Savings savings) {
        return savings.getTransferredCycles().stream()
                .map(c -> new TransferredCycleResponse(c.getMonth(), c.getYear(), c.getAmount(), c.getTransferredAt()))
                .toList();
    }

    SavingsTransactionResponse toTransactionResponse(SavingsTransaction transaction) {
        SavingsTransactionResponse response = new SavingsTransactionResponse();
        response.setId(transaction.getId());
        response.setType(transaction.getType());
        response.setAmount(transaction.getAmount());
        response.setSignedAmount(transaction.getSignedAmount());
        response.setSource(transaction.getSource());
        response.setDescription(transaction.getDescription());
        if (transaction.getBudgetCycle() != null) {
            response.setCycleMonth(transaction.getBudgetCycle().getMonth());
            response.setCycleYear(transaction.getBudgetCycle().getYear());
        }
        response.setRelatedBudgetId(transaction.getRelatedBudgetId());
        response.setBalanceAfter(transaction.getBalanceAfter());
        response.setCreatedAt(transaction.getCreatedAt());
        return response;
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
