package com.cofre.backend.services;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertNotNull;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.ArgumentMatchers.isNull;
import static org.mockito.Mockito.inOrder;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.verifyNoInteractions;
import static org.mockito.Mockito.when;

import java.math.BigDecimal;
import java.time.Clock;
import java.time.LocalDateTime;
import java.time.ZoneId;
import java.time.ZoneOffset;
import java.util.List;
import java.util.Optional;
import java.util.UUID;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.InOrder;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.dao.DataIntegrityViolationException;
import org.springframework.data.domain.PageImpl;
import org.springframework.data.domain.PageRequest;
import org.springframework.data.domain.Pageable;
import org.springframework.data.domain.Sort;

import com.cofre.backend.config.SavingsProperties;
import com.cofre.backend.dto.savings.SavingsOperationResult;
import com.cofre.backend.dto.savings.SavingsStatisticsResponse;
import com.cofre.backend.dto.savings.SavingsTransactionFilter;
import com.cofre.backend.dto.savings.SavingsTransactionPageResponse;
import com.cofre.backend.entities.BudgetCycle;
import com.cofre.backend.entities.Person;
import com.cofre.backend.entities.Savings;
import com.cofre.backend.entities.SavingsTransaction;
import com.cofre.backend.enums.SavingsSource;
import com.cofre.backend.enums.SavingsTransactionType;
import com.cofre.backend.exceptions.BadRequestException;
import com.cofre.backend.exceptions.DuplicateTransferException;
import com.cofre.backend.exceptions.ErrorCode;
import com.cofre.backend.exceptions.InsufficientFundsException;
import com.cofre.backend.exceptions.InvalidAmountException;
import com.cofre.backend.repositories.SavingsRepository;
import com.cofre.backend.repositories.SavingsTransactionRepository;

@ExtendWith(MockitoExtension.class)
class SavingsServiceTest {

    private static final LocalDateTime NOW = LocalDateTime.of(2024, 2, 5, 14, 30);
    private static final Clock CLOCK = Clock.fixed(NOW.toInstant(ZoneOffset.UTC), ZoneId.of("UTC"));

    @Mock
    private SavingsRepository savingsRepository;

    @Mock
    private SavingsTransactionRepository savingsTransactionRepository;

    @Mock
    private SavingsAccountInitializer accountInitializer;

    private SavingsService savingsService;

    private Person owner;

    @BeforeEach
    void setUp() {
        savingsService = new SavingsService(
                savingsRepository,
                savingsTransactionRepository,
                accountInitializer,
                SavingsProperties.defaults(),
                CLOCK
        );

        owner = new Person();
        owner.setId(UUID.randomUUID());
        owner.setName("Teste");
    }

    private Savings savings(String balance, String deposits, String withdrawals) {
        return Savings.builder()
                .id(UUID.randomUUID())
                .owner(owner)
                .balance(new BigDecimal(balance))
                .totalDeposits(new BigDecimal(deposits))
                .totalWithdrawals(new BigDecimal(withdrawals))
                .build();
    }

    private void stubLockedAccount(Savings savings) {
        when(savingsRepository.existsByOwnerId(owner.getId())).thenReturn(true);
        when(savingsRepository.findByOwnerIdForUpdate(owner.getId())).thenReturn(Optional.of(savings));
    }

    private void stubPersistence() {
        when(savingsRepository.saveAndFlush(any(Savings.class))).thenAnswer(inv -> inv.getArgument(0));
        when(savingsTransactionRepository.save(any(SavingsTransaction.class))).thenAnswer(inv -> {
            SavingsTransaction tx = inv.getArgument(0);
            tx.setId(UUID.randomUUID());
            return tx;
        });
    }

    private static void assertBalanceMatchesCounters(Savings savings) {
        assertEquals(0, savings.getBalance().compareTo(savings.getTotalDeposits().subtract(savings.getTotalWithdrawals())));
    }

    @Test
    void deposit_updatesBalanceCountersAndRecordsCredit() {
        Savings savings = savings("100.00", "100.00", "0.00");
        stubLockedAccount(savings);
        stubPersistence();

        SavingsOperationResult result = savingsService.deposit(
                owner.getId(), new BigDecimal("50"), SavingsSource.MANUAL, null, null, null);

        assertEquals(new BigDecimal("150.00"), savings.getBalance());
        assertEquals(new BigDecimal("150.00"), savings.getTotalDeposits());
        assertEquals(NOW, savings.getLastTransactionDate());
        assertBalanceMatchesCounters(savings);

        assertEquals(new BigDecimal("150.00"), result.getSavings().getBalance());
        assertNotNull(result.getTransaction().getId());
        assertEquals(SavingsTransactionType.CREDIT, result.getTransaction().getType());
        assertEquals(new BigDecimal("50.00"), result.getTransaction().getAmount());
        assertEquals(new BigDecimal("150.00"), result.getTransaction().getBalanceAfter());
        assertEquals("Depósito manual", result.getTransaction().getDescription());
        assertEquals(NOW, result.getTransaction().getCreatedAt());
    }

    @Test
    void deposit_firstAccess_createsAccountBeforeLocking() {
        Savings savings = savings("0", "0", "0");
        when(savingsRepository.existsByOwnerId(owner.getId())).thenReturn(false);
        when(accountInitializer.createIfAbsent(owner.getId())).thenReturn(true);
        when(savingsRepository.findByOwnerIdForUpdate(owner.getId())).thenReturn(Optional.of(savings));
        stubPersistence();

        savingsService.deposit(owner.getId(), new BigDecimal("10"), SavingsSource.MANUAL, "primeiro", null, null);

        InOrder order = inOrder(accountInitializer, savingsRepository);
        order.verify(accountInitializer).createIfAbsent(owner.getId());
        order.verify(savingsRepository).findByOwnerIdForUpdate(owner.getId());
        assertEquals(new BigDecimal("10.00"), savings.getBalance());
    }

    @Test
    void deposit_accountCreatedConcurrently_reusesExistingAccount() {
        Savings savings = savings("0", "0", "0");
        when(savingsRepository.existsByOwnerId(owner.getId())).thenReturn(false);
        when(accountInitializer.createIfAbsent(owner.getId())).thenReturn(false);
        when(savingsRepository.findByOwnerIdForUpdate(owner.getId())).thenReturn(Optional.of(savings));
        stubPersistence();

        SavingsOperationResult result = savingsService.deposit(
                owner.getId(), new BigDecimal("10"), SavingsSource.MANUAL, null, null, null);

        assertEquals(new BigDecimal("10.00"), result.getSavings().getBalance());
    }

    @Test
    void deposit_existingAccount_skipsInitializer() {
        Savings savings = savings("5.00", "5.00", "0.00");
        stubLockedAccount(savings);
        stubPersistence();

        savingsService.deposit(owner.getId(), new BigDecimal("1"), SavingsSource.MANUAL, null, null, null);

        verifyNoInteractions(accountInitializer);
    }

    @Test
    void deposit_nonPositiveAmount_throwsBeforeTouchingAccount() {
        assertThrows(InvalidAmountException.class, () -> savingsService.deposit(
                owner.getId(), BigDecimal.ZERO, SavingsSource.MANUAL, null, null, null));
        assertThrows(InvalidAmountException.class, () -> savingsService.deposit(
                owner.getId(), null, SavingsSource.MANUAL, null, null, null));

        verifyNoInteractions(savingsRepository, savingsTransactionRepository);
    }

    @Test
    void deposit_surplus_recordsCycleOnAccountAndTransaction() {
        Savings savings = savings("0", "0", "0");
        stubLockedAccount(savings);
        stubPersistence();

        SavingsOperationResult result = savingsService.deposit(
                owner.getId(), new BigDecimal("75"), SavingsSource.BUDGET_SURPLUS, null, BudgetCycle.of(1, 2024), null);

        assertTrue(savings.isCycleTransferred(1, 2024));
        assertEquals(new BigDecimal("75.00"), savings.findTransferredCycle(1, 2024).orElseThrow().getAmount());
        assertEquals(1, result.getSavings().getTransferredCycles().size());
        assertEquals(1, result.getTransaction().getCycleMonth());
        assertEquals(2024, result.getTransaction().getCycleYear());
        assertEquals("Transferência da sobra do orçamento de 1/2024", result.getTransaction().getDescription());
    }

    @Test
    void deposit_surplusForTransferredCycle_throwsDuplicateAndKeepsBalance() {
        Savings savings = savings("75.00", "75.00", "0.00");
        savings.addTransferredCycle(1, 2024, new BigDecimal("75.00"), NOW.minusDays(3));
        stubLockedAccount(savings);

        DuplicateTransferException ex = assertThrows(DuplicateTransferException.class, () -> savingsService.deposit(
                owner.getId(), new BigDecimal("75"), SavingsSource.BUDGET_SURPLUS, null, BudgetCycle.of(1, 2024), null));

        assertEquals(ErrorCode.DUPLICATE_TRANSFER, ex.getCode());
        assertEquals(new BigDecimal("75.00"), savings.getBalance());
        verify(savingsRepository, never()).saveAndFlush(any());
        verify(savingsTransactionRepository, never()).save(any());
    }

    @Test
    void deposit_cycleUniqueViolation_isTranslatedToDuplicate() {
        Savings savings = savings("0", "0", "0");
        stubLockedAccount(savings);
        when(savingsRepository.saveAndFlush(any(Savings.class)))
                .thenThrow(new DataIntegrityViolationException("uk_transferred_cycle"));

        assertThrows(DuplicateTransferException.class, () -> savingsService.deposit(
                owner.getId(), new BigDecimal("30"), SavingsSource.BUDGET_SURPLUS, null, BudgetCycle.of(2, 2024), null));

        verify(savingsTransactionRepository, never()).save(any());
    }

    @Test
    void deposit_storageFailureWithoutCycle_propagatesAsIs() {
        Savings savings = savings("0", "0", "0");
        stubLockedAccount(savings);
        DataIntegrityViolationException failure = new DataIntegrityViolationException("check constraint");
        when(savingsRepository.saveAndFlush(any(Savings.class))).thenThrow(failure);

        DataIntegrityViolationException thrown = assertThrows(DataIntegrityViolationException.class, () -> savingsService.deposit(
                owner.getId(), new BigDecimal("30"), SavingsSource.MANUAL, null, null, null));

        assertEquals(failure, thrown);
    }

    @Test
    void withdraw_insufficientBalance_throwsAndKeepsBalance() {
        Savings savings = savings("20.00", "20.00", "0.00");
        stubLockedAccount(savings);

        InsufficientFundsException ex = assertThrows(InsufficientFundsException.class, () -> savingsService.withdraw(
                owner.getId(), new BigDecimal("50"), SavingsSource.MANUAL, null, null, null));

        assertEquals(ErrorCode.INSUFFICIENT_BALANCE, ex.getCode());
        assertEquals(new BigDecimal("20.00"), ex.getAvailable());
        assertEquals(new BigDecimal("50.00"), ex.getRequired());
        assertEquals(new BigDecimal("20.00"), savings.getBalance());
        verify(savingsRepository, never()).saveAndFlush(any());
    }

    @Test
    void depositThenWithdraw_sameAmount_restoresBalanceWithConsistentRunningTotal() {
        Savings savings = savings("100.00", "100.00", "0.00");
        stubLockedAccount(savings);
        stubPersistence();

        SavingsOperationResult credit = savingsService.deposit(
                owner.getId(), new BigDecimal("80"), SavingsSource.MANUAL, null, null, null);
        SavingsOperationResult debit = savingsService.withdraw(
                owner.getId(), new BigDecimal("80"), SavingsSource.MANUAL, null, null, null);

        assertEquals(new BigDecimal("100.00"), savings.getBalance());
        assertEquals(new BigDecimal("180.00"), savings.getTotalDeposits());
        assertEquals(new BigDecimal("80.00"), savings.getTotalWithdrawals());
        assertBalanceMatchesCounters(savings);

        assertEquals(new BigDecimal("180.00"), credit.getTransaction().getBalanceAfter());
        assertEquals(new BigDecimal("80.00"), credit.getTransaction().getSignedAmount());
        assertEquals(new BigDecimal("100.00"), debit.getTransaction().getBalanceAfter());
        assertEquals(new BigDecimal("-80.00"), debit.getTransaction().getSignedAmount());
        assertEquals("Saque manual", debit.getTransaction().getDescription());
        assertEquals(0, credit.getTransaction().getBalanceAfter()
                .add(debit.getTransaction().getSignedAmount())
                .compareTo(debit.getTransaction().getBalanceAfter()));
    }

    @Test
    void withdraw_withBudgetContext_keepsRelatedBudgetAndDescription() {
        Savings savings = savings("100.00", "100.00", "0.00");
        UUID budgetId = UUID.randomUUID();
        stubLockedAccount(savings);
        stubPersistence();

        SavingsOperationResult result = savingsService.withdraw(
                owner.getId(), new BigDecimal("25"), SavingsSource.BUDGET_OVERRUN, "  Cobertura Mercado  ", null, budgetId);

        ArgumentCaptor<SavingsTransaction> captor = ArgumentCaptor.forClass(SavingsTransaction.class);
        verify(savingsTransactionRepository).save(captor.capture());
        assertEquals(budgetId, captor.getValue().getRelatedBudgetId());
        assertEquals(owner, captor.getValue().getOwner());
        assertEquals("Cobertura Mercado", result.getTransaction().getDescription());
        assertEquals(SavingsSource.BUDGET_OVERRUN, result.getTransaction().getSource());
    }

    @Test
    void getTransactions_defaults_usesFirstPageNewestFirst() {
        SavingsTransaction tx = SavingsTransaction.builder()
                .id(UUID.randomUUID())
                .owner(owner)
                .type(SavingsTransactionType.CREDIT)
                .amount(new BigDecimal("10.00"))
                .source(SavingsSource.MANUAL)
                .balanceAfter(new BigDecimal("10.00"))
                .createdAt(NOW)
                .build();

        ArgumentCaptor<Pageable> pageable = ArgumentCaptor.forClass(Pageable.class);
        when(savingsTransactionRepository.search(eq(owner.getId()), isNull(), isNull(), isNull(), isNull(), pageable.capture()))
                .thenAnswer(inv -> new PageImpl<>(List.of(tx), inv.getArgument(5), 45));

        SavingsTransactionPageResponse page = savingsService.getTransactions(owner.getId(), null);

        assertEquals(0, pageable.getValue().getPageNumber());
        assertEquals(20, pageable.getValue().getPageSize());
        assertEquals(Sort.Direction.DESC, pageable.getValue().getSort().getOrderFor("createdAt").getDirection());
        assertEquals(1, page.getPage());
        assertEquals(20, page.getLimit());
        assertEquals(45, page.getTotal());
        assertEquals(3, page.getPages());
        assertTrue(page.isHasMore());
        assertEquals(1, page.getTransactions().size());
    }

    @Test
    void getTransactions_lastPage_hasNoMore() {
        when(savingsTransactionRepository.search(any(), any(), any(), any(), any(), any()))
                .thenAnswer(inv -> new PageImpl<>(List.of(), PageRequest.of(2, 20), 45));

        SavingsTransactionPageResponse page = savingsService.getTransactions(owner.getId(),
                SavingsTransactionFilter.builder().page(3).limit(20).type(SavingsTransactionType.DEBIT).build());

        assertFalse(page.isHasMore());
        assertEquals(3, page.getPage());
    }

    @Test
    void getTransactions_invalidPaging_throwsBadRequest() {
        assertThrows(BadRequestException.class, () -> savingsService.getTransactions(owner.getId(),
                SavingsTransactionFilter.builder().limit(101).build()));
        assertThrows(BadRequestException.class, () -> savingsService.getTransactions(owner.getId(),
                SavingsTransactionFilter.builder().page(0).build()));

        verifyNoInteractions(savingsTransactionRepository);
    }

    @Test
    void getStatistics_groupsByMonthAndSource() {
        Savings savings = savings("70.00", "100.00", "30.00");
        when(savingsRepository.existsByOwnerId(owner.getId())).thenReturn(true);
        when(savingsRepository.findByOwnerId(owner.getId())).thenReturn(Optional.of(savings));

        SavingsTransaction janCredit = tx(SavingsTransactionType.CREDIT, SavingsSource.MANUAL, "60.00", LocalDateTime.of(2024, 1, 3, 9, 0));
        SavingsTransaction janCredit2 = tx(SavingsTransactionType.CREDIT, SavingsSource.BUDGET_SURPLUS, "40.00", LocalDateTime.of(2024, 1, 31, 9, 0));
        SavingsTransaction febDebit = tx(SavingsTransactionType.DEBIT, SavingsSource.MANUAL, "30.00", LocalDateTime.of(2024, 2, 1, 9, 0));

        when(savingsTransactionRepository.findByOwnerIdAndCreatedAtGreaterThanEqualOrderByCreatedAtAsc(
                owner.getId(), LocalDateTime.of(2023, 8, 5, 0, 0)))
                .thenReturn(List.of(janCredit, janCredit2, febDebit));
        when(savingsTransactionRepository.sumBySource(owner.getId())).thenReturn(List.of(
                view(SavingsSource.MANUAL, SavingsTransactionType.CREDIT, "60.00", 1L),
                view(SavingsSource.BUDGET_SURPLUS, SavingsTransactionType.CREDIT, "40.00", 1L),
                view(SavingsSource.MANUAL, SavingsTransactionType.DEBIT, "30.00", 1L)));
        when(savingsTransactionRepository.countByOwnerId(owner.getId())).thenReturn(3L);

        SavingsStatisticsResponse stats = savingsService.getStatistics(owner.getId());

        assertEquals(new BigDecimal("70.00"), stats.getCurrentBalance());
        assertEquals(new BigDecimal("70.00"), stats.getNetSavings());
        assertEquals(3, stats.getTransactionCount());

        assertEquals(2, stats.getMonthlyBreakdown().size());
        SavingsStatisticsResponse.MonthlyTotal january = stats.getMonthlyBreakdown().get(0);
        assertEquals(1, january.getMonth());
        assertEquals(SavingsTransactionType.CREDIT, january.getType());
        assertEquals(new BigDecimal("100.00"), january.getTotal());
        assertEquals(2, stats.getMonthlyBreakdown().get(1).getMonth());

        assertEquals(3, stats.getSourceBreakdown().size());
        assertEquals(SavingsSource.MANUAL, stats.getSourceBreakdown().get(0).getSource());
        assertEquals(new BigDecimal("60.00"), stats.getSourceBreakdown().get(0).getTotal());
    }

    private SavingsTransaction tx(SavingsTransactionType type, SavingsSource source, String amount, LocalDateTime at) {
        return SavingsTransaction.builder()
                .id(UUID.randomUUID())
                .owner(owner)
                .type(type)
                .source(source)
                .amount(new BigDecimal(amount))
                .balanceAfter(BigDecimal.ZERO)
                .createdAt(at)
                .build();
    }

    private SavingsTransactionRepository.SourceTotalView view(
            SavingsSource source, SavingsTransactionType type, String total, Long count) {
        return new SavingsTransactionRepository.SourceTotalView() {
            @Override
            public SavingsSource getSource() {
                return source;
            }

            @Override
            public SavingsTransactionType getType() {
                return type;
            }

            @Override
            public BigDecimal getTotal() {
                return new BigDecimal(total);
            }

            @Override
            public Long getCount() {
                return count;
            }
        };
    }
}
