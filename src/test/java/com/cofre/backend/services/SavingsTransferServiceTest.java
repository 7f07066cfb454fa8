package com.cofre.backend.services;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.ArgumentMatchers.isNull;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.verifyNoInteractions;
import static org.mockito.Mockito.when;

import java.math.BigDecimal;
import java.time.Clock;
import java.time.LocalDate;
import java.time.LocalDateTime;
import java.time.ZoneId;
import java.time.ZoneOffset;
import java.util.Arrays;
import java.util.List;
import java.util.Optional;
import java.util.UUID;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import com.cofre.backend.dto.savings.BudgetTransferResult;
import com.cofre.backend.dto.savings.CycleBudgetSummary;
import com.cofre.backend.dto.savings.SavingsOperationResult;
import com.cofre.backend.dto.savings.SavingsResponse;
import com.cofre.backend.dto.savings.SavingsTransactionResponse;
import com.cofre.backend.dto.savings.SurplusTransferResult;
import com.cofre.backend.dto.savings.TransferStatusResponse;
import com.cofre.backend.entities.Budget;
import com.cofre.backend.entities.BudgetCycle;
import com.cofre.backend.entities.Category;
import com.cofre.backend.entities.Person;
import com.cofre.backend.entities.Savings;
import com.cofre.backend.enums.BudgetStatus;
import com.cofre.backend.enums.CategoryType;
import com.cofre.backend.enums.SavingsSource;
import com.cofre.backend.enums.TransactionType;
import com.cofre.backend.exceptions.AlreadyTransferredException;
import com.cofre.backend.exceptions.BadRequestException;
import com.cofre.backend.exceptions.ErrorCode;
import com.cofre.backend.exceptions.InsufficientFundsException;
import com.cofre.backend.exceptions.NotOverrunException;
import com.cofre.backend.exceptions.NothingToTransferException;
import com.cofre.backend.exceptions.ResourceNotFoundException;
import com.cofre.backend.repositories.BudgetRepository;

@ExtendWith(MockitoExtension.class)
class SavingsTransferServiceTest {

    private static final LocalDateTime NOW = LocalDateTime.of(2024, 2, 3, 8, 0);
    private static final Clock CLOCK = Clock.fixed(NOW.toInstant(ZoneOffset.UTC), ZoneId.of("UTC"));

    @Mock
    private BudgetRepository budgetRepository;

    @Mock
    private BudgetService budgetService;

    @Mock
    private LedgerQueryService ledgerQueryService;

    @Mock
    private SavingsService savingsService;

    private SavingsTransferService transferService;

    private Person owner;
    private Category groceries;

    @BeforeEach
    void setUp() {
        transferService = new SavingsTransferService(budgetRepository, budgetService, ledgerQueryService, savingsService, CLOCK);

        owner = new Person();
        owner.setId(UUID.randomUUID());
        owner.setName("Teste");

        groceries = Category.builder()
                .id(UUID.randomUUID())
                .owner(owner)
                .name("Mercado")
                .type(CategoryType.EXPENSE)
                .build();
    }

    private Budget januaryBudget(String amount) {
        return Budget.builder()
                .id(UUID.randomUUID())
                .owner(owner)
                .category(groceries)
                .amount(new BigDecimal(amount))
                .startDate(LocalDate.of(2024, 1, 1))
                .endDate(LocalDate.of(2024, 1, 31))
                .status(BudgetStatus.COMPLETED)
                .build();
    }

    private void stubSpending(Budget budget, String spent) {
        when(ledgerQueryService.calculateSpending(owner.getId(), groceries.getId(), budget.getStartDate(), budget.getEndDate()))
                .thenReturn(new BigDecimal(spent));
    }

    private Savings savingsWithBalance(String balance) {
        return Savings.builder()
                .id(UUID.randomUUID())
                .owner(owner)
                .balance(new BigDecimal(balance))
                .totalDeposits(new BigDecimal(balance))
                .build();
    }

    private static SavingsOperationResult operationResult(String balance) {
        SavingsResponse savings = new SavingsResponse();
        savings.setBalance(new BigDecimal(balance));
        return new SavingsOperationResult(savings, new SavingsTransactionResponse());
    }

    // ----- sobra de orçamento -----

    @Test
    void transferBudgetRemainder_depositsRemainderAndMarksBudget() {
        Budget budget = januaryBudget("500.00");
        when(budgetRepository.findByIdAndOwnerIdForUpdate(budget.getId(), owner.getId())).thenReturn(Optional.of(budget));
        stubSpending(budget, "320.00");
        when(savingsService.deposit(eq(owner.getId()), eq(new BigDecimal("180.00")), eq(SavingsSource.BUDGET_REMAINDER),
                anyString(), isNull(), eq(budget.getId())))
                .thenReturn(operationResult("180.00"));

        BudgetTransferResult result = transferService.transferBudgetRemainder(owner.getId(), budget.getId());

        assertEquals(new BigDecimal("180.00"), result.getSavings().getBalance());
        assertTrue(budget.isSavingsTransferred());
        assertEquals(new BigDecimal("180.00"), budget.getSavingsTransferAmount());
        assertEquals(NOW, budget.getSavingsTransferDate());
        verify(budgetService).applyCurrentStatus(budget);
        verify(budgetRepository).saveAndFlush(budget);
        verify(savingsService).deposit(owner.getId(), new BigDecimal("180.00"), SavingsSource.BUDGET_REMAINDER,
                "Sobra do orçamento Mercado (01/01/2024 a 31/01/2024)", null, budget.getId());
    }

    @Test
    void transferBudgetRemainder_alreadyTransferred_throwsWithoutDeposit() {
        Budget budget = januaryBudget("500.00");
        budget.setSavingsTransferred(true);
        budget.setSavingsTransferAmount(new BigDecimal("180.00"));
        when(budgetRepository.findByIdAndOwnerIdForUpdate(budget.getId(), owner.getId())).thenReturn(Optional.of(budget));

        AlreadyTransferredException ex = assertThrows(AlreadyTransferredException.class,
                () -> transferService.transferBudgetRemainder(owner.getId(), budget.getId()));

        assertEquals(ErrorCode.ALREADY_TRANSFERRED, ex.getCode());
        assertEquals(new BigDecimal("180.00"), ex.getDetails().get("transferredAmount"));
        verifyNoInteractions(savingsService, ledgerQueryService);
    }

    @Test
    void transferBudgetRemainder_fullySpent_throwsNothingToTransfer() {
        Budget budget = januaryBudget("500.00");
        when(budgetRepository.findByIdAndOwnerIdForUpdate(budget.getId(), owner.getId())).thenReturn(Optional.of(budget));
        stubSpending(budget, "500.00");

        NothingToTransferException ex = assertThrows(NothingToTransferException.class,
                () -> transferService.transferBudgetRemainder(owner.getId(), budget.getId()));

        assertEquals(ErrorCode.NOTHING_TO_TRANSFER, ex.getCode());
        assertFalse(budget.isSavingsTransferred());
        verifyNoInteractions(savingsService);
    }

    @Test
    void transferBudgetRemainder_unknownBudget_throwsNotFound() {
        UUID budgetId = UUID.randomUUID();
        when(budgetRepository.findByIdAndOwnerIdForUpdate(budgetId, owner.getId())).thenReturn(Optional.empty());

        assertThrows(ResourceNotFoundException.class, () -> transferService.transferBudgetRemainder(owner.getId(), budgetId));
    }

    @Test
    void transferBudgetRemainder_markFailure_propagates() {
        Budget budget = januaryBudget("500.00");
        when(budgetRepository.findByIdAndOwnerIdForUpdate(budget.getId(), owner.getId())).thenReturn(Optional.of(budget));
        stubSpending(budget, "320.00");
        when(savingsService.deposit(any(), any(), any(), any(), any(), any())).thenReturn(operationResult("180.00"));
        IllegalStateException failure = new IllegalStateException("falha de escrita");
        when(budgetRepository.saveAndFlush(budget)).thenThrow(failure);

        IllegalStateException thrown = assertThrows(IllegalStateException.class,
                () -> transferService.transferBudgetRemainder(owner.getId(), budget.getId()));

        assertEquals(failure, thrown);
    }

    // ----- estouro de orçamento -----

    @Test
    void coverBudgetOverrunById_withoutAmount_coversWholeOverrun() {
        Budget budget = januaryBudget("300.00");
        when(budgetRepository.findByIdAndOwnerId(budget.getId(), owner.getId())).thenReturn(Optional.of(budget));
        stubSpending(budget, "380.00");
        when(savingsService.lockAccount(owner.getId())).thenReturn(savingsWithBalance("200.00"));
        when(savingsService.withdraw(eq(owner.getId()), eq(new BigDecimal("80.00")), eq(SavingsSource.BUDGET_OVERRUN),
                anyString(), isNull(), eq(budget.getId())))
                .thenReturn(operationResult("120.00"));

        BudgetTransferResult result = transferService.coverBudgetOverrunById(owner.getId(), budget.getId(), null);

        assertEquals(new BigDecimal("120.00"), result.getSavings().getBalance());
        verify(savingsService).withdraw(owner.getId(), new BigDecimal("80.00"), SavingsSource.BUDGET_OVERRUN,
                "Cobertura de estouro do orçamento Mercado (01/01/2024 a 31/01/2024)", null, budget.getId());
    }

    @Test
    void coverBudgetOverrunById_insufficientSavings_throwsAndKeepsBalance() {
        Budget budget = januaryBudget("300.00");
        Savings savings = savingsWithBalance("50.00");
        when(budgetRepository.findByIdAndOwnerId(budget.getId(), owner.getId())).thenReturn(Optional.of(budget));
        stubSpending(budget, "380.00");
        when(savingsService.lockAccount(owner.getId())).thenReturn(savings);

        InsufficientFundsException ex = assertThrows(InsufficientFundsException.class,
                () -> transferService.coverBudgetOverrunById(owner.getId(), budget.getId(), null));

        assertEquals(ErrorCode.INSUFFICIENT_SAVINGS, ex.getCode());
        assertEquals(new BigDecimal("50.00"), ex.getAvailable());
        assertEquals(new BigDecimal("80.00"), ex.getRequired());
        assertEquals(new BigDecimal("50.00"), savings.getBalance());
        verify(savingsService, never()).withdraw(any(), any(), any(), any(), any(), any());
    }

    @Test
    void coverBudgetOverrunById_requestAboveOverrun_isCappedAtOverrun() {
        Budget budget = januaryBudget("300.00");
        when(budgetRepository.findByIdAndOwnerId(budget.getId(), owner.getId())).thenReturn(Optional.of(budget));
        stubSpending(budget, "380.00");
        when(savingsService.lockAccount(owner.getId())).thenReturn(savingsWithBalance("500.00"));
        when(savingsService.withdraw(any(), any(), any(), any(), any(), any())).thenReturn(operationResult("420.00"));

        transferService.coverBudgetOverrunById(owner.getId(), budget.getId(), new BigDecimal("200"));

        verify(savingsService).withdraw(eq(owner.getId()), eq(new BigDecimal("80.00")), eq(SavingsSource.BUDGET_OVERRUN),
                anyString(), isNull(), eq(budget.getId()));
    }

    @Test
    void coverBudgetOverrunById_partialRequest_withdrawsRequestedAmount() {
        Budget budget = januaryBudget("300.00");
        when(budgetRepository.findByIdAndOwnerId(budget.getId(), owner.getId())).thenReturn(Optional.of(budget));
        stubSpending(budget, "380.00");
        when(savingsService.lockAccount(owner.getId())).thenReturn(savingsWithBalance("500.00"));
        when(savingsService.withdraw(any(), any(), any(), any(), any(), any())).thenReturn(operationResult("470.00"));

        transferService.coverBudgetOverrunById(owner.getId(), budget.getId(), new BigDecimal("30"));

        verify(savingsService).withdraw(eq(owner.getId()), eq(new BigDecimal("30.00")), eq(SavingsSource.BUDGET_OVERRUN),
                anyString(), isNull(), eq(budget.getId()));
    }

    @Test
    void coverBudgetOverrunById_budgetWithinLimit_throwsNotOverrun() {
        Budget budget = januaryBudget("300.00");
        when(budgetRepository.findByIdAndOwnerId(budget.getId(), owner.getId())).thenReturn(Optional.of(budget));
        stubSpending(budget, "300.00");

        NotOverrunException ex = assertThrows(NotOverrunException.class,
                () -> transferService.coverBudgetOverrunById(owner.getId(), budget.getId(), null));

        assertEquals(ErrorCode.NOT_OVERRUN, ex.getCode());
        verifyNoInteractions(savingsService);
    }

    // ----- saldo livre -----

    @Test
    void manualContribution_aboveAvailableBalance_throws() {
        when(savingsService.lockAccount(owner.getId())).thenReturn(savingsWithBalance("500.00"));
        when(ledgerQueryService.totalByType(owner.getId(), TransactionType.INCOME)).thenReturn(new BigDecimal("1000.00"));
        when(ledgerQueryService.totalByType(owner.getId(), TransactionType.EXPENSE)).thenReturn(new BigDecimal("400.00"));

        InsufficientFundsException ex = assertThrows(InsufficientFundsException.class,
                () -> transferService.manualContribution(owner.getId(), new BigDecimal("150"), null));

        assertEquals(ErrorCode.INSUFFICIENT_AVAILABLE_BALANCE, ex.getCode());
        assertEquals(new BigDecimal("100.00"), ex.getAvailable());
        verify(savingsService, never()).deposit(any(), any(), any(), any(), any(), any());
    }

    @Test
    void manualContribution_withinAvailableBalance_depositsManualCredit() {
        when(savingsService.lockAccount(owner.getId())).thenReturn(savingsWithBalance("500.00"));
        when(ledgerQueryService.totalByType(owner.getId(), TransactionType.INCOME)).thenReturn(new BigDecimal("1000.00"));
        when(ledgerQueryService.totalByType(owner.getId(), TransactionType.EXPENSE)).thenReturn(new BigDecimal("400.00"));
        when(savingsService.deposit(owner.getId(), new BigDecimal("100.00"), SavingsSource.MANUAL, "reserva", null, null))
                .thenReturn(operationResult("600.00"));

        SavingsOperationResult result = transferService.manualContribution(owner.getId(), new BigDecimal("100"), "reserva");

        assertEquals(new BigDecimal("600.00"), result.getSavings().getBalance());
    }

    @Test
    void getAvailableBalance_neverNegative() {
        when(savingsService.getBalance(owner.getId())).thenReturn(new BigDecimal("50.00"));
        when(ledgerQueryService.totalByType(owner.getId(), TransactionType.INCOME)).thenReturn(new BigDecimal("100.00"));
        when(ledgerQueryService.totalByType(owner.getId(), TransactionType.EXPENSE)).thenReturn(new BigDecimal("200.00"));

        assertEquals(new BigDecimal("0.00"), transferService.getAvailableBalance(owner.getId()));
    }

    @Test
    void manualWithdrawal_delegatesAsManualDebit() {
        when(savingsService.withdraw(owner.getId(), new BigDecimal("25.00"), SavingsSource.MANUAL, null, null, null))
                .thenReturn(operationResult("75.00"));

        SavingsOperationResult result = transferService.manualWithdrawal(owner.getId(), new BigDecimal("25"), null);

        assertEquals(new BigDecimal("75.00"), result.getSavings().getBalance());
    }

    // ----- ciclo mensal legado -----

    private void stubCycle(String spent, String... amounts) {
        List<Budget> budgets = Arrays.stream(amounts).map(this::januaryBudget).toList();
        when(budgetRepository.findByOwnerIdAndMonthAndYearAndStatusNot(owner.getId(), 1, 2024, BudgetStatus.CANCELLED))
                .thenReturn(budgets);
        when(ledgerQueryService.totalByTypeBetween(owner.getId(), TransactionType.EXPENSE,
                LocalDate.of(2024, 1, 1), LocalDate.of(2024, 1, 31)))
                .thenReturn(new BigDecimal(spent));
    }

    @Test
    void calculateBudgetRemaining_sumsCycleBudgetsAgainstMonthExpenses() {
        stubCycle("350.00", "300.00", "200.00");

        CycleBudgetSummary summary = transferService.calculateBudgetRemaining(owner.getId(), 1, 2024);

        assertEquals(new BigDecimal("500.00"), summary.getTotalBudget());
        assertEquals(new BigDecimal("350.00"), summary.getTotalSpent());
        assertEquals(new BigDecimal("150.00"), summary.getRemaining());
        assertFalse(summary.isOverBudget());
        assertEquals(new BigDecimal("0.00"), summary.getOverrunAmount());
    }

    @Test
    void calculateBudgetRemaining_overspent_reportsOverrun() {
        stubCycle("620.00", "500.00");

        CycleBudgetSummary summary = transferService.calculateBudgetRemaining(owner.getId(), 1, 2024);

        assertTrue(summary.isOverBudget());
        assertEquals(new BigDecimal("-120.00"), summary.getRemaining());
        assertEquals(new BigDecimal("120.00"), summary.getOverrunAmount());
    }

    @Test
    void calculateBudgetRemaining_invalidCycle_throwsBadRequest() {
        assertThrows(BadRequestException.class, () -> transferService.calculateBudgetRemaining(owner.getId(), 13, 2024));
        assertThrows(BadRequestException.class, () -> transferService.calculateBudgetRemaining(owner.getId(), 1, 1999));
        verifyNoInteractions(budgetRepository, ledgerQueryService);
    }

    @Test
    void transferBudgetSurplus_depositsRemainingWithCycle() {
        stubCycle("350.00", "300.00", "200.00");
        when(savingsService.deposit(owner.getId(), new BigDecimal("150.00"), SavingsSource.BUDGET_SURPLUS,
                "Sobra do orçamento de Janeiro 2024", BudgetCycle.of(1, 2024), null))
                .thenReturn(operationResult("150.00"));

        SurplusTransferResult result = transferService.transferBudgetSurplus(owner.getId(), 1, 2024);

        assertEquals(new BigDecimal("150.00"), result.getSavings().getBalance());
        assertEquals(new BigDecimal("150.00"), result.getBudgetSummary().getRemaining());
    }

    @Test
    void transferBudgetSurplus_noSurplus_throwsNothingToTransfer() {
        stubCycle("500.00", "500.00");

        assertThrows(NothingToTransferException.class, () -> transferService.transferBudgetSurplus(owner.getId(), 1, 2024));
        verifyNoInteractions(savingsService);
    }

    @Test
    void coverBudgetOverrun_cycle_withdrawsWithCycleDescription() {
        when(savingsService.lockAccount(owner.getId())).thenReturn(savingsWithBalance("300.00"));
        when(savingsService.withdraw(owner.getId(), new BigDecimal("120.00"), SavingsSource.BUDGET_OVERRUN,
                "Cobertura de estouro de Janeiro 2024", BudgetCycle.of(1, 2024), null))
                .thenReturn(operationResult("180.00"));

        SavingsOperationResult result = transferService.coverBudgetOverrun(owner.getId(), new BigDecimal("120"), 1, 2024);

        assertEquals(new BigDecimal("180.00"), result.getSavings().getBalance());
    }

    @Test
    void getTransferStatus_transferredCycle_blocksNewSurplus() {
        stubCycle("350.00", "300.00", "200.00");
        Savings savings = savingsWithBalance("150.00");
        savings.addTransferredCycle(1, 2024, new BigDecimal("150.00"), NOW.minusDays(1));
        when(savingsService.getOrCreate(owner.getId())).thenReturn(savings);

        TransferStatusResponse status = transferService.getTransferStatus(owner.getId(), 1, 2024);

        assertTrue(status.isAlreadyTransferred());
        assertEquals(new BigDecimal("150.00"), status.getTransferredAmount());
        assertFalse(status.isCanTransferSurplus());
        assertFalse(status.isCanCoverOverrun());
        assertEquals(new BigDecimal("150.00"), status.getCurrentSavings());
    }

    @Test
    void getTransferStatus_overspentCycle_canCoverWhenSavingsSuffice() {
        stubCycle("620.00", "500.00");
        when(savingsService.getOrCreate(owner.getId())).thenReturn(savingsWithBalance("200.00"));

        TransferStatusResponse status = transferService.getTransferStatus(owner.getId(), 1, 2024);

        assertFalse(status.isAlreadyTransferred());
        assertNull(status.getTransferredAmount());
        assertFalse(status.isCanTransferSurplus());
        assertTrue(status.isCanCoverOverrun());
    }
}
