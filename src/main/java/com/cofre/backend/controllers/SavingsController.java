package com.cofre.backend.controllers;

import java.math.BigDecimal;
import java.time.LocalDateTime;
import java.util.Map;
import java.util.UUID;

import org.springframework.format.annotation.DateTimeFormat;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

import com.cofre.backend.dto.ApiResponse;
import com.cofre.backend.dto.savings.BudgetSavingsRequest;
import com.cofre.backend.dto.savings.BudgetTransferResult;
import com.cofre.backend.dto.savings.CycleTransferRequest;
import com.cofre.backend.dto.savings.SavingsAmountRequest;
import com.cofre.backend.dto.savings.SavingsOperationResult;
import com.cofre.backend.dto.savings.SavingsOverviewResponse;
import com.cofre.backend.dto.savings.SavingsStatisticsResponse;
import com.cofre.backend.dto.savings.SavingsTransactionFilter;
import com.cofre.backend.dto.savings.SavingsTransactionPageResponse;
import com.cofre.backend.dto.savings.SurplusTransferResult;
import com.cofre.backend.dto.savings.TransferStatusResponse;
import com.cofre.backend.enums.SavingsSource;
import com.cofre.backend.enums.SavingsTransactionType;
import com.cofre.backend.security.SecurityService;
import com.cofre.backend.services.SavingsService;
import com.cofre.backend.services.SavingsTransferService;

import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;

@RestController
@RequestMapping("/api/savings")
@RequiredArgsConstructor
public class SavingsController {

    private final SavingsService savingsService;
    private final SavingsTransferService transferService;
    private final SecurityService securityService;

    @GetMapping
    public ResponseEntity<ApiResponse<SavingsOverviewResponse>> getSavings() {
        UUID ownerId = securityService.getAuthenticatedPersonIdOrThrow();
        SavingsOverviewResponse overview = savingsService.getSavings(ownerId);
        return ResponseEntity.ok(ApiResponse.success(overview, "Poupança"));
    }

    @GetMapping("/available-balance")
    public ResponseEntity<ApiResponse<Map<String, BigDecimal>>> availableBalance() {
        UUID ownerId = securityService.getAuthenticatedPersonIdOrThrow();
        BigDecimal available = transferService.getAvailableBalance(ownerId);
        return ResponseEntity.ok(ApiResponse.success(Map.of("availableBalance", available), "Saldo disponível"));
    }

    @GetMapping("/transfer-status")
    public ResponseEntity<ApiResponse<TransferStatusResponse>> transferStatus(
            @RequestParam int month,
            @RequestParam int year
    ) {
        UUID ownerId = securityService.getAuthenticatedPersonIdOrThrow();
        TransferStatusResponse status = transferService.getTransferStatus(ownerId, month, year);
        return ResponseEntity.ok(ApiResponse.success(status, "Situação da transferência"));
    }

    @GetMapping("/transactions")
    public ResponseEntity<ApiResponse<SavingsTransactionPageResponse>> transactions(
            @RequestParam(required = false) Integer page,
            @RequestParam(required = false) Integer limit,
            @RequestParam(required = false) SavingsTransactionType type,
            @RequestParam(required = false) SavingsSource source,
            @RequestParam(required = false) @DateTimeFormat(iso = DateTimeFormat.ISO.DATE_TIME) LocalDateTime startDate,
            @RequestParam(required = false) @DateTimeFormat(iso = DateTimeFormat.ISO.DATE_TIME) LocalDateTime endDate
    ) {
        UUID ownerId = securityService.getAuthenticatedPersonIdOrThrow();
        SavingsTransactionFilter filter = SavingsTransactionFilter.builder()
                .page(page)
                .limit(limit)
                .type(type)
                .source(source)
                .startDate(startDate)
                .endDate(endDate)
                .build();
        SavingsTransactionPageResponse result = savingsService.getTransactions(ownerId, filter);
        return ResponseEntity.ok(ApiResponse.success(result, "Movimentações da poupança"));
    }

    @GetMapping("/statistics")
    public ResponseEntity<ApiResponse<SavingsStatisticsResponse>> statistics() {
        UUID ownerId = securityService.getAuthenticatedPersonIdOrThrow();
        SavingsStatisticsResponse stats = savingsService.getStatistics(ownerId);
        return ResponseEntity.ok(ApiResponse.success(stats, "Estatísticas da poupança"));
    }

    @PostMapping("/contribute")
    public ResponseEntity<ApiResponse<SavingsOperationResult>> contribute(
            @Valid @RequestBody SavingsAmountRequest request
    ) {
        UUID ownerId = securityService.getAuthenticatedPersonIdOrThrow();
        SavingsOperationResult result = transferService.manualContribution(ownerId, request.getAmount(), request.getDescription());
        return ResponseEntity.ok(ApiResponse.success(result, "Contribuição registrada"));
    }

    @PostMapping("/withdraw")
    public ResponseEntity<ApiResponse<SavingsOperationResult>> withdraw(
            @Valid @RequestBody SavingsAmountRequest request
    ) {
        UUID ownerId = securityService.getAuthenticatedPersonIdOrThrow();
        SavingsOperationResult result = transferService.manualWithdrawal(ownerId, request.getAmount(), request.getDescription());
        return ResponseEntity.ok(ApiResponse.success(result, "Saque registrado"));
    }

    @PostMapping("/transfer-surplus")
    public ResponseEntity<ApiResponse<SurplusTransferResult>> transferSurplus(
            @Valid @RequestBody CycleTransferRequest request
    ) {
        UUID ownerId = securityService.getAuthenticatedPersonIdOrThrow();
        SurplusTransferResult result = transferService.transferBudgetSurplus(ownerId, request.getMonth(), request.getYear());
        return ResponseEntity.ok(ApiResponse.success(result, "Sobra transferida para a poupança"));
    }

    @PostMapping("/cover-overrun")
    public ResponseEntity<ApiResponse<SavingsOperationResult>> coverOverrun(
            @Valid @RequestBody CycleTransferRequest request
    ) {
        UUID ownerId = securityService.getAuthenticatedPersonIdOrThrow();
        SavingsOperationResult result = transferService.coverBudgetOverrun(
                ownerId, request.getAmount(), request.getMonth(), request.getYear());
        return ResponseEntity.ok(ApiResponse.success(result, "Estouro coberto pela poupança"));
    }

    @PostMapping("/transfer-budget-remainder")
    public ResponseEntity<ApiResponse<BudgetTransferResult>> transferBudgetRemainder(
            @Valid @RequestBody BudgetSavingsRequest request
    ) {
        UUID ownerId = securityService.getAuthenticatedPersonIdOrThrow();
        BudgetTransferResult result = transferService.transferBudgetRemainder(ownerId, request.getBudgetId());
        return ResponseEntity.ok(ApiResponse.success(result, "Sobra do orçamento transferida para a poupança"));
    }

    @PostMapping("/cover-budget-overrun")
    public ResponseEntity<ApiResponse<BudgetTransferResult>> coverBudgetOverrun(
            @Valid @RequestBody BudgetSavingsRequest request
    ) {
        UUID ownerId = securityService.getAuthenticatedPersonIdOrThrow();
        BudgetTransferResult result = transferService.coverBudgetOverrunById(ownerId, request.getBudgetId(), request.getAmount());
        return ResponseEntity.ok(ApiResponse.success(result, "Estouro do orçamento coberto pela poupança"));
    }
}
