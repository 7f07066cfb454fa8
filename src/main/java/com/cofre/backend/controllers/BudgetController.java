package com.cofre.backend.controllers;

import java.util.List;
import java.util.UUID;

import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.DeleteMapping;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.PutMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

import com.cofre.backend.dto.ApiResponse;
import com.cofre.backend.dto.budget.BudgetMonthlySummaryResponse;
import com.cofre.backend.dto.budget.BudgetRequest;
import com.cofre.backend.dto.budget.BudgetResponse;
import com.cofre.backend.dto.budget.BudgetUpdateRequest;
import com.cofre.backend.enums.BudgetStatus;
import com.cofre.backend.security.SecurityService;
import com.cofre.backend.services.BudgetService;

import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;

@RestController
@RequestMapping("/api/budgets")
@RequiredArgsConstructor
public class BudgetController {

    private final BudgetService budgetService;
    private final SecurityService securityService;

    @PostMapping
    public ResponseEntity<ApiResponse<BudgetResponse>> createOrUpdate(
            @Valid @RequestBody BudgetRequest request
    ) {
        UUID ownerId = securityService.getAuthenticatedPersonIdOrThrow();
        BudgetResponse response = budgetService.createOrUpdate(ownerId, request);
        return ResponseEntity.status(HttpStatus.CREATED).body(ApiResponse.success(response, "Orçamento salvo"));
    }

    @GetMapping
    public ResponseEntity<ApiResponse<List<BudgetResponse>>> list(
            @RequestParam(required = false) BudgetStatus status,
            @RequestParam(required = false) Integer month,
            @RequestParam(required = false) Integer year
    ) {
        UUID ownerId = securityService.getAuthenticatedPersonIdOrThrow();
        List<BudgetResponse> budgets = budgetService.list(ownerId, status, month, year);
        return ResponseEntity.ok(ApiResponse.success(budgets, "Orçamentos"));
    }

    @GetMapping("/summary")
    public ResponseEntity<ApiResponse<BudgetMonthlySummaryResponse>> monthlySummary(
            @RequestParam int month,
            @RequestParam int year
    ) {
        UUID ownerId = securityService.getAuthenticatedPersonIdOrThrow();
        BudgetMonthlySummaryResponse summary = budgetService.getMonthlySummary(ownerId, month, year);
        return ResponseEntity.ok(ApiResponse.success(summary, "Resumo mensal dos orçamentos"));
    }

    @GetMapping("/ended")
    public ResponseEntity<ApiResponse<List<BudgetResponse>>> endedForTransfer() {
        UUID ownerId = securityService.getAuthenticatedPersonIdOrThrow();
        List<BudgetResponse> budgets = budgetService.getEndedForTransfer(ownerId);
        return ResponseEntity.ok(ApiResponse.success(budgets, "Orçamentos encerrados com sobra"));
    }

    @GetMapping("/overruns")
    public ResponseEntity<ApiResponse<List<BudgetResponse>>> overruns() {
        UUID ownerId = securityService.getAuthenticatedPersonIdOrThrow();
        List<BudgetResponse> budgets = budgetService.getOverrunBudgets(ownerId);
        return ResponseEntity.ok(ApiResponse.success(budgets, "Orçamentos estourados"));
    }

    @GetMapping("/{budgetId}")
    public ResponseEntity<ApiResponse<BudgetResponse>> getById(
            @PathVariable UUID budgetId
    ) {
        UUID ownerId = securityService.getAuthenticatedPersonIdOrThrow();
        BudgetResponse response = budgetService.getById(budgetId, ownerId);
        return ResponseEntity.ok(ApiResponse.success(response, "Orçamento"));
    }

    @PutMapping("/{budgetId}")
    public ResponseEntity<ApiResponse<BudgetResponse>> update(
            @PathVariable UUID budgetId,
            @Valid @RequestBody BudgetUpdateRequest request
    ) {
        UUID ownerId = securityService.getAuthenticatedPersonIdOrThrow();
        BudgetResponse response = budgetService.update(budgetId, ownerId, request);
        return ResponseEntity.ok(ApiResponse.success(response, "Orçamento atualizado"));
    }

    @DeleteMapping("/{budgetId}")
    public ResponseEntity<ApiResponse<Void>> delete(
            @PathVariable UUID budgetId
    ) {
        UUID ownerId = securityService.getAuthenticatedPersonIdOrThrow();
        budgetService.delete(budgetId, ownerId);
        return ResponseEntity.ok(ApiResponse.success(null, "Orçamento removido"));
    }
}
