package com.cofre.backend.services;

import java.math.BigDecimal;
import java.math.RoundingMode;
import java.time.LocalDate;
import java.util.UUID;

import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import com.cofre.backend.enums.TransactionType;
import com.cofre.backend.repositories.FinancialTransactionRepository;

import lombok.RequiredArgsConstructor;

/**
 * Somatórios sobre o livro de lançamentos. Sempre consulta o banco: orçamentos são
 * avaliados contra os dados do momento, sem cache.
 */
@Service
@RequiredArgsConstructor
@Transactional(readOnly = true)
public class LedgerQueryService {

    private static final int MONEY_SCALE = 2;

    private final FinancialTransactionRepository transactionRepository;

    /**
     * Total de despesas do dono na categoria com data em [startDate, endDate], inclusive.
     */
    public BigDecimal calculateSpending(UUID ownerId, UUID categoryId, LocalDate startDate, LocalDate endDate) {
        return orZero(transactionRepository.sumByCategoryAndPeriod(
                ownerId, categoryId, TransactionType.EXPENSE, startDate, endDate));
    }

    public BigDecimal totalByTypeBetween(UUID ownerId, TransactionType type, LocalDate startDate, LocalDate endDate) {
        return orZero(transactionRepository.sumByTypeAndPeriod(ownerId, type, startDate, endDate));
    }

    public BigDecimal totalByType(UUID ownerId, TransactionType type) {
        return orZero(transactionRepository.sumByType(ownerId, type));
    }

    private BigDecimal orZero(BigDecimal value) {
        if (value == null) {
            return BigDecimal.ZERO.setScale(MONEY_SCALE, RoundingMode.HALF_UP);
        }
        return value.setScale(MONEY_SCALE, RoundingMode.HALF_UP);
    }
}
