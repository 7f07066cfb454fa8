package com.cofre.backend.repositories;

import java.math.BigDecimal;
import java.time.LocalDate;
import java.util.UUID;

import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;

import com.cofre.backend.entities.FinancialTransaction;
import com.cofre.backend.enums.TransactionType;

public interface FinancialTransactionRepository extends JpaRepository<FinancialTransaction, UUID> {

    // SUM retorna null quando não há linhas; quem chama normaliza para zero
    @Query("""
            SELECT SUM(t.amount) FROM FinancialTransaction t
            WHERE t.person.id = :personId
              AND t.category.id = :categoryId
              AND t.type = :type
              AND t.transactionDate BETWEEN :startDate AND :endDate
            """)
    BigDecimal sumByCategoryAndPeriod(
            @Param("personId") UUID personId,
            @Param("categoryId") UUID categoryId,
            @Param("type") TransactionType type,
            @Param("startDate") LocalDate startDate,
            @Param("endDate") LocalDate endDate
    );

    @Query("""
            SELECT SUM(t.amount) FROM FinancialTransaction t
            WHERE t.person.id = :personId
              AND t.type = :type
              AND t.transactionDate BETWEEN :startDate AND :endDate
            """)
    BigDecimal sumByTypeAndPeriod(
            @Param("personId") UUID personId,
            @Param("type") TransactionType type,
            @Param("startDate") LocalDate startDate,
            @Param("endDate") LocalDate endDate
    );

    @Query("SELECT SUM(t.amount) FROM FinancialTransaction t WHERE t.person.id = :personId AND t.type = :type")
    BigDecimal sumByType(@Param("personId") UUID personId, @Param("type") TransactionType type);
}
