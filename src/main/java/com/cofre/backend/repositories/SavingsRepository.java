package com.cofre.backend.repositories;

import java.math.BigDecimal;
import java.time.LocalDateTime;
import java.util.Optional;
import java.util.UUID;

import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Lock;
import org.springframework.data.jpa.repository.Modifying;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;

import com.cofre.backend.entities.Savings;

import jakarta.persistence.LockModeType;

public interface SavingsRepository extends JpaRepository<Savings, UUID> {

    Optional<Savings> findByOwnerId(UUID ownerId);

    boolean existsByOwnerId(UUID ownerId);

    // só o saldo, sem carregar a entidade no contexto de persistência
    @Query("select s.balance from Savings s where s.owner.id = :ownerId")
    Optional<BigDecimal> findBalanceByOwnerId(@Param("ownerId") UUID ownerId);

    /**
     * Carrega a poupança com lock de escrita na linha. Toda movimentação de saldo passa por
     * aqui, o que serializa depósitos e saques do mesmo dono.
     */
    @Lock(LockModeType.PESSIMISTIC_WRITE)
    @Query("select s from Savings s where s.owner.id = :ownerId")
    Optional<Savings> findByOwnerIdForUpdate(@Param("ownerId") UUID ownerId);

    // PostgreSQL (e H2 em modo PostgreSQL): conflito na unique de owner_id não insere nada
    @Modifying
    @Query(value = """
            insert into savings (id, owner_id, balance, total_deposits, total_withdrawals, version, created_at, updated_at)
            values (:id, :ownerId, 0, 0, 0, 0, :now, :now)
            on conflict do nothing
            """, nativeQuery = true)
    int insertEmptyIfAbsent(@Param("id") UUID id, @Param("ownerId") UUID ownerId, @Param("now") LocalDateTime now);
}
