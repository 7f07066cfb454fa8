package com.cofre.backend.repositories;

import java.time.LocalDate;
import java.util.Collection;
import java.util.List;
import java.util.Optional;
import java.util.UUID;

import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Lock;
import org.springframework.data.jpa.repository.Modifying;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import org.springframework.stereotype.Repository;

import com.cofre.backend.entities.Budget;
import com.cofre.backend.enums.BudgetStatus;

import jakarta.persistence.LockModeType;

@Repository
public interface BudgetRepository extends JpaRepository<Budget, UUID> {

    Optional<Budget> findByIdAndOwnerId(UUID id, UUID ownerId);

    @Lock(LockModeType.PESSIMISTIC_WRITE)
    @Query("select b from Budget b where b.id = :id and b.owner.id = :ownerId")
    Optional<Budget> findByIdAndOwnerIdForUpdate(@Param("id") UUID id, @Param("ownerId") UUID ownerId);

    List<Budget> findByOwnerIdOrderByStartDateDesc(UUID ownerId);

    List<Budget> findByOwnerIdAndStatusOrderByStartDateDesc(UUID ownerId, BudgetStatus status);

    List<Budget> findByOwnerIdAndStatusAndSavingsTransferredFalseOrderByEndDateAsc(UUID ownerId, BudgetStatus status);

    List<Budget> findByOwnerIdAndMonthAndYearAndStatusNot(UUID ownerId, Integer month, Integer year, BudgetStatus status);

    @Query("""
            select b from Budget b
            where b.owner.id = :ownerId
              and b.category.id = :categoryId
              and b.status not in :excludedStatuses
              and b.startDate <= :endDate
              and b.endDate >= :startDate
            order by b.startDate asc
            """)
    List<Budget> findOverlapping(
            @Param("ownerId") UUID ownerId,
            @Param("categoryId") UUID categoryId,
            @Param("startDate") LocalDate startDate,
            @Param("endDate") LocalDate endDate,
            @Param("excludedStatuses") Collection<BudgetStatus> excludedStatuses
    );

    @Modifying(flushAutomatically = true, clearAutomatically = true)
    @Query("""
            update Budget b set b.status = com.cofre.backend.enums.BudgetStatus.ACTIVE
            where b.owner.id = :ownerId
              and b.status = com.cofre.backend.enums.BudgetStatus.UPCOMING
              and b.startDate <= :today
              and b.endDate >= :today
            """)
    int activateStarted(@Param("ownerId") UUID ownerId, @Param("today") LocalDate today);

    @Modifying(flushAutomatically = true, clearAutomatically = true)
    @Query("""
            update Budget b set b.status = com.cofre.backend.enums.BudgetStatus.COMPLETED
            where b.owner.id = :ownerId
              and b.status in (com.cofre.backend.enums.BudgetStatus.UPCOMING, com.cofre.backend.enums.BudgetStatus.ACTIVE)
              and b.endDate < :today
            """)
    int completeEnded(@Param("ownerId") UUID ownerId, @Param("today") LocalDate today);
}
