package com.cofre.backend.repositories;

import java.math.BigDecimal;
import java.time.LocalDateTime;
import java.util.List;
import java.util.UUID;

import org.springframework.data.domain.Page;
import org.springframework.data.domain.Pageable;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;

import com.cofre.backend.entities.SavingsTransaction;
import com.cofre.backend.enums.SavingsSource;
import com.cofre.backend.enums.SavingsTransactionType;

public interface SavingsTransactionRepository extends JpaRepository<SavingsTransaction, UUID> {

    List<SavingsTransaction> findByOwnerIdOrderByCreatedAtDesc(UUID ownerId, Pageable pageable);

    List<SavingsTransaction> findByOwnerIdAndCreatedAtGreaterThanEqualOrderByCreatedAtAsc(UUID ownerId, LocalDateTime since);

    long countByOwnerId(UUID ownerId);

    @Query("""
            SELECT t FROM SavingsTransaction t
            WHERE t.owner.id = :ownerId
              AND (:type IS NULL OR t.type = :type)
              AND (:source IS NULL OR t.source = :source)
              AND (cast(:start as timestamp) IS NULL OR t.createdAt >= :start)
              AND (cast(:end as timestamp) IS NULL OR t.createdAt <= :end)
            """)
    Page<SavingsTransaction> search(
            @Param("ownerId") UUID ownerId,
            @Param("type") SavingsTransactionType type,
            @Param("source") SavingsSource source,
            @Param("start") LocalDateTime start,
            @Param("end") LocalDateTime end,
            Pageable pageable
    );

    @Query("""
            SELECT t.source AS source, t.type AS type, SUM(t.amount) AS total, COUNT(t) AS count
            FROM SavingsTransaction t
            WHERE t.owner.id = :ownerId
            GROUP BY t.source, t.type
            """)
    List<SourceTotalView> sumBySource(@Param("ownerId") UUID ownerId);

    interface SourceTotalView {
        SavingsSource getSource();

        SavingsTransactionType getType();

        BigDecimal getTotal();

        Long getCount();
    }
}
