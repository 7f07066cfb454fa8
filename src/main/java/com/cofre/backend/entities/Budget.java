package com.cofre.backend.entities;

import java.math.BigDecimal;
import java.time.LocalDate;
import java.time.LocalDateTime;
import java.util.UUID;

import org.hibernate.annotations.CreationTimestamp;
import org.hibernate.annotations.UpdateTimestamp;

import com.cofre.backend.enums.BudgetPeriodType;
import com.cofre.backend.enums.BudgetStatus;

import jakarta.persistence.Column;
import jakarta.persistence.Entity;
import jakarta.persistence.EnumType;
import jakarta.persistence.Enumerated;
import jakarta.persistence.FetchType;
import jakarta.persistence.GeneratedValue;
import jakarta.persistence.GenerationType;
import jakarta.persistence.Id;
import jakarta.persistence.Index;
import jakarta.persistence.JoinColumn;
import jakarta.persistence.ManyToOne;
import jakarta.persistence.PrePersist;
import jakarta.persistence.PreUpdate;
import jakarta.persistence.Table;
import jakarta.persistence.Version;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.Setter;

@Entity
@Table(
        name = "budgets",
        indexes = {
                @Index(name = "idx_budget_owner_status", columnList = "owner_id, status"),
                @Index(name = "idx_budget_owner_period", columnList = "owner_id, start_date, end_date"),
                @Index(name = "idx_budget_owner_category_period", columnList = "owner_id, category_id, start_date, end_date"),
                @Index(name = "idx_budget_owner_month_year", columnList = "owner_id, budget_month, budget_year")
        }
)
@Getter
@Setter
@NoArgsConstructor
@AllArgsConstructor
@Builder
public class Budget {

    @Id
    @GeneratedValue(strategy = GenerationType.UUID)
    private UUID id;

    @ManyToOne(fetch = FetchType.LAZY, optional = false)
    @JoinColumn(name = "owner_id", nullable = false)
    private Person owner;

    @ManyToOne(fetch = FetchType.LAZY, optional = false)
    @JoinColumn(name = "category_id", nullable = false)
    private Category category;

    @Column(nullable = false, precision = 19, scale = 2)
    private BigDecimal amount;

    // Período (datas inclusivas)
    @Column(name = "start_date", nullable = false)
    private LocalDate startDate;

    @Column(name = "end_date", nullable = false)
    private LocalDate endDate;

    @Enumerated(EnumType.STRING)
    @Column(name = "period_type", nullable = false, length = 20)
    @Builder.Default
    private BudgetPeriodType periodType = BudgetPeriodType.MONTHLY;

    @Enumerated(EnumType.STRING)
    @Column(nullable = false, length = 20)
    @Builder.Default
    private BudgetStatus status = BudgetStatus.UPCOMING;

    // Campos legados (ciclo mensal), sempre derivados de startDate
    @Column(name = "budget_month")
    private Integer month;

    @Column(name = "budget_year")
    private Integer year;

    // Transferência para a poupança
    @Column(name = "savings_transferred", nullable = false)
    @Builder.Default
    private boolean savingsTransferred = false;

    @Column(name = "savings_transfer_amount", nullable = false, precision = 19, scale = 2)
    @Builder.Default
    private BigDecimal savingsTransferAmount = BigDecimal.ZERO;

    @Column(name = "savings_transfer_date")
    private LocalDateTime savingsTransferDate;

    @Column(length = 500)
    @Builder.Default
    private String notes = "";

    @Version
    private Long version;

    // Auditoria
    @CreationTimestamp
    @Column(updatable = false)
    private LocalDateTime createdAt;

    @UpdateTimestamp
    private LocalDateTime updatedAt;

    @PrePersist
    @PreUpdate
    void syncLegacyCycle() {
        if (startDate != null) {
            this.month = startDate.getMonthValue();
            this.year = startDate.getYear();
        }
    }
}
