package com.cofre.backend.entities;

import java.math.BigDecimal;
import java.time.LocalDateTime;
import java.util.UUID;

import org.hibernate.annotations.Immutable;

import com.cofre.backend.enums.SavingsSource;
import com.cofre.backend.enums.SavingsTransactionType;

import jakarta.persistence.Column;
import jakarta.persistence.Embedded;
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
import jakarta.persistence.Table;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.Setter;

/**
 * Registro de auditoria da poupança. Só é inserido, nunca alterado ou removido.
 */
@Entity
@Immutable
@Table(
        name = "savings_transactions",
        indexes = {
                @Index(name = "idx_savings_tx_owner_created", columnList = "owner_id, created_at"),
                @Index(name = "idx_savings_tx_owner_type_created", columnList = "owner_id, type, created_at"),
                @Index(name = "idx_savings_tx_owner_source_created", columnList = "owner_id, source, created_at"),
                @Index(name = "idx_savings_tx_owner_cycle", columnList = "owner_id, cycle_month, cycle_year")
        }
)
@Getter
@Setter
@NoArgsConstructor
@AllArgsConstructor
@Builder
public class SavingsTransaction {

    @Id
    @GeneratedValue(strategy = GenerationType.UUID)
    private UUID id;

    @ManyToOne(fetch = FetchType.LAZY, optional = false)
    @JoinColumn(name = "owner_id", nullable = false)
    private Person owner;

    @Enumerated(EnumType.STRING)
    @Column(nullable = false, length = 10)
    private SavingsTransactionType type;

    @Column(nullable = false, precision = 19, scale = 2)
    private BigDecimal amount;

    @Enumerated(EnumType.STRING)
    @Column(nullable = false, length = 30)
    private SavingsSource source;

    @Column(length = 500)
    private String description;

    @Embedded
    private BudgetCycle budgetCycle;

    // sem FK: orçamentos cobertos pela poupança ainda podem ser removidos
    @Column(name = "related_budget_id")
    private UUID relatedBudgetId;

    @Column(name = "balance_after", nullable = false, precision = 19, scale = 2)
    private BigDecimal balanceAfter;

    // preenchido pelo ledger com o mesmo Clock usado no saldo
    @Column(name = "created_at", nullable = false, updatable = false)
    private LocalDateTime createdAt;

    public BigDecimal getSignedAmount() {
        return type == SavingsTransactionType.DEBIT ? amount.negate() : amount;
    }
}
