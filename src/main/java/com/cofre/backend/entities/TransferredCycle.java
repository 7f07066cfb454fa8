package com.cofre.backend.entities;

import java.math.BigDecimal;
import java.time.LocalDateTime;
import java.util.UUID;

import jakarta.persistence.Column;
import jakarta.persistence.Entity;
import jakarta.persistence.FetchType;
import jakarta.persistence.GeneratedValue;
import jakarta.persistence.GenerationType;
import jakarta.persistence.Id;
import jakarta.persistence.JoinColumn;
import jakarta.persistence.ManyToOne;
import jakarta.persistence.Table;
import jakarta.persistence.UniqueConstraint;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.Setter;

/**
 * Ciclo mensal legado (month/year) cuja sobra já foi transferida para a poupança.
 * A unique constraint impede crédito duplicado mesmo se duas requisições passarem
 * pela checagem ao mesmo tempo.
 */
@Entity
@Table(
        name = "savings_transferred_cycles",
        uniqueConstraints = {
                @UniqueConstraint(name = "uk_transferred_cycle", columnNames = {"savings_id", "cycle_month", "cycle_year"})
        }
)
@Getter
@Setter
@NoArgsConstructor
@AllArgsConstructor
@Builder
public class TransferredCycle {

    @Id
    @GeneratedValue(strategy = GenerationType.UUID)
    private UUID id;

    @ManyToOne(fetch = FetchType.LAZY, optional = false)
    @JoinColumn(name = "savings_id", nullable = false)
    private Savings savings;

    @Column(name = "cycle_month", nullable = false)
    private int month;

    @Column(name = "cycle_year", nullable = false)
    private int year;

    @Column(nullable = false, precision = 19, scale = 2)
    private BigDecimal amount;

    @Column(name = "transferred_at", nullable = false)
    private LocalDateTime transferredAt;
}
