package com.cofre.backend.entities;

import java.math.BigDecimal;
import java.time.LocalDateTime;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.UUID;

import org.hibernate.annotations.CreationTimestamp;
import org.hibernate.annotations.UpdateTimestamp;

import jakarta.persistence.CascadeType;
import jakarta.persistence.Column;
import jakarta.persistence.Entity;
import jakarta.persistence.FetchType;
import jakarta.persistence.GeneratedValue;
import jakarta.persistence.GenerationType;
import jakarta.persistence.Id;
import jakarta.persistence.JoinColumn;
import jakarta.persistence.OneToMany;
import jakarta.persistence.OneToOne;
import jakarta.persistence.OrderBy;
import jakarta.persistence.Table;
import jakarta.persistence.Version;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.Setter;

/**
 * Conta poupança do usuário. Existe no máximo uma por dono (unique em owner_id).
 *
 * <p>Os acumuladores {@code totalDeposits} e {@code totalWithdrawals} são mantidos por
 * incremento e só podem ser alterados junto com {@code balance}, dentro da mesma
 * transação que grava o {@link SavingsTransaction} correspondente.
 */
@Entity
@Table(name = "savings")
@Getter
@Setter
@NoArgsConstructor
@AllArgsConstructor
@Builder
public class Savings {

    @Id
    @GeneratedValue(strategy = GenerationType.UUID)
    private UUID id;

    @OneToOne(fetch = FetchType.LAZY, optional = false)
    @JoinColumn(name = "owner_id", nullable = false, unique = true)
    private Person owner;

    @Column(nullable = false, precision = 19, scale = 2)
    @Builder.Default
    private BigDecimal balance = BigDecimal.ZERO;

    @Column(name = "total_deposits", nullable = false, precision = 19, scale = 2)
    @Builder.Default
    private BigDecimal totalDeposits = BigDecimal.ZERO;

    @Column(name = "total_withdrawals", nullable = false, precision = 19, scale = 2)
    @Builder.Default
    private BigDecimal totalWithdrawals = BigDecimal.ZERO;

    @Column(name = "last_transaction_date")
    private LocalDateTime lastTransactionDate;

    @OneToMany(mappedBy = "savings", cascade = CascadeType.ALL, orphanRemoval = true)
    @OrderBy("transferredAt ASC")
    @Builder.Default
    private List<TransferredCycle> transferredCycles = new ArrayList<>();

    @Version
    private Long version;

    @CreationTimestamp
    @Column(updatable = false)
    private LocalDateTime createdAt;

    @UpdateTimestamp
    private LocalDateTime updatedAt;

    public boolean isCycleTransferred(int month, int year) {
        return findTransferredCycle(month, year).isPresent();
    }

    public Optional<TransferredCycle> findTransferredCycle(int month, int year) {
        return transferredCycles.stream()
                .filter(c -> c.getMonth() == month && c.getYear() == year)
                .findFirst();
    }

    public void addTransferredCycle(int month, int year, BigDecimal amount, LocalDateTime transferredAt) {
        TransferredCycle cycle = TransferredCycle.builder()
                .savings(this)
                .month(month)
                .year(year)
                .amount(amount)
                .transferredAt(transferredAt)
                .build();
        transferredCycles.add(cycle);
    }
}
