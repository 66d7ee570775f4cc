package com.nosota.mpayout.model;

import jakarta.persistence.*;
import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.Setter;

import java.math.BigDecimal;
import java.time.LocalDateTime;
import java.util.UUID;

/**
 * Append-only record of a single fund movement on a merchant wallet.
 *
 * <p>Exactly one of {@code creditAmount} / {@code debitAmount} is non-zero. Monetary fields,
 * references and ownership are write-once; only {@code status} moves, and only
 * PENDING → COMPLETED | FAILED.
 *
 * <p>Wallet balance = SUM(creditAmount) - SUM(debitAmount) over all entries of the wallet,
 * regardless of status. A failed payout keeps its DEBIT entry (status FAILED) and is offset
 * by a REFUND entry.
 */
@Entity
@Table(name = "ledger_entry", indexes = {
        @Index(name = "idx_ledger_entry_wallet", columnList = "wallet_id"),
        @Index(name = "idx_ledger_entry_transaction", columnList = "transaction_id")
})
@Getter
@Setter
@NoArgsConstructor
public class LedgerEntry {

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    @Column(name = "owner_id", nullable = false, updatable = false)
    private Long ownerId;

    @Column(name = "wallet_id", nullable = false, updatable = false)
    private Integer walletId;

    @Enumerated(EnumType.STRING)
    @Column(name = "fund_category", nullable = false, updatable = false, length = 16)
    private FundCategory fundCategory;

    @Enumerated(EnumType.STRING)
    @Column(name = "entry_type", nullable = false, updatable = false, length = 16)
    private LedgerEntryType entryType;

    @Column(name = "credit_amount", nullable = false, updatable = false, precision = 12, scale = 2)
    private BigDecimal creditAmount = BigDecimal.ZERO;

    @Column(name = "debit_amount", nullable = false, updatable = false, precision = 12, scale = 2)
    private BigDecimal debitAmount = BigDecimal.ZERO;

    /**
     * Human-traceable reference: client reference id, REFUND_{ref}, REFUND_TIMEOUT_{ref}.
     */
    @Column(name = "reference_id", nullable = false, updatable = false, length = 80)
    private String referenceId;

    /**
     * Payout transaction this movement belongs to. Null for wallet funding.
     */
    @Column(name = "transaction_id", updatable = false)
    private UUID transactionId;

    @Enumerated(EnumType.STRING)
    @Column(name = "status", nullable = false, length = 16)
    private LedgerEntryStatus status;

    @Column(name = "remarks", updatable = false)
    private String remarks;

    @Column(name = "created_at", nullable = false, updatable = false)
    private LocalDateTime createdAt;
}
