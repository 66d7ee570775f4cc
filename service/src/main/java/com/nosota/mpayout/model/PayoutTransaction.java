package com.nosota.mpayout.model;

import com.nosota.mpayout.api.model.PayoutStatus;
import com.nosota.mpayout.api.model.TransferMode;
import jakarta.persistence.*;
import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.Setter;

import java.math.BigDecimal;
import java.time.LocalDateTime;
import java.util.UUID;

/**
 * One bank transfer attempt out of a merchant wallet.
 *
 * <p>Lifecycle:
 * <pre>
 * PENDING → PROCESSING → SUCCESS | FAILED | REFUNDED
 * </pre>
 *
 * <p>Rows are written only by the transfer path and by reconciliation (and only while
 * PENDING or PROCESSING). {@code walletDebited} is true exactly when a DEBIT ledger entry
 * references this transaction; its id is kept in {@code walletDebitEntryId}.
 */
@Entity
@Table(name = "payout_transaction", indexes = {
        @Index(name = "idx_payout_tx_merchant_created", columnList = "merchant_id, created_at"),
        @Index(name = "idx_payout_tx_status_created", columnList = "status, created_at"),
        @Index(name = "idx_payout_tx_provider_id", columnList = "provider_transaction_id")
})
@Getter
@Setter
@NoArgsConstructor
public class PayoutTransaction {

    @Id
    @GeneratedValue(strategy = GenerationType.UUID)
    private UUID id;

    @Column(name = "merchant_id", nullable = false, updatable = false)
    private Long merchantId;

    @Column(name = "distributor_id", updatable = false)
    private Long distributorId;

    @Column(name = "master_distributor_id", updatable = false)
    private Long masterDistributorId;

    // Beneficiary
    @Column(name = "account_number", nullable = false, updatable = false, length = 18)
    private String accountNumber;

    @Column(name = "ifsc_code", nullable = false, updatable = false, length = 11)
    private String ifscCode;

    @Column(name = "account_holder_name", nullable = false, updatable = false)
    private String accountHolderName;

    @Column(name = "bank_id", updatable = false)
    private Integer bankId;

    @Column(name = "bank_name", updatable = false)
    private String bankName;

    @Column(name = "beneficiary_mobile", updatable = false, length = 10)
    private String beneficiaryMobile;

    // Sender
    @Column(name = "sender_name", updatable = false)
    private String senderName;

    @Column(name = "sender_mobile", updatable = false, length = 10)
    private String senderMobile;

    @Column(name = "sender_email", updatable = false)
    private String senderEmail;

    @Enumerated(EnumType.STRING)
    @Column(name = "transfer_mode", nullable = false, updatable = false, length = 4)
    private TransferMode transferMode;

    /**
     * Amount sent to the beneficiary. Write-once.
     */
    @Column(name = "amount", nullable = false, updatable = false, precision = 12, scale = 2)
    private BigDecimal amount;

    /**
     * Charge resolved by pricing at submission. Write-once.
     */
    @Column(name = "charge", nullable = false, updatable = false, precision = 12, scale = 2)
    private BigDecimal charge;

    /**
     * amount + charge, computed once before reservation. Write-once.
     */
    @Column(name = "total_debited", nullable = false, updatable = false, precision = 12, scale = 2)
    private BigDecimal totalDebited;

    @Column(name = "client_ref_id", nullable = false, unique = true, updatable = false, length = 64)
    private String clientRefId;

    @Column(name = "provider_transaction_id", length = 64)
    private String providerTransactionId;

    /**
     * Bank reference number (RRN/UTR), known once the rail acknowledged the transfer.
     */
    @Column(name = "reference_number", length = 64)
    private String referenceNumber;

    /**
     * Pricing scheme used. Null means default pricing.
     */
    @Column(name = "scheme_id", updatable = false)
    private UUID schemeId;

    @Column(name = "scheme_name", updatable = false)
    private String schemeName;

    @Enumerated(EnumType.STRING)
    @Column(name = "status", nullable = false, length = 16)
    private PayoutStatus status;

    @Column(name = "failure_reason", length = 512)
    private String failureReason;

    @Column(name = "remarks", updatable = false)
    private String remarks;

    @Column(name = "wallet_debited", nullable = false)
    private boolean walletDebited;

    @Column(name = "wallet_debit_entry_id")
    private Long walletDebitEntryId;

    @Column(name = "created_at", nullable = false, updatable = false)
    private LocalDateTime createdAt;

    @Column(name = "updated_at", nullable = false)
    private LocalDateTime updatedAt;

    @Column(name = "completed_at")
    private LocalDateTime completedAt;

    @Version
    private Long version;
}
