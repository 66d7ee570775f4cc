package com.nosota.mpayout.model;

import jakarta.persistence.*;
import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.Setter;

import java.time.LocalDateTime;

/**
 * Primary wallet of a merchant.
 * <p>
 * Holds no balance column: the balance is derived from {@link LedgerEntry} rows. The row
 * is locked (PESSIMISTIC_WRITE) around every reservation and refund so that balance check
 * and entry insertion are serialized per merchant.
 * </p>
 */
@Entity
@Table(name = "wallet")
@Getter
@Setter
@NoArgsConstructor
public class Wallet {
    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Integer id;

    /**
     * Merchant (retailer) that owns the wallet. One wallet per merchant.
     */
    @Column(name = "owner_id", nullable = false, unique = true)
    private Long ownerId;

    @Column(name = "description")
    private String description;

    /**
     * ISO 4217 code. Default: INR
     */
    @Column(name = "currency", nullable = false, length = 3)
    private String currency = "INR";

    @Column(name = "created_at", nullable = false, updatable = false)
    private LocalDateTime createdAt;
}
