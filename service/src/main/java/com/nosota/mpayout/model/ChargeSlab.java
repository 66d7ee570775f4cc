package com.nosota.mpayout.model;

import com.nosota.mpayout.api.model.TransferMode;
import jakarta.persistence.*;
import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.Setter;

import java.math.BigDecimal;
import java.util.UUID;

/**
 * Payout charge for one amount band and transfer mode of a scheme.
 * Bands are inclusive on both ends.
 */
@Entity
@Table(name = "charge_slab", indexes = {
        @Index(name = "idx_charge_slab_scheme_mode", columnList = "scheme_id, transfer_mode")
})
@Getter
@Setter
@NoArgsConstructor
public class ChargeSlab {
    @Id
    @GeneratedValue(strategy = GenerationType.UUID)
    private UUID id;

    @Column(name = "scheme_id", nullable = false)
    private UUID schemeId;

    @Enumerated(EnumType.STRING)
    @Column(name = "transfer_mode", nullable = false, length = 4)
    private TransferMode transferMode;

    @Column(name = "min_amount", nullable = false, precision = 12, scale = 2)
    private BigDecimal minAmount;

    @Column(name = "max_amount", nullable = false, precision = 12, scale = 2)
    private BigDecimal maxAmount;

    /**
     * Flat amount, or percentage rate when {@code chargeType} is PERCENTAGE.
     */
    @Column(name = "charge_value", nullable = false, precision = 12, scale = 4)
    private BigDecimal chargeValue;

    @Enumerated(EnumType.STRING)
    @Column(name = "charge_type", nullable = false, length = 16)
    private ChargeType chargeType;

    @Column(name = "active", nullable = false)
    private boolean active = true;
}
