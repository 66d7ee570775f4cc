package com.nosota.mpayout.pricing;

import com.nosota.mpayout.api.model.TransferMode;
import com.nosota.mpayout.model.ChargeSlab;
import com.nosota.mpayout.model.ChargeType;

import java.math.BigDecimal;
import java.math.RoundingMode;
import java.time.LocalDateTime;

final class SlabCharges {

    private static final BigDecimal HUNDRED = BigDecimal.valueOf(100);

    private SlabCharges() {
    }

    /**
     * Flat value, or round(amount * rate / 100, 2) for percentage slabs. Half-up rounding.
     */
    static BigDecimal chargeFor(ChargeSlab slab, BigDecimal amount) {
        if (slab.getChargeType() == ChargeType.PERCENTAGE) {
            return amount.multiply(slab.getChargeValue()).divide(HUNDRED, 2, RoundingMode.HALF_UP);
        }
        return slab.getChargeValue().setScale(2, RoundingMode.HALF_UP);
    }

    static boolean covers(ChargeSlab slab, TransferMode transferMode, BigDecimal amount) {
        return slab.isActive()
                && slab.getTransferMode() == transferMode
                && slab.getMinAmount().compareTo(amount) <= 0
                && slab.getMaxAmount().compareTo(amount) >= 0;
    }

    static boolean isEffective(LocalDateTime from, LocalDateTime to, LocalDateTime now) {
        return (from == null || !from.isAfter(now)) && (to == null || !to.isBefore(now));
    }

    static boolean matchesService(String filter, String serviceType) {
        return filter == null || filter.equals(serviceType) || "all".equals(filter);
    }
}
