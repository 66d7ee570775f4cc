package com.nosota.mpayout.pricing;

import com.nosota.mpayout.api.model.TransferMode;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.core.annotation.Order;
import org.springframework.stereotype.Component;

import java.math.BigDecimal;
import java.math.RoundingMode;
import java.util.Optional;

/**
 * Last resort: static fee per transfer mode. Never empty.
 *
 * <pre>
 * payout:
 *   default-charge:
 *     imps: 5
 *     neft: 3
 * </pre>
 */
@Component
@Order(3)
public class DefaultFeeChargeStrategy implements ChargeStrategy {

    @Value("${payout.default-charge.imps:5}")
    private BigDecimal impsCharge;

    @Value("${payout.default-charge.neft:3}")
    private BigDecimal neftCharge;

    @Override
    public Optional<ChargeQuote> quote(Long merchantId, String serviceType, BigDecimal amount,
                                       TransferMode transferMode) {
        BigDecimal charge = transferMode == TransferMode.IMPS ? impsCharge : neftCharge;
        return Optional.of(new ChargeQuote(charge.setScale(2, RoundingMode.HALF_UP), null, null, name()));
    }

    @Override
    public String name() {
        return "default-fee";
    }
}
