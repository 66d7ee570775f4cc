package com.nosota.mpayout.pricing;

import java.math.BigDecimal;
import java.util.UUID;

/**
 * Charge resolved for one transfer.
 *
 * @param charge     Charge, scale 2
 * @param schemeId   Scheme the charge comes from, null for default pricing
 * @param schemeName Scheme name, null for default pricing
 * @param source     Strategy that produced the quote
 */
public record ChargeQuote(
        BigDecimal charge,
        UUID schemeId,
        String schemeName,
        String source
) {

    public boolean isDefaultPricing() {
        return schemeId == null;
    }
}
