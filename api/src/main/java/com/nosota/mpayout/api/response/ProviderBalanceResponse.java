package com.nosota.mpayout.api.response;

import java.math.BigDecimal;

/**
 * Float balance held with the payout provider.
 */
public record ProviderBalanceResponse(
        BigDecimal balance,
        BigDecimal lien,
        BigDecimal availableBalance
) {}
