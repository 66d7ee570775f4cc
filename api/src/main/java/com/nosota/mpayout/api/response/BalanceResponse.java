package com.nosota.mpayout.api.response;

import java.math.BigDecimal;

/**
 * Response for merchant wallet balance query.
 */
public record BalanceResponse(
        Long merchantId,
        BigDecimal availableBalance
) {}
