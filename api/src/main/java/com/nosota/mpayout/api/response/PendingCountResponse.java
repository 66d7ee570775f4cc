package com.nosota.mpayout.api.response;

/**
 * Number of unresolved (pending or processing) transactions of a merchant.
 */
public record PendingCountResponse(
        Long merchantId,
        long pendingCount
) {}
