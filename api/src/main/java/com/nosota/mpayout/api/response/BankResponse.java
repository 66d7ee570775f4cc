package com.nosota.mpayout.api.response;

/**
 * Bank supported by the payout provider.
 */
public record BankResponse(
        Integer bankId,
        String bankName,
        String code,
        String ifscPrefix,
        boolean impsEnabled,
        boolean neftEnabled,
        boolean popular
) {}
