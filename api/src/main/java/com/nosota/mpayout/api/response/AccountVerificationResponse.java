package com.nosota.mpayout.api.response;

import java.math.BigDecimal;

/**
 * Successful account verification.
 *
 * @param verificationCharge Fee the provider bills for the lookup
 */
public record AccountVerificationResponse(
        boolean valid,
        String accountHolderName,
        String bankName,
        String branchName,
        BigDecimal verificationCharge,
        String message
) {}
