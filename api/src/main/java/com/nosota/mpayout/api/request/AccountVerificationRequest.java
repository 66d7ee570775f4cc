package com.nosota.mpayout.api.request;

import jakarta.validation.constraints.NotBlank;

/**
 * Bank account to check before sending a transfer to it.
 *
 * @param bankName Optional, passed through to the provider
 */
public record AccountVerificationRequest(
        @NotBlank(message = "Account number is required")
        String accountNumber,

        @NotBlank(message = "IFSC code is required")
        String ifscCode,

        String bankName
) {
}
