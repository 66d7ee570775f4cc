package com.nosota.mpayout.api.request;

import jakarta.validation.constraints.NotBlank;

/**
 * Status notification pushed by the payout provider.
 *
 * @param clientRefId           Our client reference sent with the transfer
 * @param providerTransactionId Provider transaction id
 * @param status                Provider status (numeric code or text)
 * @param operatorReference     Bank reference number (RRN/UTR), if settled
 * @param message               Provider message
 */
public record ProviderCallbackRequest(
        @NotBlank(message = "Client reference is required")
        String clientRefId,

        String providerTransactionId,

        @NotBlank(message = "Status is required")
        String status,

        String operatorReference,
        String message
) {
}
