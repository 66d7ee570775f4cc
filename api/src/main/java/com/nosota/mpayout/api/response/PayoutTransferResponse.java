package com.nosota.mpayout.api.response;

import com.nosota.mpayout.api.model.PayoutStatus;
import com.nosota.mpayout.api.model.TransferMode;

import java.math.BigDecimal;
import java.util.UUID;

/**
 * Response for a submitted payout transfer.
 *
 * @param transactionId         Payout transaction id
 * @param clientRefId           Client reference id of the transaction
 * @param status                SUCCESS, or PROCESSING while the provider outcome is not final
 * @param providerTransactionId Provider transaction id, if the provider acknowledged the transfer
 * @param referenceNumber       Bank reference number, if already available
 * @param amount                Transferred amount
 * @param charge                Charge applied
 * @param totalDebited          amount + charge
 * @param maskedAccountNumber   Beneficiary account with all but the last 4 digits masked
 * @param accountHolderName     Beneficiary name
 * @param bankName              Bank name
 * @param transferMode          IMPS or NEFT
 * @param schemeName            Pricing scheme used, null when default pricing applied
 * @param message               Human readable outcome
 */
public record PayoutTransferResponse(
        UUID transactionId,
        String clientRefId,
        PayoutStatus status,
        String providerTransactionId,
        String referenceNumber,
        BigDecimal amount,
        BigDecimal charge,
        BigDecimal totalDebited,
        String maskedAccountNumber,
        String accountHolderName,
        String bankName,
        TransferMode transferMode,
        String schemeName,
        String message
) {
}
