package com.nosota.mpayout.provider;

import com.nosota.mpayout.api.model.TransferMode;

import java.math.BigDecimal;

/**
 * Normalized transfer instruction handed to the provider.
 */
public record ProviderTransferRequest(
        String accountNumber,
        String ifscCode,
        String accountHolderName,
        BigDecimal amount,
        TransferMode transferMode,
        Integer bankId,
        String bankName,
        String beneficiaryMobile,
        String senderName,
        String senderMobile,
        String senderEmail,
        String remarks,
        String clientRefId
) {
}
