package com.nosota.mpayout.api.request;

import com.nosota.mpayout.api.model.TransferMode;

import java.math.BigDecimal;

/**
 * Request for transferring funds from the merchant wallet to an external bank account.
 *
 * <p>Field rules (account length, IFSC format, mobile format, amount limits) are checked by the
 * service so that the first failing rule is reported with a specific reason.
 *
 * @param accountNumber     Beneficiary bank account number (9-18 digits)
 * @param ifscCode          Beneficiary branch IFSC code
 * @param accountHolderName Beneficiary name as registered with the bank
 * @param bankId            Provider bank identifier (from the bank list)
 * @param bankName          Bank display name
 * @param beneficiaryMobile Beneficiary 10-digit mobile number
 * @param senderName        Sender name
 * @param senderMobile      Sender 10-digit mobile number
 * @param senderEmail       Optional sender email
 * @param amount            Amount to transfer, excluding charges
 * @param transferMode      IMPS or NEFT
 * @param remarks           Optional free text forwarded to the provider
 * @param clientRefId       Optional caller-generated idempotency token
 */
public record PayoutTransferRequest(
        String accountNumber,
        String ifscCode,
        String accountHolderName,
        Integer bankId,
        String bankName,
        String beneficiaryMobile,
        String senderName,
        String senderMobile,
        String senderEmail,
        BigDecimal amount,
        TransferMode transferMode,
        String remarks,
        String clientRefId
) {
}
