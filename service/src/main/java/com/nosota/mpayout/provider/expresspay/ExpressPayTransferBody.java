package com.nosota.mpayout.provider.expresspay;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.nosota.mpayout.provider.ProviderTransferRequest;

import java.math.BigDecimal;

/**
 * Request body of POST /expressPay2. Field names follow the provider contract.
 */
public record ExpressPayTransferBody(
        @JsonProperty("AccountNo") String accountNo,
        @JsonProperty("AmountR") BigDecimal amount,
        @JsonProperty("APIRequestID") String apiRequestId,
        @JsonProperty("BankID") Integer bankId,
        @JsonProperty("BeneMobile") String beneficiaryMobile,
        @JsonProperty("BeneName") String beneficiaryName,
        @JsonProperty("bankName") String bankName,
        @JsonProperty("IFSC") String ifsc,
        @JsonProperty("SenderEmail") String senderEmail,
        @JsonProperty("SenderMobile") String senderMobile,
        @JsonProperty("SenderName") String senderName,
        @JsonProperty("paymentType") String paymentType,
        @JsonProperty("WebHook") String webhook,
        @JsonProperty("extraParam1") String extraParam1,
        @JsonProperty("extraParam2") String extraParam2,
        @JsonProperty("extraField1") String extraField1,
        @JsonProperty("sub_service_name") String subServiceName,
        @JsonProperty("remark") String remark
) {

    private static final String DEFAULT_SENDER_EMAIL = "noreply@example.com";

    public static ExpressPayTransferBody of(ProviderTransferRequest request, String apiRequestId, String webhookUrl) {
        String remark = request.remarks() != null && !request.remarks().isBlank()
                ? request.remarks().trim()
                : "Payout transfer to " + request.accountHolderName();
        String email = request.senderEmail() != null && !request.senderEmail().isBlank()
                ? request.senderEmail().trim()
                : DEFAULT_SENDER_EMAIL;

        return new ExpressPayTransferBody(
                request.accountNumber(),
                request.amount(),
                apiRequestId,
                request.bankId(),
                request.beneficiaryMobile(),
                request.accountHolderName(),
                request.bankName(),
                request.ifscCode(),
                email,
                request.senderMobile(),
                request.senderName(),
                request.transferMode().name(),
                webhookUrl == null ? "" : webhookUrl,
                "NA",
                "NA",
                request.clientRefId(),
                "ExpressPay",
                remark);
    }
}
