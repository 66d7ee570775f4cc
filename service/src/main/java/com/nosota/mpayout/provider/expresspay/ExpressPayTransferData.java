package com.nosota.mpayout.provider.expresspay;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.math.BigDecimal;

@JsonIgnoreProperties(ignoreUnknown = true)
public record ExpressPayTransferData(
        String clientReqId,
        BigDecimal totalAmount,
        BigDecimal serviceCharge,
        BigDecimal transactionAmount,
        String referenceNo,
        @JsonProperty("transaction_id") String transactionId,
        String status,
        String remark
) {
}
