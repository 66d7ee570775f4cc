package com.nosota.mpayout.provider.expresspay;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * Payload of POST /accountVerify. {@code isValid} false means the bank did not recognise the account.
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public record ExpressPayAccountData(
        String accountHolderName,
        String bankName,
        String branchName,
        @JsonProperty("isValid") Boolean valid,
        String transactionId
) {
}
