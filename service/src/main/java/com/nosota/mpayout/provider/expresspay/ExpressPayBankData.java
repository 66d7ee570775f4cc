package com.nosota.mpayout.provider.expresspay;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;

@JsonIgnoreProperties(ignoreUnknown = true)
public record ExpressPayBankData(
        Integer id,
        String bankName,
        String code,
        String ifsc,
        @JsonProperty("isIMPS") Boolean imps,
        @JsonProperty("isNEFT") Boolean neft,
        @JsonProperty("isPopular") Boolean popular
) {
}
