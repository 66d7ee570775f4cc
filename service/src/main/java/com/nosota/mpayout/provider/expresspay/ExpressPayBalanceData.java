package com.nosota.mpayout.provider.expresspay;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;

import java.math.BigDecimal;

@JsonIgnoreProperties(ignoreUnknown = true)
public record ExpressPayBalanceData(
        BigDecimal balance,
        BigDecimal lien
) {
}
