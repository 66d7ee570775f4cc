package com.nosota.mpayout.provider;

import java.math.BigDecimal;

/**
 * Funds held with the provider. Lien is blocked and cannot fund transfers.
 */
public record ProviderFloatBalance(BigDecimal balance, BigDecimal lien) {

    public BigDecimal available() {
        return balance.subtract(lien);
    }
}
