package com.nosota.mpayout.error;

import lombok.Getter;

import java.math.BigDecimal;

/**
 * Provider float cannot cover the transfer. Details are logged, not returned to the caller.
 */
@Getter
public class ProviderUnderfundedException extends ProviderUnavailableException {

    private final BigDecimal availableFloat;
    private final BigDecimal requiredAmount;

    public ProviderUnderfundedException(String message, BigDecimal availableFloat, BigDecimal requiredAmount) {
        super(message);
        this.availableFloat = availableFloat;
        this.requiredAmount = requiredAmount;
    }
}
