package com.nosota.mpayout.error;

import lombok.Getter;

import java.util.UUID;

/**
 * Provider explicitly rejected a transfer after the wallet was debited.
 * Raised only after the refund has been booked.
 */
@Getter
public class ProviderRejectedException extends Exception {

    private final UUID transactionId;
    private final String clientRefId;

    public ProviderRejectedException(String message, UUID transactionId, String clientRefId) {
        super(message);
        this.transactionId = transactionId;
        this.clientRefId = clientRefId;
    }
}
