package com.nosota.mpayout.api.model;

/**
 * Lifecycle status of a payout transaction.
 *
 * <pre>
 * PENDING -> PROCESSING -> SUCCESS | FAILED | REFUNDED
 * </pre>
 */
public enum PayoutStatus {
    /**
     * PENDING: Transaction row exists but the wallet debit is not confirmed yet.
     */
    PENDING,

    /**
     * PROCESSING: Wallet debited, the provider outcome is not final.
     * May persist until the reconciliation job resolves it.
     */
    PROCESSING,

    /**
     * SUCCESS: Provider confirmed the transfer. Final state.
     */
    SUCCESS,

    /**
     * FAILED: Provider rejected the transfer and the wallet was refunded. Final state.
     */
    FAILED,

    /**
     * REFUNDED: Auto-refunded by reconciliation after no provider acknowledgement. Final state.
     */
    REFUNDED;

    public boolean isFinal() {
        return this == SUCCESS || this == FAILED || this == REFUNDED;
    }
}
