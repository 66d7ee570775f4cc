package com.nosota.mpayout.service;

/**
 * What applying an outcome did to a transaction.
 */
public enum Resolution {
    /**
     * Status moved without a refund (e.g. PROCESSING → SUCCESS).
     */
    UPDATED,

    /**
     * Refund booked, status moved to FAILED or REFUNDED.
     */
    REFUNDED,

    /**
     * Outcome not final yet, status unchanged.
     */
    UNCHANGED,

    /**
     * Transaction already final (resolved by another path), nothing done.
     */
    SKIPPED
}
