package com.nosota.mpayout.model;

/**
 * Status of a ledger entry. PENDING may move once, to COMPLETED or FAILED.
 */
public enum LedgerEntryStatus {
    PENDING,
    COMPLETED,
    FAILED
}
