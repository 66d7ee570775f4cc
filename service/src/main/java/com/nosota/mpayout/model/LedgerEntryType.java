package com.nosota.mpayout.model;

/**
 * Movement type of a ledger entry.
 */
public enum LedgerEntryType {
    DEBIT,
    CREDIT,
    REFUND
}
