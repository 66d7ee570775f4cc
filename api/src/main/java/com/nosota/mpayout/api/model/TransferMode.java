package com.nosota.mpayout.api.model;

/**
 * Interbank transfer rail requested for a payout.
 */
public enum TransferMode {
    IMPS,
    NEFT
}
