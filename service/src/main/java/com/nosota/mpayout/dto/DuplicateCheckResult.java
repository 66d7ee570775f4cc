package com.nosota.mpayout.dto;

import com.nosota.mpayout.model.PayoutTransaction;

/**
 * Outcome of the duplicate check.
 *
 * @param blocked              true when a transfer to the same destination is inside the window
 * @param remainingWaitSeconds seconds until the window closes (positive when blocked)
 * @param priorTransaction     the blocking transaction, null when not blocked
 */
public record DuplicateCheckResult(
        boolean blocked,
        long remainingWaitSeconds,
        PayoutTransaction priorTransaction
) {

    public static DuplicateCheckResult clear() {
        return new DuplicateCheckResult(false, 0, null);
    }

    public static DuplicateCheckResult blocked(long remainingWaitSeconds, PayoutTransaction priorTransaction) {
        return new DuplicateCheckResult(true, remainingWaitSeconds, priorTransaction);
    }
}
