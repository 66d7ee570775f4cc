package com.nosota.mpayout.dto;

import java.util.List;
import java.util.UUID;

/**
 * Filter of a reconciliation run. Null fields mean "no restriction".
 */
public record ReconciliationScope(
        Long merchantId,
        List<UUID> transactionIds
) {

    public static ReconciliationScope all() {
        return new ReconciliationScope(null, null);
    }

    public boolean hasTransactionIds() {
        return transactionIds != null && !transactionIds.isEmpty();
    }
}
