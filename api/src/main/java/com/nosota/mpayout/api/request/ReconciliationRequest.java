package com.nosota.mpayout.api.request;

import java.util.List;
import java.util.UUID;

/**
 * Optional scope for an on-demand reconciliation run.
 *
 * @param merchantId     Restrict the run to one merchant (null for all)
 * @param transactionIds Restrict the run to explicit transactions (null or empty for all)
 */
public record ReconciliationRequest(
        Long merchantId,
        List<UUID> transactionIds
) {
}
