package com.nosota.mpayout.api.response;

import com.nosota.mpayout.api.dto.ReconciliationItemDTO;

import java.util.List;

/**
 * Summary of one reconciliation run.
 *
 * @param checked      Transactions examined
 * @param resolved     Transactions whose status was updated from the provider without a refund
 * @param refunded     Transactions refunded (provider failure or auto-refund)
 * @param stillPending Transactions left unresolved
 * @param results      Per-transaction outcome
 */
public record ReconciliationResponse(
        int checked,
        int resolved,
        int refunded,
        int stillPending,
        List<ReconciliationItemDTO> results
) {}
