package com.nosota.mpayout.api.dto;

import com.nosota.mpayout.api.model.PayoutStatus;

import java.util.UUID;

/**
 * Outcome of reconciling a single transaction.
 *
 * @param transactionId  Payout transaction id
 * @param previousStatus Status before the run
 * @param newStatus      Status after the run
 * @param action         status_updated, refunded, auto_refunded, still_pending, provider_check_failed or skipped
 */
public record ReconciliationItemDTO(
        UUID transactionId,
        PayoutStatus previousStatus,
        PayoutStatus newStatus,
        String action
) {}
