package com.nosota.mpayout.dto;

import com.nosota.mpayout.api.dto.ReconciliationItemDTO;

import java.util.List;

/**
 * Result of a reconciliation run. {@code checked} counts every examined transaction;
 * transactions resolved concurrently by another path are reported as "skipped" and counted in no other bucket.
 */
public record ReconciliationSummary(
        int checked,
        int resolved,
        int refunded,
        int stillPending,
        List<ReconciliationItemDTO> results
) {
}
