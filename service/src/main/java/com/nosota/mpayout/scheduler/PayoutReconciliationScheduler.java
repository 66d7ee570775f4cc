package com.nosota.mpayout.scheduler;

import com.nosota.mpayout.dto.ReconciliationScope;
import com.nosota.mpayout.dto.ReconciliationSummary;
import com.nosota.mpayout.service.PayoutReconciliationService;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Component;

/**
 * Scheduled job resolving payout transactions left PENDING or PROCESSING.
 *
 * <p>Configuration:
 * <pre>
 * scheduler:
 *   payout-reconciliation:
 *     enabled: true              # enable/disable scheduler
 *     cron: "0 *&#47;5 * * * *"   # every 5 minutes
 * </pre>
 */
@Component
@RequiredArgsConstructor
@Slf4j
@ConditionalOnProperty(
        value = "scheduler.payout-reconciliation.enabled",
        havingValue = "true",
        matchIfMissing = true
)
public class PayoutReconciliationScheduler {

    private final PayoutReconciliationService payoutReconciliationService;

    @Scheduled(cron = "${scheduler.payout-reconciliation.cron:0 */5 * * * *}")
    public void reconcilePendingPayouts() {
        log.debug("Starting scheduled job: payout reconciliation");

        try {
            ReconciliationSummary summary = payoutReconciliationService.reconcile(ReconciliationScope.all());

            if (summary.checked() > 0) {
                log.info("Payout reconciliation: checked={}, resolved={}, refunded={}, stillPending={}",
                        summary.checked(), summary.resolved(), summary.refunded(), summary.stillPending());
            }

        } catch (Exception e) {
            log.error("Payout reconciliation run failed: {}", e.getMessage(), e);
        }
    }
}
