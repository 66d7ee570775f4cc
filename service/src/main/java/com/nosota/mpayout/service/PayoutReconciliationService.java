package com.nosota.mpayout.service;

import com.nosota.mpayout.api.dto.ReconciliationItemDTO;
import com.nosota.mpayout.api.model.PayoutStatus;
import com.nosota.mpayout.api.request.ProviderCallbackRequest;
import com.nosota.mpayout.dto.ReconciliationScope;
import com.nosota.mpayout.dto.ReconciliationSummary;
import com.nosota.mpayout.error.PayoutTransactionNotFoundException;
import com.nosota.mpayout.error.WalletNotFoundException;
import com.nosota.mpayout.model.PayoutTransaction;
import com.nosota.mpayout.provider.PayoutProvider;
import com.nosota.mpayout.provider.ProviderStatus;
import com.nosota.mpayout.provider.StatusCheckResult;
import com.nosota.mpayout.repository.PayoutTransactionRepository;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.data.domain.PageRequest;
import org.springframework.data.domain.Pageable;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.Duration;
import java.time.LocalDateTime;
import java.util.ArrayList;
import java.util.List;

/**
 * Resolves transactions left PENDING or PROCESSING.
 *
 * <p>Only transactions older than {@code payout.reconciliation.stale-minutes} are selected, oldest first,
 * at most {@code payout.reconciliation.batch-size} per run. For each one:
 * <ul>
 *   <li>with a provider transaction id: the provider status is queried and a final status adopted;
 *       FAILED refunds the wallet</li>
 *   <li>without one: refunded and marked REFUNDED once older than {@code payout.reconciliation.auto-refund-hours},
 *       otherwise left alone</li>
 * </ul>
 * Every transition goes through {@link PayoutTransactionService} on a locked row, so repeated or concurrent
 * runs never refund twice.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class PayoutReconciliationService {

    static final String STATUS_UPDATED = "status_updated";
    static final String REFUNDED = "refunded";
    static final String AUTO_REFUNDED = "auto_refunded";
    static final String STILL_PENDING = "still_pending";
    static final String PROVIDER_CHECK_FAILED = "provider_check_failed";
    static final String SKIPPED = "skipped";
    static final String ERROR = "error";

    private final PayoutTransactionRepository payoutTransactionRepository;
    private final PayoutTransactionService payoutTransactionService;
    private final PayoutProvider payoutProvider;
    private final Clock clock;

    @Value("${payout.reconciliation.stale-minutes:5}")
    private long staleMinutes;

    @Value("${payout.reconciliation.auto-refund-hours:48}")
    private long autoRefundHours;

    @Value("${payout.reconciliation.batch-size:50}")
    private int batchSize;

    public ReconciliationSummary reconcile(ReconciliationScope scope) {
        LocalDateTime now = LocalDateTime.now(clock);
        List<PayoutTransaction> candidates = select(scope, now.minusMinutes(staleMinutes));
        if (candidates.isEmpty()) {
            log.debug("No stale payout transactions to reconcile");
            return new ReconciliationSummary(0, 0, 0, 0, List.of());
        }

        log.info("Reconciling {} stale payout transactions (merchantId={})", candidates.size(), scope.merchantId());

        int resolved = 0;
        int refunded = 0;
        int stillPending = 0;
        List<ReconciliationItemDTO> results = new ArrayList<>(candidates.size());

        for (PayoutTransaction tx : candidates) {
            ReconciliationItemDTO item;
            try {
                item = reconcileOne(tx, now);
            } catch (Exception e) {
                log.error("Failed to reconcile payout {}", tx.getId(), e);
                item = new ReconciliationItemDTO(tx.getId(), tx.getStatus(), tx.getStatus(), ERROR);
            }
            results.add(item);

            switch (item.action()) {
                case STATUS_UPDATED -> resolved++;
                case REFUNDED, AUTO_REFUNDED -> refunded++;
                case STILL_PENDING, PROVIDER_CHECK_FAILED -> stillPending++;
                default -> {
                }
            }
        }

        log.info("Reconciliation complete: checked={}, resolved={}, refunded={}, stillPending={}",
                candidates.size(), resolved, refunded, stillPending);
        return new ReconciliationSummary(candidates.size(), resolved, refunded, stillPending, results);
    }

    /**
     * Re-queries the provider for one unresolved transaction and applies a final status. Never auto-refunds.
     * Provider errors are logged and the stored state is returned unchanged.
     */
    public PayoutTransaction refreshStatus(PayoutTransaction tx) {
        if (!PayoutTransactionService.UNRESOLVED.contains(tx.getStatus()) || tx.getProviderTransactionId() == null) {
            return tx;
        }

        try {
            StatusCheckResult result = payoutProvider.getStatus(tx.getProviderTransactionId());
            if (!result.ok()) {
                log.warn("Status refresh of payout {} failed: {}", tx.getId(), result.message());
                return tx;
            }
            payoutTransactionService.applyProviderStatus(tx.getId(), result.status(), result.operatorReference(),
                    result.message(), null);
        } catch (WalletNotFoundException | RuntimeException e) {
            log.error("Status refresh of payout {} failed", tx.getId(), e);
            return tx;
        }
        return payoutTransactionService.getById(tx.getId());
    }

    /**
     * Applies a status pushed by the provider for a client reference id.
     *
     * <p>A pushed failure refunds the wallet, so it is only applied once the provider's status check
     * reports the same. When that check errors, or the transaction has no provider id to check, the
     * transaction is left for reconciliation. If the check reports a different status, that status is
     * applied instead.
     */
    public Resolution applyCallback(ProviderCallbackRequest callback)
            throws PayoutTransactionNotFoundException, WalletNotFoundException {
        PayoutTransaction tx = payoutTransactionService.findByClientRefId(callback.clientRefId())
                .orElseThrow(() -> new PayoutTransactionNotFoundException(
                        "Payout transaction with client reference " + callback.clientRefId() + " not found"));

        ProviderStatus status = ProviderStatus.fromCode(callback.status());
        if (status == ProviderStatus.FAILED) {
            return applyConfirmedFailure(tx, callback);
        }

        Resolution resolution = payoutTransactionService.applyProviderStatus(tx.getId(), status,
                callback.operatorReference(), callback.message(), callback.providerTransactionId());

        log.info("Provider callback for {}: status={}, resolution={}", callback.clientRefId(), status, resolution);
        return resolution;
    }

    private Resolution applyConfirmedFailure(PayoutTransaction tx, ProviderCallbackRequest callback)
            throws WalletNotFoundException {
        String providerTransactionId = tx.getProviderTransactionId() != null
                ? tx.getProviderTransactionId() : callback.providerTransactionId();
        if (providerTransactionId == null) {
            log.warn("Failure callback for {} has no provider transaction id to confirm; left for reconciliation",
                    callback.clientRefId());
            return Resolution.UNCHANGED;
        }

        StatusCheckResult confirmed = payoutProvider.getStatus(providerTransactionId);
        if (!confirmed.ok()) {
            log.warn("Failure callback for {} could not be confirmed: {}; left for reconciliation",
                    callback.clientRefId(), confirmed.message());
            return Resolution.UNCHANGED;
        }

        Resolution resolution;
        if (confirmed.status() == ProviderStatus.FAILED) {
            resolution = payoutTransactionService.applyProviderStatus(tx.getId(), ProviderStatus.FAILED,
                    callback.operatorReference(), callback.message(), callback.providerTransactionId());
        } else {
            log.warn("Failure callback for {} contradicted by provider status {}",
                    callback.clientRefId(), confirmed.status());
            resolution = payoutTransactionService.applyProviderStatus(tx.getId(), confirmed.status(),
                    confirmed.operatorReference(), confirmed.message(), callback.providerTransactionId());
        }
        log.info("Provider callback for {}: status=FAILED, confirmed={}, resolution={}",
                callback.clientRefId(), confirmed.status(), resolution);
        return resolution;
    }

    private ReconciliationItemDTO reconcileOne(PayoutTransaction tx, LocalDateTime now)
            throws WalletNotFoundException {
        PayoutStatus previous = tx.getStatus();

        if (tx.getProviderTransactionId() != null) {
            StatusCheckResult result = payoutProvider.getStatus(tx.getProviderTransactionId());
            if (!result.ok()) {
                log.warn("Provider status check for payout {} failed: {}", tx.getId(), result.message());
                return new ReconciliationItemDTO(tx.getId(), previous, previous, PROVIDER_CHECK_FAILED);
            }

            Resolution resolution = payoutTransactionService.applyProviderStatus(tx.getId(), result.status(),
                    result.operatorReference(), result.message(), null);
            return item(tx, previous, switch (resolution) {
                case UPDATED -> STATUS_UPDATED;
                case REFUNDED -> REFUNDED;
                case UNCHANGED -> STILL_PENDING;
                case SKIPPED -> SKIPPED;
            });
        }

        long ageHours = Duration.between(tx.getCreatedAt(), now).toHours();
        if (ageHours < autoRefundHours) {
            return new ReconciliationItemDTO(tx.getId(), previous, previous, STILL_PENDING);
        }

        Resolution resolution = payoutTransactionService.autoRefund(tx.getId(), ageHours);
        return item(tx, previous, switch (resolution) {
            case REFUNDED -> AUTO_REFUNDED;
            case SKIPPED -> SKIPPED;
            default -> STATUS_UPDATED;
        });
    }

    private ReconciliationItemDTO item(PayoutTransaction tx, PayoutStatus previous, String action) {
        PayoutStatus current = STILL_PENDING.equals(action)
                ? previous
                : payoutTransactionService.getById(tx.getId()).getStatus();
        return new ReconciliationItemDTO(tx.getId(), previous, current, action);
    }

    private List<PayoutTransaction> select(ReconciliationScope scope, LocalDateTime cutoff) {
        Pageable batch = PageRequest.of(0, batchSize);
        if (scope.merchantId() != null && scope.hasTransactionIds()) {
            return payoutTransactionRepository.findByMerchantIdAndIdInAndStatusInAndCreatedAtBeforeOrderByCreatedAtAsc(
                    scope.merchantId(), scope.transactionIds(), PayoutTransactionService.UNRESOLVED, cutoff, batch);
        }
        if (scope.merchantId() != null) {
            return payoutTransactionRepository.findByMerchantIdAndStatusInAndCreatedAtBeforeOrderByCreatedAtAsc(
                    scope.merchantId(), PayoutTransactionService.UNRESOLVED, cutoff, batch);
        }
        if (scope.hasTransactionIds()) {
            return payoutTransactionRepository.findByIdInAndStatusInAndCreatedAtBeforeOrderByCreatedAtAsc(
                    scope.transactionIds(), PayoutTransactionService.UNRESOLVED, cutoff, batch);
        }
        return payoutTransactionRepository.findByStatusInAndCreatedAtBeforeOrderByCreatedAtAsc(
                PayoutTransactionService.UNRESOLVED, cutoff, batch);
    }
}
