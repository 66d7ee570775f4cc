package com.nosota.mpayout.service;

import com.nosota.mpayout.api.model.PayoutStatus;
import com.nosota.mpayout.dto.DuplicateCheckResult;
import com.nosota.mpayout.model.PayoutTransaction;
import com.nosota.mpayout.repository.PayoutTransactionRepository;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.Duration;
import java.time.LocalDateTime;
import java.util.EnumSet;
import java.util.Optional;
import java.util.Set;

/**
 * Rejects rapid re-submission of a transfer to the same destination.
 *
 * <p>A request is blocked when the same merchant has a PENDING, PROCESSING or SUCCESS transaction to the
 * same account number created within the trailing window ({@code payout.duplicate-window-seconds},
 * default 120). This is a best-effort net against double clicks and client retries, not a lock:
 * retries of the same logical request are recognized through the client reference id instead.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class DuplicateGuard {

    static final Set<PayoutStatus> BLOCKING_STATUSES =
            EnumSet.of(PayoutStatus.PENDING, PayoutStatus.PROCESSING, PayoutStatus.SUCCESS);

    private final PayoutTransactionRepository payoutTransactionRepository;
    private final Clock clock;

    @Value("${payout.duplicate-window-seconds:120}")
    private long windowSeconds;

    public DuplicateCheckResult check(Long merchantId, String accountNumber) {
        return check(merchantId, accountNumber, windowSeconds);
    }

    public DuplicateCheckResult check(Long merchantId, String accountNumber, long windowSeconds) {
        LocalDateTime now = LocalDateTime.now(clock);

        Optional<PayoutTransaction> prior = payoutTransactionRepository
                .findFirstByMerchantIdAndAccountNumberAndStatusInAndCreatedAtAfterOrderByCreatedAtDesc(
                        merchantId, accountNumber, BLOCKING_STATUSES, now.minusSeconds(windowSeconds));
        if (prior.isEmpty()) {
            return DuplicateCheckResult.clear();
        }

        long elapsed = Duration.between(prior.get().getCreatedAt(), now).getSeconds();
        long wait = Math.max(1, windowSeconds - elapsed);
        log.warn("Duplicate transfer blocked: merchantId={}, account={}, priorTransaction={}, waitSeconds={}",
                merchantId, AccountMasking.mask(accountNumber), prior.get().getId(), wait);
        return DuplicateCheckResult.blocked(wait, prior.get());
    }
}
