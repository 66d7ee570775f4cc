package com.nosota.mpayout.service;

import com.nosota.mpayout.api.model.PayoutStatus;
import org.springframework.stereotype.Component;

import java.util.EnumSet;
import java.util.Map;
import java.util.Set;

/**
 * State machine for validating PayoutStatus transitions.
 *
 * <p>State diagram:
 * <pre>
 *        PENDING
 *         |    \
 *     PROCESSING FAILED
 *     /   |   \
 * SUCCESS FAILED REFUNDED
 * </pre>
 *
 * <ul>
 *   <li>PENDING → PROCESSING once the wallet debit is confirmed</li>
 *   <li>PENDING → FAILED for a transaction that was never debited</li>
 *   <li>PROCESSING → REFUNDED only through reconciliation (auto-refund)</li>
 *   <li>SUCCESS, FAILED and REFUNDED are final</li>
 * </ul>
 */
@Component
public class PayoutStatusStateMachine {

    private static final Map<PayoutStatus, Set<PayoutStatus>> ALLOWED_TRANSITIONS = Map.of(
            PayoutStatus.PENDING, EnumSet.of(
                    PayoutStatus.PROCESSING,
                    PayoutStatus.FAILED
            ),
            PayoutStatus.PROCESSING, EnumSet.of(
                    PayoutStatus.SUCCESS,
                    PayoutStatus.FAILED,
                    PayoutStatus.REFUNDED
            )
    );

    /**
     * Same status is always allowed (no-op).
     */
    public boolean isTransitionAllowed(PayoutStatus fromStatus, PayoutStatus toStatus) {
        if (fromStatus == null || toStatus == null) {
            return false;
        }
        if (fromStatus == toStatus) {
            return true;
        }
        Set<PayoutStatus> allowedTargets = ALLOWED_TRANSITIONS.get(fromStatus);
        return allowedTargets != null && allowedTargets.contains(toStatus);
    }

    /**
     * @throws IllegalStateException if the transition is not allowed
     */
    public void validateTransition(PayoutStatus fromStatus, PayoutStatus toStatus) {
        if (!isTransitionAllowed(fromStatus, toStatus)) {
            throw new IllegalStateException(
                    String.format("Invalid payout status transition: %s → %s. Allowed transitions from %s: %s",
                            fromStatus, toStatus, fromStatus,
                            ALLOWED_TRANSITIONS.getOrDefault(fromStatus, Set.of()))
            );
        }
    }

    public boolean isFinalState(PayoutStatus status) {
        return status != null && status.isFinal();
    }

    public Set<PayoutStatus> getAllowedTransitions(PayoutStatus fromStatus) {
        return ALLOWED_TRANSITIONS.getOrDefault(fromStatus, Set.of());
    }
}
