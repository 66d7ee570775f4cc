package com.nosota.mpayout.error;

import com.nosota.mpayout.api.model.PayoutStatus;
import lombok.Getter;

import java.math.BigDecimal;
import java.time.LocalDateTime;
import java.util.UUID;

/**
 * A transfer to the same destination was accepted inside the duplicate window.
 */
@Getter
public class DuplicatePayoutException extends Exception {

    private final long waitSeconds;
    private final UUID priorTransactionId;
    private final PayoutStatus priorStatus;
    private final BigDecimal priorAmount;
    private final LocalDateTime priorCreatedAt;

    public DuplicatePayoutException(String message, long waitSeconds, UUID priorTransactionId,
                                    PayoutStatus priorStatus, BigDecimal priorAmount, LocalDateTime priorCreatedAt) {
        super(message);
        this.waitSeconds = waitSeconds;
        this.priorTransactionId = priorTransactionId;
        this.priorStatus = priorStatus;
        this.priorAmount = priorAmount;
        this.priorCreatedAt = priorCreatedAt;
    }
}
