package com.nosota.mpayout.error;

import lombok.Getter;

/**
 * Transfer request rejected before any side effect. Carries the first failing field.
 */
@Getter
public class PayoutValidationException extends Exception {

    private final String field;

    public PayoutValidationException(String field, String message) {
        super(message);
        this.field = field;
    }
}
