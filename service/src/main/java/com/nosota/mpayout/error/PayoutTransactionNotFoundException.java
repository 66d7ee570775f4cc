package com.nosota.mpayout.error;

public class PayoutTransactionNotFoundException extends Exception {
    public PayoutTransactionNotFoundException() {
    }

    public PayoutTransactionNotFoundException(String message) {
        super(message);
    }

    public PayoutTransactionNotFoundException(String message, Throwable cause) {
        super(message, cause);
    }

    public PayoutTransactionNotFoundException(Throwable cause) {
        super(cause);
    }
}
