package com.nosota.mpayout.error;

/**
 * Provider could not confirm a beneficiary account. Nothing is charged or debited.
 */
public class AccountVerificationFailedException extends Exception {

    public AccountVerificationFailedException(String message) {
        super(message);
    }
}
