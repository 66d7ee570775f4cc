package com.nosota.mpayout.service;

/**
 * Masks bank account numbers for responses and logs: every character but the last four becomes '*'.
 */
public final class AccountMasking {

    private static final int VISIBLE = 4;

    private AccountMasking() {
    }

    public static String mask(String accountNumber) {
        if (accountNumber == null || accountNumber.length() <= VISIBLE) {
            return accountNumber;
        }
        int hidden = accountNumber.length() - VISIBLE;
        return "*".repeat(hidden) + accountNumber.substring(hidden);
    }
}
