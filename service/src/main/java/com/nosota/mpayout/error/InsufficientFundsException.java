package com.nosota.mpayout.error;

import lombok.Getter;

import java.math.BigDecimal;

/**
 * Wallet balance does not cover amount + charge.
 * {@code amount} and {@code charge} are null when raised by the ledger, which only knows the total.
 */
@Getter
public class InsufficientFundsException extends Exception {

    private final BigDecimal walletBalance;
    private final BigDecimal amount;
    private final BigDecimal charge;
    private final BigDecimal totalRequired;

    public InsufficientFundsException(String message, BigDecimal walletBalance, BigDecimal totalRequired) {
        this(message, walletBalance, null, null, totalRequired);
    }

    public InsufficientFundsException(String message, BigDecimal walletBalance, BigDecimal amount,
                                      BigDecimal charge, BigDecimal totalRequired) {
        super(message);
        this.walletBalance = walletBalance;
        this.amount = amount;
        this.charge = charge;
        this.totalRequired = totalRequired;
    }
}
