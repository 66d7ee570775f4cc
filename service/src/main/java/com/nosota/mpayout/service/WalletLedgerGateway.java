package com.nosota.mpayout.service;

import com.nosota.mpayout.error.InsufficientFundsException;
import com.nosota.mpayout.error.WalletNotFoundException;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.Positive;

import java.math.BigDecimal;
import java.util.UUID;

/**
 * Money movements on a merchant wallet.
 *
 * <p>Every movement is a ledger entry tagged with the payout transaction it belongs to.
 * Reservation and refund are atomic per merchant: a concurrent movement for the same merchant
 * cannot observe the balance between the check and the insert.
 */
public interface WalletLedgerGateway {

    /**
     * Current spendable balance.
     */
    BigDecimal balance(@NotNull Long merchantId) throws WalletNotFoundException;

    /**
     * Checks the balance and books a PENDING DEBIT entry in one atomic step.
     *
     * @return id of the DEBIT entry
     * @throws InsufficientFundsException if the balance is below {@code totalAmount}
     */
    Long reserve(@NotNull Long merchantId, @NotNull UUID transactionId, @Positive BigDecimal totalAmount,
                 String description, @NotNull String reference)
            throws WalletNotFoundException, InsufficientFundsException;

    /**
     * Books a REFUND entry for a transaction. Not capacity-checked. At most one refund exists per
     * transaction: a repeated call returns the existing entry.
     *
     * @return id of the REFUND entry
     */
    Long refund(@NotNull Long merchantId, @NotNull UUID transactionId, @Positive BigDecimal totalAmount,
                String description, @NotNull String reference)
            throws WalletNotFoundException;

    /**
     * Funds a wallet (top-up), creating the wallet on first use.
     *
     * @return id of the CREDIT entry
     */
    Long credit(@NotNull Long merchantId, @Positive BigDecimal amount, String description, @NotNull String reference);

    /**
     * Moves a PENDING entry to COMPLETED. Returns false when the entry is no longer PENDING.
     */
    boolean completeEntry(@NotNull Long entryId);

    /**
     * Moves a PENDING entry to FAILED. Returns false when the entry is no longer PENDING.
     */
    boolean failEntry(@NotNull Long entryId);
}
