package com.nosota.mpayout.provider;

import com.nosota.mpayout.error.ProviderUnavailableException;

import java.util.List;

/**
 * External bank-transfer provider.
 *
 * <p>Transfer, status and account verification calls never throw for provider or network failures:
 * every outcome is returned as a tagged result so that callers must handle rejection and timeout explicitly.
 */
public interface PayoutProvider {

    /**
     * Initiates a transfer. Must not be retried by the caller on {@link TransferOutcome.Kind#TIMEOUT}.
     */
    TransferOutcome initiateTransfer(ProviderTransferRequest request);

    StatusCheckResult getStatus(String providerTransactionId);

    ProviderFloatBalance getFloatBalance() throws ProviderUnavailableException;

    List<ProviderBank> listBanks() throws ProviderUnavailableException;

    /**
     * Looks up the holder of a bank account.
     *
     * @param accountNumber digits only
     * @param ifscCode      upper-case IFSC
     * @param bankName      optional, may be null
     */
    AccountVerification verifyAccount(String accountNumber, String ifscCode, String bankName);
}
