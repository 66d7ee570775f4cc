package com.nosota.mpayout.provider;

/**
 * Result of a transfer initiation.
 *
 * <ul>
 *   <li>ACCEPTED: provider took the transfer; {@code providerTransactionId} and {@code status} are set</li>
 *   <li>REJECTED: provider explicitly refused; nothing will be paid out</li>
 *   <li>TIMEOUT: no answer within the time budget; the transfer may still be executed</li>
 * </ul>
 */
public record TransferOutcome(
        Kind kind,
        String providerTransactionId,
        ProviderStatus status,
        String referenceNumber,
        String message
) {

    public enum Kind {
        ACCEPTED,
        REJECTED,
        TIMEOUT
    }

    public static TransferOutcome accepted(String providerTransactionId, ProviderStatus status,
                                           String referenceNumber, String message) {
        return new TransferOutcome(Kind.ACCEPTED, providerTransactionId, status, referenceNumber, message);
    }

    public static TransferOutcome rejected(String message) {
        return new TransferOutcome(Kind.REJECTED, null, ProviderStatus.FAILED, null, message);
    }

    public static TransferOutcome timeout(String message) {
        return new TransferOutcome(Kind.TIMEOUT, null, null, null, message);
    }
}
