package com.nosota.mpayout.provider;

/**
 * Result of a provider status query. When {@code ok} is false the provider could not be asked
 * and {@code status} is null.
 *
 * @param operatorReference Bank reference number (RRN/UTR)
 */
public record StatusCheckResult(
        boolean ok,
        ProviderStatus status,
        String operatorReference,
        String message
) {

    public static StatusCheckResult of(ProviderStatus status, String operatorReference, String message) {
        return new StatusCheckResult(true, status, operatorReference, message);
    }

    public static StatusCheckResult error(String message) {
        return new StatusCheckResult(false, null, null, message);
    }
}
