package com.nosota.mpayout.provider;

/**
 * Result of a provider account lookup. When {@code verified} is false only {@code message} is set.
 *
 * @param providerReference Provider id of the lookup, billed separately
 */
public record AccountVerification(
        boolean verified,
        String accountHolderName,
        String bankName,
        String branchName,
        String providerReference,
        String message
) {

    public static AccountVerification verified(String accountHolderName, String bankName, String branchName,
                                               String providerReference) {
        return new AccountVerification(true, accountHolderName, bankName, branchName, providerReference, null);
    }

    public static AccountVerification failed(String message) {
        return new AccountVerification(false, null, null, null, null, message);
    }
}
