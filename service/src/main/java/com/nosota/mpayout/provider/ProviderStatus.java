package com.nosota.mpayout.provider;

import java.util.Locale;

/**
 * Transfer status as reported by the provider.
 */
public enum ProviderStatus {
    SUCCESS,
    PENDING,
    FAILED;

    /**
     * Maps the provider status code (2 = success, 1 = pending, 0 = failed) or its textual form.
     * Anything unknown is treated as PENDING.
     */
    public static ProviderStatus fromCode(String code) {
        if (code == null) {
            return PENDING;
        }
        return switch (code.trim().toLowerCase(Locale.ROOT)) {
            case "2", "success", "successful" -> SUCCESS;
            case "0", "failed", "failure" -> FAILED;
            default -> PENDING;
        };
    }
}
