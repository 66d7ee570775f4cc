package com.nosota.mpayout.provider;

public record ProviderBank(
        Integer bankId,
        String bankName,
        String code,
        String ifscPrefix,
        boolean impsEnabled,
        boolean neftEnabled,
        boolean popular
) {
}
