package com.nosota.mpayout.provider.expresspay;

/**
 * Request body of POST /accountVerify.
 */
public record ExpressPayAccountVerifyBody(
        String accountNumber,
        String ifsc,
        String bankName
) {
}
