package com.nosota.mpayout.provider.expresspay;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;

/**
 * Envelope of every ExpressPay response.
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public record ExpressPayResponse<T>(
        Boolean success,
        Integer status,
        String message,
        T data
) {

    public boolean succeeded() {
        return Boolean.TRUE.equals(success);
    }
}
