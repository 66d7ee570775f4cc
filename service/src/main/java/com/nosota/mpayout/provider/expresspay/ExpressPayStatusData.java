package com.nosota.mpayout.provider.expresspay;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;

import java.math.BigDecimal;

/**
 * Payload of POST /statusCheck. {@code status} is 2 (success), 1 (pending) or 0 (failed);
 * {@code opid} is the bank reference number.
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public record ExpressPayStatusData(
        String status,
        String msg,
        String opid,
        String rpid,
        BigDecimal amount,
        String errorcode
) {
}
