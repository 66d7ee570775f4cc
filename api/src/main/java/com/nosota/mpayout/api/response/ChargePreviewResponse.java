package com.nosota.mpayout.api.response;

import com.nosota.mpayout.api.model.TransferMode;

import java.math.BigDecimal;
import java.util.UUID;

/**
 * Charge that would be applied to a transfer, without submitting it.
 */
public record ChargePreviewResponse(
        BigDecimal amount,
        TransferMode transferMode,
        BigDecimal charge,
        BigDecimal totalDebit,
        UUID schemeId,
        String schemeName
) {}
