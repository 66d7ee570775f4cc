package com.nosota.mpayout.pricing;

import com.nosota.mpayout.api.model.TransferMode;

import java.math.BigDecimal;
import java.util.Optional;

/**
 * One way of pricing a transfer. Strategies are tried in {@code @Order}; the first non-empty quote wins.
 * An empty result (no scheme, no slab, zero charge) passes the request on to the next strategy,
 * as does a runtime failure.
 */
public interface ChargeStrategy {

    Optional<ChargeQuote> quote(Long merchantId, String serviceType, BigDecimal amount, TransferMode transferMode);

    String name();
}
