package com.nosota.mpayout.pricing;

import com.nosota.mpayout.api.model.TransferMode;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.math.BigDecimal;
import java.util.List;
import java.util.Optional;

/**
 * Resolves the charge of a transfer by walking the {@link ChargeStrategy} chain.
 *
 * <p>Pricing never fails a transfer: a failing strategy is logged and skipped, and the chain ends
 * with {@link DefaultFeeChargeStrategy}.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class PricingResolver {

    private final List<ChargeStrategy> strategies;

    public ChargeQuote resolve(Long merchantId, String serviceType, BigDecimal amount, TransferMode transferMode) {
        for (ChargeStrategy strategy : strategies) {
            try {
                Optional<ChargeQuote> quote = strategy.quote(merchantId, serviceType, amount, transferMode);
                if (quote.isPresent()) {
                    log.info("Priced transfer: merchantId={}, amount={}, mode={}, charge={}, scheme={}, source={}",
                            merchantId, amount, transferMode, quote.get().charge(),
                            quote.get().schemeName(), quote.get().source());
                    return quote.get();
                }
            } catch (RuntimeException e) {
                log.warn("Pricing strategy {} failed for merchant {}, falling through: {}",
                        strategy.name(), merchantId, e.getMessage());
            }
        }
        throw new IllegalStateException("No pricing strategy produced a charge for merchant " + merchantId);
    }
}
