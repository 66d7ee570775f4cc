package com.nosota.mpayout.pricing;

import com.nosota.mpayout.api.model.TransferMode;
import com.nosota.mpayout.model.ChargeSlab;
import com.nosota.mpayout.model.EntityRole;
import com.nosota.mpayout.model.Scheme;
import com.nosota.mpayout.model.SchemeMapping;
import com.nosota.mpayout.repository.ChargeSlabRepository;
import com.nosota.mpayout.repository.SchemeMappingRepository;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.core.annotation.Order;
import org.springframework.stereotype.Component;

import java.math.BigDecimal;
import java.time.Clock;
import java.time.LocalDateTime;
import java.util.Comparator;
import java.util.Optional;

/**
 * Secondary pricing: only the merchant's own scheme mapping, filtered and ordered in memory from
 * plain lookups. Used when the hierarchical lookup fails or yields nothing.
 */
@Component
@Order(2)
@RequiredArgsConstructor
@Slf4j
public class DirectMappingChargeStrategy implements ChargeStrategy {

    private static final Comparator<SchemeMapping> BEST_MAPPING_FIRST = Comparator
            .comparingInt(SchemeMapping::getPriority)
            .thenComparing(SchemeMapping::getCreatedAt, Comparator.nullsLast(Comparator.reverseOrder()));

    private final SchemeMappingRepository schemeMappingRepository;
    private final ChargeSlabRepository chargeSlabRepository;
    private final Clock clock;

    @Override
    public Optional<ChargeQuote> quote(Long merchantId, String serviceType, BigDecimal amount,
                                       TransferMode transferMode) {
        LocalDateTime now = LocalDateTime.now(clock);

        Optional<Scheme> scheme = schemeMappingRepository.findActiveMappings(merchantId, EntityRole.RETAILER)
                .stream()
                .filter(m -> SlabCharges.isEffective(m.getEffectiveFrom(), m.getEffectiveTo(), now))
                .filter(m -> SlabCharges.matchesService(m.getServiceType(), serviceType))
                .filter(m -> m.getScheme().isActive())
                .filter(m -> SlabCharges.matchesService(m.getScheme().getServiceScope(), serviceType))
                .filter(m -> SlabCharges.isEffective(m.getScheme().getEffectiveFrom(), m.getScheme().getEffectiveTo(), now))
                .sorted(BEST_MAPPING_FIRST)
                .map(SchemeMapping::getScheme)
                .findFirst();
        if (scheme.isEmpty()) {
            return Optional.empty();
        }

        Optional<ChargeSlab> slab = chargeSlabRepository.findBySchemeIdAndActiveTrue(scheme.get().getId())
                .stream()
                .filter(s -> SlabCharges.covers(s, transferMode, amount))
                .max(Comparator.comparing(ChargeSlab::getMinAmount));
        if (slab.isEmpty()) {
            return Optional.empty();
        }

        BigDecimal charge = SlabCharges.chargeFor(slab.get(), amount);
        if (charge.signum() <= 0) {
            return Optional.empty();
        }
        log.debug("Direct mapping priced merchant {} with scheme {}: {}", merchantId, scheme.get().getName(), charge);
        return Optional.of(new ChargeQuote(charge, scheme.get().getId(), scheme.get().getName(), name()));
    }

    @Override
    public String name() {
        return "direct-mapping";
    }
}
