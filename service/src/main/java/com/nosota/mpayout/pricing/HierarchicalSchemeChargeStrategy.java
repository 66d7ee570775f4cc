package com.nosota.mpayout.pricing;

import com.nosota.mpayout.api.model.TransferMode;
import com.nosota.mpayout.model.ChargeSlab;
import com.nosota.mpayout.model.EntityRole;
import com.nosota.mpayout.model.MerchantHierarchy;
import com.nosota.mpayout.model.Scheme;
import com.nosota.mpayout.model.SchemeMapping;
import com.nosota.mpayout.repository.ChargeSlabRepository;
import com.nosota.mpayout.repository.MerchantHierarchyRepository;
import com.nosota.mpayout.repository.SchemeMappingRepository;
import com.nosota.mpayout.repository.SchemeRepository;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.core.annotation.Order;
import org.springframework.stereotype.Component;

import java.math.BigDecimal;
import java.time.Clock;
import java.time.LocalDateTime;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

/**
 * Primary pricing: resolves the effective scheme through the merchant hierarchy and prices the
 * transfer with the matching slab.
 *
 * <p>Resolution order (first hit wins):
 * <ol>
 *   <li>scheme mapped to the merchant (retailer)</li>
 *   <li>scheme mapped to its distributor</li>
 *   <li>scheme mapped to its master distributor</li>
 *   <li>effective GLOBAL scheme</li>
 * </ol>
 * Within one level, mapping priority ascending, newest first. Mapping and scheme must both be active,
 * effective now and match the service type (exact, "all" or unset).
 */
@Component
@Order(1)
@RequiredArgsConstructor
@Slf4j
public class HierarchicalSchemeChargeStrategy implements ChargeStrategy {

    private final MerchantHierarchyRepository merchantHierarchyRepository;
    private final SchemeMappingRepository schemeMappingRepository;
    private final SchemeRepository schemeRepository;
    private final ChargeSlabRepository chargeSlabRepository;
    private final Clock clock;

    @Override
    public Optional<ChargeQuote> quote(Long merchantId, String serviceType, BigDecimal amount,
                                       TransferMode transferMode) {
        Optional<Scheme> scheme = resolveScheme(merchantId, serviceType);
        if (scheme.isEmpty()) {
            log.debug("No scheme resolved for merchant {} ({})", merchantId, serviceType);
            return Optional.empty();
        }

        Optional<BigDecimal> charge = chargeForScheme(scheme.get(), amount, transferMode);
        if (charge.isEmpty()) {
            log.info("Scheme {} has no positive {} charge for amount {}", scheme.get().getName(), transferMode, amount);
            return Optional.empty();
        }
        return Optional.of(new ChargeQuote(charge.get(), scheme.get().getId(), scheme.get().getName(), name()));
    }

    @Override
    public String name() {
        return "hierarchical-scheme";
    }

    /**
     * Effective scheme of a merchant for a service type.
     */
    public Optional<Scheme> resolveScheme(Long merchantId, String serviceType) {
        LocalDateTime now = LocalDateTime.now(clock);

        for (Assignee assignee : assigneesOf(merchantId)) {
            List<SchemeMapping> mappings = schemeMappingRepository
                    .findEffectiveMappings(assignee.entityId(), assignee.role(), serviceType, now);
            if (!mappings.isEmpty()) {
                Scheme scheme = mappings.get(0).getScheme();
                log.debug("Merchant {} resolved scheme {} via {} {}",
                        merchantId, scheme.getName(), assignee.role(), assignee.entityId());
                return Optional.of(scheme);
            }
        }

        return schemeRepository.findEffectiveGlobalSchemes(serviceType, now).stream().findFirst();
    }

    /**
     * Charge of a scheme for an amount and mode. Empty when no slab matches or the charge is not positive.
     */
    public Optional<BigDecimal> chargeForScheme(Scheme scheme, BigDecimal amount, TransferMode transferMode) {
        List<ChargeSlab> slabs = chargeSlabRepository.findMatchingSlabs(scheme.getId(), transferMode, amount);
        if (slabs.isEmpty()) {
            return Optional.empty();
        }
        BigDecimal charge = SlabCharges.chargeFor(slabs.get(0), amount);
        return charge.signum() > 0 ? Optional.of(charge) : Optional.empty();
    }

    private List<Assignee> assigneesOf(Long merchantId) {
        List<Assignee> assignees = new ArrayList<>(3);
        assignees.add(new Assignee(merchantId, EntityRole.RETAILER));

        Optional<MerchantHierarchy> hierarchy = merchantHierarchyRepository.findById(merchantId);
        hierarchy.map(MerchantHierarchy::getDistributorId)
                .ifPresent(id -> assignees.add(new Assignee(id, EntityRole.DISTRIBUTOR)));
        hierarchy.map(MerchantHierarchy::getMasterDistributorId)
                .ifPresent(id -> assignees.add(new Assignee(id, EntityRole.MASTER_DISTRIBUTOR)));
        return assignees;
    }

    private record Assignee(Long entityId, EntityRole role) {
    }
}
