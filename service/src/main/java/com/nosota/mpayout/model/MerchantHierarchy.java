package com.nosota.mpayout.model;

import jakarta.persistence.Column;
import jakarta.persistence.Entity;
import jakarta.persistence.Id;
import jakarta.persistence.Table;
import lombok.AllArgsConstructor;
import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.Setter;

/**
 * Position of a merchant in the retailer → distributor → master distributor chain.
 * Maintained by partner onboarding, read-only here.
 */
@Entity
@Table(name = "merchant_hierarchy")
@Getter
@Setter
@AllArgsConstructor
@NoArgsConstructor
public class MerchantHierarchy {
    @Id
    @Column(name = "merchant_id")
    private Long merchantId;

    @Column(name = "distributor_id")
    private Long distributorId;

    @Column(name = "master_distributor_id")
    private Long masterDistributorId;
}
