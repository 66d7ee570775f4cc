package com.nosota.mpayout.repository;

import com.nosota.mpayout.api.model.TransferMode;
import com.nosota.mpayout.model.ChargeSlab;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import org.springframework.stereotype.Repository;

import java.math.BigDecimal;
import java.util.List;
import java.util.UUID;

@Repository
public interface ChargeSlabRepository extends JpaRepository<ChargeSlab, UUID> {

    /**
     * Active slabs of a scheme whose band contains {@code amount}, narrowest (highest minimum) first.
     */
    @Query("SELECT c FROM ChargeSlab c " +
            "WHERE c.schemeId = :schemeId AND c.transferMode = :mode AND c.active = true " +
            "AND c.minAmount <= :amount AND c.maxAmount >= :amount " +
            "ORDER BY c.minAmount DESC")
    List<ChargeSlab> findMatchingSlabs(@Param("schemeId") UUID schemeId,
                                       @Param("mode") TransferMode mode,
                                       @Param("amount") BigDecimal amount);

    List<ChargeSlab> findBySchemeIdAndActiveTrue(UUID schemeId);
}
