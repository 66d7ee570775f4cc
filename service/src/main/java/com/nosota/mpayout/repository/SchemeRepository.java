package com.nosota.mpayout.repository;

import com.nosota.mpayout.model.Scheme;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import org.springframework.stereotype.Repository;

import java.time.LocalDateTime;
import java.util.List;
import java.util.UUID;

@Repository
public interface SchemeRepository extends JpaRepository<Scheme, UUID> {

    /**
     * Active GLOBAL schemes for a service type, effective at {@code now}, best first
     * (priority ascending, newest first).
     */
    @Query("SELECT s FROM Scheme s " +
            "WHERE s.schemeType = com.nosota.mpayout.model.SchemeType.GLOBAL " +
            "AND s.active = true " +
            "AND (s.serviceScope IS NULL OR s.serviceScope = :serviceType OR s.serviceScope = 'all') " +
            "AND (s.effectiveFrom IS NULL OR s.effectiveFrom <= :now) " +
            "AND (s.effectiveTo IS NULL OR s.effectiveTo >= :now) " +
            "ORDER BY s.priority ASC, s.createdAt DESC")
    List<Scheme> findEffectiveGlobalSchemes(@Param("serviceType") String serviceType,
                                            @Param("now") LocalDateTime now);
}
