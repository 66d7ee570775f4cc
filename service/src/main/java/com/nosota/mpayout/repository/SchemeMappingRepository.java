package com.nosota.mpayout.repository;

import com.nosota.mpayout.model.EntityRole;
import com.nosota.mpayout.model.SchemeMapping;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import org.springframework.stereotype.Repository;

import java.time.LocalDateTime;
import java.util.List;
import java.util.UUID;

@Repository
public interface SchemeMappingRepository extends JpaRepository<SchemeMapping, UUID> {

    /**
     * Mappings of an entity whose mapping and scheme are both active and effective at {@code now}
     * and whose service filter matches {@code serviceType} (exact, "all" or unset).
     * Ordered by mapping priority ascending, newest first.
     */
    @Query("SELECT m FROM SchemeMapping m JOIN FETCH m.scheme s " +
            "WHERE m.entityId = :entityId AND m.entityRole = :role " +
            "AND m.active = true AND s.active = true " +
            "AND (m.serviceType IS NULL OR m.serviceType = :serviceType OR m.serviceType = 'all') " +
            "AND (s.serviceScope IS NULL OR s.serviceScope = :serviceType OR s.serviceScope = 'all') " +
            "AND (m.effectiveFrom IS NULL OR m.effectiveFrom <= :now) " +
            "AND (m.effectiveTo IS NULL OR m.effectiveTo >= :now) " +
            "AND (s.effectiveFrom IS NULL OR s.effectiveFrom <= :now) " +
            "AND (s.effectiveTo IS NULL OR s.effectiveTo >= :now) " +
            "ORDER BY m.priority ASC, m.createdAt DESC")
    List<SchemeMapping> findEffectiveMappings(@Param("entityId") Long entityId,
                                              @Param("role") EntityRole role,
                                              @Param("serviceType") String serviceType,
                                              @Param("now") LocalDateTime now);

    /**
     * All active mappings of an entity, unfiltered. Callers apply window and service rules.
     */
    @Query("SELECT m FROM SchemeMapping m JOIN FETCH m.scheme " +
            "WHERE m.entityId = :entityId AND m.entityRole = :role AND m.active = true")
    List<SchemeMapping> findActiveMappings(@Param("entityId") Long entityId,
                                           @Param("role") EntityRole role);
}
