package com.nosota.mpayout.model;

import jakarta.persistence.*;
import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.Setter;

import java.time.LocalDateTime;
import java.util.UUID;

/**
 * Assignment of a {@link Scheme} to a retailer, distributor or master distributor.
 */
@Entity
@Table(name = "scheme_mapping", indexes = {
        @Index(name = "idx_scheme_mapping_entity", columnList = "entity_id, entity_role")
})
@Getter
@Setter
@NoArgsConstructor
public class SchemeMapping {
    @Id
    @GeneratedValue(strategy = GenerationType.UUID)
    private UUID id;

    @ManyToOne(fetch = FetchType.LAZY, optional = false)
    @JoinColumn(name = "scheme_id", nullable = false)
    private Scheme scheme;

    @Column(name = "entity_id", nullable = false)
    private Long entityId;

    @Enumerated(EnumType.STRING)
    @Column(name = "entity_role", nullable = false, length = 24)
    private EntityRole entityRole;

    /**
     * Null or "all" matches every service type.
     */
    @Column(name = "service_type", length = 32)
    private String serviceType;

    @Column(name = "priority", nullable = false)
    private int priority = 100;

    @Column(name = "active", nullable = false)
    private boolean active = true;

    @Column(name = "effective_from")
    private LocalDateTime effectiveFrom;

    @Column(name = "effective_to")
    private LocalDateTime effectiveTo;

    @Column(name = "created_at", nullable = false, updatable = false)
    private LocalDateTime createdAt;
}
