package com.nosota.mpayout.model;

import jakarta.persistence.*;
import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.Setter;

import java.time.LocalDateTime;
import java.util.UUID;

/**
 * Named pricing policy. Read-only here (managed by the scheme editor).
 */
@Entity
@Table(name = "scheme")
@Getter
@Setter
@NoArgsConstructor
public class Scheme {
    @Id
    @GeneratedValue(strategy = GenerationType.UUID)
    private UUID id;

    @Column(name = "name", nullable = false)
    private String name;

    @Enumerated(EnumType.STRING)
    @Column(name = "scheme_type", nullable = false, length = 16)
    private SchemeType schemeType;

    /**
     * Service the scheme prices ("payout", "bbps", ...) or "all". Null means all.
     */
    @Column(name = "service_scope", length = 32)
    private String serviceScope;

    /**
     * Lower value wins.
     */
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
