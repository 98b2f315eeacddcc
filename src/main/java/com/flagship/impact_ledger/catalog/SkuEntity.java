package com.flagship.impact_ledger.catalog;

import jakarta.persistence.Column;
import jakarta.persistence.Entity;
import jakarta.persistence.EnumType;
import jakarta.persistence.Enumerated;
import jakarta.persistence.Id;
import jakarta.persistence.PrePersist;
import jakarta.persistence.PreUpdate;
import jakarta.persistence.Table;
import lombok.AccessLevel;
import lombok.AllArgsConstructor;
import lombok.Getter;
import lombok.NoArgsConstructor;

import java.math.BigDecimal;
import java.time.Instant;
import java.util.UUID;

/**
 * JPA entity for the {@code skus} table.
 * No setters: once referenced by a transaction a SKU only changes through {@link #deactivate()}.
 */
@Entity
@Table(name = "skus")
@Getter
@NoArgsConstructor(access = AccessLevel.PROTECTED)
@AllArgsConstructor(access = AccessLevel.PRIVATE)
public class SkuEntity {

    @Id
    @Column(nullable = false, updatable = false)
    private UUID id;

    @Column(nullable = false, unique = true, updatable = false, length = 100)
    private String code;

    @Column(nullable = false)
    private String name;

    @Column(nullable = false, precision = 19, scale = 4)
    private BigDecimal price;

    @Enumerated(EnumType.STRING)
    @Column(name = "acquisition_mode", nullable = false, length = 20)
    private AcquisitionMode acquisitionMode;

    @Column(name = "impact_multiplier", nullable = false, precision = 10, scale = 4)
    private BigDecimal impactMultiplier;

    @Column(name = "connect_threshold", nullable = false, precision = 19, scale = 4)
    private BigDecimal connectThreshold;

    @Column(nullable = false)
    private boolean active;

    @Column(name = "created_at", nullable = false, updatable = false)
    private Instant createdAt;

    @Column(name = "updated_at", nullable = false)
    private Instant updatedAt;

    @PrePersist
    void onCreate() {
        this.createdAt = Instant.now();
        this.updatedAt = this.createdAt;
    }

    @PreUpdate
    void onUpdate() {
        this.updatedAt = Instant.now();
    }

    static SkuEntity create(String code, String name, BigDecimal price, AcquisitionMode mode,
                            BigDecimal impactMultiplier, BigDecimal connectThreshold) {
        return new SkuEntity(UUID.randomUUID(), code, name, price, mode,
            impactMultiplier, connectThreshold, true, null, null);
    }

    void deactivate() {
        this.active = false;
    }

    public Sku toDomain() {
        return new Sku(id, code, name, price, acquisitionMode, impactMultiplier, connectThreshold, active);
    }
}
