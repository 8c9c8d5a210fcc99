package com.slipsafe.claims.persistence.entity;

import jakarta.persistence.*;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;
import org.hibernate.annotations.Immutable;

/**
 * Read-only mapping of registered merchants.
 */
@Entity
@Immutable
@Table(name = "merchants", indexes = {
    @Index(name = "idx_merchant_business_name", columnList = "business_name")
})
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class MerchantEntity {

    @Id
    @Column(name = "id", nullable = false)
    private String id;

    @Column(name = "business_name", nullable = false)
    private String businessName;

    @Column(name = "is_active", nullable = false)
    private boolean active;
}
