package com.slipsafe.claims.persistence.entity;

import jakarta.persistence.*;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;
import org.hibernate.annotations.Immutable;

/**
 * Read-only mapping of merchant staff accounts.
 */
@Entity
@Immutable
@Table(name = "merchant_users", indexes = {
    @Index(name = "idx_merchant_user_merchant", columnList = "merchant_id")
})
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class MerchantUserEntity {

    @Id
    @Column(name = "id", nullable = false)
    private String id;

    @Column(name = "merchant_id", nullable = false)
    private String merchantId;

    @Column(name = "full_name")
    private String fullName;

    @Enumerated(EnumType.STRING)
    @Column(name = "role", nullable = false, length = 16)
    private Role role;

    @Column(name = "is_active", nullable = false)
    private boolean active;

    public enum Role {
        OWNER, MANAGER, STAFF
    }
}
