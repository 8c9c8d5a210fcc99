package com.slipsafe.claims.persistence.repository;

import com.slipsafe.claims.persistence.entity.MerchantUserEntity;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.stereotype.Repository;

import java.util.Optional;

@Repository
public interface MerchantUserRepository extends JpaRepository<MerchantUserEntity, String> {

    Optional<MerchantUserEntity> findByIdAndMerchantId(String id, String merchantId);
}
