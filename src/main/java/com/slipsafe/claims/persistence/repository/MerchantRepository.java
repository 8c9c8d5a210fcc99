package com.slipsafe.claims.persistence.repository;

import com.slipsafe.claims.persistence.entity.MerchantEntity;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import org.springframework.stereotype.Repository;

import java.util.List;

@Repository
public interface MerchantRepository extends JpaRepository<MerchantEntity, String> {

    @Query("SELECT m FROM MerchantEntity m WHERE LOWER(m.businessName) = LOWER(:name) AND m.active = true")
    List<MerchantEntity> findActiveByBusinessName(@Param("name") String name);
}
