package com.slipsafe.claims.persistence.repository;

import com.slipsafe.claims.persistence.entity.ClaimVerificationEntity;
import org.springframework.data.domain.Page;
import org.springframework.data.domain.Pageable;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import org.springframework.stereotype.Repository;

import java.time.Instant;
import java.util.List;

/** Spring Data repository for the verification audit log. */
@Repository
public interface ClaimVerificationRepository extends JpaRepository<ClaimVerificationEntity, String> {

    @Query("SELECT COUNT(v) FROM ClaimVerificationEntity v "
            + "WHERE v.claimId = :claimId AND v.pinCorrect = false AND v.createdAt >= :since")
    long countFailedPinAttemptsSince(@Param("claimId") String claimId, @Param("since") Instant since);

    List<ClaimVerificationEntity> findByClaimIdOrderByCreatedAtAsc(String claimId);

    Page<ClaimVerificationEntity> findByMerchantIdOrderByCreatedAtDesc(String merchantId, Pageable pageable);
}
