package com.slipsafe.claims.persistence.repository;

import com.slipsafe.claims.fraud.domain.FraudEventType;
import com.slipsafe.claims.persistence.entity.FraudEventEntity;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.JpaSpecificationExecutor;
import org.springframework.data.jpa.repository.Modifying;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import org.springframework.stereotype.Repository;
import org.springframework.transaction.annotation.Transactional;

import java.time.Instant;
import java.util.List;

/**
 * Repository for fraud events. Filtering goes through {@link JpaSpecificationExecutor}
 * (see {@code FraudEventSpecifications}).
 */
@Repository
public interface FraudEventRepository extends JpaRepository<FraudEventEntity, String>,
        JpaSpecificationExecutor<FraudEventEntity> {

    List<FraudEventEntity> findByClaimIdOrderByCreatedAtAsc(String claimId);

    boolean existsByClaimIdAndEventTypeAndCreatedAtGreaterThanEqual(String claimId, FraudEventType eventType,
                                                                      Instant since);

    /**
     * Marks an event resolved if it is not already.
     *
     * @return 1 on the first resolution, 0 when already resolved or unknown
     */
    @Modifying(clearAutomatically = true, flushAutomatically = true)
    @Transactional
    @Query("UPDATE FraudEventEntity e SET e.resolved = true, e.resolvedAt = :at, e.resolvedBy = :resolvedBy "
            + "WHERE e.id = :id AND e.resolved = false")
    int resolve(@Param("id") String id, @Param("resolvedBy") String resolvedBy, @Param("at") Instant at);
}
