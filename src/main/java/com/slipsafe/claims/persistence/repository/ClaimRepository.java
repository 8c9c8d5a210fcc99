package com.slipsafe.claims.persistence.repository;

import com.slipsafe.claims.domain.ClaimState;
import com.slipsafe.claims.domain.ClaimType;
import com.slipsafe.claims.persistence.entity.ClaimEntity;
import jakarta.persistence.LockModeType;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Lock;
import org.springframework.data.jpa.repository.Modifying;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import org.springframework.stereotype.Repository;
import org.springframework.transaction.annotation.Transactional;

import java.math.BigDecimal;
import java.time.Instant;
import java.util.Collection;
import java.util.List;
import java.util.Optional;

/**
 * Spring Data repository for claims. Every state change is a conditional update that only matches
 * while the claim is still open, so concurrent callers race on the row and at most one wins.
 */
@Repository
public interface ClaimRepository extends JpaRepository<ClaimEntity, String> {

    Optional<ClaimEntity> findByClaimCode(String claimCode);

    boolean existsByClaimCode(String claimCode);

    /** Row lock on the claim, held until the surrounding transaction ends. */
    @Lock(LockModeType.PESSIMISTIC_WRITE)
    @Query("SELECT c FROM ClaimEntity c WHERE c.id = :id")
    Optional<ClaimEntity> lockById(@Param("id") String id);

    List<ClaimEntity> findByUserIdOrderByCreatedAtDesc(String userId);

    @Query("SELECT c FROM ClaimEntity c WHERE c.purchaseId = :purchaseId AND c.claimType = :claimType "
            + "AND c.state IN :states AND c.expiresAt > :now ORDER BY c.createdAt DESC")
    List<ClaimEntity> findReusable(@Param("purchaseId") String purchaseId,
                                   @Param("claimType") ClaimType claimType,
                                   @Param("states") Collection<ClaimState> states,
                                   @Param("now") Instant now);

    /**
     * Moves an open claim to a settled state (REDEEMED, PARTIAL or REFUSED).
     *
     * @return 1 if this call performed the transition, 0 if the claim was no longer open
     */
    @Modifying(clearAutomatically = true, flushAutomatically = true)
    @Transactional
    @Query("UPDATE ClaimEntity c SET c.state = :newState, c.redeemedAmount = :redeemedAmount, "
            + "c.redeemedAt = :at, c.redeemedByMerchantId = :merchantId, c.redeemedByUserId = :merchantUserId, "
            + "c.openSlot = null, c.updatedAt = :at WHERE c.id = :id AND c.state IN :openStates")
    int settle(@Param("id") String id,
               @Param("newState") ClaimState newState,
               @Param("redeemedAmount") BigDecimal redeemedAmount,
               @Param("merchantId") String merchantId,
               @Param("merchantUserId") String merchantUserId,
               @Param("at") Instant at,
               @Param("openStates") Collection<ClaimState> openStates);

    @Modifying(clearAutomatically = true, flushAutomatically = true)
    @Transactional
    @Query("UPDATE ClaimEntity c SET c.state = com.slipsafe.claims.domain.ClaimState.EXPIRED, c.openSlot = null, "
            + "c.updatedAt = :at WHERE c.id = :id AND c.state IN :openStates")
    int expire(@Param("id") String id,
               @Param("at") Instant at,
               @Param("openStates") Collection<ClaimState> openStates);

    /**
     * Writes EXPIRED for open claims of a (purchase, type) whose deadline has passed, releasing their
     * open slot for a new claim.
     */
    @Modifying(clearAutomatically = true, flushAutomatically = true)
    @Transactional
    @Query("UPDATE ClaimEntity c SET c.state = com.slipsafe.claims.domain.ClaimState.EXPIRED, c.openSlot = null, "
            + "c.updatedAt = :now WHERE c.purchaseId = :purchaseId AND c.claimType = :claimType "
            + "AND c.state IN :openStates AND c.expiresAt <= :now")
    int expireLapsed(@Param("purchaseId") String purchaseId,
                     @Param("claimType") ClaimType claimType,
                     @Param("now") Instant now,
                     @Param("openStates") Collection<ClaimState> openStates);

    @Modifying(clearAutomatically = true, flushAutomatically = true)
    @Transactional
    @Query("UPDATE ClaimEntity c SET c.state = com.slipsafe.claims.domain.ClaimState.PENDING, c.updatedAt = :at "
            + "WHERE c.id = :id AND c.state = com.slipsafe.claims.domain.ClaimState.ISSUED")
    int hold(@Param("id") String id, @Param("at") Instant at);

    default int settle(String id, ClaimState newState, BigDecimal redeemedAmount,
                       String merchantId, String merchantUserId, Instant at) {
        return settle(id, newState, redeemedAmount, merchantId, merchantUserId, at, ClaimState.OPEN_STATES);
    }

    default int expire(String id, Instant at) {
        return expire(id, at, ClaimState.OPEN_STATES);
    }

    default int expireLapsed(String purchaseId, ClaimType claimType, Instant now) {
        return expireLapsed(purchaseId, claimType, now, ClaimState.OPEN_STATES);
    }
}
