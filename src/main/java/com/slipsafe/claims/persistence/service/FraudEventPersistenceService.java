package com.slipsafe.claims.persistence.service;

import com.slipsafe.claims.fraud.domain.FraudEvent;
import com.slipsafe.claims.fraud.domain.FraudEventFilter;
import com.slipsafe.claims.persistence.entity.FraudEventEntity;
import com.slipsafe.claims.persistence.repository.ClaimRepository;
import com.slipsafe.claims.persistence.repository.FraudEventRepository;
import com.slipsafe.claims.persistence.repository.FraudEventSpecifications;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.data.domain.Page;
import org.springframework.data.domain.PageRequest;
import org.springframework.data.domain.Pageable;
import org.springframework.data.domain.Sort;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.time.Instant;
import java.util.Optional;
import java.util.UUID;

/**
 * Service for persisting and querying fraud events.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class FraudEventPersistenceService {

    private final FraudEventRepository fraudEventRepository;
    private final ClaimRepository claimRepository;

    @Transactional
    public FraudEvent persist(FraudEvent event) {
        FraudEventEntity entity = FraudEventEntity.builder()
                .id(event.getId() != null ? event.getId() : UUID.randomUUID().toString())
                .claimId(event.getClaimId())
                .purchaseId(event.getPurchaseId())
                .userId(event.getUserId())
                .merchantId(event.getMerchantId())
                .eventType(event.getEventType())
                .severity(event.getSeverity())
                .description(event.getDescription())
                .metadata(event.getMetadata())
                .verificationId(event.getVerificationId())
                .resolved(false)
                .createdAt(event.getCreatedAt())
                .build();
        FraudEventEntity saved = fraudEventRepository.save(entity);
        log.debug("Persisted fraud event: id={}, claimId={}, type={}, severity={}",
                saved.getId(), saved.getClaimId(), saved.getEventType(), saved.getSeverity());
        return toDomain(saved);
    }

    /**
     * Persists the event unless one of the same type was already recorded for its claim since {@code since}.
     * The claim row is locked for the check, so concurrent callers for one claim are serialized.
     *
     * @return the saved event, or empty when an earlier one covers the window
     */
    @Transactional
    public Optional<FraudEvent> persistOnce(FraudEvent event, Instant since) {
        claimRepository.lockById(event.getClaimId());
        if (fraudEventRepository.existsByClaimIdAndEventTypeAndCreatedAtGreaterThanEqual(
                event.getClaimId(), event.getEventType(), since)) {
            return Optional.empty();
        }
        return Optional.of(persist(event));
    }

    /**
     * @return true if this call resolved the event, false if it was already resolved
     */
    @Transactional
    public boolean resolve(String id, String resolvedBy, Instant at) {
        return fraudEventRepository.resolve(id, resolvedBy, at) == 1;
    }

    @Transactional(readOnly = true)
    public Optional<FraudEvent> findById(String id) {
        return fraudEventRepository.findById(id).map(FraudEventPersistenceService::toDomain);
    }

    @Transactional(readOnly = true)
    public Page<FraudEvent> search(FraudEventFilter filter, Pageable pageable) {
        Pageable sorted = pageable.getSort().isSorted()
                ? pageable
                : PageRequest.of(pageable.getPageNumber(), pageable.getPageSize(), Sort.by(Sort.Direction.DESC, "createdAt"));
        return fraudEventRepository.findAll(FraudEventSpecifications.matching(filter), sorted)
                .map(FraudEventPersistenceService::toDomain);
    }

    static FraudEvent toDomain(FraudEventEntity entity) {
        return FraudEvent.builder()
                .id(entity.getId())
                .claimId(entity.getClaimId())
                .purchaseId(entity.getPurchaseId())
                .userId(entity.getUserId())
                .merchantId(entity.getMerchantId())
                .eventType(entity.getEventType())
                .severity(entity.getSeverity())
                .description(entity.getDescription())
                .metadata(entity.getMetadata())
                .verificationId(entity.getVerificationId())
                .resolved(entity.isResolved())
                .resolvedAt(entity.getResolvedAt())
                .resolvedBy(entity.getResolvedBy())
                .createdAt(entity.getCreatedAt())
                .build();
    }
}
