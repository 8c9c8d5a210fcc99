package com.slipsafe.claims.persistence.repository;

import com.slipsafe.claims.fraud.domain.FraudEventFilter;
import com.slipsafe.claims.persistence.entity.FraudEventEntity;
import jakarta.persistence.criteria.Predicate;
import org.springframework.data.jpa.domain.Specification;

import java.util.ArrayList;
import java.util.List;

/**
 * Builds the fraud event query for a {@link FraudEventFilter}; absent filter fields do not constrain.
 */
public final class FraudEventSpecifications {

    private FraudEventSpecifications() {
    }

    public static Specification<FraudEventEntity> matching(FraudEventFilter filter) {
        return (root, query, cb) -> {
            List<Predicate> predicates = new ArrayList<>();
            if (filter.getEventType() != null) {
                predicates.add(cb.equal(root.get("eventType"), filter.getEventType()));
            }
            if (filter.getSeverity() != null) {
                predicates.add(cb.equal(root.get("severity"), filter.getSeverity()));
            }
            if (filter.getResolved() != null) {
                predicates.add(cb.equal(root.get("resolved"), filter.getResolved()));
            }
            if (filter.getClaimId() != null) {
                predicates.add(cb.equal(root.get("claimId"), filter.getClaimId()));
            }
            if (filter.getMerchantId() != null) {
                predicates.add(cb.equal(root.get("merchantId"), filter.getMerchantId()));
            }
            if (filter.getCreatedSince() != null) {
                predicates.add(cb.greaterThanOrEqualTo(root.get("createdAt"), filter.getCreatedSince()));
            }
            return cb.and(predicates.toArray(new Predicate[0]));
        };
    }
}
