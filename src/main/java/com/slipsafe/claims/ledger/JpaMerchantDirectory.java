package com.slipsafe.claims.ledger;

import com.slipsafe.claims.persistence.entity.MerchantEntity;
import com.slipsafe.claims.persistence.entity.MerchantUserEntity;
import com.slipsafe.claims.persistence.repository.MerchantRepository;
import com.slipsafe.claims.persistence.repository.MerchantUserRepository;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.List;
import java.util.Optional;

@Slf4j
@Component
@RequiredArgsConstructor
public class JpaMerchantDirectory implements MerchantDirectory {

    private final MerchantRepository merchantRepository;
    private final MerchantUserRepository merchantUserRepository;

    @Override
    public Optional<MerchantStaff> findActiveStaff(String merchantId, String merchantUserId) {
        if (merchantId == null || merchantUserId == null) {
            return Optional.empty();
        }
        Optional<MerchantEntity> merchant = merchantRepository.findById(merchantId).filter(MerchantEntity::isActive);
        if (merchant.isEmpty()) {
            return Optional.empty();
        }
        return merchantUserRepository.findByIdAndMerchantId(merchantUserId, merchantId)
                .filter(MerchantUserEntity::isActive)
                .map(user -> MerchantStaff.builder()
                        .merchantId(merchantId)
                        .businessName(merchant.get().getBusinessName())
                        .merchantUserId(user.getId())
                        .fullName(user.getFullName())
                        .role(user.getRole().name())
                        .build());
    }

    @Override
    public Optional<String> findMerchantIdByName(String businessName) {
        if (businessName == null || businessName.isBlank()) {
            return Optional.empty();
        }
        List<MerchantEntity> matches = merchantRepository.findActiveByBusinessName(businessName.trim());
        if (matches.size() > 1) {
            log.warn("Ambiguous merchant attribution: {} registered merchants named '{}'", matches.size(), businessName);
            return Optional.empty();
        }
        return matches.stream().findFirst().map(MerchantEntity::getId);
    }
}
