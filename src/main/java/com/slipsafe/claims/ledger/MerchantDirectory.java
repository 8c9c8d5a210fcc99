package com.slipsafe.claims.ledger;

import java.util.Optional;

/**
 * Read-only view of registered merchants and their staff.
 */
public interface MerchantDirectory {

    /** Active staff member {@code merchantUserId} of active merchant {@code merchantId}, if both exist. */
    Optional<MerchantStaff> findActiveStaff(String merchantId, String merchantUserId);

    /** Registered merchant whose business name matches a purchase's merchant name (case-insensitive). */
    Optional<String> findMerchantIdByName(String businessName);
}
