package com.slipsafe.claims.ledger;

import lombok.Builder;
import lombok.Value;

@Value
@Builder
public class MerchantStaff {

    String merchantId;
    String businessName;
    String merchantUserId;
    String fullName;
    String role;
}
