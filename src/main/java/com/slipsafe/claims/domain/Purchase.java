package com.slipsafe.claims.domain;

import lombok.Builder;
import lombok.Value;

import java.math.BigDecimal;
import java.time.LocalDate;

/**
 * Read-only view of a purchase owned by the external purchase ledger.
 */
@Value
@Builder
public class Purchase {

    String id;
    String userId;
    String merchantName;
    LocalDate purchaseDate;
    BigDecimal totalAmount;
    /** Last day a return or exchange is accepted. May be null when the receipt carried no policy. */
    LocalDate returnBy;
    /** Last day of warranty cover. May be null. */
    LocalDate warrantyEnds;
}
