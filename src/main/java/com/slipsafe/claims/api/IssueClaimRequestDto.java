package com.slipsafe.claims.api;

import jakarta.validation.constraints.NotBlank;
import lombok.Data;

/**
 * Request body for POST /api/v1/claims.
 */
@Data
public class IssueClaimRequestDto {

    @NotBlank(message = "purchaseId is required")
    private String purchaseId;

    /** Consumer asking for the claim; must own the purchase. */
    @NotBlank(message = "userId is required")
    private String userId;

    /** RETURN, WARRANTY or EXCHANGE (case-insensitive). */
    @NotBlank(message = "claimType is required")
    private String claimType;
}
