package com.slipsafe.claims.fraud.api;

import com.slipsafe.claims.fraud.domain.FraudSeverity;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.Size;
import lombok.Data;

/**
 * Request body for POST /api/v1/fraud/events.
 */
@Data
public class SuspiciousPatternRequestDto {

    private String claimId;

    private String purchaseId;

    private String userId;

    private String merchantId;

    /** Defaults to LOW. */
    private FraudSeverity severity;

    @NotBlank(message = "description is required")
    @Size(max = 1000)
    private String description;

    private String metadata;
}
