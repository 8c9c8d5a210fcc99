package com.slipsafe.claims.api;

import com.fasterxml.jackson.annotation.JsonIgnore;
import jakarta.validation.constraints.AssertTrue;
import jakarta.validation.constraints.NotBlank;
import lombok.Data;

/**
 * Request body for POST /api/v1/claims/verify and /hold. Identify the claim by the typed code,
 * the scanned credential, or both.
 */
@Data
public class VerifyClaimRequestDto {

    private String claimCode;

    @NotBlank(message = "pin is required")
    private String pin;

    /** Signed credential or full QR payload. */
    private String credential;

    private String merchantId;

    private String merchantUserId;

    private String notes;

    @JsonIgnore
    @AssertTrue(message = "claimCode or credential is required")
    public boolean isClaimIdentified() {
        return (claimCode != null && !claimCode.isBlank()) || (credential != null && !credential.isBlank());
    }
}
