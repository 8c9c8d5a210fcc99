package com.slipsafe.claims.api;

import com.fasterxml.jackson.annotation.JsonIgnore;
import jakarta.validation.constraints.AssertTrue;
import jakarta.validation.constraints.NotBlank;
import lombok.Data;

import java.math.BigDecimal;

/**
 * Request body for POST /api/v1/claims/redeem.
 */
@Data
public class RedeemClaimRequestDto {

    private String claimCode;

    @NotBlank(message = "pin is required")
    private String pin;

    private String credential;

    /** Required when partial; otherwise optional and must equal the original amount. */
    private BigDecimal refundAmount;

    private boolean partial;

    /** Decline the claim after a successful match. */
    private boolean refuse;

    private String notes;

    @NotBlank(message = "merchantId is required")
    private String merchantId;

    @NotBlank(message = "merchantUserId is required")
    private String merchantUserId;

    @JsonIgnore
    @AssertTrue(message = "claimCode or credential is required")
    public boolean isClaimIdentified() {
        return (claimCode != null && !claimCode.isBlank()) || (credential != null && !credential.isBlank());
    }
}
