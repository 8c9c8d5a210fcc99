package com.slipsafe.claims.fraud.api;

import jakarta.validation.constraints.NotBlank;
import lombok.Data;

@Data
public class ResolveFraudEventRequestDto {

    @NotBlank(message = "resolvedBy is required")
    private String resolvedBy;
}
