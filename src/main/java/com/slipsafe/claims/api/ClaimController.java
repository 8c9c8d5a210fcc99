package com.slipsafe.claims.api;

import com.slipsafe.claims.core.ClaimIssuer;
import com.slipsafe.claims.core.ClaimRedeemer;
import com.slipsafe.claims.core.ClaimVerifier;
import com.slipsafe.claims.domain.ClaimSummary;
import com.slipsafe.claims.domain.IssuedClaim;
import com.slipsafe.claims.domain.RedemptionOutcome;
import com.slipsafe.claims.domain.RedemptionRequest;
import com.slipsafe.claims.domain.VerificationOutcome;
import com.slipsafe.claims.domain.VerificationRequest;
import com.slipsafe.claims.persistence.service.VerificationAuditService;
import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.media.Content;
import io.swagger.v3.oas.annotations.media.Schema;
import io.swagger.v3.oas.annotations.responses.ApiResponse;
import io.swagger.v3.oas.annotations.responses.ApiResponses;
import io.swagger.v3.oas.annotations.tags.Tag;
import jakarta.servlet.http.HttpServletRequest;
import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.data.domain.PageRequest;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

import java.util.List;

/**
 * REST API for claim issuance (consumer side) and verification, hold and redemption (merchant side).
 */
@Slf4j
@RestController
@RequestMapping("/api/v1/claims")
@RequiredArgsConstructor
@Tag(name = "Claims", description = "Issue, verify and redeem receipt claims")
public class ClaimController {

    private static final int MAX_PAGE_SIZE = 200;

    private final ClaimIssuer claimIssuer;
    private final ClaimVerifier claimVerifier;
    private final ClaimRedeemer claimRedeemer;
    private final VerificationAuditService auditService;

    @PostMapping
    @Operation(
            summary = "Issue claim",
            description = "Issues a return, warranty or exchange claim for a purchase owned by the user. "
                    + "Idempotent: while an open claim of the same type exists it is returned with reused=true.")
    @ApiResponses({
            @ApiResponse(responseCode = "200", description = "Claim issued or reused. Body carries the code, PIN and QR payload.",
                    content = @Content(mediaType = "application/json", schema = @Schema(implementation = IssuedClaim.class))),
            @ApiResponse(responseCode = "400", description = "Validation failed or unknown claimType. Body: { \"error\": \"VALIDATION_FAILED\"|\"INVALID_CLAIM_TYPE\", ... }"),
            @ApiResponse(responseCode = "403", description = "Purchase belongs to another user. Body: { \"error\": \"NOT_OWNER\", \"message\": \"...\" }"),
            @ApiResponse(responseCode = "404", description = "Purchase not found. Body: { \"error\": \"PURCHASE_NOT_FOUND\", \"message\": \"...\" }"),
            @ApiResponse(responseCode = "409", description = "Concurrent issuance for the same purchase and type. Retry shortly.")
    })
    public ResponseEntity<IssuedClaim> issue(@Valid @RequestBody IssueClaimRequestDto dto) {
        IssuedClaim issued = claimIssuer.issueClaim(dto.getPurchaseId(), dto.getUserId(), dto.getClaimType());
        return ResponseEntity.ok(issued);
    }

    @GetMapping("/{claimCode}")
    @Operation(summary = "Look up claim", description = "Claim summary by code, without the PIN. 404 when unknown.")
    public ResponseEntity<ClaimSummary> lookup(@PathVariable String claimCode) {
        return claimVerifier.lookup(claimCode)
                .map(ResponseEntity::ok)
                .orElseGet(() -> ResponseEntity.notFound().build());
    }

    @GetMapping
    @Operation(summary = "List a user's claims", description = "Claims issued to the user, newest first.")
    public ResponseEntity<List<ClaimSummary>> listForUser(@RequestParam String userId) {
        return ResponseEntity.ok(claimVerifier.claimsForUser(userId));
    }

    @PostMapping("/verify")
    @Operation(
            summary = "Verify claim",
            description = "Read-only check of a presented claim. Always 200; read body.status: MATCH, NO_MATCH, EXPIRED, "
                    + "ALREADY_REDEEMED, INVALID or RATE_LIMITED (failureCode gives the reason). Every call is audited.")
    @ApiResponses({
            @ApiResponse(responseCode = "200", description = "Verification performed. Check body.status.",
                    content = @Content(mediaType = "application/json", schema = @Schema(implementation = VerificationOutcome.class))),
            @ApiResponse(responseCode = "400", description = "Validation failed (missing pin, or neither claimCode nor credential).")
    })
    public ResponseEntity<VerificationOutcome> verify(@Valid @RequestBody VerifyClaimRequestDto dto, HttpServletRequest httpRequest) {
        return ResponseEntity.ok(claimVerifier.verify(toVerificationRequest(dto, httpRequest)));
    }

    @PostMapping("/hold")
    @Operation(summary = "Hold claim", description = "Moves an issued claim to PENDING while staff inspect the item. Requires active merchant staff.")
    @ApiResponses({
            @ApiResponse(responseCode = "200", description = "Hold processed. Check body.status and body.newState.",
                    content = @Content(mediaType = "application/json", schema = @Schema(implementation = RedemptionOutcome.class))),
            @ApiResponse(responseCode = "403", description = "Not an active merchant staff account. Body: { \"error\": \"MERCHANT_ACCESS_DENIED\", ... }")
    })
    public ResponseEntity<RedemptionOutcome> hold(@Valid @RequestBody VerifyClaimRequestDto dto, HttpServletRequest httpRequest) {
        return ResponseEntity.ok(claimRedeemer.hold(toVerificationRequest(dto, httpRequest)));
    }

    @PostMapping("/redeem")
    @Operation(
            summary = "Redeem claim",
            description = "Full or partial redemption, or refusal (refuse=true), performed at most once per claim. "
                    + "Verification failures return 200 with the status; amount errors return 400 INVALID_AMOUNT.")
    @ApiResponses({
            @ApiResponse(responseCode = "200", description = "Redemption processed. Check body.status and body.newState.",
                    content = @Content(mediaType = "application/json", schema = @Schema(implementation = RedemptionOutcome.class))),
            @ApiResponse(responseCode = "400", description = "Validation failed or invalid refund amount. Body: { \"error\": \"VALIDATION_FAILED\"|\"INVALID_AMOUNT\", ... }"),
            @ApiResponse(responseCode = "403", description = "Not an active merchant staff account. Body: { \"error\": \"MERCHANT_ACCESS_DENIED\", ... }")
    })
    public ResponseEntity<RedemptionOutcome> redeem(@Valid @RequestBody RedeemClaimRequestDto dto, HttpServletRequest httpRequest) {
        RedemptionRequest request = RedemptionRequest.builder()
                .claimCode(dto.getClaimCode())
                .pin(dto.getPin())
                .credential(dto.getCredential())
                .refundAmount(dto.getRefundAmount())
                .partial(dto.isPartial())
                .refuse(dto.isRefuse())
                .notes(dto.getNotes())
                .merchantId(dto.getMerchantId())
                .merchantUserId(dto.getMerchantUserId())
                .clientIp(ClientInfo.clientIp(httpRequest))
                .userAgent(ClientInfo.userAgent(httpRequest))
                .build();
        RedemptionOutcome outcome = claimRedeemer.redeem(request);
        log.debug("Redemption completed: merchantId={} status={} newState={}", dto.getMerchantId(), outcome.getStatus(), outcome.getNewState());
        return ResponseEntity.ok(outcome);
    }

    @GetMapping("/verifications")
    @Operation(summary = "Merchant verification history", description = "Audit rows recorded for the merchant, newest first.")
    public ResponseEntity<PageResponseDto<VerificationRecordDto>> verifications(
            @RequestParam String merchantId,
            @RequestParam(defaultValue = "0") int page,
            @RequestParam(defaultValue = "50") int size) {
        if (page < 0 || size < 1 || size > MAX_PAGE_SIZE) {
            throw new IllegalArgumentException("page must be >= 0 and size between 1 and " + MAX_PAGE_SIZE);
        }
        return ResponseEntity.ok(PageResponseDto.from(
                auditService.findByMerchant(merchantId, PageRequest.of(page, size)), VerificationRecordDto::from));
    }

    private static VerificationRequest toVerificationRequest(VerifyClaimRequestDto dto, HttpServletRequest httpRequest) {
        return VerificationRequest.builder()
                .claimCode(dto.getClaimCode())
                .pin(dto.getPin())
                .credential(dto.getCredential())
                .merchantId(dto.getMerchantId())
                .merchantUserId(dto.getMerchantUserId())
                .notes(dto.getNotes())
                .clientIp(ClientInfo.clientIp(httpRequest))
                .userAgent(ClientInfo.userAgent(httpRequest))
                .build();
    }
}
