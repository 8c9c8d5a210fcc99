package com.slipsafe.claims.fraud.api;

import com.slipsafe.claims.api.PageResponseDto;
import com.slipsafe.claims.fraud.domain.FraudEvent;
import com.slipsafe.claims.fraud.domain.FraudEventFilter;
import com.slipsafe.claims.fraud.domain.FraudEventType;
import com.slipsafe.claims.fraud.domain.FraudSeverity;
import com.slipsafe.claims.fraud.domain.SuspiciousPatternReport;
import com.slipsafe.claims.fraud.engine.FraudDetector;
import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.responses.ApiResponse;
import io.swagger.v3.oas.annotations.responses.ApiResponses;
import io.swagger.v3.oas.annotations.tags.Tag;
import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.data.domain.PageRequest;
import org.springframework.format.annotation.DateTimeFormat;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

import java.time.Instant;
import java.util.function.Function;

/**
 * REST API for reviewing, flagging and resolving fraud events.
 */
@Slf4j
@RestController
@RequestMapping("/api/v1/fraud")
@RequiredArgsConstructor
@Tag(name = "Fraud", description = "Fraud events raised on claim verification and redemption")
public class FraudEventController {

    private static final int MAX_PAGE_SIZE = 200;

    private final FraudDetector fraudDetector;

    @GetMapping("/events")
    @Operation(summary = "List fraud events", description = "Filter by type, severity, resolution, claim, merchant and creation time. Newest first.")
    public ResponseEntity<PageResponseDto<FraudEvent>> listEvents(
            @RequestParam(required = false) FraudEventType type,
            @RequestParam(required = false) FraudSeverity severity,
            @RequestParam(required = false) Boolean resolved,
            @RequestParam(required = false) String claimId,
            @RequestParam(required = false) String merchantId,
            @RequestParam(required = false) @DateTimeFormat(iso = DateTimeFormat.ISO.DATE_TIME) Instant since,
            @RequestParam(defaultValue = "0") int page,
            @RequestParam(defaultValue = "50") int size) {
        if (page < 0 || size < 1 || size > MAX_PAGE_SIZE) {
            throw new IllegalArgumentException("page must be >= 0 and size between 1 and " + MAX_PAGE_SIZE);
        }
        FraudEventFilter filter = FraudEventFilter.builder()
                .eventType(type)
                .severity(severity)
                .resolved(resolved)
                .claimId(claimId)
                .merchantId(merchantId)
                .createdSince(since)
                .build();
        return ResponseEntity.ok(PageResponseDto.from(fraudDetector.listFraudEvents(filter, PageRequest.of(page, size)), Function.identity()));
    }

    @PostMapping("/events")
    @Operation(summary = "Flag suspicious pattern", description = "Records a SUSPICIOUS_PATTERN event with a free-text description.")
    @ApiResponses({
            @ApiResponse(responseCode = "201", description = "Event recorded and published"),
            @ApiResponse(responseCode = "400", description = "Validation failed")
    })
    public ResponseEntity<FraudEvent> flagSuspiciousPattern(@Valid @RequestBody SuspiciousPatternRequestDto dto) {
        FraudEvent event = fraudDetector.flagSuspiciousPattern(SuspiciousPatternReport.builder()
                .claimId(dto.getClaimId())
                .purchaseId(dto.getPurchaseId())
                .userId(dto.getUserId())
                .merchantId(dto.getMerchantId())
                .severity(dto.getSeverity())
                .description(dto.getDescription())
                .metadata(dto.getMetadata())
                .build());
        return ResponseEntity.status(HttpStatus.CREATED).body(event);
    }

    @PostMapping("/events/{id}/resolve")
    @Operation(summary = "Resolve fraud event", description = "Idempotent: resolving twice keeps the first resolution. Never changes claim state.")
    @ApiResponses({
            @ApiResponse(responseCode = "200", description = "Event resolved (or already resolved)"),
            @ApiResponse(responseCode = "404", description = "Unknown event id. Body: { \"error\": \"FRAUD_EVENT_NOT_FOUND\", ... }")
    })
    public ResponseEntity<FraudEvent> resolve(@PathVariable String id, @Valid @RequestBody ResolveFraudEventRequestDto dto) {
        return ResponseEntity.ok(fraudDetector.resolveFraudEvent(id, dto.getResolvedBy()));
    }
}
