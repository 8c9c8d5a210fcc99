package com.slipsafe.claims.core.credential;

import com.slipsafe.claims.domain.ClaimType;
import io.jsonwebtoken.Claims;
import io.jsonwebtoken.ExpiredJwtException;
import io.jsonwebtoken.Jws;
import io.jsonwebtoken.JwtException;
import io.jsonwebtoken.Jwts;
import io.jsonwebtoken.SignatureAlgorithm;
import io.jsonwebtoken.security.Keys;
import lombok.extern.slf4j.Slf4j;

import java.math.BigDecimal;
import java.nio.charset.StandardCharsets;
import java.security.Key;
import java.time.Clock;
import java.time.Instant;
import java.time.LocalDate;
import java.time.format.DateTimeParseException;
import java.util.Date;
import java.util.Locale;

/**
 * Signs and verifies claim credentials as HS256 JWTs. Constructed explicitly with its key, issuer and
 * clock (see {@code CredentialConfig}); holds no other state.
 *
 * <p>Token layout: {@code sub} = claim code, {@code mer} merchant name, {@code pdt} ISO purchase date,
 * {@code amt} amount as a plain decimal string, {@code fpr} purchase fingerprint, {@code typ} claim type,
 * plus {@code iss}, {@code iat} and {@code exp}.
 */
@Slf4j
public class ClaimCredentialSigner {

    static final String MERCHANT = "mer";
    static final String PURCHASE_DATE = "pdt";
    static final String AMOUNT = "amt";
    static final String FINGERPRINT = "fpr";
    static final String CLAIM_TYPE = "typ";

    private static final int MIN_SECRET_BYTES = 32;

    private final Key key;
    private final String issuer;
    private final Clock clock;

    public ClaimCredentialSigner(String secret, String issuer, Clock clock) {
        if (secret == null || secret.getBytes(StandardCharsets.UTF_8).length < MIN_SECRET_BYTES) {
            throw new IllegalArgumentException("Credential secret must be at least " + MIN_SECRET_BYTES + " bytes");
        }
        this.key = Keys.hmacShaKeyFor(secret.getBytes(StandardCharsets.UTF_8));
        this.issuer = issuer;
        this.clock = clock;
    }

    public String sign(ClaimCredential credential) {
        Instant issuedAt = credential.getIssuedAt() != null ? credential.getIssuedAt() : clock.instant();
        return Jwts.builder()
                .setSubject(credential.getClaimCode())
                .setIssuer(issuer)
                .claim(MERCHANT, credential.getMerchantName())
                .claim(PURCHASE_DATE, credential.getPurchaseDate().toString())
                .claim(AMOUNT, credential.getAmount().toPlainString())
                .claim(FINGERPRINT, credential.getFingerprint())
                .claim(CLAIM_TYPE, credential.getClaimType().name())
                .setIssuedAt(Date.from(issuedAt))
                .setExpiration(Date.from(credential.getExpiresAt()))
                .signWith(key, SignatureAlgorithm.HS256)
                .compact();
    }

    /**
     * Verifies the signature and decodes the payload. A token past its own {@code exp} is still
     * returned (flagged {@code tokenExpired}) once its signature has been checked.
     *
     * @throws InvalidCredentialException on a bad signature, foreign issuer, or malformed payload
     */
    public ClaimCredential parse(String token) throws InvalidCredentialException {
        if (token == null || token.isBlank()) {
            throw new InvalidCredentialException("Credential is empty");
        }
        Claims claims;
        boolean expired = false;
        try {
            Jws<Claims> jws = Jwts.parserBuilder()
                    .setSigningKey(key)
                    .setClock(() -> Date.from(clock.instant()))
                    .build()
                    .parseClaimsJws(token.trim());
            if (!SignatureAlgorithm.HS256.getValue().equals(jws.getHeader().getAlgorithm())) {
                throw new InvalidCredentialException("Unexpected algorithm " + jws.getHeader().getAlgorithm());
            }
            claims = jws.getBody();
        } catch (ExpiredJwtException e) {
            // signature was verified before the expiry check
            claims = e.getClaims();
            expired = true;
        } catch (JwtException | IllegalArgumentException e) {
            log.debug("Credential rejected: {}", e.getMessage());
            throw new InvalidCredentialException("Credential signature or format invalid", e);
        }
        if (!issuer.equals(claims.getIssuer())) {
            throw new InvalidCredentialException("Unexpected credential issuer");
        }
        return decode(claims, expired);
    }

    private static ClaimCredential decode(Claims claims, boolean expired) throws InvalidCredentialException {
        try {
            String claimCode = claims.getSubject();
            String merchant = claims.get(MERCHANT, String.class);
            String purchaseDate = claims.get(PURCHASE_DATE, String.class);
            String amount = claims.get(AMOUNT, String.class);
            String fingerprint = claims.get(FINGERPRINT, String.class);
            String type = claims.get(CLAIM_TYPE, String.class);
            if (isBlank(claimCode) || isBlank(merchant) || isBlank(purchaseDate) || isBlank(amount)
                    || isBlank(fingerprint) || isBlank(type) || claims.getExpiration() == null) {
                throw new InvalidCredentialException("Credential payload incomplete");
            }
            return ClaimCredential.builder()
                    .claimCode(claimCode)
                    .merchantName(merchant)
                    .purchaseDate(LocalDate.parse(purchaseDate))
                    .amount(new BigDecimal(amount))
                    .fingerprint(fingerprint)
                    .claimType(ClaimType.valueOf(type.toUpperCase(Locale.ROOT)))
                    .issuedAt(claims.getIssuedAt() != null ? claims.getIssuedAt().toInstant() : null)
                    .expiresAt(claims.getExpiration().toInstant())
                    .tokenExpired(expired)
                    .build();
        } catch (DateTimeParseException | IllegalArgumentException | JwtException e) {
            throw new InvalidCredentialException("Credential payload malformed", e);
        }
    }

    private static boolean isBlank(String s) {
        return s == null || s.isBlank();
    }
}
