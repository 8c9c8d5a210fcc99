package com.slipsafe.claims.domain;

import java.util.EnumSet;
import java.util.Set;

/**
 * Lifecycle of a claim. ISSUED and PENDING are the only open states; every other state is terminal
 * and is reached at most once per claim.
 */
public enum ClaimState {
    /** Minted and handed to the consumer. */
    ISSUED,
    /** A merchant has verified the claim and is inspecting the item. */
    PENDING,
    /** Fully redeemed for the original amount. */
    REDEEMED,
    /** Redeemed for less than the original amount. */
    PARTIAL,
    /** Merchant declined the claim despite a technical match. */
    REFUSED,
    /** Acted on after its deadline. */
    EXPIRED;

    public static final Set<ClaimState> OPEN_STATES = EnumSet.of(ISSUED, PENDING);

    public boolean isTerminal() {
        return !OPEN_STATES.contains(this);
    }
}
