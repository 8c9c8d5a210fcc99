package com.slipsafe.claims.domain;

/**
 * Kind of request that produced an audit row.
 */
public enum AttemptType {
    VERIFY,
    HOLD,
    REDEEM
}
