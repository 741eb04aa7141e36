package com.keg.security;

/**
 * The two tiers of session credentials.
 * <p>
 * Every token carries the tier as its {@code ren} claim. Callers state the tier they expect
 * through this enum instead of a bare boolean, so a renewal token cannot be accepted where an
 * access token is required or the other way round.
 */
public enum TokenType {

    /** Short-lived credential presented on every authenticated request. */
    ACCESS(false),

    /** Long-lived credential whose only use is obtaining a fresh access token. */
    RENEWAL(true);

    private final boolean renewal;

    TokenType(boolean renewal) {
        this.renewal = renewal;
    }

    /** The value of the {@code ren} claim for this tier. */
    public boolean isRenewal() {
        return renewal;
    }

    /** Maps a decoded {@code ren} claim back to its tier. */
    public static TokenType fromDiscriminant(boolean renewal) {
        return renewal ? RENEWAL : ACCESS;
    }
}
