package com.keg.security;

import java.time.Instant;

/**
 * The signed payload of a session token: {@code {sub, iss, exp, ren}}.
 *
 * @param subject    identity key of the member (its fully-qualified directory name)
 * @param issuer     the configured issuer
 * @param expiration absolute expiration in epoch seconds
 * @param renewal    the type discriminant, true for renewal tokens
 */
public record Claims(String subject, String issuer, long expiration, boolean renewal) {

    public Claims {
        if (subject == null || subject.isBlank()) {
            throw new IllegalArgumentException("subject must not be null or blank");
        }
        if (issuer == null) {
            throw new IllegalArgumentException("issuer must not be null");
        }
    }

    public TokenType type() {
        return TokenType.fromDiscriminant(renewal);
    }

    public Instant expiresAt() {
        return Instant.ofEpochSecond(expiration);
    }

    /**
     * Fails unless these claims belong to a token of the {@code expected} tier.
     *
     * @throws TokenException with {@link TokenException.Reason#WRONG_TYPE} on a mismatch
     */
    public void requireType(TokenType expected) throws TokenException {
        if (type() != expected) {
            throw new TokenException(TokenException.Reason.WRONG_TYPE,
                    "Expected a " + expected + " token but got a " + type() + " token");
        }
    }
}
