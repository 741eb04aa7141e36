package com.keg.security;

/**
 * A presented token could not be turned into an identity.
 * <p>
 * The {@link Reason} is meant for logs only. Whatever the reason, HTTP callers see the same
 * opaque 401.
 */
public class TokenException extends Exception {

    public enum Reason {
        /** Not a compact JWS, or its payload is not a JSON claims set. */
        MALFORMED,
        /** Signature does not verify or uses an algorithm other than RS512. */
        INVALID_SIGNATURE,
        EXPIRED,
        /** Renewal token presented as access token, or vice versa. */
        WRONG_TYPE,
        /** The subject is no longer in the member cache. */
        UNKNOWN_SUBJECT,
        /** A required claim is missing, has the wrong type, or the issuer does not match. */
        INVALID_CLAIMS
    }

    private final Reason reason;

    public TokenException(Reason reason, String message) {
        super(message);
        this.reason = reason;
    }

    public TokenException(Reason reason, String message, Throwable cause) {
        super(message, cause);
        this.reason = reason;
    }

    public Reason getReason() {
        return reason;
    }
}
