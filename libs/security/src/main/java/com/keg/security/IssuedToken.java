package com.keg.security;

/**
 * A freshly signed token together with the claims it carries.
 *
 * @param claims the structured payload, e.g. for computing a cookie or header expiry
 * @param token  the compact serialization {@code header.payload.signature}
 */
public record IssuedToken(Claims claims, String token) {

    @Override
    public String toString() {
        return "IssuedToken[claims=" + claims + "]";
    }
}
