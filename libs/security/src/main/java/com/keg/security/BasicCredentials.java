package com.keg.security;

import java.nio.charset.StandardCharsets;
import java.util.Base64;
import java.util.Optional;

/**
 * Username and password taken from an HTTP Basic {@code Authorization} header.
 *
 * @param username the part before the first colon
 * @param password everything after the first colon, may itself contain colons
 */
public record BasicCredentials(String username, String password) {

    private static final String PREFIX = "Basic ";

    /**
     * Parses a header value.
     *
     * @return empty if the header is absent or not a Basic header
     * @throws IllegalArgumentException if it is a Basic header whose payload is not valid
     *                                  Base64 or has no colon
     */
    public static Optional<BasicCredentials> parse(String headerValue) {
        if (headerValue == null || !headerValue.startsWith(PREFIX)) {
            return Optional.empty();
        }
        byte[] decoded;
        try {
            decoded = Base64.getDecoder().decode(headerValue.substring(PREFIX.length()).strip());
        } catch (IllegalArgumentException e) {
            throw new IllegalArgumentException("Basic credentials are not valid Base64", e);
        }
        String pair = new String(decoded, StandardCharsets.UTF_8);
        int colon = pair.indexOf(':');
        if (colon < 0) {
            throw new IllegalArgumentException("Basic credentials do not contain a colon");
        }
        return Optional.of(new BasicCredentials(pair.substring(0, colon), pair.substring(colon + 1)));
    }

    @Override
    public String toString() {
        return "BasicCredentials[username=" + username + "]";
    }
}
