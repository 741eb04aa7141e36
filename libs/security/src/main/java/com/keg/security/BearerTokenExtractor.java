package com.keg.security;

import java.util.Locale;
import java.util.Optional;

/**
 * Extracts bearer tokens from {@code Authorization} and {@code Authorization-Renewal} header
 * values.
 */
public final class BearerTokenExtractor {

    private static final String SCHEME = "bearer";

    private BearerTokenExtractor() {
        // utility class
    }

    /**
     * Extracts the token from a header value of the form {@code "Bearer <token>"}.
     * <p>
     * The scheme is matched case-insensitively and must be followed by whitespace.
     *
     * @param headerValue the full header value (may be null)
     * @return the token, or empty if the header is missing or uses another scheme
     */
    public static Optional<String> extract(String headerValue) {
        if (headerValue == null || headerValue.isBlank()) {
            return Optional.empty();
        }
        String trimmed = headerValue.strip();
        if (!trimmed.toLowerCase(Locale.ROOT).startsWith(SCHEME)) {
            return Optional.empty();
        }
        String rest = trimmed.substring(SCHEME.length());
        if (rest.isEmpty() || !Character.isWhitespace(rest.charAt(0))) {
            return Optional.empty();
        }
        String token = rest.strip();
        return token.isEmpty() ? Optional.empty() : Optional.of(token);
    }

    /** Renders a token as a header value. */
    public static String toHeaderValue(String token) {
        return "Bearer " + token;
    }
}
