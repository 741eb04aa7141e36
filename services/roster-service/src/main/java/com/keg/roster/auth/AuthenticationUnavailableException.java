package com.keg.roster.auth;

/**
 * Tokens cannot be issued or verified because the key material is missing or broken.
 */
public class AuthenticationUnavailableException extends RuntimeException {

    public AuthenticationUnavailableException(String message) {
        super(message);
    }

    public AuthenticationUnavailableException(String message, Throwable cause) {
        super(message, cause);
    }
}
