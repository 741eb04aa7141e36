package com.keg.roster.auth;

/**
 * Credentials or token could not be verified.
 * <p>
 * The message is for logs; the HTTP response never reveals it.
 */
public class AuthenticationFailedException extends RuntimeException {

    public AuthenticationFailedException(String message) {
        super(message);
    }

    public AuthenticationFailedException(String message, Throwable cause) {
        super(message, cause);
    }
}
