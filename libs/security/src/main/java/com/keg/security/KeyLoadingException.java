package com.keg.security;

/**
 * Key material could not be read or parsed.
 */
public class KeyLoadingException extends RuntimeException {

    public KeyLoadingException(String message) {
        super(message);
    }

    public KeyLoadingException(String message, Throwable cause) {
        super(message, cause);
    }
}
