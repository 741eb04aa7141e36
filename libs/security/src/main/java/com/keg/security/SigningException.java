package com.keg.security;

/**
 * Token issuance failed because of the key material or the encoder.
 * <p>
 * This is an infrastructure failure and must not be reported as bad credentials.
 */
public class SigningException extends Exception {

    public SigningException(String message, Throwable cause) {
        super(message, cause);
    }
}
