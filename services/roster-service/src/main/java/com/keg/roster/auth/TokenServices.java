package com.keg.roster.auth;

import com.keg.security.CredentialIssuer;
import com.keg.security.CredentialValidator;
import java.util.Optional;

/**
 * The issuer and validator built from the configured key pair. Either is absent when its key
 * could not be loaded; the service then runs without login or without token validation.
 */
public class TokenServices {

    private final CredentialIssuer issuer;
    private final CredentialValidator validator;

    public TokenServices(CredentialIssuer issuer, CredentialValidator validator) {
        this.issuer = issuer;
        this.validator = validator;
    }

    public Optional<CredentialIssuer> issuer() {
        return Optional.ofNullable(issuer);
    }

    public Optional<CredentialValidator> validator() {
        return Optional.ofNullable(validator);
    }

    public CredentialIssuer requireIssuer() {
        return issuer().orElseThrow(() ->
                new AuthenticationUnavailableException("Private key unavailable, tokens cannot be issued"));
    }

    public CredentialValidator requireValidator() {
        return validator().orElseThrow(() ->
                new AuthenticationUnavailableException("Public key unavailable, tokens cannot be verified"));
    }
}
