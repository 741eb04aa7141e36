package com.keg.security;

import java.security.PrivateKey;
import java.time.Clock;
import java.time.Duration;
import java.util.Objects;
import org.jose4j.jws.AlgorithmIdentifiers;
import org.jose4j.jws.JsonWebSignature;
import org.jose4j.jwt.JwtClaims;
import org.jose4j.jwt.NumericDate;
import org.jose4j.lang.JoseException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Signs session tokens with the service's RSA private key (RS512).
 * <p>
 * A login issues two tokens from one authentication: an access token living
 * {@code accessLifetime} and a renewal token living {@code renewalLifetime}. Each has its own
 * claims and its own signature.
 */
public class CredentialIssuer {

    private static final Logger log = LoggerFactory.getLogger(CredentialIssuer.class);

    /** Name of the type discriminant claim. */
    public static final String RENEWAL_CLAIM = "ren";

    private final PrivateKey privateKey;
    private final String issuer;
    private final Duration accessLifetime;
    private final Duration renewalLifetime;
    private final Clock clock;

    public CredentialIssuer(PrivateKey privateKey, String issuer, Duration accessLifetime,
                            Duration renewalLifetime, Clock clock) {
        this.privateKey = Objects.requireNonNull(privateKey, "privateKey must not be null");
        this.issuer = Objects.requireNonNull(issuer, "issuer must not be null");
        this.accessLifetime = Objects.requireNonNull(accessLifetime, "accessLifetime must not be null");
        this.renewalLifetime = Objects.requireNonNull(renewalLifetime, "renewalLifetime must not be null");
        this.clock = Objects.requireNonNull(clock, "clock must not be null");
    }

    /**
     * Issues a token of the given tier for {@code subject}.
     *
     * @param subject identity key of the authenticated member
     * @param type    which tier to issue
     * @throws SigningException if the key cannot sign (wrong type, too short, ...)
     */
    public IssuedToken issue(String subject, TokenType type) throws SigningException {
        long expiration = clock.instant().plus(lifetimeOf(type)).getEpochSecond();
        Claims claims = new Claims(subject, issuer, expiration, type.isRenewal());

        JwtClaims payload = new JwtClaims();
        payload.setSubject(claims.subject());
        payload.setIssuer(claims.issuer());
        payload.setExpirationTime(NumericDate.fromSeconds(claims.expiration()));
        payload.setClaim(RENEWAL_CLAIM, claims.renewal());

        JsonWebSignature jws = new JsonWebSignature();
        jws.setPayload(payload.toJson());
        jws.setKey(privateKey);
        jws.setAlgorithmHeaderValue(AlgorithmIdentifiers.RSA_USING_SHA512);
        try {
            String token = jws.getCompactSerialization();
            log.debug("Issued {} token for '{}' expiring at {}", type, subject, claims.expiresAt());
            return new IssuedToken(claims, token);
        } catch (JoseException e) {
            throw new SigningException("Unable to sign " + type + " token", e);
        }
    }

    public Duration lifetimeOf(TokenType type) {
        return type == TokenType.RENEWAL ? renewalLifetime : accessLifetime;
    }
}
