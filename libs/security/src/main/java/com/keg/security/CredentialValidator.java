package com.keg.security;

import java.security.PublicKey;
import java.time.Clock;
import java.util.Objects;
import org.jose4j.jwa.AlgorithmConstraints;
import org.jose4j.jws.AlgorithmIdentifiers;
import org.jose4j.jwt.JwtClaims;
import org.jose4j.jwt.MalformedClaimException;
import org.jose4j.jwt.NumericDate;
import org.jose4j.jwt.consumer.ErrorCodes;
import org.jose4j.jwt.consumer.InvalidJwtException;
import org.jose4j.jwt.consumer.JwtConsumer;
import org.jose4j.jwt.consumer.JwtConsumerBuilder;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Verifies inbound tokens and decodes their claims.
 * <p>
 * A token is accepted only if
 * <ul>
 *   <li>it is a compact JWS signed with RS512 by the matching private key,</li>
 *   <li>{@code sub}, {@code iss}, {@code exp} and a boolean {@code ren} are present,</li>
 *   <li>{@code iss} equals the configured issuer,</li>
 *   <li>{@code exp} lies after the current instant of the injected clock (no skew).</li>
 * </ul>
 * Decoding is side-effect free. Whether the subject still exists and whether the token tier
 * fits the caller are checked afterwards against the live member cache.
 */
public class CredentialValidator {

    private static final Logger log = LoggerFactory.getLogger(CredentialValidator.class);

    private final PublicKey publicKey;
    private final String issuer;
    private final Clock clock;

    public CredentialValidator(PublicKey publicKey, String issuer, Clock clock) {
        this.publicKey = Objects.requireNonNull(publicKey, "publicKey must not be null");
        this.issuer = Objects.requireNonNull(issuer, "issuer must not be null");
        this.clock = Objects.requireNonNull(clock, "clock must not be null");
    }

    /**
     * Verifies {@code token} and returns its claims.
     *
     * @param token the raw compact token, without any {@code Bearer } prefix
     * @throws TokenException if any check fails
     */
    public Claims decode(String token) throws TokenException {
        if (token == null || token.isBlank()) {
            throw new TokenException(TokenException.Reason.MALFORMED, "Token is empty");
        }
        JwtClaims jwtClaims;
        try {
            jwtClaims = consumer().processToClaims(token);
        } catch (InvalidJwtException e) {
            TokenException.Reason reason = classify(e);
            log.info("Cannot validate token ({}): {}", reason, e.getMessage());
            throw new TokenException(reason, "Token rejected: " + reason, e);
        }
        return toClaims(jwtClaims);
    }

    private JwtConsumer consumer() {
        return new JwtConsumerBuilder()
                .setRequireSubject()
                .setRequireExpirationTime()
                .setExpectedIssuer(true, issuer)
                .setVerificationKey(publicKey)
                .setJwsAlgorithmConstraints(
                        AlgorithmConstraints.ConstraintType.PERMIT, AlgorithmIdentifiers.RSA_USING_SHA512)
                .setEvaluationTime(NumericDate.fromSeconds(clock.instant().getEpochSecond()))
                .build();
    }

    private static Claims toClaims(JwtClaims jwtClaims) throws TokenException {
        Object renewal = jwtClaims.getClaimValue(CredentialIssuer.RENEWAL_CLAIM);
        if (!(renewal instanceof Boolean)) {
            throw new TokenException(TokenException.Reason.INVALID_CLAIMS,
                    "Claim '" + CredentialIssuer.RENEWAL_CLAIM + "' is missing or not a boolean");
        }
        try {
            return new Claims(
                    jwtClaims.getSubject(),
                    jwtClaims.getIssuer(),
                    jwtClaims.getExpirationTime().getValue(),
                    (Boolean) renewal);
        } catch (MalformedClaimException | IllegalArgumentException e) {
            throw new TokenException(TokenException.Reason.INVALID_CLAIMS, "Malformed claim", e);
        }
    }

    private static TokenException.Reason classify(InvalidJwtException e) {
        if (e.hasExpired()) {
            return TokenException.Reason.EXPIRED;
        }
        if (e.hasErrorCode(ErrorCodes.SIGNATURE_INVALID) || e.hasErrorCode(ErrorCodes.SIGNATURE_MISSING)) {
            return TokenException.Reason.INVALID_SIGNATURE;
        }
        if (e.hasErrorCode(ErrorCodes.ISSUER_INVALID)
                || e.hasErrorCode(ErrorCodes.ISSUER_MISSING)
                || e.hasErrorCode(ErrorCodes.SUBJECT_MISSING)
                || e.hasErrorCode(ErrorCodes.EXPIRATION_MISSING)
                || e.hasErrorCode(ErrorCodes.MALFORMED_CLAIM)) {
            return TokenException.Reason.INVALID_CLAIMS;
        }
        return TokenException.Reason.MALFORMED;
    }
}
