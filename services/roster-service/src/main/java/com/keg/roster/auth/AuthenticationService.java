package com.keg.roster.auth;

import com.keg.directory.DirectoryClient;
import com.keg.directory.SessionException;
import com.keg.observability.MetricFactory;
import com.keg.roster.member.Member;
import com.keg.roster.member.MemberCache;
import com.keg.security.BasicCredentials;
import com.keg.security.Claims;
import com.keg.security.CredentialIssuer;
import com.keg.security.CredentialValidator;
import com.keg.security.IssuedToken;
import com.keg.security.SigningException;
import com.keg.security.TokenException;
import com.keg.security.TokenType;
import io.micrometer.core.instrument.Counter;
import java.util.Optional;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * The login, renewal and bearer-token flows.
 * <p>
 * Every way a login or token can fail ends in {@link AuthenticationFailedException}, whose
 * HTTP rendering reveals nothing. Missing key material is reported separately as
 * {@link AuthenticationUnavailableException}.
 */
public class AuthenticationService {

    private static final Logger log = LoggerFactory.getLogger(AuthenticationService.class);

    private final DirectoryClient directory;
    private final MemberCache cache;
    private final TokenServices tokens;
    private final MemberTokenResolver resolver;

    private final Counter successfulLogins;
    private final Counter failedLogins;
    private final Counter unavailableLogins;

    public AuthenticationService(DirectoryClient directory, MemberCache cache, TokenServices tokens,
                                 MetricFactory metrics) {
        this.directory = directory;
        this.cache = cache;
        this.tokens = tokens;
        this.resolver = new MemberTokenResolver(cache);
        this.successfulLogins = metrics.counter("keg.login.attempts", "Login attempts", "outcome", "success");
        this.failedLogins = metrics.counter("keg.login.attempts", "Login attempts", "outcome", "failure");
        this.unavailableLogins = metrics.counter("keg.login.attempts", "Login attempts", "outcome", "unavailable");
    }

    /**
     * Verifies the credentials with a bind as the member and issues an access and a renewal
     * token.
     * <p>
     * The username may be the short username or a mail address; the bind uses the member's
     * fully-qualified name from the cache.
     */
    public TokenPair login(BasicCredentials credentials) {
        CredentialIssuer issuer;
        try {
            issuer = tokens.requireIssuer();
        } catch (AuthenticationUnavailableException e) {
            unavailableLogins.increment();
            log.error("Login refused: {}", e.getMessage());
            throw e;
        }
        log.debug("Trying to authenticate '{}'", credentials.username());
        Optional<Member> candidate = cache.find(credentials.username());
        if (candidate.isEmpty()) {
            failedLogins.increment();
            log.info("Someone tried to authenticate with a non-existing username: {}", credentials.username());
            throw new AuthenticationFailedException("Unknown username");
        }
        Member member = candidate.get();
        if (!bind(member, credentials.password())) {
            failedLogins.increment();
            throw new AuthenticationFailedException("Bind rejected for " + member.fullUsername());
        }
        try {
            IssuedToken access = issuer.issue(member.fullUsername(), TokenType.ACCESS);
            IssuedToken renewal = issuer.issue(member.fullUsername(), TokenType.RENEWAL);
            successfulLogins.increment();
            log.info("Authenticated '{}'", member.username());
            return new TokenPair(member, access, renewal);
        } catch (SigningException e) {
            unavailableLogins.increment();
            throw new AuthenticationUnavailableException("Unable to sign tokens", e);
        }
    }

    /**
     * Issues a fresh access token for the holder of a valid renewal token.
     */
    public IssuedToken renew(String renewalToken) {
        CredentialIssuer issuer = tokens.requireIssuer();
        Member member = resolve(tokens.requireValidator(), renewalToken, TokenType.RENEWAL);
        try {
            return issuer.issue(member.fullUsername(), TokenType.ACCESS);
        } catch (SigningException e) {
            throw new AuthenticationUnavailableException("Unable to sign access token", e);
        }
    }

    /**
     * Resolves the member behind an access token.
     */
    public Member authenticate(String accessToken) {
        Optional<CredentialValidator> validator = tokens.validator();
        if (validator.isEmpty()) {
            log.warn("Unable to verify tokens without a public key, requests using authentication will not work");
            throw new AuthenticationFailedException("Public key unavailable");
        }
        return resolve(validator.get(), accessToken, TokenType.ACCESS);
    }

    private Member resolve(CredentialValidator validator, String token, TokenType expected) {
        try {
            Claims claims = validator.decode(token);
            return resolver.resolve(claims, expected);
        } catch (TokenException e) {
            log.info("Rejected {} token: {} ({})", expected, e.getMessage(), e.getReason());
            throw new AuthenticationFailedException("Invalid " + expected + " token", e);
        }
    }

    private boolean bind(Member member, String password) {
        try {
            return directory.authenticate(member.fullUsername(), password);
        } catch (SessionException e) {
            log.error("Failed to open an authentication session for '{}': {}", member.fullUsername(), e.getMessage());
            return false;
        }
    }
}
