package com.keg.roster.api;

import com.keg.roster.auth.AuthenticationFailedException;
import com.keg.roster.auth.AuthenticationService;
import com.keg.roster.auth.ExecutiveRole;
import com.keg.roster.auth.ExecutiveRoleAuthorizer;
import com.keg.roster.auth.TokenPair;
import com.keg.roster.infrastructure.web.AuthenticationInterceptor;
import com.keg.roster.member.Member;
import com.keg.security.BasicCredentials;
import com.keg.security.BearerTokenExtractor;
import com.keg.security.IssuedToken;
import java.util.List;
import org.springframework.http.HttpHeaders;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RequestAttribute;
import org.springframework.web.bind.annotation.RequestHeader;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

/**
 * Self-service endpoints: login, token renewal and the caller's own data.
 */
@RestController
@RequestMapping("/api/v1/user")
public class UserController {

    public static final String RENEWAL_HEADER = "Authorization-Renewal";

    private final AuthenticationService authentication;
    private final ExecutiveRoleAuthorizer authorizer;

    public UserController(AuthenticationService authentication, ExecutiveRoleAuthorizer authorizer) {
        this.authentication = authentication;
        this.authorizer = authorizer;
    }

    /**
     * Logs in with HTTP Basic credentials. On success the access token is returned in
     * {@code Authorization} and the renewal token in {@code Authorization-Renewal}.
     */
    @GetMapping("/login")
    public ResponseEntity<SessionView> login(
            @RequestHeader(value = HttpHeaders.AUTHORIZATION, required = false) String authorization) {
        BasicCredentials credentials = BasicCredentials.parse(authorization)
                .orElseThrow(() -> new AuthenticationFailedException("No basic credentials"));
        TokenPair tokens = authentication.login(credentials);
        return ResponseEntity.ok()
                .header(HttpHeaders.AUTHORIZATION, BearerTokenExtractor.toHeaderValue(tokens.access().token()))
                .header(RENEWAL_HEADER, BearerTokenExtractor.toHeaderValue(tokens.renewal().token()))
                .body(new SessionView(tokens.member().username(),
                        tokens.access().claims().expiresAt(), tokens.renewal().claims().expiresAt()));
    }

    /**
     * Exchanges the renewal token from {@code Authorization-Renewal} for a new access token.
     */
    @GetMapping("/renew")
    public ResponseEntity<SessionView> renew(
            @RequestHeader(value = RENEWAL_HEADER, required = false) String renewalHeader) {
        String renewalToken = BearerTokenExtractor.extract(renewalHeader)
                .orElseThrow(() -> new AuthenticationFailedException("No renewal token"));
        IssuedToken access = authentication.renew(renewalToken);
        return ResponseEntity.ok()
                .header(HttpHeaders.AUTHORIZATION, BearerTokenExtractor.toHeaderValue(access.token()))
                .body(new SessionView(null, access.claims().expiresAt(), null));
    }

    @GetMapping("/info")
    public MemberView info(
            @RequestAttribute(name = AuthenticationInterceptor.MEMBER_ATTRIBUTE, required = false) Member member) {
        return MemberView.of(requireMember(member), true);
    }

    @GetMapping("/executive-roles")
    public List<String> executiveRoles(
            @RequestAttribute(name = AuthenticationInterceptor.MEMBER_ATTRIBUTE, required = false) Member member) {
        return authorizer.rolesOf(requireMember(member)).stream().map(ExecutiveRole::key).toList();
    }

    private static Member requireMember(Member member) {
        if (member == null) {
            throw new AuthenticationFailedException("Route requires an access token");
        }
        return member;
    }
}
