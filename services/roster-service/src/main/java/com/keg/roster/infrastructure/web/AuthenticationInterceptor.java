package com.keg.roster.infrastructure.web;

import com.keg.observability.CorrelationContextHolder;
import com.keg.roster.auth.AccessDeniedException;
import com.keg.roster.auth.AuthenticationFailedException;
import com.keg.roster.auth.AuthenticationService;
import com.keg.roster.auth.ExecutiveRoleAuthorizer;
import com.keg.roster.auth.RequiresExecutiveRole;
import com.keg.roster.member.Member;
import com.keg.security.BearerTokenExtractor;
import jakarta.servlet.http.HttpServletRequest;
import jakarta.servlet.http.HttpServletResponse;
import java.util.Optional;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.HttpHeaders;
import org.springframework.web.method.HandlerMethod;
import org.springframework.web.servlet.HandlerInterceptor;

/**
 * Resolves the bearer access token of a request and enforces {@link RequiresExecutiveRole}.
 * <p>
 * <ul>
 *   <li>No {@code Authorization} header, or one with another scheme: the request continues
 *       anonymously.</li>
 *   <li>A bearer token that does not resolve to a member: 401.</li>
 *   <li>A resolved member is stored as request attribute {@link #MEMBER_ATTRIBUTE}.</li>
 * </ul>
 */
public class AuthenticationInterceptor implements HandlerInterceptor {

    private static final Logger log = LoggerFactory.getLogger(AuthenticationInterceptor.class);

    public static final String MEMBER_ATTRIBUTE = "com.keg.roster.authenticatedMember";

    private final AuthenticationService authentication;
    private final ExecutiveRoleAuthorizer authorizer;

    public AuthenticationInterceptor(AuthenticationService authentication, ExecutiveRoleAuthorizer authorizer) {
        this.authentication = authentication;
        this.authorizer = authorizer;
    }

    @Override
    public boolean preHandle(HttpServletRequest request, HttpServletResponse response, Object handler) {
        Optional<String> token = BearerTokenExtractor.extract(request.getHeader(HttpHeaders.AUTHORIZATION));
        if (token.isPresent()) {
            Member member = authentication.authenticate(token.get());
            request.setAttribute(MEMBER_ATTRIBUTE, member);
            CorrelationContextHolder.bindUsername(member.username());
        } else {
            log.debug("Request does not carry a bearer token");
        }

        if (handler instanceof HandlerMethod) {
            RequiresExecutiveRole required = ((HandlerMethod) handler).getMethodAnnotation(RequiresExecutiveRole.class);
            if (required != null) {
                Object member = request.getAttribute(MEMBER_ATTRIBUTE);
                if (member == null) {
                    throw new AuthenticationFailedException("Route requires role '" + required.value().key() + "'");
                }
                if (!authorizer.authorize((Member) member, required.value())) {
                    throw new AccessDeniedException(required.value());
                }
            }
        }
        return true;
    }
}
