package com.keg.roster.infrastructure.web;

import com.keg.observability.CorrelationContextHolder;
import com.keg.roster.auth.AccessDeniedException;
import com.keg.roster.auth.AuthenticationFailedException;
import com.keg.roster.auth.AuthenticationUnavailableException;
import com.keg.roster.member.MemberNotFoundException;
import java.net.URI;
import java.time.Instant;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.HttpStatus;
import org.springframework.http.ProblemDetail;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;

/**
 * Maps exceptions to RFC 7807 {@link ProblemDetail} responses.
 * <p>
 * Authentication failures all produce the same body so callers cannot tell a wrong password
 * from an unknown user or an expired token from a forged one. Every problem carries a
 * timestamp and the correlation ID of the request.
 */
@RestControllerAdvice
public class GlobalExceptionHandler {

    private static final Logger log = LoggerFactory.getLogger(GlobalExceptionHandler.class);

    static final String AUTHENTICATION_FAILURE_TITLE = "Authentication Failure";
    static final String AUTHENTICATION_FAILURE_DETAIL = "Something went wrong during the authentication either "
            + "wrong credentials or server errors, due to security reasons no more details are provided.";

    @ExceptionHandler(AuthenticationFailedException.class)
    public ProblemDetail handleAuthenticationFailed(AuthenticationFailedException ex) {
        log.info("Authentication failed: {}", ex.getMessage());
        return problem(HttpStatus.UNAUTHORIZED, AUTHENTICATION_FAILURE_TITLE, AUTHENTICATION_FAILURE_DETAIL,
                "authentication");
    }

    @ExceptionHandler(AuthenticationUnavailableException.class)
    public ProblemDetail handleAuthenticationUnavailable(AuthenticationUnavailableException ex) {
        log.error("Authentication unavailable: {}", ex.getMessage(), ex.getCause());
        return problem(HttpStatus.SERVICE_UNAVAILABLE, "Authentication Unavailable",
                "Authentication is temporarily unavailable", "authentication-unavailable");
    }

    @ExceptionHandler(AccessDeniedException.class)
    public ProblemDetail handleAccessDenied(AccessDeniedException ex) {
        log.warn("Access denied: {}", ex.getMessage());
        ProblemDetail problem = problem(HttpStatus.FORBIDDEN, "Forbidden", ex.getMessage(), "forbidden");
        problem.setProperty("requiredRole", ex.getRole().key());
        return problem;
    }

    @ExceptionHandler(MemberNotFoundException.class)
    public ProblemDetail handleMemberNotFound(MemberNotFoundException ex) {
        log.debug("Not found: {}", ex.getMessage());
        return problem(HttpStatus.NOT_FOUND, "Not Found", ex.getMessage(), "not-found");
    }

    @ExceptionHandler(IllegalArgumentException.class)
    public ProblemDetail handleIllegalArgument(IllegalArgumentException ex) {
        log.warn("Bad request: {}", ex.getMessage());
        return problem(HttpStatus.BAD_REQUEST, "Bad Request", ex.getMessage(), "bad-request");
    }

    @ExceptionHandler(Exception.class)
    public ProblemDetail handleGeneric(Exception ex) {
        log.error("Internal server error", ex);
        return problem(HttpStatus.INTERNAL_SERVER_ERROR, "Internal Server Error",
                "An unexpected error occurred", "internal");
    }

    private ProblemDetail problem(HttpStatus status, String title, String detail, String type) {
        ProblemDetail problem = ProblemDetail.forStatusAndDetail(status, detail);
        problem.setTitle(title);
        problem.setType(URI.create("https://keg.mvl.at/errors/" + type));
        problem.setProperty("timestamp", Instant.now().toString());
        CorrelationContextHolder.get()
                .ifPresent(ctx -> problem.setProperty("correlationId", ctx.correlationId()));
        return problem;
    }
}
