package com.keg.roster.infrastructure.web;

import com.keg.observability.CorrelationContext;
import com.keg.observability.CorrelationContextHolder;
import jakarta.servlet.FilterChain;
import jakarta.servlet.ServletException;
import jakarta.servlet.http.HttpServletRequest;
import jakarta.servlet.http.HttpServletResponse;
import java.io.IOException;
import java.util.UUID;
import java.util.regex.Pattern;
import org.springframework.core.Ordered;
import org.springframework.core.annotation.Order;
import org.springframework.stereotype.Component;
import org.springframework.web.filter.OncePerRequestFilter;

/**
 * Propagates or generates the {@code X-Correlation-ID} of every request and exposes it to the
 * logs through {@link CorrelationContextHolder}.
 * <p>
 * The ID is echoed on the response so users can quote it when reporting a problem. Inbound IDs
 * end up in every log line, so only short IDs made of letters, digits, dots, dashes and
 * underscores are taken over; anything else is replaced by a fresh one.
 */
@Component
@Order(Ordered.HIGHEST_PRECEDENCE)
public class CorrelationIdFilter extends OncePerRequestFilter {

    public static final String CORRELATION_ID_HEADER = "X-Correlation-ID";

    static final String ORIGIN = "http";

    private static final Pattern ACCEPTED_ID = Pattern.compile("[A-Za-z0-9._-]{1,64}");

    @Override
    protected void doFilterInternal(
            HttpServletRequest request, HttpServletResponse response, FilterChain filterChain)
            throws ServletException, IOException {

        String correlationId = acceptOrGenerate(request.getHeader(CORRELATION_ID_HEADER));
        response.setHeader(CORRELATION_ID_HEADER, correlationId);
        CorrelationContextHolder.set(new CorrelationContext(correlationId, null, ORIGIN));
        try {
            filterChain.doFilter(request, response);
        } finally {
            CorrelationContextHolder.clear();
        }
    }

    static String acceptOrGenerate(String inbound) {
        if (inbound != null && ACCEPTED_ID.matcher(inbound).matches()) {
            return inbound;
        }
        return UUID.randomUUID().toString();
    }
}
