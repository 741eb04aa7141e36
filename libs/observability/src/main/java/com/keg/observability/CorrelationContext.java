package com.keg.observability;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Immutable correlation context that flows through one HTTP request or one background job.
 * <p>
 * The values are injected into the SLF4J MDC by {@link CorrelationContextHolder} so that every
 * log line written while handling the request carries them.
 *
 * @param correlationId unique ID for the request, propagated from {@code X-Correlation-ID} or generated
 * @param username      the member the request is authenticated as (null while anonymous)
 * @param origin        what started the work, e.g. {@code http} or {@code sync}
 */
public record CorrelationContext(
        String correlationId,
        String username,
        String origin
) {

    public static final String MDC_CORRELATION_ID = "correlationId";
    public static final String MDC_USERNAME = "username";
    public static final String MDC_ORIGIN = "origin";

    static final List<String> MDC_KEYS = List.of(MDC_CORRELATION_ID, MDC_USERNAME, MDC_ORIGIN);

    public CorrelationContext {
        if (correlationId == null || correlationId.isBlank()) {
            throw new IllegalArgumentException("correlationId must not be null or blank");
        }
    }

    /**
     * Returns a copy of this context bound to the given username.
     */
    public CorrelationContext withUsername(String username) {
        return new CorrelationContext(correlationId, username, origin);
    }

    /**
     * The MDC view of this context. Absent values map to null so the holder can remove
     * stale keys.
     */
    Map<String, String> mdcEntries() {
        Map<String, String> entries = new LinkedHashMap<>();
        entries.put(MDC_CORRELATION_ID, correlationId);
        entries.put(MDC_USERNAME, username);
        entries.put(MDC_ORIGIN, origin);
        return entries;
    }
}
