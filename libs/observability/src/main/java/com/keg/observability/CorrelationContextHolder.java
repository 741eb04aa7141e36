package com.keg.observability;

import java.util.Optional;
import org.slf4j.MDC;

/**
 * Keeps the {@link CorrelationContext} of the current thread and mirrors it into the SLF4J MDC.
 * <p>
 * Request threads and the synchronization thread are pooled. Whoever installs a context is
 * responsible for removing it, either with {@link #clear()} in a {@code finally} block or by
 * running the work through {@link #runWithContext(CorrelationContext, Runnable)}.
 */
public final class CorrelationContextHolder {

    private static final ThreadLocal<CorrelationContext> CURRENT = new ThreadLocal<>();

    private CorrelationContextHolder() {
    }

    public static void set(CorrelationContext context) {
        if (context == null) {
            throw new IllegalArgumentException("context must not be null");
        }
        CURRENT.set(context);
        context.mdcEntries().forEach(CorrelationContextHolder::putOrRemove);
    }

    public static Optional<CorrelationContext> get() {
        return Optional.ofNullable(CURRENT.get());
    }

    /**
     * Adds the authenticated username to the current context. Does nothing outside a context,
     * e.g. in unit tests that call a service directly.
     */
    public static void bindUsername(String username) {
        get().ifPresent(context -> set(context.withUsername(username)));
    }

    public static void clear() {
        CURRENT.remove();
        CorrelationContext.MDC_KEYS.forEach(MDC::remove);
    }

    /**
     * Runs {@code work} under {@code context} and afterwards reinstates whatever context the
     * thread had before.
     */
    public static void runWithContext(CorrelationContext context, Runnable work) {
        CorrelationContext outer = CURRENT.get();
        set(context);
        try {
            work.run();
        } finally {
            if (outer == null) {
                clear();
            } else {
                set(outer);
            }
        }
    }

    private static void putOrRemove(String key, String value) {
        if (value == null) {
            MDC.remove(key);
        } else {
            MDC.put(key, value);
        }
    }
}
