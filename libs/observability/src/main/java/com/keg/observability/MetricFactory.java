package com.keg.observability;

import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.Gauge;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Tags;
import io.micrometer.core.instrument.Timer;
import java.util.List;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.atomic.AtomicLong;

/**
 * Registers the meters of one service. Every meter carries a {@code service} tag, so the
 * dashboards can tell the roster service apart from other services scraping into the same
 * Prometheus.
 * <p>
 * Extra tags are given as alternating keys and values: {@code counter("keg.login.attempts",
 * "Login attempts", "outcome", "failure")}.
 */
public final class MetricFactory {

    public static final String TAG_SERVICE = "service";

    private final MeterRegistry registry;
    private final Tags serviceTags;
    // Micrometer only keeps weak references to gauge state objects
    private final List<AtomicLong> gaugeValues = new CopyOnWriteArrayList<>();

    public MetricFactory(MeterRegistry registry, String serviceName) {
        if (registry == null) {
            throw new IllegalArgumentException("registry must not be null");
        }
        if (serviceName == null || serviceName.isBlank()) {
            throw new IllegalArgumentException("serviceName must not be null or blank");
        }
        this.registry = registry;
        this.serviceTags = Tags.of(TAG_SERVICE, serviceName);
    }

    /**
     * Returns the counter with this name and tags, registering it on first use.
     */
    public Counter counter(String name, String description, String... tags) {
        return Counter.builder(name).description(description).tags(tagsOf(tags)).register(registry);
    }

    public Timer timer(String name, String description, String... tags) {
        return Timer.builder(name).description(description).tags(tagsOf(tags)).register(registry);
    }

    /**
     * Registers a gauge reporting the returned value, which starts at zero.
     */
    public AtomicLong gauge(String name, String description, String... tags) {
        AtomicLong value = new AtomicLong();
        Gauge.builder(name, value, AtomicLong::doubleValue)
                .description(description)
                .tags(tagsOf(tags))
                .register(registry);
        gaugeValues.add(value);
        return value;
    }

    private Tags tagsOf(String... keyValues) {
        if (keyValues.length % 2 != 0) {
            throw new IllegalArgumentException("tags must be key/value pairs, got " + keyValues.length + " strings");
        }
        return serviceTags.and(keyValues);
    }
}
