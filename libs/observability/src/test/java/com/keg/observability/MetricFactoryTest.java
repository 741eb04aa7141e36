package com.keg.observability;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.Timer;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import java.time.Duration;
import java.util.concurrent.atomic.AtomicLong;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

/**
 * Tests for {@link MetricFactory}: service tag on every meter, counter/timer/gauge behaviour.
 */
@DisplayName("MetricFactory")
class MetricFactoryTest {

    private SimpleMeterRegistry registry;
    private MetricFactory factory;

    @BeforeEach
    void setUp() {
        registry = new SimpleMeterRegistry();
        factory = new MetricFactory(registry, "roster-service");
    }

    @Nested
    @DisplayName("Construction")
    class Construction {

        @Test
        @DisplayName("should reject null registry")
        void shouldRejectNullRegistry() {
            assertThatThrownBy(() -> new MetricFactory(null, "svc"))
                    .isInstanceOf(IllegalArgumentException.class)
                    .hasMessageContaining("registry");
        }

        @Test
        @DisplayName("should reject an odd number of tag strings")
        void shouldRejectDanglingTagKey() {
            assertThatThrownBy(() -> factory.counter("keg.sync.cycles", "Sync cycles", "outcome"))
                    .isInstanceOf(IllegalArgumentException.class)
                    .hasMessageContaining("key/value");
        }

        @Test
        @DisplayName("should reject blank service name")
        void shouldRejectBlankServiceName() {
            assertThatThrownBy(() -> new MetricFactory(registry, "  "))
                    .isInstanceOf(IllegalArgumentException.class)
                    .hasMessageContaining("serviceName");
        }
    }

    @Test
    @DisplayName("counter carries service and extra tags")
    void counterCarriesTags() {
        Counter counter = factory.counter("keg.sync.cycles", "Sync cycles", "outcome", "failure");

        counter.increment();
        counter.increment();

        assertThat(counter.count()).isEqualTo(2.0);
        assertThat(counter.getId().getTag("service")).isEqualTo("roster-service");
        assertThat(counter.getId().getTag("outcome")).isEqualTo("failure");
    }

    @Test
    @DisplayName("same name and tags resolve to the same counter")
    void counterIsShared() {
        factory.counter("keg.login.attempts", "Logins", "outcome", "success").increment();
        factory.counter("keg.login.attempts", "Logins", "outcome", "success").increment();

        assertThat(registry.get("keg.login.attempts").tag("outcome", "success").counter().count())
                .isEqualTo(2.0);
    }

    @Test
    @DisplayName("timer records durations")
    void timerRecords() {
        Timer timer = factory.timer("keg.sync.duration", "Sync duration");

        timer.record(Duration.ofMillis(150));
        timer.record(Duration.ofMillis(250));

        assertThat(timer.count()).isEqualTo(2);
        assertThat(timer.getId().getTag("service")).isEqualTo("roster-service");
    }

    @Test
    @DisplayName("gauge survives garbage collection of the caller's reference")
    void gaugeIsStronglyHeld() {
        factory.gauge("keg.sync.members", "Cached members").set(7);

        System.gc();

        assertThat(registry.get("keg.sync.members").gauge().value()).isEqualTo(7.0);
    }

    @Test
    @DisplayName("gauge follows its AtomicLong")
    void gaugeFollowsValue() {
        AtomicLong value = factory.gauge("keg.sync.members", "Cached members");

        value.set(10);
        assertThat(registry.get("keg.sync.members").gauge().value()).isEqualTo(10.0);

        value.set(25);
        assertThat(registry.get("keg.sync.members").tag("service", "roster-service").gauge().value())
                .isEqualTo(25.0);
    }
}
