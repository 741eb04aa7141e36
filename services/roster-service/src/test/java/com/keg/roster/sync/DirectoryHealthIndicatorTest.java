package com.keg.roster.sync;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.when;

import com.keg.roster.member.MemberCache;
import java.time.Instant;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.springframework.boot.actuate.health.Health;
import org.springframework.boot.actuate.health.Status;

@DisplayName("DirectoryHealthIndicator")
class DirectoryHealthIndicatorTest {

    private static final Instant FIRST = Instant.parse("2024-03-01T10:00:00Z");
    private static final Instant SECOND = Instant.parse("2024-03-01T10:15:00Z");

    private final MemberSynchronizer synchronizer = mock(MemberSynchronizer.class);
    private final DirectoryHealthIndicator indicator = new DirectoryHealthIndicator(synchronizer, new MemberCache());

    @Test
    @DisplayName("is UNKNOWN before the first cycle")
    void unknownBeforeFirstCycle() {
        when(synchronizer.status()).thenReturn(SynchronizationStatus.NEVER_RUN);

        assertThat(indicator.health().getStatus()).isEqualTo(Status.UNKNOWN);
    }

    @Test
    @DisplayName("is DOWN while no cycle succeeded")
    void downWithoutSuccess() {
        when(synchronizer.status()).thenReturn(SynchronizationStatus.NEVER_RUN.failed(FIRST, "members"));

        Health health = indicator.health();

        assertThat(health.getStatus()).isEqualTo(Status.DOWN);
        assertThat(health.getDetails()).containsEntry("failedCategory", "members");
    }

    @Test
    @DisplayName("is UP with current data after a successful cycle")
    void upAfterSuccess() {
        when(synchronizer.status()).thenReturn(SynchronizationStatus.NEVER_RUN.succeeded(FIRST));

        Health health = indicator.health();

        assertThat(health.getStatus()).isEqualTo(Status.UP);
        assertThat(health.getDetails()).containsEntry("members", 0).doesNotContainKey("stale");
    }

    @Test
    @DisplayName("stays UP but marks the data stale when a later cycle failed")
    void staleAfterLaterFailure() {
        when(synchronizer.status())
                .thenReturn(SynchronizationStatus.NEVER_RUN.succeeded(FIRST).failed(SECOND, "registers"));

        Health health = indicator.health();

        assertThat(health.getStatus()).isEqualTo(Status.UP);
        assertThat(health.getDetails())
                .containsEntry("stale", true)
                .containsEntry("lastSuccess", FIRST.toString())
                .containsEntry("lastAttempt", SECOND.toString());
    }
}
