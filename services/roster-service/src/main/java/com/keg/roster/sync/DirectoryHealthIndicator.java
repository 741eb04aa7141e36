package com.keg.roster.sync;

import com.keg.roster.member.MemberCache;
import org.springframework.boot.actuate.health.Health;
import org.springframework.boot.actuate.health.HealthIndicator;
import org.springframework.stereotype.Component;

/**
 * Reports the state of the directory synchronization under {@code /actuator/health}.
 * <p>
 * UNKNOWN until the first cycle finished, DOWN while no cycle ever succeeded, UP otherwise.
 * A failed cycle after an earlier success keeps the status UP and only marks the data stale,
 * since the cache still serves the previous snapshot.
 */
@Component("directoryHealthIndicator")
public class DirectoryHealthIndicator implements HealthIndicator {

    private final MemberSynchronizer synchronizer;
    private final MemberCache cache;

    public DirectoryHealthIndicator(MemberSynchronizer synchronizer, MemberCache cache) {
        this.synchronizer = synchronizer;
        this.cache = cache;
    }

    @Override
    public Health health() {
        SynchronizationStatus status = synchronizer.status();
        if (!status.hasRun()) {
            return Health.unknown().withDetail("reason", "no synchronization cycle has run yet").build();
        }
        Health.Builder builder = status.lastSuccess() == null ? Health.down() : Health.up();
        builder.withDetail("members", cache.size())
                .withDetail("lastAttempt", status.lastAttempt().toString());
        if (status.lastSuccess() != null) {
            builder.withDetail("lastSuccess", status.lastSuccess().toString());
        }
        if (status.lastCycleFailed()) {
            builder.withDetail("stale", true).withDetail("failedCategory", status.failedCategory());
        }
        return builder.build();
    }
}
