package com.keg.roster.sync;

import java.time.Instant;

/**
 * What the last cycles did, for the health endpoint.
 *
 * @param lastAttempt    start of the most recent cycle, null if none ran yet
 * @param lastSuccess    start of the most recent successful cycle, null if none succeeded
 * @param failedCategory the category the most recent cycle failed on, null if it succeeded
 */
public record SynchronizationStatus(Instant lastAttempt, Instant lastSuccess, String failedCategory) {

    public static final SynchronizationStatus NEVER_RUN = new SynchronizationStatus(null, null, null);

    SynchronizationStatus succeeded(Instant at) {
        return new SynchronizationStatus(at, at, null);
    }

    SynchronizationStatus failed(Instant at, String category) {
        return new SynchronizationStatus(at, lastSuccess, category);
    }

    public boolean hasRun() {
        return lastAttempt != null;
    }

    public boolean lastCycleFailed() {
        return failedCategory != null;
    }
}
