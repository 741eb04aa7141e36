package com.keg.roster.sync;

import com.keg.observability.CorrelationContext;
import com.keg.observability.CorrelationContextHolder;
import java.time.Duration;
import java.util.UUID;
import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.TimeUnit;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.context.SmartLifecycle;

/**
 * Runs {@link MemberSynchronizer#runOnce()} on a single background thread: immediately at
 * startup, then with a fixed delay between the end of one cycle and the start of the next.
 * <p>
 * Manual cycles from {@link #triggerNow()} go to the same thread, so two cycles never overlap.
 */
public class SynchronizationScheduler implements SmartLifecycle {

    private static final Logger log = LoggerFactory.getLogger(SynchronizationScheduler.class);

    static final String ORIGIN = "sync";

    private final MemberSynchronizer synchronizer;
    private final Duration interval;
    private final boolean periodic;
    private final ScheduledExecutorService executor;
    private volatile boolean running;

    public SynchronizationScheduler(MemberSynchronizer synchronizer, Duration interval, boolean periodic) {
        if (interval.isZero() || interval.isNegative()) {
            throw new IllegalArgumentException("interval must be positive");
        }
        this.synchronizer = synchronizer;
        this.interval = interval;
        this.periodic = periodic;
        this.executor = Executors.newSingleThreadScheduledExecutor(runnable -> {
            Thread thread = new Thread(runnable, "member-sync");
            thread.setDaemon(true);
            return thread;
        });
    }

    @Override
    public void start() {
        if (periodic) {
            log.info("Synchronizing members every {} seconds", interval.toSeconds());
            executor.scheduleWithFixedDelay(() -> cycle("scheduled"), 0, interval.toSeconds(), TimeUnit.SECONDS);
        } else {
            log.warn("Periodic member synchronization is disabled");
        }
        running = true;
    }

    @Override
    public void stop() {
        executor.shutdownNow();
        running = false;
    }

    @Override
    public boolean isRunning() {
        return running;
    }

    /**
     * Queues an out-of-band cycle and returns immediately.
     */
    public void triggerNow() {
        log.info("Manual member synchronization requested");
        executor.execute(() -> cycle("manual"));
    }

    void cycle(String trigger) {
        var context = new CorrelationContext(UUID.randomUUID().toString(), null, ORIGIN);
        CorrelationContextHolder.runWithContext(context, () -> {
            log.debug("Starting {} synchronization cycle", trigger);
            try {
                synchronizer.runOnce();
            } catch (RuntimeException e) {
                // a thrown exception would cancel all further scheduled cycles
                log.error("Synchronization cycle failed unexpectedly", e);
            }
        });
    }
}
