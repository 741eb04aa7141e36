package com.keg.roster.sync;

import com.keg.directory.DirectoryAccessException;
import com.keg.directory.DirectoryClient;
import com.keg.directory.DirectoryEntryMapper;
import com.keg.observability.MetricFactory;
import com.keg.roster.config.LdapProperties;
import com.keg.roster.config.LdapProperties.SearchScope;
import com.keg.roster.member.DirectorySnapshot;
import com.keg.roster.member.Group;
import com.keg.roster.member.GroupEntryMapper;
import com.keg.roster.member.Member;
import com.keg.roster.member.MemberCache;
import com.keg.roster.member.MemberEntryMapper;
import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.Timer;
import java.time.Clock;
import java.time.Instant;
import java.util.Comparator;
import java.util.HashSet;
import java.util.List;
import java.util.concurrent.atomic.AtomicLong;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * One synchronization cycle: fetch five categories from the directory and, only if all of them
 * arrived, replace the member cache in one step.
 * <p>
 * A failed fetch leaves the cache untouched. There is no retry inside a cycle; the next
 * scheduled cycle is the retry.
 */
public class MemberSynchronizer {

    private static final Logger log = LoggerFactory.getLogger(MemberSynchronizer.class);

    static final String MEMBERS = "members";
    static final String SUTLERS = "sutlers";
    static final String HONORARY = "honorary";
    static final String REGISTERS = "registers";
    static final String EXECUTIVES = "executives";

    private final DirectoryClient directory;
    private final MemberCache cache;
    private final LdapProperties ldap;
    private final MemberEntryMapper memberMapper;
    private final GroupEntryMapper groupMapper;
    private final Comparator<String> titleOrder;
    private final Clock clock;

    private final Counter successfulCycles;
    private final Counter failedCycles;
    private final AtomicLong cachedMembers;
    private final Timer cycleDuration;

    private volatile SynchronizationStatus status = SynchronizationStatus.NEVER_RUN;

    public MemberSynchronizer(DirectoryClient directory, MemberCache cache, LdapProperties ldap,
                              MetricFactory metrics, Clock clock) {
        this.directory = directory;
        this.cache = cache;
        this.ldap = ldap;
        this.memberMapper = new MemberEntryMapper(ldap.memberMapping(), ldap.addressMapping());
        this.groupMapper = new GroupEntryMapper(ldap.groupMapping());
        this.titleOrder = titleOrder(ldap.titleOrdering());
        this.clock = clock;
        this.successfulCycles = metrics.counter("keg.sync.cycles", "Directory synchronization cycles",
                "outcome", "success");
        this.failedCycles = metrics.counter("keg.sync.cycles", "Directory synchronization cycles",
                "outcome", "failure");
        this.cachedMembers = metrics.gauge("keg.sync.members", "Members in the cache after the last cycle");
        this.cycleDuration = metrics.timer("keg.sync.duration", "Duration of a synchronization cycle");
    }

    /**
     * Runs one cycle.
     *
     * @return true iff the cache was replaced
     */
    public boolean runOnce() {
        return Boolean.TRUE.equals(cycleDuration.record(this::cycle));
    }

    private boolean cycle() {
        Instant started = clock.instant();
        log.info("Synchronizing members and groups from {}", ldap.server());
        FetchOutcome outcome = fetchAll();
        if (!outcome.successful()) {
            log.warn("Unable to fetch {} from the directory server, keeping the cached data: {}",
                    outcome.category(), outcome.cause().getMessage());
            failedCycles.increment();
            status = status.failed(started, outcome.category());
            return false;
        }
        DirectorySnapshot snapshot = outcome.snapshot()
                .mapMembers(m -> m.withTitles(sortTitles(m.titles())));
        cache.replaceAll(snapshot);
        cachedMembers.set(cache.size());
        successfulCycles.increment();
        status = status.succeeded(started);
        log.info("Done with member synchronization");
        return true;
    }

    /**
     * Fetches every category in sequence, stopping at the first failure.
     */
    FetchOutcome fetchAll() {
        String category = MEMBERS;
        try {
            List<Member> members = fetch(ldap.member(), memberMapper);
            category = SUTLERS;
            List<Member> sutlers = fetch(ldap.sutler(), memberMapper);
            category = HONORARY;
            List<Member> honorary = fetch(ldap.honorary(), memberMapper);
            category = REGISTERS;
            List<Group> registers = fetch(ldap.register(), groupMapper);
            category = EXECUTIVES;
            List<Group> executives = fetch(ldap.executives(), groupMapper);
            return FetchOutcome.ok(
                    new DirectorySnapshot(members, sutlers, honorary, registers, new HashSet<>(executives)));
        } catch (DirectoryAccessException | RuntimeException e) {
            return FetchOutcome.fail(category, e);
        }
    }

    private <T> List<T> fetch(SearchScope scope, DirectoryEntryMapper<T> mapper) throws DirectoryAccessException {
        return directory.searchTyped(scope.base(), scope.filter(), mapper);
    }

    /**
     * Sorts titles by the configured precedence. A title missing from it ranks like the first
     * listed title; ties keep their directory order.
     */
    List<String> sortTitles(List<String> titles) {
        return titles.stream().sorted(titleOrder).toList();
    }

    public SynchronizationStatus status() {
        return status;
    }

    private static Comparator<String> titleOrder(List<String> ordering) {
        return Comparator.comparingInt(title -> {
            int index = ordering.indexOf(title);
            return Math.max(index, 0);
        });
    }
}
