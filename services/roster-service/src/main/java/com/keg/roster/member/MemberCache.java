package com.keg.roster.member;

import java.util.ArrayList;
import java.util.Collections;
import java.util.HashSet;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.locks.ReentrantReadWriteLock;
import java.util.function.Function;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * In-memory snapshot of every member and group known to the directory.
 * <p>
 * Six collections are kept: all members, sutlers, honorary members, registers, executive
 * groups and the members of each register. {@link #replaceAll(DirectorySnapshot)} is the only
 * mutator and swaps all six under one write lock, so a reader sees either the complete old or
 * the complete new state.
 * <p>
 * The lock is fair: once the synchronization waits for the write lock, new readers queue behind
 * it. No I/O happens while the lock is held.
 */
public class MemberCache {

    private static final Logger log = LoggerFactory.getLogger(MemberCache.class);

    private final ReentrantReadWriteLock lock = new ReentrantReadWriteLock(true);

    private final Set<Member> members = new LinkedHashSet<>();
    private final List<Member> sutlers = new ArrayList<>();
    private final List<Member> honoraryMembers = new ArrayList<>();
    private final List<Group> registers = new ArrayList<>();
    private final Set<Group> executives = new HashSet<>();
    private final List<RegisterEntry> membersByRegister = new ArrayList<>();

    private final MemberCacheView view = new LockedView();

    /**
     * Runs {@code reader} under the read lock. The view passed in must not escape the callback.
     */
    public <T> T read(Function<MemberCacheView, T> reader) {
        lock.readLock().lock();
        try {
            return reader.apply(view);
        } finally {
            lock.readLock().unlock();
        }
    }

    /**
     * Replaces the whole content of the cache with {@code snapshot}.
     * <p>
     * Members, sutlers and honorary members are sorted by member order, registers by group
     * order, and the members of each register are rebuilt from the sorted member list.
     */
    public void replaceAll(DirectorySnapshot snapshot) {
        List<Member> sortedMembers = sorted(snapshot.members());
        List<Member> sortedSutlers = sorted(snapshot.sutlers());
        List<Member> sortedHonorary = sorted(snapshot.honoraryMembers());
        List<Group> sortedRegisters = sorted(snapshot.registers());
        List<RegisterEntry> entries = new ArrayList<>(sortedRegisters.size());
        for (Group register : sortedRegisters) {
            List<Member> inRegister = sortedMembers.stream()
                    .filter(m -> register.contains(m.fullUsername()))
                    .toList();
            entries.add(new RegisterEntry(register, inRegister));
        }

        lock.writeLock().lock();
        try {
            members.clear();
            members.addAll(sortedMembers);
            sutlers.clear();
            sutlers.addAll(sortedSutlers);
            honoraryMembers.clear();
            honoraryMembers.addAll(sortedHonorary);
            registers.clear();
            registers.addAll(sortedRegisters);
            executives.clear();
            executives.addAll(snapshot.executives());
            membersByRegister.clear();
            membersByRegister.addAll(entries);
        } finally {
            lock.writeLock().unlock();
        }
        log.info("Member cache replaced: {} members, {} sutlers, {} honorary members, {} registers, {} executive groups",
                sortedMembers.size(), sortedSutlers.size(), sortedHonorary.size(),
                sortedRegisters.size(), snapshot.executives().size());
    }

    /**
     * Looks a member up by DN, username or mail address, ignoring case.
     */
    public Optional<Member> find(String key) {
        return read(v -> v.find(key));
    }

    /**
     * Copies all six collections under a single read lock.
     */
    public CacheSnapshot snapshot() {
        return read(CacheSnapshot::copyOf);
    }

    public int size() {
        return read(v -> v.members().size());
    }

    private static <T extends Comparable<? super T>> List<T> sorted(List<T> source) {
        List<T> copy = new ArrayList<>(source);
        Collections.sort(copy);
        return copy;
    }

    private final class LockedView implements MemberCacheView {

        @Override
        public Set<Member> members() {
            return Collections.unmodifiableSet(members);
        }

        @Override
        public List<Member> sutlers() {
            return Collections.unmodifiableList(sutlers);
        }

        @Override
        public List<Member> honoraryMembers() {
            return Collections.unmodifiableList(honoraryMembers);
        }

        @Override
        public List<Group> registers() {
            return Collections.unmodifiableList(registers);
        }

        @Override
        public Set<Group> executives() {
            return Collections.unmodifiableSet(executives);
        }

        @Override
        public List<RegisterEntry> membersByRegister() {
            return Collections.unmodifiableList(membersByRegister);
        }
    }
}
