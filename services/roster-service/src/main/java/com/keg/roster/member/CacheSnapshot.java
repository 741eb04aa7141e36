package com.keg.roster.member;

import java.util.Collections;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;

/**
 * An immutable copy of all six cache collections, taken under one read lock.
 */
public record CacheSnapshot(
        Set<Member> members,
        List<Member> sutlers,
        List<Member> honoraryMembers,
        List<Group> registers,
        Set<Group> executives,
        List<RegisterEntry> membersByRegister
) implements MemberCacheView {

    static CacheSnapshot copyOf(MemberCacheView view) {
        return new CacheSnapshot(
                Collections.unmodifiableSet(new LinkedHashSet<>(view.members())),
                List.copyOf(view.sutlers()),
                List.copyOf(view.honoraryMembers()),
                List.copyOf(view.registers()),
                Set.copyOf(view.executives()),
                List.copyOf(view.membersByRegister()));
    }
}
