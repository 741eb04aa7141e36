package com.keg.roster.member;

import java.util.List;
import java.util.Optional;
import java.util.Set;

/**
 * Read-only view of the {@link MemberCache}, valid only inside
 * {@link MemberCache#read(java.util.function.Function)}.
 * <p>
 * The collections are live views guarded by the read lock. Copy what must outlive the callback.
 */
public interface MemberCacheView {

    /** All members, unique by value, in member order. */
    Set<Member> members();

    List<Member> sutlers();

    List<Member> honoraryMembers();

    /** Registers in group order. */
    List<Group> registers();

    Set<Group> executives();

    /** One entry per register, in register order. */
    List<RegisterEntry> membersByRegister();

    /** Case-insensitive lookup by DN, username or mail address. */
    default Optional<Member> find(String key) {
        return members().stream().filter(m -> m.matches(key)).findFirst();
    }
}
