package com.keg.roster.member;

import java.util.List;

/**
 * A register together with the cached members listed in it, in member order.
 */
public record RegisterEntry(Group register, List<Member> members) {

    public RegisterEntry {
        members = List.copyOf(members);
    }
}
