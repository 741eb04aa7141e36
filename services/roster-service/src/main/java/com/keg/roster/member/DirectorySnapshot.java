package com.keg.roster.member;

import java.util.List;
import java.util.Set;
import java.util.function.UnaryOperator;

/**
 * The complete result of one successful synchronization: five collections fetched from the
 * directory, not yet sorted.
 */
public record DirectorySnapshot(
        List<Member> members,
        List<Member> sutlers,
        List<Member> honoraryMembers,
        List<Group> registers,
        Set<Group> executives
) {

    public DirectorySnapshot {
        members = List.copyOf(members);
        sutlers = List.copyOf(sutlers);
        honoraryMembers = List.copyOf(honoraryMembers);
        registers = List.copyOf(registers);
        executives = Set.copyOf(executives);
    }

    /** Applies {@code transformation} to every member of the three member collections. */
    public DirectorySnapshot mapMembers(UnaryOperator<Member> transformation) {
        return new DirectorySnapshot(
                members.stream().map(transformation).toList(),
                sutlers.stream().map(transformation).toList(),
                honoraryMembers.stream().map(transformation).toList(),
                registers,
                executives);
    }
}
