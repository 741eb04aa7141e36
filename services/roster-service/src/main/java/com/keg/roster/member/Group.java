package com.keg.roster.member;

import java.util.Comparator;
import java.util.List;

/**
 * A directory group: either a register (instrument section) or an executive group.
 *
 * @param members fully-qualified names of the members of this group
 */
public record Group(String name, String namePlural, String description, List<String> members)
        implements Comparable<Group> {

    private static final Comparator<String> NAME_ORDER = Comparator.nullsFirst(Comparator.naturalOrder());

    public Group {
        members = members == null ? List.of() : List.copyOf(members);
    }

    /** Case-insensitive membership test on the fully-qualified name. */
    public boolean contains(String fullUsername) {
        return members.stream().anyMatch(m -> m.equalsIgnoreCase(fullUsername));
    }

    @Override
    public int compareTo(Group other) {
        return NAME_ORDER.compare(name, other.name);
    }
}
