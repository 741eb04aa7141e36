package com.keg.roster.member;

import com.keg.directory.DirectoryEntryMapper;
import com.keg.directory.RawEntry;
import com.keg.roster.config.LdapProperties.GroupMapping;

/**
 * Maps register and executive group entries through the configured attribute names.
 */
public class GroupEntryMapper implements DirectoryEntryMapper<Group> {

    private final GroupMapping mapping;

    public GroupEntryMapper(GroupMapping mapping) {
        this.mapping = mapping;
    }

    @Override
    public Group fromEntry(RawEntry entry) {
        return new Group(
                entry.firstValue(mapping.name()),
                entry.firstValue(mapping.namePlural()),
                entry.firstValue(mapping.description()),
                entry.values(mapping.members()));
    }
}
