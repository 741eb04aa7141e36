package com.keg.roster.auth;

import com.keg.roster.config.LdapProperties;
import com.keg.roster.member.Member;
import com.keg.roster.member.MemberCache;
import java.util.Arrays;
import java.util.List;
import java.util.Optional;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Decides whether a member holds an {@link ExecutiveRole}.
 * <p>
 * The decision is made on every call against the current cache content, so group changes in
 * the directory take effect with the next synchronization. It fails closed: an unmapped role, a
 * group missing from the cache and a member missing from the group all deny.
 */
public class ExecutiveRoleAuthorizer {

    private static final Logger log = LoggerFactory.getLogger(ExecutiveRoleAuthorizer.class);

    private final MemberCache cache;
    private final LdapProperties ldap;

    public ExecutiveRoleAuthorizer(MemberCache cache, LdapProperties ldap) {
        this.cache = cache;
        this.ldap = ldap;
    }

    public boolean authorize(Member member, ExecutiveRole role) {
        Optional<String> groupName = ldap.executiveGroup(role.key());
        if (groupName.isEmpty()) {
            log.warn("No executive group configured for role '{}'", role.key());
            return false;
        }
        boolean granted = isInGroup(member, groupName.get());
        if (!granted) {
            log.warn("Member '{}' is not member of the '{}' executive group or the group does not exist "
                    + "on the directory server", member.fullUsername(), groupName.get());
        }
        return granted;
    }

    /**
     * Every role the member currently holds, in declaration order.
     */
    public List<ExecutiveRole> rolesOf(Member member) {
        return Arrays.stream(ExecutiveRole.values())
                .filter(role -> ldap.executiveGroup(role.key())
                        .map(groupName -> isInGroup(member, groupName))
                        .orElse(false))
                .toList();
    }

    private boolean isInGroup(Member member, String groupNamePlural) {
        return cache.read(view -> view.executives().stream()
                .filter(group -> group.namePlural().equalsIgnoreCase(groupNamePlural))
                .anyMatch(group -> group.contains(member.fullUsername())));
    }
}
