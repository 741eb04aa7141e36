package com.keg.roster.auth;

/**
 * Capabilities granted through membership in an executive group.
 * <p>
 * The key is looked up in {@code keg.ldap.executive-mapping} to find the plural name of the
 * group that confers the role.
 */
public enum ExecutiveRole {

    /** Maintains the score archive. */
    ARCHIVE("archive"),

    /** Maintains the roster, e.g. may force a directory synchronization. */
    ROSTER("roster");

    private final String key;

    ExecutiveRole(String key) {
        this.key = key;
    }

    public String key() {
        return key;
    }
}
