package com.keg.roster.auth;

/**
 * An authenticated member lacks the executive role a route requires.
 */
public class AccessDeniedException extends RuntimeException {

    private final ExecutiveRole role;

    public AccessDeniedException(ExecutiveRole role) {
        super("Executive role '" + role.key() + "' required");
        this.role = role;
    }

    public ExecutiveRole getRole() {
        return role;
    }
}
