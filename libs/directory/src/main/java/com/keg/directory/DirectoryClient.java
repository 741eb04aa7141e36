package com.keg.directory;

import java.util.ArrayList;
import java.util.List;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Entry point for talking to the directory server.
 * <p>
 * Offers three things: opening a (service-)bound session, a one-shot typed search that opens,
 * searches, maps and unbinds, and verifying a user's password by binding as that user.
 * Every call opens its own connection; nothing is pooled or shared between threads.
 */
public class DirectoryClient {

    private static final Logger log = LoggerFactory.getLogger(DirectoryClient.class);

    private final DirectorySettings settings;
    private final DirectoryConnector connector;

    public DirectoryClient(DirectorySettings settings) {
        this(settings, new JndiDirectoryConnector(settings));
    }

    public DirectoryClient(DirectorySettings settings, DirectoryConnector connector) {
        this.settings = settings;
        this.connector = connector;
    }

    /**
     * Opens a session bound with the configured service account (anonymous if none is set).
     */
    public DirectorySession openSession() throws SessionException {
        return openSession(settings.bindDn(), settings.passwordOrEmpty());
    }

    /**
     * Opens a session to the configured server.
     * <p>
     * A rejected bind is reported but not fatal: the session continues anonymously, and any
     * search that needs the privileges fails on its own as a {@link DirectoryException}.
     *
     * @param bindDn   DN to bind as, or null for an anonymous session
     * @param password the password, null is treated as empty
     * @throws SessionException if the server is unreachable
     */
    public DirectorySession openSession(String bindDn, String password) throws SessionException {
        log.info("Connecting to directory server {}", settings.serverUrl());
        if (bindDn == null) {
            log.warn("Using the directory server without a bind user");
            return connector.connect(null, null);
        }
        try {
            log.debug("Binding directory user '{}'", bindDn);
            return connector.connect(bindDn, password == null ? "" : password);
        } catch (BindRejectedException e) {
            log.error("Failed to bind '{}', continuing anonymously: {}", bindDn, e.getMessage());
            return connector.connect(null, null);
        }
    }

    /**
     * Searches the subtree below {@code baseDn} and maps every entry with {@code mapper}.
     * <p>
     * Opening, searching and unbinding must all succeed; otherwise the call fails and no
     * partial result is returned.
     *
     * @throws SessionException   if no session could be opened
     * @throws DirectoryException if the search or the unbind failed
     */
    public <T> List<T> searchTyped(String baseDn, String filter, DirectoryEntryMapper<T> mapper)
            throws SessionException, DirectoryException {
        log.info("Searching the directory at '{}' with filter '{}'", baseDn, filter);
        List<RawEntry> entries;
        try (DirectorySession session = openSession()) {
            entries = session.search(baseDn, filter);
        }
        log.debug("Mapping {} entries found below '{}'", entries.size(), baseDn);
        List<T> mapped = new ArrayList<>(entries.size());
        for (RawEntry entry : entries) {
            mapped.add(mapper.fromEntry(entry));
        }
        return mapped;
    }

    /**
     * Verifies a password by binding as {@code dn} on a fresh connection.
     * <p>
     * Blank passwords are refused locally: a simple bind with an empty password is an
     * unauthenticated bind, which most servers accept for any DN.
     *
     * @return true iff the server accepted the bind
     * @throws SessionException if the server could not be reached (as opposed to a refusal)
     */
    public boolean authenticate(String dn, String password) throws SessionException {
        if (dn == null || dn.isBlank() || password == null || password.isEmpty()) {
            log.debug("Refusing bind with blank DN or password");
            return false;
        }
        DirectorySession session;
        try {
            session = connector.connect(dn, password);
        } catch (BindRejectedException e) {
            log.debug("Bind rejected for '{}'", dn);
            return false;
        }
        try {
            session.close();
        } catch (DirectoryException e) {
            log.debug("Unbind after successful authentication of '{}' failed", dn, e);
        }
        return true;
    }
}
