package com.keg.directory;

/**
 * Opens transport connections to the directory server.
 */
@FunctionalInterface
public interface DirectoryConnector {

    /**
     * Connects and, if {@code bindDn} is not null, performs a simple bind.
     *
     * @param bindDn   the DN to bind as, or null for an anonymous connection
     * @param password the bind password (ignored when {@code bindDn} is null)
     * @throws BindRejectedException if the server refuses the credentials
     * @throws SessionException      if the server cannot be reached
     */
    DirectorySession connect(String bindDn, String password) throws SessionException;
}
