package com.keg.directory;

import java.util.List;

/**
 * An open connection to the directory server.
 * <p>
 * Closing the session unbinds it. A session is used by one thread at a time.
 */
public interface DirectorySession extends AutoCloseable {

    /**
     * Runs a subtree search returning all attributes of every matching entry.
     *
     * @param baseDn the search base
     * @param filter an RFC 4515 filter string
     * @return the entries found, possibly empty
     * @throws DirectoryException if the search fails or times out
     */
    List<RawEntry> search(String baseDn, String filter) throws DirectoryException;

    @Override
    void close() throws DirectoryException;
}
