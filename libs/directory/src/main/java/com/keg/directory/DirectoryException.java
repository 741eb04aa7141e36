package com.keg.directory;

/**
 * A search or unbind failed after the session was opened.
 */
public class DirectoryException extends DirectoryAccessException {

    public DirectoryException(String message, Throwable cause) {
        super(message, cause);
    }
}
