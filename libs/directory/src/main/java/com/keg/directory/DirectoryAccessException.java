package com.keg.directory;

/**
 * Base class of the checked failures raised while talking to the directory server.
 * <p>
 * Both subtypes are recoverable: the next synchronization cycle or the next login attempt
 * simply opens a new connection.
 */
public abstract class DirectoryAccessException extends Exception {

    protected DirectoryAccessException(String message) {
        super(message);
    }

    protected DirectoryAccessException(String message, Throwable cause) {
        super(message, cause);
    }
}
