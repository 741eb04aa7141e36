package com.keg.directory;

/**
 * The directory connection could not be opened or bound.
 */
public class SessionException extends DirectoryAccessException {

    public SessionException(String message) {
        super(message);
    }

    public SessionException(String message, Throwable cause) {
        super(message, cause);
    }
}
