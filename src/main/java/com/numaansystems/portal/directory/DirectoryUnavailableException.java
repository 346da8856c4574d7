package com.numaansystems.portal.directory;

/**
 * The directory could not be reached or answered with a protocol fault.
 */
public class DirectoryUnavailableException extends RuntimeException {

    public DirectoryUnavailableException(String message, Throwable cause) {
        super(message, cause);
    }
}
