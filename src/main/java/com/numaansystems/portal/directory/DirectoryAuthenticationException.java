package com.numaansystems.portal.directory;

/**
 * The directory refused the bind: wrong password, unknown user or locked account.
 */
public class DirectoryAuthenticationException extends RuntimeException {

    public DirectoryAuthenticationException(String message, Throwable cause) {
        super(message, cause);
    }
}
