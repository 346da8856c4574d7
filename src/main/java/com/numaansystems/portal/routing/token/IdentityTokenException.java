package com.numaansystems.portal.routing.token;

public class IdentityTokenException extends RuntimeException {

    public IdentityTokenException(String message, Throwable cause) {
        super(message, cause);
    }
}
