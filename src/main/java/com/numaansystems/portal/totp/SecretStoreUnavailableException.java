package com.numaansystems.portal.totp;

/**
 * The second-factor secret store cannot answer, as opposed to answering "not enrolled".
 */
public class SecretStoreUnavailableException extends RuntimeException {

    public SecretStoreUnavailableException(String message, Throwable cause) {
        super(message, cause);
    }
}
