package com.numaansystems.portal.service;

/**
 * Thrown by {@link TwoFactorAuthenticationService} when a login step fails.
 *
 * <p>The message is safe to show to the user. Detail that could help credential guessing is
 * only written to the log.</p>
 */
public class PortalAuthenticationException extends RuntimeException {

    private final AuthErrorKind kind;

    public PortalAuthenticationException(AuthErrorKind kind, String message) {
        super(message);
        this.kind = kind;
    }

    public PortalAuthenticationException(AuthErrorKind kind, String message, Throwable cause) {
        super(message, cause);
        this.kind = kind;
    }

    public AuthErrorKind getKind() {
        return kind;
    }
}
