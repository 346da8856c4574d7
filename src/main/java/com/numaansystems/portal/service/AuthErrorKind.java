package com.numaansystems.portal.service;

/**
 * Distinguishable failures of the two-factor login flow.
 *
 * <p>The metric label is what monitoring alerts on, so every kind has its own.</p>
 */
public enum AuthErrorKind {

    INVALID_CREDENTIALS("invalid_credentials"),
    INVALID_DEPARTMENT("invalid_department"),
    UNAUTHORIZED("unauthorized"),
    DIRECTORY_ERROR("directory_error"),
    SESSION_EXPIRED("session_expired"),
    INVALID_CODE_FORMAT("invalid_format"),
    NOT_ENROLLED("not_enrolled"),
    CONFIGURATION_ERROR("configuration_error"),
    INVALID_CODE("invalid_code");

    private final String label;

    AuthErrorKind(String label) {
        this.label = label;
    }

    public String label() {
        return label;
    }
}
