package com.numaansystems.portal.model;

import java.time.Instant;

/**
 * A fully authenticated portal session.
 *
 * <p>Only created by promoting a {@link PendingAuthentication}. Its lifetime is absolute:
 * activity does not extend {@link #getExpiresAt()}.</p>
 *
 * @author Numaan Systems
 * @version 0.1.0
 */
public final class AuthenticatedSession implements SessionState {

    private final Identity identity;
    private final String department;
    private final Instant issuedAt;
    private final Instant expiresAt;

    public AuthenticatedSession(Identity identity, String department, Instant issuedAt, Instant expiresAt) {
        this.identity = identity;
        this.department = department;
        this.issuedAt = issuedAt;
        this.expiresAt = expiresAt;
    }

    @Override
    public Identity getIdentity() {
        return identity;
    }

    @Override
    public String getDepartment() {
        return department;
    }

    public boolean isPermanent() {
        return true;
    }

    public Instant getIssuedAt() {
        return issuedAt;
    }

    @Override
    public Instant getExpiresAt() {
        return expiresAt;
    }

    @Override
    public String toString() {
        return "AuthenticatedSession{username='" + identity.getUsername()
                + "', department='" + department + "', issuedAt=" + issuedAt + "}";
    }
}
