package com.numaansystems.portal.model;

import java.time.Instant;

/**
 * Directory credentials verified, second factor not yet verified.
 *
 * <p>Single-use: it is either promoted into an {@link AuthenticatedSession} or discarded.
 * It expires on its own when the second factor is never completed.</p>
 *
 * @author Numaan Systems
 * @version 0.1.0
 */
public final class PendingAuthentication implements SessionState {

    private final Identity identity;
    private final String department;
    private final Instant createdAt;
    private final Instant expiresAt;

    public PendingAuthentication(Identity identity, String department, Instant createdAt, Instant expiresAt) {
        this.identity = identity;
        this.department = department;
        this.createdAt = createdAt;
        this.expiresAt = expiresAt;
    }

    @Override
    public Identity getIdentity() {
        return identity;
    }

    public String getUsername() {
        return identity.getUsername();
    }

    @Override
    public String getDepartment() {
        return department;
    }

    public Instant getCreatedAt() {
        return createdAt;
    }

    @Override
    public Instant getExpiresAt() {
        return expiresAt;
    }

    @Override
    public String toString() {
        return "PendingAuthentication{username='" + identity.getUsername()
                + "', department='" + department + "', expiresAt=" + expiresAt + "}";
    }
}
