package com.numaansystems.portal.model;

import java.time.Instant;

/**
 * A record held in the session store under a session id.
 *
 * <p>Implementations use identity equality so the store can compare-and-remove the exact
 * record a caller read.</p>
 */
public interface SessionState {

    Identity getIdentity();

    String getDepartment();

    Instant getExpiresAt();

    default boolean isExpired(Instant now) {
        return !now.isBefore(getExpiresAt());
    }
}
