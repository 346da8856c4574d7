package com.numaansystems.portal.service;

import com.numaansystems.portal.model.SessionState;

import java.util.Optional;

/**
 * Storage for pending and authenticated session records, keyed by session id.
 *
 * <p>The only mutable state shared between requests in the login flow. Implementations must
 * be safe for concurrent use and must treat expired records as absent.</p>
 *
 * @author Numaan Systems
 * @version 0.1.0
 */
public interface SessionStore {

    /**
     * @param sessionId the id from the session cookie, may be {@code null}
     * @return the live record, or empty if absent or expired
     */
    Optional<SessionState> get(String sessionId);

    void put(String sessionId, SessionState state);

    /**
     * Removes whatever record is stored under the id. Removing an absent id is a no-op.
     *
     * @return the removed record if it was still live
     */
    Optional<SessionState> delete(String sessionId);

    /**
     * Atomically removes the record only if it is still exactly {@code expected}.
     *
     * <p>Of several callers racing to remove the same record, exactly one gets {@code true}.</p>
     */
    boolean remove(String sessionId, SessionState expected);

    /**
     * @return the number of live records of the given type
     */
    int count(Class<? extends SessionState> type);
}
