package com.numaansystems.portal.service;

import com.numaansystems.portal.model.SessionState;
import jakarta.annotation.PreDestroy;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.TimeUnit;

/**
 * In-memory {@link SessionStore} backed by a {@link ConcurrentHashMap}.
 *
 * <h2>Expiry</h2>
 * <p>Records carry their own expiry instant. {@link #get(String)} hides expired records
 * immediately; a background sweep removes them from memory at a fixed interval.</p>
 *
 * <h2>Storage</h2>
 * <p>State is local to one gateway instance. Running several instances behind a load
 * balancer requires sticky sessions or a shared store implementation.</p>
 *
 * @author Numaan Systems
 * @version 0.1.0
 */
@Service
public class InMemorySessionStore implements SessionStore {

    private static final Logger logger = LoggerFactory.getLogger(InMemorySessionStore.class);

    private final ConcurrentHashMap<String, SessionState> sessions = new ConcurrentHashMap<>();
    private final ScheduledExecutorService scheduler;
    private final Clock clock;

    public InMemorySessionStore(Clock clock,
                                @Value("${portal.session.sweep-interval:PT1M}") Duration sweepInterval) {
        this.clock = clock;
        this.scheduler = Executors.newSingleThreadScheduledExecutor(runnable -> {
            Thread thread = new Thread(runnable, "session-sweeper");
            thread.setDaemon(true);
            return thread;
        });
        long intervalMillis = sweepInterval.toMillis();
        scheduler.scheduleAtFixedRate(this::sweepExpired, intervalMillis, intervalMillis, TimeUnit.MILLISECONDS);
    }

    @PreDestroy
    public void shutdown() {
        scheduler.shutdownNow();
    }

    @Override
    public Optional<SessionState> get(String sessionId) {
        if (sessionId == null || sessionId.isEmpty()) {
            return Optional.empty();
        }
        SessionState state = sessions.get(sessionId);
        if (state == null) {
            return Optional.empty();
        }
        if (state.isExpired(clock.instant())) {
            sessions.remove(sessionId, state);
            logger.debug("Session record expired for user: {}", state.getIdentity().getUsername());
            return Optional.empty();
        }
        return Optional.of(state);
    }

    @Override
    public void put(String sessionId, SessionState state) {
        sessions.put(sessionId, state);
    }

    @Override
    public Optional<SessionState> delete(String sessionId) {
        if (sessionId == null || sessionId.isEmpty()) {
            return Optional.empty();
        }
        SessionState removed = sessions.remove(sessionId);
        if (removed == null || removed.isExpired(clock.instant())) {
            return Optional.empty();
        }
        return Optional.of(removed);
    }

    @Override
    public boolean remove(String sessionId, SessionState expected) {
        if (sessionId == null || expected == null) {
            return false;
        }
        return sessions.remove(sessionId, expected);
    }

    @Override
    public int count(Class<? extends SessionState> type) {
        Instant now = clock.instant();
        int count = 0;
        for (SessionState state : sessions.values()) {
            if (type.isInstance(state) && !state.isExpired(now)) {
                count++;
            }
        }
        return count;
    }

    void sweepExpired() {
        Instant now = clock.instant();
        int removed = 0;
        for (Map.Entry<String, SessionState> entry : sessions.entrySet()) {
            if (entry.getValue().isExpired(now) && sessions.remove(entry.getKey(), entry.getValue())) {
                removed++;
            }
        }
        if (removed > 0) {
            logger.info("Removed {} expired session records", removed);
        }
    }
}
