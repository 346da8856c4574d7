package com.numaansystems.portal.service;

import com.numaansystems.portal.PortalFixtures;
import com.numaansystems.portal.PortalFixtures.MutableClock;
import com.numaansystems.portal.model.AuthenticatedSession;
import com.numaansystems.portal.model.Identity;
import com.numaansystems.portal.model.PendingAuthentication;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.util.Set;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Unit tests for InMemorySessionStore.
 */
class InMemorySessionStoreTest {

    private MutableClock clock;
    private InMemorySessionStore store;
    private Identity alice;

    @BeforeEach
    void setUp() {
        clock = new MutableClock(PortalFixtures.NOW);
        store = new InMemorySessionStore(clock, Duration.ofHours(1));
        alice = new Identity("alice", "Alice Example", "alice@example.com", Set.of("hr"));
    }

    @AfterEach
    void tearDown() {
        store.shutdown();
    }

    private PendingAuthentication pending(Duration ttl) {
        return new PendingAuthentication(alice, "HR", clock.instant(), clock.instant().plus(ttl));
    }

    @Test
    @DisplayName("Should return stored record until it expires")
    void testGetHidesExpired() {
        // Arrange
        store.put("s1", pending(Duration.ofMinutes(5)));

        // Act & Assert
        assertTrue(store.get("s1").isPresent());
        clock.advance(Duration.ofMinutes(5));
        assertTrue(store.get("s1").isEmpty(), "Record at its expiry instant is absent");
    }

    @Test
    @DisplayName("Should treat null and empty ids as absent")
    void testNullIds() {
        assertTrue(store.get(null).isEmpty());
        assertTrue(store.get("").isEmpty());
        assertTrue(store.delete(null).isEmpty());
        assertFalse(store.remove(null, pending(Duration.ofMinutes(5))));
    }

    @Test
    @DisplayName("Compare-and-remove only succeeds for the expected record")
    void testRemoveExpected() {
        // Arrange
        PendingAuthentication first = pending(Duration.ofMinutes(5));
        PendingAuthentication second = pending(Duration.ofMinutes(5));
        store.put("s1", first);

        // Act & Assert
        assertFalse(store.remove("s1", second), "Different record with equal content must not match");
        assertTrue(store.remove("s1", first));
        assertFalse(store.remove("s1", first), "Second remove must fail");
    }

    @Test
    @DisplayName("Delete returns the live record once")
    void testDelete() {
        // Arrange
        store.put("s1", pending(Duration.ofMinutes(5)));

        // Act & Assert
        assertTrue(store.delete("s1").isPresent());
        assertTrue(store.delete("s1").isEmpty());
    }

    @Test
    @DisplayName("Count and sweep consider only live records")
    void testCountAndSweep() {
        // Arrange
        store.put("p1", pending(Duration.ofMinutes(5)));
        store.put("p2", pending(Duration.ofMinutes(30)));
        store.put("a1", new AuthenticatedSession(alice, "HR", clock.instant(), clock.instant().plus(Duration.ofHours(8))));

        // Act
        clock.advance(Duration.ofMinutes(10));
        store.sweepExpired();

        // Assert
        assertEquals(1, store.count(PendingAuthentication.class));
        assertEquals(1, store.count(AuthenticatedSession.class));
        assertTrue(store.get("p1").isEmpty());
        assertTrue(store.get("p2").isPresent());
    }
}
