package com.numaansystems.portal.totp;

import com.numaansystems.portal.PortalFixtures;
import com.numaansystems.portal.config.PortalProperties;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.LinkedHashMap;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Unit tests for ConfiguredSecondFactorSecretStore.
 */
class ConfiguredSecondFactorSecretStoreTest {

    private ConfiguredSecondFactorSecretStore store;

    @BeforeEach
    void setUp() {
        Map<String, String> secrets = new LinkedHashMap<>();
        secrets.put("alice", PortalFixtures.ALICE_SECRET);
        secrets.put("dave", "  ");

        PortalProperties properties = new PortalProperties();
        properties.getTotp().setSecrets(secrets);
        store = new ConfiguredSecondFactorSecretStore(properties);
    }

    @Test
    @DisplayName("Enrolled user's secret is returned")
    void testLookup() {
        assertEquals(PortalFixtures.ALICE_SECRET, store.lookup("alice").orElseThrow());
        assertTrue(store.isEnrolled("alice"));
    }

    @Test
    @DisplayName("Unknown users and blank secrets count as not enrolled")
    void testNotEnrolled() {
        assertFalse(store.isEnrolled("carol"));
        assertFalse(store.isEnrolled("dave"));
        assertTrue(store.lookup("dave").isEmpty());
    }

    @Test
    @DisplayName("Later changes to the configuration map are not visible")
    void testSnapshot() {
        PortalProperties properties = new PortalProperties();
        properties.getTotp().getSecrets().put("alice", PortalFixtures.ALICE_SECRET);
        ConfiguredSecondFactorSecretStore snapshot = new ConfiguredSecondFactorSecretStore(properties);

        properties.getTotp().getSecrets().put("erin", PortalFixtures.BOB_SECRET);

        assertFalse(snapshot.isEnrolled("erin"));
    }
}
