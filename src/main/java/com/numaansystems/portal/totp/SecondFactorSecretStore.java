package com.numaansystems.portal.totp;

import java.util.Optional;

/**
 * Lookup of the shared TOTP secret enrolled for a user.
 *
 * @author Numaan Systems
 * @version 0.1.0
 */
public interface SecondFactorSecretStore {

    /**
     * @param username directory username
     * @return the base32 secret, or empty if the user is not enrolled
     * @throws SecretStoreUnavailableException if the store itself cannot be consulted
     */
    Optional<String> lookup(String username);

    /**
     * @throws SecretStoreUnavailableException if the store itself cannot be consulted
     */
    default boolean isEnrolled(String username) {
        return lookup(username).isPresent();
    }
}
