package com.numaansystems.portal.directory;

import java.util.List;

/**
 * Minimal view of the directory service used by the login flow.
 *
 * <p>Both operations are blocking network calls. Neither retries.</p>
 *
 * @author Numaan Systems
 * @version 0.1.0
 */
public interface DirectoryClient {

    /**
     * Binds with the given credentials and releases the connection.
     *
     * @throws DirectoryAuthenticationException if the directory rejects the credentials
     * @throws DirectoryUnavailableException if the directory cannot be reached or answers with a fault
     */
    void bind(String userDn, String password);

    /**
     * Subtree search below {@code base}.
     *
     * @param base full distinguished name of the search base
     * @param filter an already escaped LDAP filter
     * @param attributes attributes to return
     * @throws DirectoryUnavailableException on communication or protocol faults
     */
    List<DirectoryEntry> search(String base, String filter, String... attributes);
}
