package com.numaansystems.portal.directory;

import org.springframework.ldap.support.LdapUtils;

import javax.naming.ldap.LdapName;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Optional;

/**
 * A directory search result.
 *
 * <p>Display name and email are optional in the directory; callers apply their own fallback.
 * {@link #getGroups()} holds leaf group names, already extracted from the {@code memberOf}
 * distinguished names.</p>
 */
public final class DirectoryEntry {

    private final String displayName;
    private final String email;
    private final List<String> groups;

    public DirectoryEntry(String displayName, String email, List<String> groups) {
        this.displayName = displayName;
        this.email = email;
        this.groups = Collections.unmodifiableList(new ArrayList<>(groups));
    }

    public Optional<String> getDisplayName() {
        return Optional.ofNullable(displayName).filter(value -> !value.isBlank());
    }

    public Optional<String> getEmail() {
        return Optional.ofNullable(email).filter(value -> !value.isBlank());
    }

    public List<String> getGroups() {
        return groups;
    }

    /**
     * Value of the first RDN of a group DN:
     * {@code cn=hr,cn=groups,cn=accounts,dc=example} yields {@code hr}.
     *
     * @throws org.springframework.ldap.InvalidNameException if {@code groupDn} is not a DN
     * @throws IllegalArgumentException if {@code groupDn} is empty
     */
    public static String leafGroupName(String groupDn) {
        LdapName name = LdapUtils.newLdapName(groupDn);
        if (name.isEmpty()) {
            throw new IllegalArgumentException("Empty group DN");
        }
        // LdapName indexes RDNs right to left
        return String.valueOf(name.getRdn(name.size() - 1).getValue());
    }
}
