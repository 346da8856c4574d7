package com.numaansystems.portal.model;

import java.util.Collections;
import java.util.LinkedHashSet;
import java.util.Objects;
import java.util.Set;

/**
 * A directory subject as produced by a successful bind.
 *
 * <p>Immutable. {@link #getGroups()} is the authoritative membership set used for
 * department authorization.</p>
 *
 * @author Numaan Systems
 * @version 0.1.0
 */
public final class Identity {

    private final String username;
    private final String fullName;
    private final String email;
    private final Set<String> groups;

    public Identity(String username, String fullName, String email, Set<String> groups) {
        this.username = Objects.requireNonNull(username, "username");
        this.fullName = fullName != null ? fullName : username;
        this.email = email;
        this.groups = Collections.unmodifiableSet(new LinkedHashSet<>(groups));
    }

    public String getUsername() {
        return username;
    }

    public String getFullName() {
        return fullName;
    }

    public String getEmail() {
        return email;
    }

    public Set<String> getGroups() {
        return groups;
    }

    public boolean isInGroup(String group) {
        return groups.contains(group);
    }

    @Override
    public String toString() {
        return "Identity{username='" + username + "', groups=" + groups + "}";
    }
}
