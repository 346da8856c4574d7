package com.numaansystems.portal.model;

import java.util.Collections;
import java.util.LinkedHashSet;
import java.util.Set;

/**
 * Identity and normalized role set produced by any kind of authentication evidence.
 */
public final class SubjectClaims {

    private final String email;
    private final String username;
    private final Set<String> roles;

    public SubjectClaims(String email, String username, Set<String> roles) {
        this.email = email;
        this.username = username;
        this.roles = Collections.unmodifiableSet(new LinkedHashSet<>(roles));
    }

    public String getEmail() {
        return email;
    }

    public String getUsername() {
        return username;
    }

    /** Trimmed, lower-cased, in the order the evidence listed them. */
    public Set<String> getRoles() {
        return roles;
    }

    @Override
    public String toString() {
        return "SubjectClaims{email='" + email + "', username='" + username + "', roles=" + roles + "}";
    }
}
