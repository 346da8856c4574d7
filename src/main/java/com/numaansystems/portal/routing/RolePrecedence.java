package com.numaansystems.portal.routing;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Locale;
import java.util.Optional;
import java.util.Set;

/**
 * Fixed priority order of roles, highest first.
 *
 * <p>{@link #primaryRoleOf(Set)} is a total function: a subject holding several roles is
 * routed by the first entry of this list that it holds, regardless of the order in which
 * its own roles were listed.</p>
 */
public final class RolePrecedence {

    private final List<String> order;

    public RolePrecedence(List<String> order) {
        Set<String> normalized = new LinkedHashSet<>();
        for (String role : order) {
            if (role != null && !role.isBlank()) {
                normalized.add(role.trim().toLowerCase(Locale.ROOT));
            }
        }
        this.order = Collections.unmodifiableList(new ArrayList<>(normalized));
    }

    /**
     * @param roles normalized (lower-cased) roles of the subject
     * @return the highest-priority role held, or empty if none of them is ranked
     */
    public Optional<String> primaryRoleOf(Set<String> roles) {
        for (String role : order) {
            if (roles.contains(role)) {
                return Optional.of(role);
            }
        }
        return Optional.empty();
    }

    public List<String> getOrder() {
        return order;
    }

    @Override
    public String toString() {
        return "RolePrecedence" + order;
    }
}
