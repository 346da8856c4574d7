package com.numaansystems.portal.routing;

import com.numaansystems.portal.model.AuthenticatedSession;
import com.numaansystems.portal.model.Identity;
import com.numaansystems.portal.model.SubjectClaims;
import com.numaansystems.portal.service.DepartmentDirectory;

import java.util.ArrayList;
import java.util.List;

/**
 * A portal session established by the two-factor login, re-presented by its cookie.
 *
 * <p>Directory groups are translated into router roles through the department table, so the
 * {@code admins} group routes as role {@code admin}.</p>
 */
public class SessionEvidence implements AuthEvidence {

    private final AuthenticatedSession session;
    private final DepartmentDirectory departments;
    private final RoleExtractor roleExtractor;

    public SessionEvidence(AuthenticatedSession session, DepartmentDirectory departments, RoleExtractor roleExtractor) {
        this.session = session;
        this.departments = departments;
        this.roleExtractor = roleExtractor;
    }

    @Override
    public SubjectClaims resolve() {
        Identity identity = session.getIdentity();
        List<String> roles = new ArrayList<>();
        for (String group : identity.getGroups()) {
            roles.add(departments.roleForGroup(group));
        }
        return new SubjectClaims(identity.getEmail(), identity.getUsername(), roleExtractor.normalize(roles));
    }

    @Override
    public String source() {
        return "portal-session";
    }
}
