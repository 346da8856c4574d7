package com.numaansystems.portal.routing;

import com.numaansystems.portal.model.SubjectClaims;

/**
 * Identity asserted by headers an upstream authenticating proxy injected.
 *
 * <p>Deployment precondition: the gateway must only be reachable through that proxy, which
 * must overwrite these headers on every request. This class cannot check its own network
 * position and trusts the values as given.</p>
 */
public class TrustedHeaderEvidence implements AuthEvidence {

    private final String email;
    private final String username;
    private final String groups;
    private final RoleExtractor roleExtractor;

    public TrustedHeaderEvidence(String email, String username, String groups, RoleExtractor roleExtractor) {
        this.email = email;
        this.username = username;
        this.groups = groups;
        this.roleExtractor = roleExtractor;
    }

    @Override
    public SubjectClaims resolve() {
        return new SubjectClaims(trim(email), trim(username), roleExtractor.extract(groups));
    }

    @Override
    public String source() {
        return "trusted-headers";
    }

    private static String trim(String value) {
        return value != null ? value.trim() : null;
    }
}
