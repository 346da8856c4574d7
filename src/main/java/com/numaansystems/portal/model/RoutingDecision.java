package com.numaansystems.portal.model;

import java.util.Set;

/**
 * Outcome of a successful routing decision: where to send the request and on whose behalf.
 */
public final class RoutingDecision {

    private final SubjectClaims subject;
    private final String primaryRole;
    private final String targetUrl;

    public RoutingDecision(SubjectClaims subject, String primaryRole, String targetUrl) {
        this.subject = subject;
        this.primaryRole = primaryRole;
        this.targetUrl = targetUrl;
    }

    public SubjectClaims getSubject() {
        return subject;
    }

    public Set<String> getRoles() {
        return subject.getRoles();
    }

    public String getPrimaryRole() {
        return primaryRole;
    }

    public String getTargetUrl() {
        return targetUrl;
    }

    @Override
    public String toString() {
        return "RoutingDecision{user='" + subject.getUsername() + "', primaryRole='" + primaryRole
                + "', target='" + targetUrl + "'}";
    }
}
