package com.numaansystems.portal.routing;

import com.numaansystems.portal.model.SubjectClaims;

/**
 * Placeholder for a request that carried no usable evidence; resolving it always fails.
 */
class MissingEvidence implements AuthEvidence {

    private final String reason;

    MissingEvidence(String reason) {
        this.reason = reason;
    }

    @Override
    public SubjectClaims resolve() {
        throw new RoutingException(RoutingErrorKind.INVALID_AUTH_EVIDENCE, reason);
    }

    @Override
    public String source() {
        return "none";
    }
}
