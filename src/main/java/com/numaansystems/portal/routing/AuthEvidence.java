package com.numaansystems.portal.routing;

import com.numaansystems.portal.model.SubjectClaims;

/**
 * Proof of authentication carried by an inbound request.
 *
 * <p>Whatever its shape, evidence yields one thing: a subject identity and a normalized role
 * set. Field validation is left to {@link RoleRoutingService}.</p>
 */
public interface AuthEvidence {

    /**
     * @throws RoutingException with {@link RoutingErrorKind#INVALID_AUTH_EVIDENCE} when the
     *         evidence cannot be read
     */
    SubjectClaims resolve();

    /** Short name of the evidence source, for logs. */
    String source();
}
