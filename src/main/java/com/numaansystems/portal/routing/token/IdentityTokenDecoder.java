package com.numaansystems.portal.routing.token;

import com.numaansystems.portal.model.SubjectClaims;

/**
 * Turns a provider-issued identity token into subject claims.
 *
 * @author Numaan Systems
 * @version 0.1.0
 */
public interface IdentityTokenDecoder {

    /**
     * @throws IdentityTokenException if the token is malformed or, for verifying
     *         implementations, fails signature, issuer, audience or expiry checks
     */
    SubjectClaims decode(String token);

    /**
     * @return whether the token's signature and standard claims are checked
     */
    boolean isVerifying();
}
