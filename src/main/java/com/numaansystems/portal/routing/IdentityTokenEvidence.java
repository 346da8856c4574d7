package com.numaansystems.portal.routing;

import com.numaansystems.portal.model.SubjectClaims;
import com.numaansystems.portal.routing.token.IdentityTokenDecoder;
import com.numaansystems.portal.routing.token.IdentityTokenException;

/**
 * An identity token issued by the external provider, sent as a bearer token or cookie.
 *
 * <p>The source name tells verified and development-only tokens apart in routing errors.</p>
 */
public class IdentityTokenEvidence implements AuthEvidence {

    private final String token;
    private final IdentityTokenDecoder decoder;

    public IdentityTokenEvidence(String token, IdentityTokenDecoder decoder) {
        this.token = token;
        this.decoder = decoder;
    }

    @Override
    public SubjectClaims resolve() {
        try {
            return decoder.decode(token);
        } catch (IdentityTokenException e) {
            throw new RoutingException(RoutingErrorKind.INVALID_AUTH_EVIDENCE,
                    "Identity token rejected: " + e.getMessage(), e);
        }
    }

    @Override
    public String source() {
        return decoder.isVerifying() ? "identity-token" : "unverified-identity-token";
    }
}
