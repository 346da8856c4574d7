package com.numaansystems.portal.routing.token;

import com.numaansystems.portal.model.SubjectClaims;
import org.springframework.security.oauth2.jwt.Jwt;
import org.springframework.security.oauth2.jwt.JwtDecoder;
import org.springframework.security.oauth2.jwt.JwtException;

/**
 * Decoder that only accepts tokens passing the delegate {@link JwtDecoder}'s checks.
 *
 * <p>In production the delegate is a {@code NimbusJwtDecoder} built from the provider's JWK
 * set, validating signature, issuer, audience and expiry.</p>
 */
public class VerifyingIdentityTokenDecoder implements IdentityTokenDecoder {

    private final JwtDecoder jwtDecoder;
    private final TokenClaimsMapper claimsMapper;

    public VerifyingIdentityTokenDecoder(JwtDecoder jwtDecoder, TokenClaimsMapper claimsMapper) {
        this.jwtDecoder = jwtDecoder;
        this.claimsMapper = claimsMapper;
    }

    @Override
    public SubjectClaims decode(String token) {
        Jwt jwt;
        try {
            jwt = jwtDecoder.decode(token);
        } catch (JwtException e) {
            throw new IdentityTokenException(e.getMessage(), e);
        }
        return claimsMapper.toSubject(jwt.getClaims());
    }

    @Override
    public boolean isVerifying() {
        return true;
    }
}
