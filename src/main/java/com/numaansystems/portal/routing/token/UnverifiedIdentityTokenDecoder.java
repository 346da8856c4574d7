package com.numaansystems.portal.routing.token;

import com.nimbusds.jwt.JWTParser;
import com.numaansystems.portal.model.SubjectClaims;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.text.ParseException;

/**
 * DEVELOPMENT ONLY: reads token claims without checking signature, issuer, audience or
 * expiry. Anyone able to send a request can impersonate any user while this is active.
 *
 * <p>Only instantiated when {@code portal.identity-token.verification} is explicitly set to
 * {@code UNVERIFIED_DEVELOPMENT_ONLY}.</p>
 */
public class UnverifiedIdentityTokenDecoder implements IdentityTokenDecoder {

    private static final Logger logger = LoggerFactory.getLogger(UnverifiedIdentityTokenDecoder.class);

    private final TokenClaimsMapper claimsMapper;

    public UnverifiedIdentityTokenDecoder(TokenClaimsMapper claimsMapper) {
        this.claimsMapper = claimsMapper;
        logger.warn("Identity token verification is DISABLED. Never run this configuration outside development.");
    }

    @Override
    public SubjectClaims decode(String token) {
        try {
            SubjectClaims subject = claimsMapper.toSubject(JWTParser.parse(token).getJWTClaimsSet().getClaims());
            logger.warn("Accepted UNVERIFIED identity token for user {}", subject.getUsername());
            return subject;
        } catch (ParseException e) {
            throw new IdentityTokenException("Malformed identity token", e);
        }
    }

    @Override
    public boolean isVerifying() {
        return false;
    }
}
