package com.numaansystems.portal.config;

import com.numaansystems.portal.routing.token.IdentityTokenDecoder;
import com.numaansystems.portal.routing.token.TokenClaimsMapper;
import com.numaansystems.portal.routing.token.UnverifiedIdentityTokenDecoder;
import com.numaansystems.portal.routing.token.VerifyingIdentityTokenDecoder;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.boot.autoconfigure.condition.ConditionalOnExpression;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.security.oauth2.core.DelegatingOAuth2TokenValidator;
import org.springframework.security.oauth2.core.OAuth2TokenValidator;
import org.springframework.security.oauth2.jwt.Jwt;
import org.springframework.security.oauth2.jwt.JwtClaimNames;
import org.springframework.security.oauth2.jwt.JwtClaimValidator;
import org.springframework.security.oauth2.jwt.JwtValidators;
import org.springframework.security.oauth2.jwt.NimbusJwtDecoder;
import org.springframework.util.StringUtils;

import java.util.ArrayList;
import java.util.Collection;
import java.util.List;

/**
 * Decoders for identity tokens presented to the router.
 *
 * <h2>Modes</h2>
 * <ul>
 *   <li>{@code VERIFIED} (default): signature against the provider's JWK set, expiry, and
 *       issuer/audience when configured. Only active once {@code jwk-set-uri} is set.</li>
 *   <li>{@code UNVERIFIED_DEVELOPMENT_ONLY}: claims are read without any check. Never use
 *       outside a developer machine.</li>
 * </ul>
 *
 * <p>Without a decoder bean a request carrying a token is rejected as missing evidence.</p>
 *
 * @author Numaan Systems
 * @version 0.1.0
 */
@Configuration
public class IdentityTokenConfig {

    private static final Logger logger = LoggerFactory.getLogger(IdentityTokenConfig.class);

    @Bean
    @ConditionalOnExpression("'${portal.identity-token.verification:VERIFIED}' == 'VERIFIED' "
            + "and '${portal.identity-token.jwk-set-uri:}' != ''")
    public IdentityTokenDecoder verifyingIdentityTokenDecoder(
            TokenClaimsMapper claimsMapper,
            @Value("${portal.identity-token.jwk-set-uri}") String jwkSetUri,
            @Value("${portal.identity-token.issuer:}") String issuer,
            @Value("${portal.identity-token.audience:}") String audience) {

        NimbusJwtDecoder jwtDecoder = NimbusJwtDecoder.withJwkSetUri(jwkSetUri).build();

        List<OAuth2TokenValidator<Jwt>> validators = new ArrayList<>();
        validators.add(StringUtils.hasText(issuer)
                ? JwtValidators.createDefaultWithIssuer(issuer)
                : JwtValidators.createDefault());
        if (StringUtils.hasText(audience)) {
            validators.add(new JwtClaimValidator<Collection<String>>(JwtClaimNames.AUD,
                    aud -> aud != null && aud.contains(audience)));
        }
        jwtDecoder.setJwtValidator(new DelegatingOAuth2TokenValidator<>(validators));

        logger.info("Identity tokens verified against {} (issuer: {}, audience: {})",
                jwkSetUri, StringUtils.hasText(issuer) ? issuer : "any", StringUtils.hasText(audience) ? audience : "any");
        return new VerifyingIdentityTokenDecoder(jwtDecoder, claimsMapper);
    }

    @Bean
    @ConditionalOnProperty(prefix = "portal.identity-token", name = "verification", havingValue = "UNVERIFIED_DEVELOPMENT_ONLY")
    public IdentityTokenDecoder unverifiedIdentityTokenDecoder(TokenClaimsMapper claimsMapper) {
        return new UnverifiedIdentityTokenDecoder(claimsMapper);
    }
}
