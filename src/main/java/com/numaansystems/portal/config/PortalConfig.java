package com.numaansystems.portal.config;

import com.numaansystems.portal.routing.RoleExtractor;
import com.numaansystems.portal.routing.RolePrecedence;
import com.numaansystems.portal.routing.token.TokenClaimsMapper;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.time.Clock;

/**
 * Shared beans for the login flow and the router.
 *
 * @author Numaan Systems
 * @version 0.1.0
 */
@Configuration
@EnableConfigurationProperties(PortalProperties.class)
public class PortalConfig {

    private static final Logger logger = LoggerFactory.getLogger(PortalConfig.class);

    @Bean
    public Clock clock() {
        return Clock.systemUTC();
    }

    /**
     * Fixed order used to collapse a role set to one primary role.
     */
    @Bean
    public RolePrecedence rolePrecedence(PortalProperties properties) {
        RolePrecedence precedence = new RolePrecedence(properties.getRolePrecedence());
        logger.info("Role precedence: {}", precedence.getOrder());
        return precedence;
    }

    @Bean
    public TokenClaimsMapper tokenClaimsMapper(RoleExtractor roleExtractor) {
        return new TokenClaimsMapper(roleExtractor);
    }
}
