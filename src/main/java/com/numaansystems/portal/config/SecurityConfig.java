package com.numaansystems.portal.config;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.ObjectProvider;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.security.config.annotation.web.builders.HttpSecurity;
import org.springframework.security.config.annotation.web.configuration.EnableWebSecurity;
import org.springframework.security.config.http.SessionCreationPolicy;
import org.springframework.security.oauth2.client.registration.ClientRegistrationRepository;
import org.springframework.security.web.SecurityFilterChain;

/**
 * Security configuration for the portal gateway.
 *
 * <p>Authorization is not expressed as Spring Security rules. The login controller and the
 * router make every decision themselves, so all requests are permitted at this layer and
 * CSRF is handled by the SameSite session cookie.</p>
 *
 * <p>When {@code portal.oidc.enabled=true} and a client registration exists, provider login
 * is enabled at {@code /oauth2/authorization/{registrationId}}.</p>
 *
 * @author Numaan Systems
 * @version 0.1.0
 */
@Configuration
@EnableWebSecurity
public class SecurityConfig {

    private static final Logger logger = LoggerFactory.getLogger(SecurityConfig.class);

    @Value("${portal.oidc.enabled:false}")
    private boolean oidcEnabled;

    /**
     * Configures the security filter chain.
     *
     * @param http the HttpSecurity to configure
     * @param clientRegistrations present only when OAuth2 client registrations are configured
     * @param successHandler stores the provider's ID token after provider login
     * @return the configured SecurityFilterChain
     * @throws Exception if an error occurs during configuration
     */
    @Bean
    public SecurityFilterChain securityFilterChain(HttpSecurity http,
                                                   ObjectProvider<ClientRegistrationRepository> clientRegistrations,
                                                   OidcLoginSuccessHandler successHandler) throws Exception {
        http
            .authorizeHttpRequests(authorize -> authorize
                .anyRequest().permitAll()
            )
            .csrf(csrf -> csrf.disable())
            .headers(headers -> headers.frameOptions(frame -> frame.sameOrigin()))
            .sessionManagement(session -> session.sessionCreationPolicy(SessionCreationPolicy.IF_REQUIRED))
            .formLogin(form -> form.disable())
            .httpBasic(basic -> basic.disable())
            .logout(logout -> logout.disable());

        if (oidcEnabled) {
            if (clientRegistrations.getIfAvailable() == null) {
                logger.error("portal.oidc.enabled is true but no OAuth2 client registration is configured; provider login disabled");
            } else {
                http.oauth2Login(oauth2 -> oauth2.successHandler(successHandler));
                logger.info("Provider login enabled");
            }
        }

        return http.build();
    }
}
