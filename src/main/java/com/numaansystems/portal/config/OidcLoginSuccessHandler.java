package com.numaansystems.portal.config;

import jakarta.servlet.http.HttpServletRequest;
import jakarta.servlet.http.HttpServletResponse;
import jakarta.servlet.http.HttpSession;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.security.core.Authentication;
import org.springframework.security.core.context.SecurityContextHolder;
import org.springframework.security.oauth2.core.oidc.OidcIdToken;
import org.springframework.security.oauth2.core.oidc.user.OidcUser;
import org.springframework.security.web.authentication.AuthenticationSuccessHandler;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.time.Duration;
import java.time.Instant;

/**
 * Runs after a successful provider login.
 *
 * <p>The provider's ID token is copied into the identity-token cookie and the user is sent to
 * {@code /}. From then on the router reads the token from the cookie on every request; the
 * Spring Security context and HTTP session used during the login dance are dropped.</p>
 *
 * @author Numaan Systems
 * @version 0.1.0
 */
@Component
public class OidcLoginSuccessHandler implements AuthenticationSuccessHandler {

    private static final Logger logger = LoggerFactory.getLogger(OidcLoginSuccessHandler.class);

    private final SessionCookies sessionCookies;

    public OidcLoginSuccessHandler(SessionCookies sessionCookies) {
        this.sessionCookies = sessionCookies;
    }

    @Override
    public void onAuthenticationSuccess(HttpServletRequest request,
                                        HttpServletResponse response,
                                        Authentication authentication) throws IOException {

        if (!(authentication.getPrincipal() instanceof OidcUser oidcUser)) {
            logger.error("Provider login for {} did not return an ID token", authentication.getName());
            response.sendError(HttpServletResponse.SC_UNAUTHORIZED, "Provider did not return an ID token");
            return;
        }

        OidcIdToken idToken = oidcUser.getIdToken();
        Duration maxAge = idToken.getExpiresAt() != null
                ? Duration.between(Instant.now(), idToken.getExpiresAt())
                : Duration.ZERO;
        if (maxAge.isNegative() || maxAge.isZero()) {
            // session cookie, dropped when the browser closes
            maxAge = Duration.ofSeconds(-1);
        }

        sessionCookies.writeIdentityToken(response, idToken.getTokenValue(), maxAge);

        SecurityContextHolder.clearContext();
        HttpSession session = request.getSession(false);
        if (session != null) {
            session.invalidate();
        }

        logger.info("PROVIDER_LOGIN | {} | ID token stored, redirecting to /", oidcUser.getPreferredUsername());
        response.sendRedirect("/");
    }
}
