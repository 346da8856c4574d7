package com.numaansystems.portal.routing;

import com.numaansystems.portal.config.SessionCookies;
import com.numaansystems.portal.model.AuthenticatedSession;
import com.numaansystems.portal.routing.token.IdentityTokenDecoder;
import com.numaansystems.portal.service.DepartmentDirectory;
import com.numaansystems.portal.service.TwoFactorAuthenticationService;
import jakarta.servlet.http.HttpServletRequest;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.ObjectProvider;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.http.HttpHeaders;
import org.springframework.stereotype.Component;

/**
 * Finds the authentication evidence an inbound request carries.
 *
 * <p>Sources are tried in order: trusted proxy headers (only when enabled), a provider
 * identity token (bearer header, then cookie), the portal session cookie. A request with none
 * of them yields evidence that fails with INVALID_AUTH_EVIDENCE when resolved, so every
 * outcome goes through {@link RoleRoutingService}.</p>
 *
 * @author Numaan Systems
 * @version 0.1.0
 */
@Component
public class AuthEvidenceResolver {

    private static final Logger logger = LoggerFactory.getLogger(AuthEvidenceResolver.class);

    private static final String BEARER_PREFIX = "Bearer ";

    private final RoleExtractor roleExtractor;
    private final ObjectProvider<IdentityTokenDecoder> tokenDecoder;
    private final TwoFactorAuthenticationService authenticationService;
    private final DepartmentDirectory departments;
    private final SessionCookies sessionCookies;

    @Value("${portal.evidence.trusted-headers-enabled:false}")
    private boolean trustedHeadersEnabled;

    @Value("${portal.evidence.email-header:X-Auth-Request-Email}")
    private String emailHeader;

    @Value("${portal.evidence.user-header:X-Auth-Request-User}")
    private String userHeader;

    @Value("${portal.evidence.groups-header:X-Auth-Request-Groups}")
    private String groupsHeader;

    public AuthEvidenceResolver(RoleExtractor roleExtractor,
                                ObjectProvider<IdentityTokenDecoder> tokenDecoder,
                                TwoFactorAuthenticationService authenticationService,
                                DepartmentDirectory departments,
                                SessionCookies sessionCookies) {
        this.roleExtractor = roleExtractor;
        this.tokenDecoder = tokenDecoder;
        this.authenticationService = authenticationService;
        this.departments = departments;
        this.sessionCookies = sessionCookies;
    }

    public AuthEvidence resolve(HttpServletRequest request) {
        if (trustedHeadersEnabled && (request.getHeader(emailHeader) != null || request.getHeader(userHeader) != null)) {
            return new TrustedHeaderEvidence(request.getHeader(emailHeader), request.getHeader(userHeader),
                    request.getHeader(groupsHeader), roleExtractor);
        }

        String token = bearerToken(request);
        if (token == null) {
            token = sessionCookies.readIdentityToken(request);
        }
        if (token != null) {
            IdentityTokenDecoder decoder = tokenDecoder.getIfAvailable();
            if (decoder == null) {
                logger.warn("Identity token presented but no token decoder is configured");
                return new MissingEvidence("Identity token evidence is not enabled");
            }
            return new IdentityTokenEvidence(token, decoder);
        }

        AuthenticatedSession session = authenticationService
                .findSession(sessionCookies.readSessionId(request))
                .orElse(null);
        if (session != null) {
            return new SessionEvidence(session, departments, roleExtractor);
        }

        return new MissingEvidence("Missing authentication evidence for " + request.getRequestURI());
    }

    private static String bearerToken(HttpServletRequest request) {
        String authorization = request.getHeader(HttpHeaders.AUTHORIZATION);
        if (authorization == null || !authorization.regionMatches(true, 0, BEARER_PREFIX, 0, BEARER_PREFIX.length())) {
            return null;
        }
        String token = authorization.substring(BEARER_PREFIX.length()).trim();
        return token.isEmpty() ? null : token;
    }
}
