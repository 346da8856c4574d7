package com.numaansystems.portal.config;

import com.numaansystems.portal.model.AuthenticatedSession;
import com.numaansystems.portal.model.Department;
import com.numaansystems.portal.service.DepartmentDirectory;
import com.numaansystems.portal.service.TwoFactorAuthenticationService;
import jakarta.servlet.FilterChain;
import jakarta.servlet.ServletException;
import jakarta.servlet.http.HttpServletRequest;
import jakarta.servlet.http.HttpServletResponse;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Component;
import org.springframework.web.filter.OncePerRequestFilter;

import java.io.IOException;

/**
 * Restricts the OpenAPI document to logged-in members of the admin department.
 *
 * <h2>Protected Endpoints</h2>
 * <ul>
 *   <li>/v3/api-docs/** - OpenAPI v3 specification</li>
 * </ul>
 *
 * <h2>Configuration</h2>
 * <pre>
 * portal:
 *   api-docs:
 *     enabled: true
 *     department: Admin
 * </pre>
 *
 * @author Numaan Systems
 * @version 0.1.0
 */
@Component
public class ApiDocsAccessFilter extends OncePerRequestFilter {

    private static final Logger logger = LoggerFactory.getLogger(ApiDocsAccessFilter.class);

    private static final String API_DOCS_PATH = "/v3/api-docs";

    private final TwoFactorAuthenticationService authenticationService;
    private final DepartmentDirectory departments;
    private final SessionCookies sessionCookies;

    @Value("${portal.api-docs.enabled:true}")
    private boolean apiDocsEnabled;

    @Value("${portal.api-docs.department:Admin}")
    private String adminDepartment;

    public ApiDocsAccessFilter(TwoFactorAuthenticationService authenticationService,
                               DepartmentDirectory departments,
                               SessionCookies sessionCookies) {
        this.authenticationService = authenticationService;
        this.departments = departments;
        this.sessionCookies = sessionCookies;
    }

    @Override
    protected boolean shouldNotFilter(HttpServletRequest request) {
        String path = request.getRequestURI().substring(request.getContextPath().length());
        return !path.startsWith(API_DOCS_PATH);
    }

    @Override
    protected void doFilterInternal(HttpServletRequest request, HttpServletResponse response, FilterChain chain)
            throws ServletException, IOException {

        if (!apiDocsEnabled) {
            logger.warn("API docs access denied: API docs are disabled");
            response.sendError(HttpServletResponse.SC_FORBIDDEN, "API documentation is disabled");
            return;
        }

        AuthenticatedSession session = authenticationService
                .findSession(sessionCookies.readSessionId(request))
                .orElse(null);
        if (session == null) {
            logger.warn("API docs access denied: no portal session");
            response.sendError(HttpServletResponse.SC_UNAUTHORIZED, "Authentication required for API documentation");
            return;
        }

        String requiredGroup = departments.findByName(adminDepartment)
                .map(Department::getRequiredGroup)
                .orElse(null);
        String username = session.getIdentity().getUsername();
        if (requiredGroup == null || !session.getIdentity().isInGroup(requiredGroup)) {
            logger.warn("API docs access denied for user: {}", username);
            response.sendError(HttpServletResponse.SC_FORBIDDEN, "Access to API documentation is restricted");
            return;
        }

        logger.info("API docs access granted to user: {}", username);
        chain.doFilter(request, response);
    }
}
