package com.numaansystems.portal.routing;

import org.springframework.http.HttpStatus;

/**
 * Terminal failure states of the router, each with its own response status and page.
 */
public enum RoutingErrorKind {

    INVALID_AUTH_EVIDENCE(HttpStatus.UNAUTHORIZED, "invalid_auth_evidence",
            "Invalid authentication headers. Please log in again."),
    NO_ROLES_ASSIGNED(HttpStatus.FORBIDDEN, "no_roles",
            "No roles assigned to your account. Please contact your administrator."),
    UNRECOGNIZED_ROLE(HttpStatus.FORBIDDEN, "unrecognized_role",
            "Invalid role assignment. Please contact your administrator."),
    ROUTING_MISCONFIGURATION(HttpStatus.INTERNAL_SERVER_ERROR, "misconfiguration",
            "Service configuration error. Please contact support."),
    BACKEND_UNAVAILABLE(HttpStatus.SERVICE_UNAVAILABLE, "backend_unavailable",
            "The dashboard is currently unavailable. Please try again later."),
    BACKEND_TIMEOUT(HttpStatus.GATEWAY_TIMEOUT, "backend_timeout",
            "The dashboard is taking too long to respond. Please try again later."),
    PROXY_INTERNAL_ERROR(HttpStatus.INTERNAL_SERVER_ERROR, "proxy_error",
            "An unexpected error occurred. Please contact support.");

    private final HttpStatus status;
    private final String label;
    private final String userMessage;

    RoutingErrorKind(HttpStatus status, String label, String userMessage) {
        this.status = status;
        this.label = label;
        this.userMessage = userMessage;
    }

    public HttpStatus status() {
        return status;
    }

    public String label() {
        return label;
    }

    public String userMessage() {
        return userMessage;
    }
}
