package com.numaansystems.portal.config;

import com.numaansystems.portal.routing.RoutingErrorKind;
import com.numaansystems.portal.routing.RoutingException;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.springframework.http.HttpStatus;
import org.springframework.http.MediaType;
import org.springframework.http.ResponseEntity;
import org.springframework.web.HttpRequestMethodNotSupportedException;

import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Unit tests for GatewayExceptionHandler.
 */
class GatewayExceptionHandlerTest {

    private final GatewayExceptionHandler handler = new GatewayExceptionHandler();

    @Test
    @DisplayName("Each routing failure gets its own status and title")
    void testRoutingPages() {
        assertPage(RoutingErrorKind.INVALID_AUTH_EVIDENCE, HttpStatus.UNAUTHORIZED, "Authentication Required");
        assertPage(RoutingErrorKind.NO_ROLES_ASSIGNED, HttpStatus.FORBIDDEN, "Access Denied");
        assertPage(RoutingErrorKind.ROUTING_MISCONFIGURATION, HttpStatus.INTERNAL_SERVER_ERROR, "Configuration Error");
        assertPage(RoutingErrorKind.BACKEND_TIMEOUT, HttpStatus.GATEWAY_TIMEOUT, "Gateway Timeout");
        assertPage(RoutingErrorKind.PROXY_INTERNAL_ERROR, HttpStatus.INTERNAL_SERVER_ERROR, "Internal Error");
    }

    @Test
    @DisplayName("Internal details never reach the page")
    void testInternalMessageHidden() {
        // Act
        ResponseEntity<String> response = handler.handleRouting(new RoutingException(
                RoutingErrorKind.ROUTING_MISCONFIGURATION, "No backend URL configured for role sales"));

        // Assert
        assertFalse(response.getBody().contains("backend URL"));
        assertTrue(response.getBody().contains("href=\"/logout\""));
    }

    @Test
    @DisplayName("Framework request errors keep their status")
    void testFrameworkError() {
        // Act
        ResponseEntity<Map<String, String>> response = handler.handleUnexpected(
                new HttpRequestMethodNotSupportedException("TRACE"));

        // Assert
        assertEquals(405, response.getStatusCode().value());
    }

    @Test
    @DisplayName("Unexpected errors become a generic 500")
    void testUnexpectedError() {
        // Act
        ResponseEntity<Map<String, String>> response = handler.handleUnexpected(new IllegalStateException("boom"));

        // Assert
        assertEquals(500, response.getStatusCode().value());
        assertEquals("An unexpected error occurred.", response.getBody().get("message"));
    }

    private void assertPage(RoutingErrorKind kind, HttpStatus status, String title) {
        ResponseEntity<String> response = handler.handleRouting(new RoutingException(kind, "internal"));
        assertEquals(status, response.getStatusCode());
        assertEquals(MediaType.TEXT_HTML, response.getHeaders().getContentType());
        assertTrue(response.getBody().contains("<h1>" + title + "</h1>"), response.getBody());
        assertTrue(response.getBody().contains(kind.userMessage()));
    }
}
