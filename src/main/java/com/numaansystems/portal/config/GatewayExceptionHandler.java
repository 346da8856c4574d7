package com.numaansystems.portal.config;

import com.numaansystems.portal.routing.RoutingErrorKind;
import com.numaansystems.portal.routing.RoutingException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.HttpStatus;
import org.springframework.http.HttpStatusCode;
import org.springframework.http.MediaType;
import org.springframework.http.ResponseEntity;
import org.springframework.web.ErrorResponse;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;
import org.springframework.web.util.HtmlUtils;

import java.util.Map;

/**
 * Turns router failures into the page the browser shows.
 *
 * <p>Every {@link RoutingErrorKind} gets its own status and title. The page never contains the
 * internal message, only the kind's user-facing text.</p>
 */
@RestControllerAdvice
public class GatewayExceptionHandler {

    private static final Logger logger = LoggerFactory.getLogger(GatewayExceptionHandler.class);

    @ExceptionHandler(RoutingException.class)
    public ResponseEntity<String> handleRouting(RoutingException e) {
        RoutingErrorKind kind = e.getKind();
        return ResponseEntity.status(kind.status())
                .contentType(MediaType.TEXT_HTML)
                .body(errorPage(kind));
    }

    @ExceptionHandler(Exception.class)
    public ResponseEntity<Map<String, String>> handleUnexpected(Exception e) {
        if (e instanceof ErrorResponse errorResponse) {
            // framework-level request errors keep their own status
            HttpStatusCode status = errorResponse.getStatusCode();
            return ResponseEntity.status(status)
                    .body(Map.of("error", String.valueOf(status.value()),
                            "message", String.valueOf(errorResponse.getBody().getDetail())));
        }
        logger.error("Unhandled error: {}", e.getMessage(), e);
        return ResponseEntity.status(HttpStatus.INTERNAL_SERVER_ERROR)
                .body(Map.of("error", "Internal Server Error",
                        "message", "An unexpected error occurred."));
    }

    static String errorPage(RoutingErrorKind kind) {
        String title = switch (kind) {
            case INVALID_AUTH_EVIDENCE -> "Authentication Required";
            case NO_ROLES_ASSIGNED, UNRECOGNIZED_ROLE -> "Access Denied";
            case ROUTING_MISCONFIGURATION -> "Configuration Error";
            case BACKEND_UNAVAILABLE -> "Service Unavailable";
            case BACKEND_TIMEOUT -> "Gateway Timeout";
            case PROXY_INTERNAL_ERROR -> "Internal Error";
        };
        String link = kind == RoutingErrorKind.INVALID_AUTH_EVIDENCE
                ? "<p><a href=\"/employee/login\">Log in</a></p>"
                : "<p><a href=\"/logout\">Log out</a></p>";

        return "<!DOCTYPE html>\n"
                + "<html><head><meta charset=\"utf-8\"><title>" + kind.status().value() + " " + title + "</title></head>\n"
                + "<body>\n"
                + "<h1>" + title + "</h1>\n"
                + "<p>" + HtmlUtils.htmlEscape(kind.userMessage()) + "</p>\n"
                + link + "\n"
                + "</body></html>\n";
    }
}
