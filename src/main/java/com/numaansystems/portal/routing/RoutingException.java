package com.numaansystems.portal.routing;

/**
 * A request could not be routed or forwarded.
 *
 * <p>The message is for the log; the page shown to the user comes from
 * {@link RoutingErrorKind#userMessage()}.</p>
 */
public class RoutingException extends RuntimeException {

    private final RoutingErrorKind kind;

    public RoutingException(RoutingErrorKind kind, String message) {
        super(message);
        this.kind = kind;
    }

    public RoutingException(RoutingErrorKind kind, String message, Throwable cause) {
        super(message, cause);
        this.kind = kind;
    }

    public RoutingErrorKind getKind() {
        return kind;
    }
}
