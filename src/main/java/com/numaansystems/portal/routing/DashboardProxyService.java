package com.numaansystems.portal.routing;

import com.numaansystems.portal.config.SessionCookies;
import com.numaansystems.portal.model.Department;
import com.numaansystems.portal.model.RoutingDecision;
import jakarta.servlet.http.HttpServletRequest;
import jakarta.servlet.http.HttpServletResponse;
import org.apache.hc.client5.http.ConnectTimeoutException;
import org.apache.hc.client5.http.classic.methods.HttpGet;
import org.apache.hc.client5.http.classic.methods.HttpUriRequestBase;
import org.apache.hc.client5.http.config.RequestConfig;
import org.apache.hc.client5.http.impl.classic.CloseableHttpClient;
import org.apache.hc.client5.http.impl.classic.CloseableHttpResponse;
import org.apache.hc.core5.http.ContentType;
import org.apache.hc.core5.http.Header;
import org.apache.hc.core5.http.HttpEntity;
import org.apache.hc.core5.http.io.entity.EntityUtils;
import org.apache.hc.core5.http.io.entity.InputStreamEntity;
import org.apache.hc.core5.util.Timeout;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Service;

import java.io.IOException;
import java.io.InputStream;
import java.io.OutputStream;
import java.net.ConnectException;
import java.net.NoRouteToHostException;
import java.net.SocketTimeoutException;
import java.net.URI;
import java.net.UnknownHostException;
import java.time.Duration;
import java.util.Enumeration;
import java.util.Locale;
import java.util.Set;
import java.util.StringJoiner;

/**
 * Forwards a routed request to its dashboard backend and relays the answer.
 *
 * <h2>Request</h2>
 * <ul>
 *   <li>Same method, path, query string and body</li>
 *   <li>Client headers are copied except hop-by-hop headers, identity headers a client could
 *       forge, and the portal's own cookies</li>
 *   <li>Identity headers are then set from the routing decision: {@code X-User-Email},
 *       {@code X-User-Name}, {@code X-User-Roles}, {@code X-Primary-Role},
 *       {@code X-Forwarded-For}, {@code X-Forwarded-Proto}</li>
 * </ul>
 *
 * <h2>Response</h2>
 * <ul>
 *   <li>Status code and body are streamed back verbatim</li>
 *   <li>{@code content-encoding}, {@code content-length}, {@code transfer-encoding},
 *       {@code connection} and other hop-by-hop headers are dropped</li>
 *   <li>Redirects are relayed, not followed</li>
 * </ul>
 *
 * <p>One attempt per inbound request. Failures map to BACKEND_UNAVAILABLE (connect),
 * BACKEND_TIMEOUT (no response within the response timeout) or PROXY_INTERNAL_ERROR.</p>
 *
 * @author Numaan Systems
 * @version 0.1.0
 */
@Service
public class DashboardProxyService {

    private static final Logger logger = LoggerFactory.getLogger(DashboardProxyService.class);

    public static final String USER_EMAIL_HEADER = "X-User-Email";
    public static final String USER_NAME_HEADER = "X-User-Name";
    public static final String USER_ROLES_HEADER = "X-User-Roles";
    public static final String PRIMARY_ROLE_HEADER = "X-Primary-Role";

    private static final Set<String> HOP_BY_HOP_HEADERS = Set.of(
            "connection", "keep-alive", "proxy-authenticate", "proxy-authorization",
            "te", "trailer", "trailers", "transfer-encoding", "upgrade");

    private static final Set<String> RESPONSE_EXCLUDED_HEADERS = Set.of(
            "content-encoding", "content-length");

    // set by the gateway itself, never taken from the client
    private static final Set<String> REQUEST_EXCLUDED_HEADERS = Set.of(
            "host", "content-length", "accept-encoding", "authorization", "cookie",
            "x-user-email", "x-user-name", "x-user-roles", "x-primary-role",
            "x-forwarded-for", "x-forwarded-proto");

    private static final String TRUSTED_HEADER_PREFIX = "x-auth-request-";

    private final CloseableHttpClient httpClient;
    private final SessionCookies sessionCookies;

    @Value("${portal.proxy.readiness-timeout:PT2S}")
    private Duration readinessTimeout;

    public DashboardProxyService(CloseableHttpClient dashboardHttpClient, SessionCookies sessionCookies) {
        this.httpClient = dashboardHttpClient;
        this.sessionCookies = sessionCookies;
    }

    /**
     * Forwards the request and writes the backend's answer to {@code response}.
     *
     * @throws RoutingException if the backend could not be reached or did not answer in time,
     *         and nothing has been written to the client yet
     */
    public void forward(HttpServletRequest request, HttpServletResponse response, RoutingDecision decision) {
        String targetUrl = buildTargetUrl(decision.getTargetUrl(), request);
        logger.info("Routing user {} (role: {}) to {}", decision.getSubject().getEmail(), decision.getPrimaryRole(), targetUrl);

        try {
            HttpUriRequestBase proxyRequest = new HttpUriRequestBase(request.getMethod(), URI.create(targetUrl));

            copyRequestHeaders(request, proxyRequest);
            setIdentityHeaders(request, proxyRequest, decision);

            if (hasRequestBody(request)) {
                ContentType contentType = request.getContentType() != null
                        ? ContentType.parseLenient(request.getContentType())
                        : null;
                proxyRequest.setEntity(new InputStreamEntity(request.getInputStream(), request.getContentLengthLong(), contentType));
            }

            try (CloseableHttpResponse proxyResponse = httpClient.execute(proxyRequest)) {
                response.setStatus(proxyResponse.getCode());
                copyResponseHeaders(proxyResponse, response);

                HttpEntity entity = proxyResponse.getEntity();
                if (entity != null) {
                    try (InputStream body = entity.getContent()) {
                        OutputStream out = response.getOutputStream();
                        body.transferTo(out);
                        out.flush();
                    }
                }
                logger.debug("Proxy request completed with status {}", proxyResponse.getCode());
            }
        } catch (ConnectException | ConnectTimeoutException | UnknownHostException | NoRouteToHostException e) {
            failed(response, RoutingErrorKind.BACKEND_UNAVAILABLE, "Connection error to " + decision.getTargetUrl(), e);
        } catch (SocketTimeoutException e) {
            failed(response, RoutingErrorKind.BACKEND_TIMEOUT, "Timeout waiting for " + decision.getTargetUrl(), e);
        } catch (IOException | RuntimeException e) {
            failed(response, RoutingErrorKind.PROXY_INTERNAL_ERROR, "Unexpected error proxying to " + decision.getTargetUrl(), e);
        }
    }

    /**
     * Probes a dashboard's health path. Used by the readiness endpoint only.
     */
    public boolean isHealthy(Department department) {
        if (!department.hasBackend()) {
            return false;
        }
        HttpGet probe = new HttpGet(trimTrailingSlash(department.getBackendUrl()) + department.getHealthPath());
        Timeout timeout = Timeout.ofMilliseconds(readinessTimeout.toMillis());
        probe.setConfig(RequestConfig.custom()
                .setConnectionRequestTimeout(timeout)
                .setResponseTimeout(timeout)
                .build());

        try (CloseableHttpResponse probeResponse = httpClient.execute(probe)) {
            EntityUtils.consume(probeResponse.getEntity());
            return probeResponse.getCode() == 200;
        } catch (IOException | RuntimeException e) {
            logger.debug("Readiness probe to {} failed: {}", department.getName(), e.getMessage());
            return false;
        }
    }

    private void failed(HttpServletResponse response, RoutingErrorKind kind, String message, Exception cause) {
        if (response.isCommitted()) {
            // status and headers already went out, the client sees a truncated body
            logger.error("{} after response was committed: {}", message, cause.getMessage());
            return;
        }
        logger.error("{}: {}", message, cause.getMessage());
        // drop backend status and headers already copied, the error page replaces them
        response.reset();
        throw new RoutingException(kind, message, cause);
    }

    static String buildTargetUrl(String backendUrl, HttpServletRequest request) {
        String path = request.getRequestURI().substring(request.getContextPath().length());
        if (path.isEmpty()) {
            path = "/";
        }
        String targetUrl = trimTrailingSlash(backendUrl) + path;
        if (request.getQueryString() != null) {
            targetUrl += "?" + request.getQueryString();
        }
        return targetUrl;
    }

    private boolean hasRequestBody(HttpServletRequest request) {
        return request.getContentLengthLong() > 0 || request.getHeader("Transfer-Encoding") != null;
    }

    /**
     * Copies client headers the backend may see. Identity headers are dropped here and set
     * again by {@link #setIdentityHeaders}, so the backend never sees a client-supplied value.
     */
    private void copyRequestHeaders(HttpServletRequest request, HttpUriRequestBase proxyRequest) {
        Enumeration<String> headerNames = request.getHeaderNames();
        while (headerNames.hasMoreElements()) {
            String headerName = headerNames.nextElement();
            String lowerName = headerName.toLowerCase(Locale.ROOT);
            if (HOP_BY_HOP_HEADERS.contains(lowerName)
                    || REQUEST_EXCLUDED_HEADERS.contains(lowerName)
                    || lowerName.startsWith(TRUSTED_HEADER_PREFIX)) {
                continue;
            }

            Enumeration<String> values = request.getHeaders(headerName);
            while (values.hasMoreElements()) {
                proxyRequest.addHeader(headerName, values.nextElement());
            }
        }

        String cookies = stripPortalCookies(request.getHeader("Cookie"), sessionCookies.portalCookieNames());
        if (cookies != null) {
            proxyRequest.setHeader("Cookie", cookies);
        }
    }

    private void setIdentityHeaders(HttpServletRequest request, HttpUriRequestBase proxyRequest, RoutingDecision decision) {
        proxyRequest.setHeader(USER_EMAIL_HEADER, decision.getSubject().getEmail());
        proxyRequest.setHeader(USER_NAME_HEADER, decision.getSubject().getUsername());
        proxyRequest.setHeader(USER_ROLES_HEADER, String.join(",", decision.getRoles()));
        proxyRequest.setHeader(PRIMARY_ROLE_HEADER, decision.getPrimaryRole());

        String forwardedFor = request.getHeader("X-Forwarded-For");
        proxyRequest.setHeader("X-Forwarded-For", forwardedFor != null ? forwardedFor : request.getRemoteAddr());
        String forwardedProto = request.getHeader("X-Forwarded-Proto");
        proxyRequest.setHeader("X-Forwarded-Proto", forwardedProto != null ? forwardedProto : request.getScheme());
    }

    private void copyResponseHeaders(CloseableHttpResponse proxyResponse, HttpServletResponse response) {
        for (Header header : proxyResponse.getHeaders()) {
            String lowerName = header.getName().toLowerCase(Locale.ROOT);
            if (HOP_BY_HOP_HEADERS.contains(lowerName) || RESPONSE_EXCLUDED_HEADERS.contains(lowerName)) {
                continue;
            }
            response.addHeader(header.getName(), header.getValue());
        }
    }

    /**
     * @return the cookie header without the named cookies, or {@code null} if nothing is left
     */
    static String stripPortalCookies(String cookieHeader, Set<String> portalCookies) {
        if (cookieHeader == null || cookieHeader.isBlank()) {
            return null;
        }
        StringJoiner kept = new StringJoiner("; ");
        for (String pair : cookieHeader.split(";")) {
            String trimmed = pair.trim();
            if (trimmed.isEmpty()) {
                continue;
            }
            int equals = trimmed.indexOf('=');
            String name = equals >= 0 ? trimmed.substring(0, equals).trim() : trimmed;
            if (!portalCookies.contains(name)) {
                kept.add(trimmed);
            }
        }
        return kept.length() > 0 ? kept.toString() : null;
    }

    private static String trimTrailingSlash(String url) {
        return url.endsWith("/") ? url.substring(0, url.length() - 1) : url;
    }
}
