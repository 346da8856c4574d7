package com.numaansystems.portal.config;

import jakarta.servlet.http.Cookie;
import jakarta.servlet.http.HttpServletRequest;
import jakarta.servlet.http.HttpServletResponse;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.http.HttpHeaders;
import org.springframework.http.ResponseCookie;
import org.springframework.stereotype.Component;
import org.springframework.web.util.WebUtils;

import java.time.Duration;
import java.util.Set;

/**
 * Reads and writes the portal's own cookies: the session id and the provider identity token.
 *
 * <p>All cookies are HttpOnly, SameSite=Lax and scoped to {@code /}. The Secure flag is on
 * unless {@code portal.session.secure-cookie=false} (plain-HTTP development setups).</p>
 *
 * @author Numaan Systems
 * @version 0.1.0
 */
@Component
public class SessionCookies {

    private final String sessionCookieName;
    private final String identityTokenCookieName;
    private final boolean secure;

    public SessionCookies(@Value("${portal.session.cookie-name:PORTAL_SESSION}") String sessionCookieName,
                          @Value("${portal.identity-token.cookie-name:PORTAL_ID_TOKEN}") String identityTokenCookieName,
                          @Value("${portal.session.secure-cookie:true}") boolean secure) {
        this.sessionCookieName = sessionCookieName;
        this.identityTokenCookieName = identityTokenCookieName;
        this.secure = secure;
    }

    public String readSessionId(HttpServletRequest request) {
        return read(request, sessionCookieName);
    }

    public String readIdentityToken(HttpServletRequest request) {
        return read(request, identityTokenCookieName);
    }

    public void writeSessionId(HttpServletResponse response, String sessionId, Duration maxAge) {
        write(response, sessionCookieName, sessionId, maxAge);
    }

    public void clearSessionId(HttpServletResponse response) {
        write(response, sessionCookieName, "", Duration.ZERO);
    }

    public void writeIdentityToken(HttpServletResponse response, String token, Duration maxAge) {
        write(response, identityTokenCookieName, token, maxAge);
    }

    public void clearIdentityToken(HttpServletResponse response) {
        write(response, identityTokenCookieName, "", Duration.ZERO);
    }

    /** Names of cookies that must never reach a dashboard backend. */
    public Set<String> portalCookieNames() {
        return Set.of(sessionCookieName, identityTokenCookieName);
    }

    public String getSessionCookieName() {
        return sessionCookieName;
    }

    private static String read(HttpServletRequest request, String name) {
        Cookie cookie = WebUtils.getCookie(request, name);
        if (cookie == null || cookie.getValue() == null || cookie.getValue().isEmpty()) {
            return null;
        }
        return cookie.getValue();
    }

    private void write(HttpServletResponse response, String name, String value, Duration maxAge) {
        ResponseCookie cookie = ResponseCookie.from(name, value)
                .httpOnly(true)
                .secure(secure)
                .sameSite("Lax")
                .path("/")
                .maxAge(maxAge)
                .build();
        response.addHeader(HttpHeaders.SET_COOKIE, cookie.toString());
    }
}
