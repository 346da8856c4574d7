package com.numaansystems.portal.controller;

import com.numaansystems.portal.PortalFixtures;
import com.numaansystems.portal.model.AuthenticatedSession;
import com.numaansystems.portal.model.Identity;
import com.numaansystems.portal.model.PendingAuthentication;
import com.numaansystems.portal.service.AuthErrorKind;
import com.numaansystems.portal.service.PortalAuthenticationException;
import com.numaansystems.portal.service.TwoFactorAuthenticationService;
import com.numaansystems.portal.service.TwoFactorAuthenticationService.IssuedSession;
import com.numaansystems.portal.service.TwoFactorAuthenticationService.TotpEnrollment;
import jakarta.servlet.http.Cookie;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.web.servlet.WebMvcTest;
import org.springframework.boot.test.mock.mockito.MockBean;
import org.springframework.context.annotation.Import;
import org.springframework.http.HttpHeaders;
import org.springframework.test.web.servlet.MockMvc;

import java.time.Duration;
import java.util.Optional;
import java.util.Set;

import static org.hamcrest.Matchers.containsString;
import static org.hamcrest.Matchers.hasItems;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.*;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.*;

/**
 * Unit tests for EmployeeLoginController.
 *
 * <p>Covers both login steps, the redirects between them and logout.</p>
 */
@WebMvcTest(EmployeeLoginController.class)
@Import(TestSecurityConfig.class)
class EmployeeLoginControllerTest {

    private static final Identity ALICE = new Identity("alice", "Alice Example", "alice@example.com", Set.of("hr", "employees"));

    @Autowired
    private MockMvc mockMvc;

    @MockBean
    private TwoFactorAuthenticationService authenticationService;

    @BeforeEach
    void setUp() {
        when(authenticationService.getPendingTtl()).thenReturn(Duration.ofMinutes(5));
        when(authenticationService.getSessionLifetime()).thenReturn(Duration.ofHours(8));
    }

    private static PendingAuthentication alicePending() {
        return new PendingAuthentication(ALICE, "HR", PortalFixtures.NOW, PortalFixtures.NOW.plus(Duration.ofMinutes(5)));
    }

    @Test
    @DisplayName("Should return the login model with the department list")
    void testLoginForm() throws Exception {
        mockMvc.perform(get("/employee/login"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.success").value(false))
                .andExpect(jsonPath("$.departments[0]").value("HR"))
                .andExpect(jsonPath("$.departments[3]").value("Admin"));
    }

    @Test
    @DisplayName("Should send a logged-in user straight to the dashboard")
    void testLoginFormWithSession() throws Exception {
        // Arrange
        AuthenticatedSession session = new AuthenticatedSession(ALICE, "HR", PortalFixtures.NOW, PortalFixtures.NOW.plus(Duration.ofHours(8)));
        when(authenticationService.findSession("sid-1")).thenReturn(Optional.of(session));

        // Act & Assert
        mockMvc.perform(get("/employee/login").cookie(new Cookie("PORTAL_SESSION", "sid-1")))
                .andExpect(status().isFound())
                .andExpect(redirectedUrl("/hr/dashboard"));
        verify(authenticationService, never()).discard(anyString());
    }

    @Test
    @DisplayName("Should reject a form with missing fields")
    void testLoginMissingFields() throws Exception {
        mockMvc.perform(post("/employee/login")
                        .param("username", "alice")
                        .param("department", "HR"))
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.error").value("Please fill in all required fields"))
                .andExpect(jsonPath("$.username").value("alice"));
        verify(authenticationService, never()).authenticatePrimary(any(), any(), any());
    }

    @Test
    @DisplayName("Should answer 403 when the user is not in the department's group")
    void testLoginUnauthorized() throws Exception {
        // Arrange
        when(authenticationService.authenticatePrimary("bob", "pw", "Admin"))
                .thenThrow(new PortalAuthenticationException(AuthErrorKind.UNAUTHORIZED,
                        "You are not authorized to access the Admin department"));

        // Act & Assert
        mockMvc.perform(post("/employee/login")
                        .param("username", "bob")
                        .param("password", "pw")
                        .param("department", "Admin"))
                .andExpect(status().isForbidden())
                .andExpect(jsonPath("$.error").value("You are not authorized to access the Admin department"))
                .andExpect(jsonPath("$.department").value("Admin"));
    }

    @Test
    @DisplayName("Should answer 401 for a wrong password")
    void testLoginInvalidCredentials() throws Exception {
        // Arrange
        when(authenticationService.authenticatePrimary("alice", "wrong", "HR"))
                .thenThrow(new PortalAuthenticationException(AuthErrorKind.INVALID_CREDENTIALS, "Invalid username or password"));

        // Act & Assert
        mockMvc.perform(post("/employee/login")
                        .param("username", "alice")
                        .param("password", "wrong")
                        .param("department", "HR"))
                .andExpect(status().isUnauthorized())
                .andExpect(jsonPath("$.error").value("Invalid username or password"));
    }

    @Test
    @DisplayName("Should hold the pending login and redirect to the TOTP step")
    void testLoginSuccess() throws Exception {
        // Arrange
        PendingAuthentication pending = alicePending();
        when(authenticationService.authenticatePrimary("alice", "pw", "HR")).thenReturn(pending);
        when(authenticationService.holdPending(null, pending)).thenReturn("pending-sid");

        // Act & Assert
        mockMvc.perform(post("/employee/login")
                        .param("username", "alice")
                        .param("password", "pw")
                        .param("department", "HR"))
                .andExpect(status().isFound())
                .andExpect(redirectedUrl("/employee/totp"))
                .andExpect(header().string(HttpHeaders.SET_COOKIE, containsString("PORTAL_SESSION=pending-sid")))
                .andExpect(header().string(HttpHeaders.SET_COOKIE, containsString("Max-Age=300")))
                .andExpect(header().string(HttpHeaders.SET_COOKIE, containsString("HttpOnly")));
    }

    @Test
    @DisplayName("Should send users without a pending login back to the first step")
    void testTotpFormWithoutPending() throws Exception {
        mockMvc.perform(get("/employee/totp"))
                .andExpect(status().isFound())
                .andExpect(redirectedUrl("/employee/login"));
    }

    @Test
    @DisplayName("Should show the TOTP model for a pending login")
    void testTotpForm() throws Exception {
        // Arrange
        when(authenticationService.findPending("pending-sid")).thenReturn(Optional.of(alicePending()));

        // Act & Assert
        mockMvc.perform(get("/employee/totp").cookie(new Cookie("PORTAL_SESSION", "pending-sid")))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.username").value("alice"))
                .andExpect(jsonPath("$.department").value("HR"));
    }

    @Test
    @DisplayName("Should issue the session and redirect to the department dashboard")
    void testTotpSuccess() throws Exception {
        // Arrange
        AuthenticatedSession session = new AuthenticatedSession(ALICE, "HR", PortalFixtures.NOW, PortalFixtures.NOW.plus(Duration.ofHours(8)));
        when(authenticationService.findPending("pending-sid")).thenReturn(Optional.of(alicePending()));
        when(authenticationService.authenticateSecondFactor("pending-sid", "123456"))
                .thenReturn(new IssuedSession("session-sid", session));

        // Act & Assert
        mockMvc.perform(post("/employee/totp")
                        .cookie(new Cookie("PORTAL_SESSION", "pending-sid"))
                        .param("code", "123456"))
                .andExpect(status().isFound())
                .andExpect(redirectedUrl("/hr/dashboard"))
                .andExpect(header().string(HttpHeaders.SET_COOKIE, containsString("PORTAL_SESSION=session-sid")))
                .andExpect(header().string(HttpHeaders.SET_COOKIE, containsString("Max-Age=28800")));
    }

    @Test
    @DisplayName("Should keep the user on the TOTP step after a wrong code")
    void testTotpInvalidCode() throws Exception {
        // Arrange
        when(authenticationService.findPending("pending-sid")).thenReturn(Optional.of(alicePending()));
        when(authenticationService.authenticateSecondFactor("pending-sid", "000000"))
                .thenThrow(new PortalAuthenticationException(AuthErrorKind.INVALID_CODE, "Invalid TOTP code. Please try again."));

        // Act & Assert
        mockMvc.perform(post("/employee/totp")
                        .cookie(new Cookie("PORTAL_SESSION", "pending-sid"))
                        .param("code", "000000"))
                .andExpect(status().isUnauthorized())
                .andExpect(jsonPath("$.error").value("Invalid TOTP code. Please try again."))
                .andExpect(jsonPath("$.username").value("alice"));
    }

    @Test
    @DisplayName("Should answer 400 for a malformed code")
    void testTotpInvalidFormat() throws Exception {
        // Arrange
        when(authenticationService.findPending("pending-sid")).thenReturn(Optional.of(alicePending()));
        when(authenticationService.authenticateSecondFactor("pending-sid", "12ab"))
                .thenThrow(new PortalAuthenticationException(AuthErrorKind.INVALID_CODE_FORMAT, "TOTP code must be 6 digits"));

        // Act & Assert
        mockMvc.perform(post("/employee/totp")
                        .cookie(new Cookie("PORTAL_SESSION", "pending-sid"))
                        .param("code", "12ab"))
                .andExpect(status().isBadRequest());
    }

    @Test
    @DisplayName("Should restart the login when the pending record expired")
    void testTotpExpired() throws Exception {
        // Arrange
        when(authenticationService.authenticateSecondFactor(eq("stale-sid"), anyString()))
                .thenThrow(new PortalAuthenticationException(AuthErrorKind.SESSION_EXPIRED, "Session expired. Please log in again."));

        // Act & Assert
        mockMvc.perform(post("/employee/totp")
                        .cookie(new Cookie("PORTAL_SESSION", "stale-sid"))
                        .param("code", "123456"))
                .andExpect(status().isFound())
                .andExpect(redirectedUrl("/employee/login"))
                .andExpect(header().doesNotExist(HttpHeaders.SET_COOKIE));
    }

    @Test
    @DisplayName("Should leave the cookie alone when a concurrent submit already used the pending record")
    void testTotpConcurrentSubmitLoses() throws Exception {
        // Arrange
        when(authenticationService.findPending("pending-sid")).thenReturn(Optional.of(alicePending()));
        when(authenticationService.authenticateSecondFactor("pending-sid", "123456"))
                .thenThrow(new PortalAuthenticationException(AuthErrorKind.SESSION_EXPIRED, "Session expired. Please log in again."));

        // Act & Assert
        mockMvc.perform(post("/employee/totp")
                        .cookie(new Cookie("PORTAL_SESSION", "pending-sid"))
                        .param("code", "123456"))
                .andExpect(status().isFound())
                .andExpect(redirectedUrl("/employee/login"))
                .andExpect(header().doesNotExist(HttpHeaders.SET_COOKIE));
    }

    @Test
    @DisplayName("Should return the caller's provisioning URI without caching")
    void testEnrollTotp() throws Exception {
        // Arrange
        String uri = "otpauth://totp/Employee%20Portal%3Aalice?secret=" + PortalFixtures.ALICE_SECRET;
        when(authenticationService.enrollment("session-sid")).thenReturn(new TotpEnrollment("alice", true, uri));

        // Act & Assert
        mockMvc.perform(get("/employee/enroll-totp").cookie(new Cookie("PORTAL_SESSION", "session-sid")))
                .andExpect(status().isOk())
                .andExpect(header().string(HttpHeaders.CACHE_CONTROL, containsString("no-store")))
                .andExpect(jsonPath("$.username").value("alice"))
                .andExpect(jsonPath("$.enrolled").value(true))
                .andExpect(jsonPath("$.provisioningUri").value(uri));
    }

    @Test
    @DisplayName("Should report only the enrolled flag when the URI may not be shown")
    void testEnrollTotpHidden() throws Exception {
        // Arrange
        when(authenticationService.enrollment("pending-sid")).thenReturn(new TotpEnrollment("alice", true, null));

        // Act & Assert
        mockMvc.perform(get("/employee/enroll-totp").cookie(new Cookie("PORTAL_SESSION", "pending-sid")))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.enrolled").value(true))
                .andExpect(jsonPath("$.provisioningUri").doesNotExist());
    }

    @Test
    @DisplayName("Should send callers without a session to the login step")
    void testEnrollTotpWithoutSession() throws Exception {
        // Arrange
        when(authenticationService.enrollment(any()))
                .thenThrow(new PortalAuthenticationException(AuthErrorKind.SESSION_EXPIRED, "Session expired. Please log in again."));

        // Act & Assert
        mockMvc.perform(get("/employee/enroll-totp"))
                .andExpect(status().isFound())
                .andExpect(redirectedUrl("/employee/login"));
    }

    @Test
    @DisplayName("Should answer 500 when no secret store is configured")
    void testEnrollTotpConfigurationError() throws Exception {
        // Arrange
        when(authenticationService.enrollment("session-sid"))
                .thenThrow(new PortalAuthenticationException(AuthErrorKind.CONFIGURATION_ERROR, "TOTP system not configured. Please contact administrator."));

        // Act & Assert
        mockMvc.perform(get("/employee/enroll-totp").cookie(new Cookie("PORTAL_SESSION", "session-sid")))
                .andExpect(status().isInternalServerError())
                .andExpect(jsonPath("$.error").value("TOTP system not configured. Please contact administrator."));
    }

    @Test
    @DisplayName("Should end the session and clear the portal cookies on logout")
    void testLogout() throws Exception {
        // Arrange
        when(authenticationService.logout("session-sid")).thenReturn(Optional.of("alice"));

        // Act & Assert
        mockMvc.perform(post("/logout").cookie(new Cookie("PORTAL_SESSION", "session-sid")))
                .andExpect(status().isFound())
                .andExpect(redirectedUrl("/"))
                .andExpect(header().stringValues(HttpHeaders.SET_COOKIE,
                        hasItems(containsString("PORTAL_SESSION=;"), containsString("PORTAL_ID_TOKEN=;"))));
        verify(authenticationService).logout("session-sid");
    }

    @Test
    @DisplayName("Logout without a session still redirects")
    void testLogoutWithoutSession() throws Exception {
        mockMvc.perform(get("/logout"))
                .andExpect(status().isFound())
                .andExpect(redirectedUrl("/"));
    }
}
