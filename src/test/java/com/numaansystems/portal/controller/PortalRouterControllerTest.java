package com.numaansystems.portal.controller;

import com.numaansystems.portal.model.RoutingDecision;
import com.numaansystems.portal.model.SubjectClaims;
import com.numaansystems.portal.routing.AuthEvidence;
import com.numaansystems.portal.routing.AuthEvidenceResolver;
import com.numaansystems.portal.routing.DashboardProxyService;
import com.numaansystems.portal.routing.RoleRoutingService;
import com.numaansystems.portal.routing.RoutingErrorKind;
import com.numaansystems.portal.routing.RoutingException;
import com.numaansystems.portal.service.TwoFactorAuthenticationService;
import jakarta.servlet.http.HttpServletResponse;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.web.servlet.WebMvcTest;
import org.springframework.boot.test.mock.mockito.MockBean;
import org.springframework.context.annotation.Import;
import org.springframework.test.web.servlet.MockMvc;

import java.util.Set;

import static org.hamcrest.Matchers.containsString;
import static org.hamcrest.Matchers.not;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.doAnswer;
import static org.mockito.Mockito.doThrow;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.*;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.*;

/**
 * Unit tests for PortalRouterController and the error pages it produces.
 */
@WebMvcTest(PortalRouterController.class)
@Import(TestSecurityConfig.class)
class PortalRouterControllerTest {

    @Autowired
    private MockMvc mockMvc;

    @MockBean
    private AuthEvidenceResolver evidenceResolver;

    @MockBean
    private RoleRoutingService routingService;

    @MockBean
    private DashboardProxyService proxyService;

    @MockBean
    private TwoFactorAuthenticationService authenticationService;

    @Test
    @DisplayName("Should hand the routing decision to the proxy")
    void testRouteForwarded() throws Exception {
        // Arrange
        AuthEvidence evidence = mock(AuthEvidence.class);
        RoutingDecision decision = new RoutingDecision(
                new SubjectClaims("alice@example.com", "alice", Set.of("hr")), "hr", "http://hr-dashboard:8501");
        when(evidenceResolver.resolve(any())).thenReturn(evidence);
        when(routingService.authorizeAndSelectTarget(evidence)).thenReturn(decision);
        doAnswer(invocation -> {
            HttpServletResponse response = invocation.getArgument(1);
            response.setStatus(200);
            response.getWriter().write("hr dashboard");
            return null;
        }).when(proxyService).forward(any(), any(), eq(decision));

        // Act & Assert
        mockMvc.perform(get("/hr/dashboard").param("tab", "payroll"))
                .andExpect(status().isOk())
                .andExpect(content().string("hr dashboard"));
        verify(proxyService).forward(any(), any(), eq(decision));
    }

    @Test
    @DisplayName("Should render the access denied page for an unknown role")
    void testUnrecognizedRole() throws Exception {
        // Arrange
        when(evidenceResolver.resolve(any())).thenReturn(mock(AuthEvidence.class));
        when(routingService.authorizeAndSelectTarget(any()))
                .thenThrow(new RoutingException(RoutingErrorKind.UNRECOGNIZED_ROLE, "No dashboard for roles [contractor]"));

        // Act & Assert
        mockMvc.perform(get("/anything"))
                .andExpect(status().isForbidden())
                .andExpect(content().string(containsString("<h1>Access Denied</h1>")))
                .andExpect(content().string(containsString("Invalid role assignment")))
                .andExpect(content().string(not(containsString("contractor"))));
        verify(proxyService, never()).forward(any(), any(), any());
    }

    @Test
    @DisplayName("Should render a login link when no identity is present")
    void testMissingEvidence() throws Exception {
        // Arrange
        when(evidenceResolver.resolve(any())).thenReturn(mock(AuthEvidence.class));
        when(routingService.authorizeAndSelectTarget(any()))
                .thenThrow(new RoutingException(RoutingErrorKind.INVALID_AUTH_EVIDENCE, "No authentication evidence"));

        // Act & Assert
        mockMvc.perform(get("/"))
                .andExpect(status().isUnauthorized())
                .andExpect(content().string(containsString("href=\"/employee/login\"")));
    }

    @Test
    @DisplayName("Should answer 503 when the dashboard is down")
    void testBackendUnavailable() throws Exception {
        // Arrange
        RoutingDecision decision = new RoutingDecision(
                new SubjectClaims("alice@example.com", "alice", Set.of("hr")), "hr", "http://hr-dashboard:8501");
        when(evidenceResolver.resolve(any())).thenReturn(mock(AuthEvidence.class));
        when(routingService.authorizeAndSelectTarget(any())).thenReturn(decision);
        doThrow(new RoutingException(RoutingErrorKind.BACKEND_UNAVAILABLE, "Connection error"))
                .when(proxyService).forward(any(), any(), eq(decision));

        // Act & Assert
        mockMvc.perform(post("/hr/dashboard/_stcore/stream"))
                .andExpect(status().isServiceUnavailable())
                .andExpect(content().string(containsString("Service Unavailable")));
    }
}
