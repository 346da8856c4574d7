package com.numaansystems.portal.controller;

import com.numaansystems.portal.config.ProxyClientConfig;
import com.numaansystems.portal.model.RoutingDecision;
import com.numaansystems.portal.model.SubjectClaims;
import com.numaansystems.portal.routing.AuthEvidenceResolver;
import com.numaansystems.portal.routing.DashboardProxyService;
import com.numaansystems.portal.routing.RoleRoutingService;
import com.numaansystems.portal.service.TwoFactorAuthenticationService;
import okhttp3.mockwebserver.MockResponse;
import okhttp3.mockwebserver.MockWebServer;
import okhttp3.mockwebserver.RecordedRequest;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.web.servlet.WebMvcTest;
import org.springframework.boot.test.mock.mockito.MockBean;
import org.springframework.context.annotation.Import;
import org.springframework.http.MediaType;
import org.springframework.test.web.servlet.MockMvc;

import java.io.IOException;
import java.util.Set;
import java.util.concurrent.TimeUnit;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.when;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.patch;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.post;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.put;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.content;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.status;

/**
 * Forwarding through the full servlet filter chain with the real proxy and an HTTP backend.
 */
@WebMvcTest(controllers = PortalRouterController.class, properties = "portal.proxy.response-timeout=PT2S")
@Import({TestSecurityConfig.class, DashboardProxyService.class, ProxyClientConfig.class})
class PortalRouterForwardingTest {

    private static final String FORM_BODY = "a=1&b=2";

    @Autowired
    private MockMvc mockMvc;

    @MockBean
    private AuthEvidenceResolver evidenceResolver;

    @MockBean
    private RoleRoutingService routingService;

    @MockBean
    private TwoFactorAuthenticationService authenticationService;

    private MockWebServer backend;

    @BeforeEach
    void setUp() throws IOException {
        backend = new MockWebServer();
        backend.start();
        String backendUrl = backend.url("/").toString().replaceAll("/$", "");
        when(routingService.authorizeAndSelectTarget(any())).thenReturn(new RoutingDecision(
                new SubjectClaims("alice@example.com", "alice", Set.of("hr")), "hr", backendUrl));
    }

    @AfterEach
    void tearDown() throws IOException {
        backend.shutdown();
    }

    @Test
    @DisplayName("Should forward a form-encoded PUT body unread")
    void testFormPutForwarded() throws Exception {
        // Arrange
        backend.enqueue(new MockResponse().setResponseCode(200).setBody("saved"));

        // Act
        mockMvc.perform(put("/hr/form")
                        .contentType(MediaType.APPLICATION_FORM_URLENCODED)
                        .content(FORM_BODY))
                .andExpect(status().isOk())
                .andExpect(content().string("saved"));

        // Assert
        RecordedRequest recorded = backend.takeRequest(1, TimeUnit.SECONDS);
        assertThat(recorded).isNotNull();
        assertThat(recorded.getMethod()).isEqualTo("PUT");
        assertThat(recorded.getPath()).isEqualTo("/hr/form");
        assertThat(recorded.getBody().readUtf8()).isEqualTo(FORM_BODY);
    }

    @Test
    @DisplayName("Should forward a form-encoded PATCH body unread")
    void testFormPatchForwarded() throws Exception {
        // Arrange
        backend.enqueue(new MockResponse().setResponseCode(204));

        // Act
        mockMvc.perform(patch("/hr/form")
                        .contentType(MediaType.APPLICATION_FORM_URLENCODED)
                        .content(FORM_BODY))
                .andExpect(status().isNoContent());

        // Assert
        RecordedRequest recorded = backend.takeRequest(1, TimeUnit.SECONDS);
        assertThat(recorded).isNotNull();
        assertThat(recorded.getMethod()).isEqualTo("PATCH");
        assertThat(recorded.getBody().readUtf8()).isEqualTo(FORM_BODY);
    }

    @Test
    @DisplayName("Should forward a form-encoded POST body unread")
    void testFormPostForwarded() throws Exception {
        // Arrange
        backend.enqueue(new MockResponse().setResponseCode(200).setBody("created"));

        // Act
        mockMvc.perform(post("/hr/form")
                        .contentType(MediaType.APPLICATION_FORM_URLENCODED)
                        .content(FORM_BODY))
                .andExpect(status().isOk());

        // Assert
        RecordedRequest recorded = backend.takeRequest(1, TimeUnit.SECONDS);
        assertThat(recorded).isNotNull();
        assertThat(recorded.getMethod()).isEqualTo("POST");
        assertThat(recorded.getBody().readUtf8()).isEqualTo(FORM_BODY);
    }
}
