package com.numaansystems.portal.controller;

import com.numaansystems.portal.model.RoutingDecision;
import com.numaansystems.portal.routing.AuthEvidenceResolver;
import com.numaansystems.portal.routing.DashboardProxyService;
import com.numaansystems.portal.routing.RoleRoutingService;
import io.swagger.v3.oas.annotations.Hidden;
import jakarta.servlet.http.HttpServletRequest;
import jakarta.servlet.http.HttpServletResponse;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

/**
 * Catch-all route: every path not claimed by another controller is sent to the dashboard of
 * the caller's primary role.
 *
 * <p>Failures surface as {@link com.numaansystems.portal.routing.RoutingException} and are
 * rendered by {@link com.numaansystems.portal.config.GatewayExceptionHandler}.</p>
 *
 * @author Numaan Systems
 * @version 0.1.0
 */
@Hidden
@RestController
public class PortalRouterController {

    private final AuthEvidenceResolver evidenceResolver;
    private final RoleRoutingService routingService;
    private final DashboardProxyService proxyService;

    public PortalRouterController(AuthEvidenceResolver evidenceResolver,
                                  RoleRoutingService routingService,
                                  DashboardProxyService proxyService) {
        this.evidenceResolver = evidenceResolver;
        this.routingService = routingService;
        this.proxyService = proxyService;
    }

    @RequestMapping("/**")
    public void route(HttpServletRequest request, HttpServletResponse response) {
        RoutingDecision decision = routingService.authorizeAndSelectTarget(evidenceResolver.resolve(request));
        proxyService.forward(request, response, decision);
    }
}
