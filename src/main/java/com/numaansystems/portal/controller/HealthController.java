package com.numaansystems.portal.controller;

import com.numaansystems.portal.model.Department;
import com.numaansystems.portal.routing.DashboardProxyService;
import com.numaansystems.portal.service.DepartmentDirectory;
import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.tags.Tag;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RestController;

import java.util.Map;

/**
 * Liveness and readiness for the router. Neither endpoint looks at the caller's identity.
 */
@RestController
@Tag(name = "Health")
public class HealthController {

    private static final Logger logger = LoggerFactory.getLogger(HealthController.class);

    private static final Map<String, String> HEALTHY = Map.of("status", "healthy", "service", "portal-router");

    private final DepartmentDirectory departments;
    private final DashboardProxyService proxyService;

    public HealthController(DepartmentDirectory departments, DashboardProxyService proxyService) {
        this.departments = departments;
        this.proxyService = proxyService;
    }

    @GetMapping({"/health", "/healthz"})
    @Operation(summary = "Liveness")
    public Map<String, String> health() {
        return HEALTHY;
    }

    /**
     * Ready when at least one dashboard answers its health path.
     */
    @GetMapping("/ready")
    @Operation(summary = "Readiness", description = "200 when at least one dashboard backend is healthy, 503 otherwise")
    public ResponseEntity<Map<String, String>> ready() {
        boolean anyHealthy = departments.all().stream()
                .filter(Department::hasBackend)
                .anyMatch(proxyService::isHealthy);

        if (!anyHealthy) {
            logger.warn("Readiness check failed: no dashboard backend is healthy");
            return ResponseEntity.status(HttpStatus.SERVICE_UNAVAILABLE).body(Map.of("status", "not ready"));
        }
        return ResponseEntity.ok(Map.of("status", "ready"));
    }
}
