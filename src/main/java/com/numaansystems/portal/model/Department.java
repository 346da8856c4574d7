package com.numaansystems.portal.model;

import java.util.Objects;

/**
 * One row of the department table: the group required to log in, the role the router
 * knows it by, and the dashboard it leads to.
 */
public final class Department {

    private final String name;
    private final String requiredGroup;
    private final String role;
    private final String dashboardPath;
    private final String backendUrl;
    private final String healthPath;

    public Department(String name, String requiredGroup, String role,
                      String dashboardPath, String backendUrl, String healthPath) {
        this.name = Objects.requireNonNull(name, "name");
        this.requiredGroup = Objects.requireNonNull(requiredGroup, "requiredGroup");
        this.role = role != null ? role : requiredGroup;
        this.dashboardPath = dashboardPath != null ? dashboardPath : "/";
        this.backendUrl = backendUrl;
        this.healthPath = healthPath != null ? healthPath : "/";
    }

    public String getName() {
        return name;
    }

    public String getRequiredGroup() {
        return requiredGroup;
    }

    public String getRole() {
        return role;
    }

    public String getDashboardPath() {
        return dashboardPath;
    }

    /**
     * @return the backend base URL, or {@code null} when none is configured
     */
    public String getBackendUrl() {
        return backendUrl;
    }

    public String getHealthPath() {
        return healthPath;
    }

    public boolean hasBackend() {
        return backendUrl != null && !backendUrl.isBlank();
    }

    @Override
    public String toString() {
        return "Department{name='" + name + "', group='" + requiredGroup + "', role='" + role + "'}";
    }
}
