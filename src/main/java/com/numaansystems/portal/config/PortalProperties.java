package com.numaansystems.portal.config;

import org.springframework.boot.context.properties.ConfigurationProperties;

import java.time.Duration;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Tabular portal configuration bound from the {@code portal.*} prefix.
 *
 * <p>Scalar settings (timeouts, URLs, flags) are injected with {@code @Value} where they are
 * used; this class only carries the settings that are lists or maps and therefore cannot be
 * expressed as a single placeholder.</p>
 *
 * <h2>Example</h2>
 * <pre>
 * portal:
 *   role-precedence: [admin, hr, it_support, sales]
 *   departments:
 *     - name: HR
 *       group: hr
 *       role: hr
 *       dashboard-path: /hr/dashboard
 *       backend-url: http://hr-dashboard:8501
 *       health-path: /_stcore/health
 *   totp:
 *     secrets:
 *       sarah: JBSWY3DPEHPK3PXP
 * </pre>
 *
 * @author Numaan Systems
 * @version 0.1.0
 */
@ConfigurationProperties(prefix = "portal")
public class PortalProperties {

    private List<DepartmentProperties> departments = new ArrayList<>();

    private List<String> rolePrecedence = new ArrayList<>();

    private Totp totp = new Totp();

    public List<DepartmentProperties> getDepartments() {
        return departments;
    }

    public void setDepartments(List<DepartmentProperties> departments) {
        this.departments = departments;
    }

    public List<String> getRolePrecedence() {
        return rolePrecedence;
    }

    public void setRolePrecedence(List<String> rolePrecedence) {
        this.rolePrecedence = rolePrecedence;
    }

    public Totp getTotp() {
        return totp;
    }

    public void setTotp(Totp totp) {
        this.totp = totp;
    }

    /**
     * One row of the department table.
     */
    public static class DepartmentProperties {

        /** Display name submitted by the login form, e.g. "IT Support" */
        private String name;

        /** Directory group required to log in to this department */
        private String group;

        /** Role name used by the router; defaults to the group name */
        private String role;

        /** Path the user lands on after login */
        private String dashboardPath;

        /** Base URL of the dashboard backend */
        private String backendUrl;

        /** Path probed by the readiness check */
        private String healthPath = "/";

        public String getName() {
            return name;
        }

        public void setName(String name) {
            this.name = name;
        }

        public String getGroup() {
            return group;
        }

        public void setGroup(String group) {
            this.group = group;
        }

        public String getRole() {
            return role;
        }

        public void setRole(String role) {
            this.role = role;
        }

        public String getDashboardPath() {
            return dashboardPath;
        }

        public void setDashboardPath(String dashboardPath) {
            this.dashboardPath = dashboardPath;
        }

        public String getBackendUrl() {
            return backendUrl;
        }

        public void setBackendUrl(String backendUrl) {
            this.backendUrl = backendUrl;
        }

        public String getHealthPath() {
            return healthPath;
        }

        public void setHealthPath(String healthPath) {
            this.healthPath = healthPath;
        }
    }

    public static class Totp {

        private String issuer = "Employee Portal";

        /** Accepted time steps on either side of the current one */
        private int window = 1;

        private Duration step = Duration.ofSeconds(30);

        /** Show the provisioning URI after the password step alone */
        private boolean enrollmentOnPending = false;

        /** Base32 shared secrets keyed by username */
        private Map<String, String> secrets = new LinkedHashMap<>();

        public String getIssuer() {
            return issuer;
        }

        public void setIssuer(String issuer) {
            this.issuer = issuer;
        }

        public int getWindow() {
            return window;
        }

        public void setWindow(int window) {
            this.window = window;
        }

        public Duration getStep() {
            return step;
        }

        public boolean isEnrollmentOnPending() {
            return enrollmentOnPending;
        }

        public void setEnrollmentOnPending(boolean enrollmentOnPending) {
            this.enrollmentOnPending = enrollmentOnPending;
        }

        public void setStep(Duration step) {
            this.step = step;
        }

        public Map<String, String> getSecrets() {
            return secrets;
        }

        public void setSecrets(Map<String, String> secrets) {
            this.secrets = secrets;
        }
    }
}
