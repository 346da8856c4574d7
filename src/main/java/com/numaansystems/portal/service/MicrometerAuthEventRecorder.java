package com.numaansystems.portal.service;

import com.numaansystems.portal.model.AuthenticatedSession;
import com.numaansystems.portal.model.PendingAuthentication;
import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.Gauge;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.time.Duration;
import java.util.Collection;
import java.util.TreeSet;

/**
 * {@link AuthEventRecorder} publishing Micrometer meters, scraped through
 * {@code /actuator/prometheus}.
 *
 * <h2>Meters</h2>
 * <ul>
 *   <li>{@code portal.login.attempts} - status, department, username</li>
 *   <li>{@code portal.ldap.auth} and timer {@code portal.ldap.response}</li>
 *   <li>{@code portal.totp.verification} and timer {@code portal.totp.validation}</li>
 *   <li>{@code portal.unauthorized.access} - username, requested_department, actual_groups</li>
 *   <li>{@code portal.invalid.credentials}, {@code portal.successful.auth}, {@code portal.logout}</li>
 *   <li>{@code portal.routing} - outcome, role</li>
 *   <li>gauges {@code portal.sessions.active} and {@code portal.totp.pending}</li>
 * </ul>
 *
 * <p>Usernames are used as labels, as the audit dashboards expect. This is only reasonable
 * for a bounded employee population.</p>
 *
 * @author Numaan Systems
 * @version 0.1.0
 */
@Service
public class MicrometerAuthEventRecorder implements AuthEventRecorder {

    private static final Logger audit = LoggerFactory.getLogger("AUDIT");

    private final MeterRegistry meterRegistry;

    public MicrometerAuthEventRecorder(MeterRegistry meterRegistry, SessionStore sessionStore) {
        this.meterRegistry = meterRegistry;

        Gauge.builder("portal.sessions.active", sessionStore, store -> store.count(AuthenticatedSession.class))
                .description("Number of active authenticated sessions")
                .register(meterRegistry);
        Gauge.builder("portal.totp.pending", sessionStore, store -> store.count(PendingAuthentication.class))
                .description("Number of users waiting for second-factor verification")
                .register(meterRegistry);
    }

    @Override
    public void loginAttempt(String username, String department, String status) {
        Counter.builder("portal.login.attempts")
                .description("Login form submissions")
                .tag("status", status)
                .tag("department", nullSafe(department))
                .tag("username", nullSafe(username))
                .register(meterRegistry)
                .increment();
    }

    @Override
    public void directoryAuth(String username, boolean success, Duration duration) {
        Counter.builder("portal.ldap.auth")
                .description("Directory bind attempts")
                .tag("status", success ? "success" : "failed")
                .tag("username", nullSafe(username))
                .register(meterRegistry)
                .increment();
        Timer.builder("portal.ldap.response")
                .description("Directory authentication response time")
                .register(meterRegistry)
                .record(duration);
    }

    @Override
    public void invalidCredentials(String username) {
        Counter.builder("portal.invalid.credentials")
                .tag("username", nullSafe(username))
                .register(meterRegistry)
                .increment();
        audit.warn("FAILED | {} | Invalid credentials", username);
    }

    @Override
    public void unauthorizedAccess(String username, String requestedDepartment, Collection<String> actualGroups) {
        String groups = String.join(",", new TreeSet<>(actualGroups));
        Counter.builder("portal.unauthorized.access")
                .description("Authenticated users requesting a department outside their groups")
                .tag("username", nullSafe(username))
                .tag("requested_department", nullSafe(requestedDepartment))
                .tag("actual_groups", groups)
                .register(meterRegistry)
                .increment();
        audit.warn("DENIED | {} | {} | Unauthorized access attempt | User groups: {}",
                username, requestedDepartment, groups);
    }

    @Override
    public void secondFactor(String username, String status, Duration duration) {
        Counter.builder("portal.totp.verification")
                .description("Second-factor verification attempts")
                .tag("status", status)
                .tag("username", nullSafe(username))
                .register(meterRegistry)
                .increment();
        Timer.builder("portal.totp.validation")
                .register(meterRegistry)
                .record(duration);
    }

    @Override
    public void successfulAuth(String username, String department) {
        Counter.builder("portal.successful.auth")
                .description("Completed two-factor logins")
                .tag("username", nullSafe(username))
                .tag("department", nullSafe(department))
                .register(meterRegistry)
                .increment();
        audit.info("SUCCESS | {} | {} | Two-factor authentication complete", username, department);
    }

    @Override
    public void logout(String username) {
        Counter.builder("portal.logout")
                .tag("username", nullSafe(username))
                .register(meterRegistry)
                .increment();
        audit.info("LOGOUT | {} | User logged out", username);
    }

    @Override
    public void routing(String outcome, String role) {
        Counter.builder("portal.routing")
                .description("Router decisions")
                .tag("outcome", outcome)
                .tag("role", nullSafe(role))
                .register(meterRegistry)
                .increment();
    }

    private static String nullSafe(String value) {
        return value != null ? value : "unknown";
    }
}
