package com.numaansystems.portal.service;

import java.time.Duration;
import java.util.Collection;

/**
 * Audit and metrics sink for authentication and routing decisions.
 *
 * <p>Called synchronously at each decision point. Implementations must tolerate concurrent
 * calls from many request threads.</p>
 *
 * @author Numaan Systems
 * @version 0.1.0
 */
public interface AuthEventRecorder {

    /** One login form submission, labelled by outcome ("success" or an error label). */
    void loginAttempt(String username, String department, String status);

    void directoryAuth(String username, boolean success, Duration duration);

    void invalidCredentials(String username);

    /** Bind succeeded but the subject lacks the department's group. */
    void unauthorizedAccess(String username, String requestedDepartment, Collection<String> actualGroups);

    void secondFactor(String username, String status, Duration duration);

    void successfulAuth(String username, String department);

    void logout(String username);

    void routing(String outcome, String role);
}
