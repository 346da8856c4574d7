package com.numaansystems.portal.routing;

import com.numaansystems.portal.model.Department;
import com.numaansystems.portal.model.RoutingDecision;
import com.numaansystems.portal.model.SubjectClaims;
import com.numaansystems.portal.service.AuthEventRecorder;
import com.numaansystems.portal.service.DepartmentDirectory;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

/**
 * Picks the single dashboard backend an authenticated subject is routed to.
 *
 * <h2>Decision</h2>
 * <ol>
 *   <li>Resolve the evidence into an identity and a normalized role set</li>
 *   <li>Require a username and an email containing {@code @} (401 otherwise)</li>
 *   <li>Require at least one role (403 "no roles")</li>
 *   <li>Select the primary role by {@link RolePrecedence} (403 "unrecognized role" if none
 *       of the subject's roles is ranked)</li>
 *   <li>Look up the backend configured for that role (500 if missing: operator error)</li>
 * </ol>
 * <p>Each outcome is counted by the {@link AuthEventRecorder}.</p>
 *
 * @author Numaan Systems
 * @version 0.1.0
 */
@Service
public class RoleRoutingService {

    private static final Logger logger = LoggerFactory.getLogger(RoleRoutingService.class);

    private final RolePrecedence precedence;
    private final DepartmentDirectory departments;
    private final AuthEventRecorder events;

    public RoleRoutingService(RolePrecedence precedence, DepartmentDirectory departments, AuthEventRecorder events) {
        this.precedence = precedence;
        this.departments = departments;
        this.events = events;
    }

    /**
     * @throws RoutingException with INVALID_AUTH_EVIDENCE, NO_ROLES_ASSIGNED,
     *         UNRECOGNIZED_ROLE or ROUTING_MISCONFIGURATION
     */
    public RoutingDecision authorizeAndSelectTarget(AuthEvidence evidence) {
        SubjectClaims subject;
        try {
            subject = evidence.resolve();
        } catch (RoutingException e) {
            throw fail(e.getKind(), null, e.getMessage());
        }

        if (subject.getUsername() == null || subject.getUsername().isBlank()) {
            throw fail(RoutingErrorKind.INVALID_AUTH_EVIDENCE, null,
                    "Missing username in " + evidence.source() + " evidence");
        }
        if (subject.getEmail() == null || !subject.getEmail().contains("@")) {
            throw fail(RoutingErrorKind.INVALID_AUTH_EVIDENCE, null,
                    "Invalid email format in " + evidence.source() + " evidence: " + subject.getEmail());
        }

        if (subject.getRoles().isEmpty()) {
            throw fail(RoutingErrorKind.NO_ROLES_ASSIGNED, null, "No roles found for user " + subject.getEmail());
        }

        String primaryRole = precedence.primaryRoleOf(subject.getRoles()).orElse(null);
        if (primaryRole == null) {
            throw fail(RoutingErrorKind.UNRECOGNIZED_ROLE, null,
                    "User " + subject.getEmail() + " has unrecognized roles: " + subject.getRoles());
        }

        Department department = departments.findByRole(primaryRole).filter(Department::hasBackend).orElse(null);
        if (department == null) {
            throw fail(RoutingErrorKind.ROUTING_MISCONFIGURATION, primaryRole,
                    "No service configured for role " + primaryRole);
        }

        events.routing("routed", primaryRole);
        logger.debug("Selected primary role {} from {} for {}", primaryRole, subject.getRoles(), subject.getEmail());
        return new RoutingDecision(subject, primaryRole, department.getBackendUrl());
    }

    private RoutingException fail(RoutingErrorKind kind, String role, String message) {
        events.routing(kind.label(), role);
        if (kind == RoutingErrorKind.ROUTING_MISCONFIGURATION) {
            logger.error(message);
        } else {
            logger.warn(message);
        }
        return new RoutingException(kind, message);
    }
}
