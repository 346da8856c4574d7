package com.numaansystems.portal.service;

import com.numaansystems.portal.directory.DirectoryAuthenticationException;
import com.numaansystems.portal.directory.DirectoryClient;
import com.numaansystems.portal.directory.DirectoryEntry;
import com.numaansystems.portal.directory.DirectoryUnavailableException;
import com.numaansystems.portal.model.AuthenticatedSession;
import com.numaansystems.portal.model.Department;
import com.numaansystems.portal.model.Identity;
import com.numaansystems.portal.model.PendingAuthentication;
import com.numaansystems.portal.model.SessionState;
import com.numaansystems.portal.totp.SecondFactorSecretStore;
import com.numaansystems.portal.totp.SecretStoreUnavailableException;
import com.numaansystems.portal.totp.TotpVerifier;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.ldap.filter.EqualsFilter;
import org.springframework.ldap.support.LdapNameBuilder;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Optional;
import java.util.Set;
import java.util.UUID;
import java.util.regex.Pattern;

/**
 * Two-step employee login: directory credentials plus department check, then a TOTP code.
 *
 * <h2>States</h2>
 * <ol>
 *   <li><b>Anonymous</b> - no record for the caller's session id</li>
 *   <li><b>Pending second factor</b> - a {@link PendingAuthentication} is stored after
 *       {@link #authenticatePrimary} and {@link #holdPending}</li>
 *   <li><b>Authenticated</b> - {@link #authenticateSecondFactor} removed the pending record
 *       and stored an {@link AuthenticatedSession} under a new session id</li>
 * </ol>
 * <p>There is no path to Authenticated that skips the pending state. A failed second factor
 * leaves the pending record in place so the user can retry until it expires.</p>
 *
 * <h2>Errors</h2>
 * <p>Every failure is a {@link PortalAuthenticationException} with its own
 * {@link AuthErrorKind}, and every outcome is reported to the {@link AuthEventRecorder}
 * before the method returns. Nothing is retried here.</p>
 *
 * @author Numaan Systems
 * @version 0.1.0
 */
@Service
public class TwoFactorAuthenticationService {

    private static final Logger logger = LoggerFactory.getLogger(TwoFactorAuthenticationService.class);

    private static final Pattern CODE_FORMAT = Pattern.compile("[0-9]{6}");
    private static final Pattern CODE_SEPARATORS = Pattern.compile("[\\s-]");

    static final String INVALID_CREDENTIALS_MESSAGE = "Invalid username or password";
    static final String DIRECTORY_ERROR_MESSAGE = "Authentication service is unavailable. Please try again later.";
    static final String CONFIGURATION_ERROR_MESSAGE = "TOTP system not configured. Please contact administrator.";
    static final String SESSION_EXPIRED_MESSAGE = "Session expired. Please log in again.";

    private final DirectoryClient directoryClient;
    private final DepartmentDirectory departments;
    private final SessionStore sessionStore;
    private final TotpVerifier totpVerifier;
    private final AuthEventRecorder events;
    private final Clock clock;

    @Autowired(required = false)
    private SecondFactorSecretStore secretStore;

    @Value("${portal.directory.user-base:cn=users,cn=accounts,dc=example,dc=internal}")
    private String userBase;

    @Value("${portal.directory.user-id-attribute:uid}")
    private String userIdAttribute;

    @Value("${portal.directory.email-domain:example.internal}")
    private String emailDomain;

    @Value("${portal.session.pending-ttl:PT5M}")
    private Duration pendingTtl;

    @Value("${portal.session.lifetime:PT8H}")
    private Duration sessionLifetime;

    @Value("${portal.totp.window:1}")
    private int totpWindow;

    @Value("${portal.totp.issuer:Employee Portal}")
    private String totpIssuer;

    @Value("${portal.totp.enrollment-on-pending:false}")
    private boolean enrollmentOnPending;

    public TwoFactorAuthenticationService(DirectoryClient directoryClient,
                                          DepartmentDirectory departments,
                                          SessionStore sessionStore,
                                          TotpVerifier totpVerifier,
                                          AuthEventRecorder events,
                                          Clock clock) {
        this.directoryClient = directoryClient;
        this.departments = departments;
        this.sessionStore = sessionStore;
        this.totpVerifier = totpVerifier;
        this.events = events;
        this.clock = clock;
    }

    /**
     * Step 1: verifies directory credentials and department membership.
     *
     * <p>Does not grant any access. The department is checked before the directory is
     * contacted.</p>
     *
     * @return a pending record, not yet stored
     * @throws PortalAuthenticationException with INVALID_DEPARTMENT, INVALID_CREDENTIALS,
     *         DIRECTORY_ERROR or UNAUTHORIZED
     */
    public PendingAuthentication authenticatePrimary(String username, String password, String departmentName) {
        String user = username != null ? username.trim() : "";

        Department department = departments.findByName(departmentName).orElse(null);
        if (department == null) {
            logger.error("ERROR | {} | Invalid department: {}", user, departmentName);
            events.loginAttempt(user, departmentName, AuthErrorKind.INVALID_DEPARTMENT.label());
            throw new PortalAuthenticationException(AuthErrorKind.INVALID_DEPARTMENT, "Invalid department selected");
        }

        if (user.isEmpty() || password == null || password.isEmpty()) {
            events.loginAttempt(user, department.getName(), AuthErrorKind.INVALID_CREDENTIALS.label());
            throw new PortalAuthenticationException(AuthErrorKind.INVALID_CREDENTIALS, INVALID_CREDENTIALS_MESSAGE);
        }

        String userDn = LdapNameBuilder.newInstance(userBase).add(userIdAttribute, user).build().toString();

        Instant bindStarted = clock.instant();
        try {
            directoryClient.bind(userDn, password);
        } catch (DirectoryAuthenticationException e) {
            events.directoryAuth(user, false, Duration.between(bindStarted, clock.instant()));
            events.invalidCredentials(user);
            events.loginAttempt(user, department.getName(), AuthErrorKind.INVALID_CREDENTIALS.label());
            logger.warn("FAILED | {} | {} | Invalid credentials: {}", user, department.getName(), e.getMessage());
            throw new PortalAuthenticationException(AuthErrorKind.INVALID_CREDENTIALS, INVALID_CREDENTIALS_MESSAGE, e);
        } catch (DirectoryUnavailableException e) {
            events.directoryAuth(user, false, Duration.between(bindStarted, clock.instant()));
            throw directoryError(user, department, e);
        }
        events.directoryAuth(user, true, Duration.between(bindStarted, clock.instant()));
        logger.info("LDAP_AUTH_SUCCESS | {} | LDAP bind successful", user);

        DirectoryEntry entry;
        try {
            String filter = new EqualsFilter(userIdAttribute, user).encode();
            List<DirectoryEntry> entries = directoryClient.search(userBase, filter, "cn", "mail", "memberOf");
            if (entries.isEmpty()) {
                throw new DirectoryUnavailableException("User " + user + " not found after successful bind", null);
            }
            entry = entries.get(0);
        } catch (DirectoryUnavailableException e) {
            throw directoryError(user, department, e);
        }

        Identity identity = new Identity(
                user,
                entry.getDisplayName().orElse(user),
                entry.getEmail().orElse(user + "@" + emailDomain),
                new LinkedHashSet<>(entry.getGroups()));
        logger.info("USER_GROUPS | {} | Groups: {}", user, String.join(", ", identity.getGroups()));

        if (!identity.isInGroup(department.getRequiredGroup())) {
            events.unauthorizedAccess(user, department.getName(), identity.getGroups());
            events.loginAttempt(user, department.getName(), AuthErrorKind.UNAUTHORIZED.label());
            throw new PortalAuthenticationException(AuthErrorKind.UNAUTHORIZED,
                    "Access denied: You are not authorized for " + department.getName() + " department");
        }

        logger.info("LDAP_VALIDATED | {} | {} | Department authorization confirmed", user, department.getName());
        events.loginAttempt(user, department.getName(), "password_verified");

        Instant now = clock.instant();
        return new PendingAuthentication(identity, department.getName(), now, now.plus(pendingTtl));
    }

    /**
     * Stores a pending record under a fresh session id.
     *
     * @param previousSessionId id the caller presented, discarded first; may be {@code null}
     * @return the new session id
     */
    public String holdPending(String previousSessionId, PendingAuthentication pending) {
        discard(previousSessionId);
        String sessionId = newSessionId();
        sessionStore.put(sessionId, pending);
        logger.debug("Pending authentication stored for user {} until {}", pending.getUsername(), pending.getExpiresAt());
        return sessionId;
    }

    /**
     * Step 2: verifies the TOTP code and promotes the pending record.
     *
     * <p>Whitespace and {@code -} are removed from the code before the format check. On
     * success the pending record is consumed exactly once: concurrent submissions of the
     * same valid code yield one session and one SESSION_EXPIRED.</p>
     *
     * @param sessionId id bound to the pending record
     * @param code code as typed by the user
     * @return the new session and its id
     * @throws PortalAuthenticationException with SESSION_EXPIRED, INVALID_CODE_FORMAT,
     *         CONFIGURATION_ERROR, NOT_ENROLLED or INVALID_CODE
     */
    public IssuedSession authenticateSecondFactor(String sessionId, String code) {
        PendingAuthentication pending = findPending(sessionId).orElse(null);
        if (pending == null) {
            events.secondFactor(null, AuthErrorKind.SESSION_EXPIRED.label(), Duration.ZERO);
            throw new PortalAuthenticationException(AuthErrorKind.SESSION_EXPIRED, SESSION_EXPIRED_MESSAGE);
        }
        String username = pending.getUsername();
        Instant started = clock.instant();

        String normalized = normalizeCode(code);
        if (!CODE_FORMAT.matcher(normalized).matches()) {
            logger.warn("TOTP_FAILED | {} | Invalid TOTP format", username);
            throw secondFactorFailure(username, started, AuthErrorKind.INVALID_CODE_FORMAT, "TOTP code must be 6 digits");
        }

        if (secretStore == null) {
            logger.error("TOTP_ERROR | {} | No second-factor secret store configured", username);
            throw secondFactorFailure(username, started, AuthErrorKind.CONFIGURATION_ERROR,
                    CONFIGURATION_ERROR_MESSAGE);
        }

        Optional<String> secret;
        try {
            secret = secretStore.lookup(username);
        } catch (SecretStoreUnavailableException e) {
            logger.error("TOTP_ERROR | {} | Secret store unavailable: {}", username, e.getMessage(), e);
            throw secondFactorFailure(username, started, AuthErrorKind.CONFIGURATION_ERROR,
                    CONFIGURATION_ERROR_MESSAGE);
        }
        if (secret.isEmpty()) {
            logger.warn("TOTP_FAILED | {} | No TOTP secret found for user", username);
            throw secondFactorFailure(username, started, AuthErrorKind.NOT_ENROLLED,
                    "TOTP not enrolled for this user. Once your administrator has provisioned a secret, "
                            + "add it to your authenticator app from /employee/enroll-totp.");
        }

        boolean valid;
        try {
            valid = totpVerifier.verify(secret.get(), normalized, totpWindow);
        } catch (IllegalArgumentException e) {
            logger.error("TOTP_ERROR | {} | Stored secret is unusable: {}", username, e.getMessage());
            throw secondFactorFailure(username, started, AuthErrorKind.CONFIGURATION_ERROR,
                    CONFIGURATION_ERROR_MESSAGE);
        }
        if (!valid) {
            logger.warn("TOTP_FAILED | {} | Invalid TOTP code", username);
            throw secondFactorFailure(username, started, AuthErrorKind.INVALID_CODE,
                    "Invalid TOTP code. Please check your authenticator app and try again.");
        }

        if (!sessionStore.remove(sessionId, pending)) {
            logger.warn("TOTP_FAILED | {} | Pending authentication already consumed", username);
            throw secondFactorFailure(username, started, AuthErrorKind.SESSION_EXPIRED,
                    SESSION_EXPIRED_MESSAGE);
        }

        Instant now = clock.instant();
        AuthenticatedSession session = new AuthenticatedSession(
                pending.getIdentity(), pending.getDepartment(), now, now.plus(sessionLifetime));
        String newSessionId = newSessionId();
        sessionStore.put(newSessionId, session);

        events.secondFactor(username, "success", Duration.between(started, now));
        events.successfulAuth(username, pending.getDepartment());
        logger.info("TOTP_SUCCESS | {} | {} | Session established until {}",
                username, pending.getDepartment(), session.getExpiresAt());

        return new IssuedSession(newSessionId, session);
    }

    /**
     * Enrollment details for the identity behind the caller's own session id.
     *
     * <p>The provisioning URI is returned for an authenticated session, and for a pending
     * record only when {@code portal.totp.enrollment-on-pending} is set. Otherwise only the
     * enrolled flag is reported.</p>
     *
     * @throws PortalAuthenticationException with SESSION_EXPIRED or CONFIGURATION_ERROR
     */
    public TotpEnrollment enrollment(String sessionId) {
        SessionState state = sessionStore.get(sessionId).orElse(null);
        if (state == null) {
            throw new PortalAuthenticationException(AuthErrorKind.SESSION_EXPIRED, SESSION_EXPIRED_MESSAGE);
        }
        String username = state.getIdentity().getUsername();

        if (secretStore == null) {
            logger.error("TOTP_ERROR | {} | No second-factor secret store configured", username);
            throw new PortalAuthenticationException(AuthErrorKind.CONFIGURATION_ERROR, CONFIGURATION_ERROR_MESSAGE);
        }

        boolean reveal = state instanceof AuthenticatedSession || enrollmentOnPending;
        try {
            if (!reveal) {
                return new TotpEnrollment(username, secretStore.isEnrolled(username), null);
            }
            Optional<String> secret = secretStore.lookup(username);
            if (secret.isEmpty()) {
                logger.info("TOTP_ENROLLMENT | {} | No secret provisioned", username);
                return new TotpEnrollment(username, false, null);
            }
            logger.info("TOTP_ENROLLMENT | {} | Provisioning URI issued", username);
            return new TotpEnrollment(username, true, totpVerifier.provisioningUri(username, secret.get(), totpIssuer));
        } catch (SecretStoreUnavailableException e) {
            logger.error("TOTP_ERROR | {} | Secret store unavailable: {}", username, e.getMessage(), e);
            throw new PortalAuthenticationException(AuthErrorKind.CONFIGURATION_ERROR, CONFIGURATION_ERROR_MESSAGE, e);
        }
    }

    public Optional<PendingAuthentication> findPending(String sessionId) {
        return sessionStore.get(sessionId)
                .filter(PendingAuthentication.class::isInstance)
                .map(PendingAuthentication.class::cast);
    }

    public Optional<AuthenticatedSession> findSession(String sessionId) {
        return sessionStore.get(sessionId)
                .filter(AuthenticatedSession.class::isInstance)
                .map(AuthenticatedSession.class::cast);
    }

    /**
     * Drops a pending record, e.g. when the user starts a new login. Authenticated sessions
     * are left alone.
     */
    public void discard(String sessionId) {
        findPending(sessionId).ifPresent(pending -> {
            if (sessionStore.remove(sessionId, pending)) {
                logger.info("Discarded pending authentication for user: {}", pending.getUsername());
            }
        });
    }

    /**
     * Ends whatever the session id refers to. Idempotent.
     *
     * @return the username that was logged out, if an authenticated session existed
     */
    public Optional<String> logout(String sessionId) {
        Optional<SessionState> removed = sessionStore.delete(sessionId);
        if (removed.isPresent() && removed.get() instanceof AuthenticatedSession session) {
            String username = session.getIdentity().getUsername();
            events.logout(username);
            return Optional.of(username);
        }
        removed.ifPresent(state ->
                logger.info("Discarded pending authentication for user {} on logout", state.getIdentity().getUsername()));
        return Optional.empty();
    }

    public Duration getPendingTtl() {
        return pendingTtl;
    }

    public Duration getSessionLifetime() {
        return sessionLifetime;
    }

    static String normalizeCode(String code) {
        return code == null ? "" : CODE_SEPARATORS.matcher(code).replaceAll("");
    }

    private PortalAuthenticationException directoryError(String user, Department department, RuntimeException cause) {
        logger.error("LDAP_ERROR | {} | {}", user, cause.getMessage(), cause);
        events.loginAttempt(user, department.getName(), AuthErrorKind.DIRECTORY_ERROR.label());
        return new PortalAuthenticationException(AuthErrorKind.DIRECTORY_ERROR, DIRECTORY_ERROR_MESSAGE, cause);
    }

    private PortalAuthenticationException secondFactorFailure(String username, Instant started,
                                                               AuthErrorKind kind, String message) {
        events.secondFactor(username, kind.label(), Duration.between(started, clock.instant()));
        return new PortalAuthenticationException(kind, message);
    }

    private static String newSessionId() {
        return UUID.randomUUID().toString();
    }

    /**
     * An authenticated session together with the id it is stored under.
     */
    public static class IssuedSession {

        private final String sessionId;
        private final AuthenticatedSession session;

        public IssuedSession(String sessionId, AuthenticatedSession session) {
            this.sessionId = sessionId;
            this.session = session;
        }

        public String getSessionId() {
            return sessionId;
        }

        public AuthenticatedSession getSession() {
            return session;
        }
    }

    /**
     * Enrollment state of one user. The provisioning URI is {@code null} unless it may be shown.
     */
    public static class TotpEnrollment {

        private final String username;
        private final boolean enrolled;
        private final String provisioningUri;

        public TotpEnrollment(String username, boolean enrolled, String provisioningUri) {
            this.username = username;
            this.enrolled = enrolled;
            this.provisioningUri = provisioningUri;
        }

        public String getUsername() {
            return username;
        }

        public boolean isEnrolled() {
            return enrolled;
        }

        public String getProvisioningUri() {
            return provisioningUri;
        }
    }
}
