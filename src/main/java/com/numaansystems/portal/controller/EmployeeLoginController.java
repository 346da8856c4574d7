package com.numaansystems.portal.controller;

import com.numaansystems.portal.config.SessionCookies;
import com.numaansystems.portal.model.AuthenticatedSession;
import com.numaansystems.portal.model.Department;
import com.numaansystems.portal.model.PendingAuthentication;
import com.numaansystems.portal.service.AuthErrorKind;
import com.numaansystems.portal.service.DepartmentDirectory;
import com.numaansystems.portal.service.PortalAuthenticationException;
import com.numaansystems.portal.service.TwoFactorAuthenticationService;
import com.numaansystems.portal.service.TwoFactorAuthenticationService.IssuedSession;
import com.numaansystems.portal.service.TwoFactorAuthenticationService.TotpEnrollment;
import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.tags.Tag;
import jakarta.servlet.http.HttpServletRequest;
import jakarta.servlet.http.HttpServletResponse;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.CacheControl;
import org.springframework.http.HttpStatus;
import org.springframework.http.MediaType;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestMethod;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

import java.net.URI;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Optional;

/**
 * Two-step employee login: password and department first, then the authenticator code.
 *
 * <h2>Flow</h2>
 * <ol>
 *   <li>{@code POST /employee/login} checks the directory password and department group and
 *       binds a pending record to a fresh session cookie</li>
 *   <li>{@code POST /employee/totp} checks the code, replaces the pending record with a session
 *       under a new id and redirects to the department dashboard</li>
 *   <li>{@code GET /employee/enroll-totp} reports the caller's own enrollment and, once
 *       allowed, the provisioning URI for an authenticator app</li>
 *   <li>{@code /logout} ends whatever the cookie refers to</li>
 * </ol>
 *
 * <p>Failed steps answer with the form model: the error message, the submitted values and
 * the department list.</p>
 *
 * @author Numaan Systems
 * @version 0.1.0
 */
@RestController
@Tag(name = "Employee login", description = "Password, department and TOTP login for department dashboards")
public class EmployeeLoginController {

    private static final Logger logger = LoggerFactory.getLogger(EmployeeLoginController.class);

    static final String LOGIN_PATH = "/employee/login";
    static final String TOTP_PATH = "/employee/totp";
    static final String ENROLL_PATH = "/employee/enroll-totp";

    private final TwoFactorAuthenticationService authenticationService;
    private final DepartmentDirectory departments;
    private final SessionCookies sessionCookies;

    public EmployeeLoginController(TwoFactorAuthenticationService authenticationService,
                                   DepartmentDirectory departments,
                                   SessionCookies sessionCookies) {
        this.authenticationService = authenticationService;
        this.departments = departments;
        this.sessionCookies = sessionCookies;
    }

    @GetMapping(value = LOGIN_PATH, produces = MediaType.APPLICATION_JSON_VALUE)
    @Operation(summary = "Login form model", description = "Redirects to the dashboard when a session already exists")
    public ResponseEntity<Map<String, Object>> loginForm(HttpServletRequest request) {
        String sessionId = sessionCookies.readSessionId(request);

        Optional<AuthenticatedSession> session = authenticationService.findSession(sessionId);
        if (session.isPresent()) {
            return redirect(dashboardPath(session.get().getDepartment()));
        }

        // a new attempt replaces any unfinished one
        authenticationService.discard(sessionId);
        return ResponseEntity.ok(loginModel(null, null, null));
    }

    @PostMapping(value = LOGIN_PATH, produces = MediaType.APPLICATION_JSON_VALUE)
    @Operation(summary = "Password step", description = "On success binds a pending record to the session cookie and redirects to the TOTP step")
    public ResponseEntity<Map<String, Object>> login(@RequestParam(required = false) String username,
                                                     @RequestParam(required = false) String password,
                                                     @RequestParam(required = false) String department,
                                                     HttpServletRequest request,
                                                     HttpServletResponse response) {

        if (isBlank(username) || isBlank(password) || isBlank(department)) {
            return ResponseEntity.badRequest()
                    .body(loginModel("Please fill in all required fields", username, department));
        }

        PendingAuthentication pending;
        try {
            pending = authenticationService.authenticatePrimary(username, password, department);
        } catch (PortalAuthenticationException e) {
            logger.info("Login for {} to {} failed: {}", username, department, e.getKind().label());
            return ResponseEntity.status(loginFailureStatus(e.getKind()))
                    .body(loginModel(e.getMessage(), username, department));
        }

        String sessionId = authenticationService.holdPending(sessionCookies.readSessionId(request), pending);
        sessionCookies.writeSessionId(response, sessionId, authenticationService.getPendingTtl());
        return redirect(TOTP_PATH);
    }

    @GetMapping(value = TOTP_PATH, produces = MediaType.APPLICATION_JSON_VALUE)
    @Operation(summary = "TOTP form model", description = "Redirects to the login step without a live pending record")
    public ResponseEntity<Map<String, Object>> totpForm(HttpServletRequest request) {
        Optional<PendingAuthentication> pending = authenticationService.findPending(sessionCookies.readSessionId(request));
        if (pending.isEmpty()) {
            return redirect(LOGIN_PATH);
        }
        return ResponseEntity.ok(totpModel(pending.get(), null));
    }

    @PostMapping(value = TOTP_PATH, produces = MediaType.APPLICATION_JSON_VALUE)
    @Operation(summary = "TOTP step", description = "On success issues the session cookie and redirects to the department dashboard")
    public ResponseEntity<Map<String, Object>> verifyTotp(@RequestParam(required = false) String code,
                                                          HttpServletRequest request,
                                                          HttpServletResponse response) {
        String sessionId = sessionCookies.readSessionId(request);
        // read before the attempt: the record is gone once it succeeds
        Optional<PendingAuthentication> pending = authenticationService.findPending(sessionId);

        IssuedSession issued;
        try {
            issued = authenticationService.authenticateSecondFactor(sessionId, code);
        } catch (PortalAuthenticationException e) {
            if (e.getKind() == AuthErrorKind.SESSION_EXPIRED || pending.isEmpty()) {
                // cookie left alone: a concurrent submit may already have replaced it
                return redirect(LOGIN_PATH);
            }
            return ResponseEntity.status(totpFailureStatus(e.getKind()))
                    .body(totpModel(pending.get(), e.getMessage()));
        }

        sessionCookies.writeSessionId(response, issued.getSessionId(), authenticationService.getSessionLifetime());
        return redirect(dashboardPath(issued.getSession().getDepartment()));
    }

    @GetMapping(value = ENROLL_PATH, produces = MediaType.APPLICATION_JSON_VALUE)
    @Operation(summary = "TOTP enrollment", description = "Enrollment of the caller's own identity; redirects to the login step without a session")
    public ResponseEntity<Map<String, Object>> enrollTotp(HttpServletRequest request) {
        TotpEnrollment enrollment;
        try {
            enrollment = authenticationService.enrollment(sessionCookies.readSessionId(request));
        } catch (PortalAuthenticationException e) {
            if (e.getKind() == AuthErrorKind.SESSION_EXPIRED) {
                return redirect(LOGIN_PATH);
            }
            Map<String, Object> model = new LinkedHashMap<>();
            model.put("success", false);
            model.put("error", e.getMessage());
            return ResponseEntity.status(totpFailureStatus(e.getKind())).body(model);
        }

        Map<String, Object> model = new LinkedHashMap<>();
        model.put("success", true);
        model.put("username", enrollment.getUsername());
        model.put("enrolled", enrollment.isEnrolled());
        model.put("provisioningUri", enrollment.getProvisioningUri());
        // the URI carries the shared secret
        return ResponseEntity.ok().cacheControl(CacheControl.noStore()).body(model);
    }

    @RequestMapping(value = "/logout", method = {RequestMethod.GET, RequestMethod.POST})
    @Operation(summary = "Log out", description = "Idempotent; clears the portal cookies and redirects to /")
    public ResponseEntity<Void> logout(HttpServletRequest request, HttpServletResponse response) {
        if (authenticationService.logout(sessionCookies.readSessionId(request)).isEmpty()) {
            logger.debug("Logout without an authenticated session");
        }

        sessionCookies.clearSessionId(response);
        sessionCookies.clearIdentityToken(response);
        return ResponseEntity.status(HttpStatus.FOUND).location(URI.create("/")).build();
    }

    static HttpStatus loginFailureStatus(AuthErrorKind kind) {
        return switch (kind) {
            case INVALID_DEPARTMENT -> HttpStatus.BAD_REQUEST;
            case UNAUTHORIZED -> HttpStatus.FORBIDDEN;
            default -> HttpStatus.UNAUTHORIZED;
        };
    }

    static HttpStatus totpFailureStatus(AuthErrorKind kind) {
        return switch (kind) {
            case INVALID_CODE_FORMAT -> HttpStatus.BAD_REQUEST;
            case NOT_ENROLLED -> HttpStatus.FORBIDDEN;
            case CONFIGURATION_ERROR -> HttpStatus.INTERNAL_SERVER_ERROR;
            default -> HttpStatus.UNAUTHORIZED;
        };
    }

    private Map<String, Object> loginModel(String error, String username, String department) {
        Map<String, Object> model = new LinkedHashMap<>();
        model.put("success", false);
        model.put("error", error);
        model.put("username", username);
        model.put("department", department);
        model.put("departments", departments.departmentNames());
        return model;
    }

    private Map<String, Object> totpModel(PendingAuthentication pending, String error) {
        Map<String, Object> model = new LinkedHashMap<>();
        model.put("success", false);
        model.put("error", error);
        model.put("username", pending.getUsername());
        model.put("department", pending.getDepartment());
        return model;
    }

    private String dashboardPath(String departmentName) {
        return departments.findByName(departmentName)
                .map(Department::getDashboardPath)
                .orElse("/");
    }

    private static <T> ResponseEntity<T> redirect(String location) {
        return ResponseEntity.status(HttpStatus.FOUND).location(URI.create(location)).build();
    }

    private static boolean isBlank(String value) {
        return value == null || value.isBlank();
    }
}
