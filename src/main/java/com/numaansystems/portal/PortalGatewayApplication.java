package com.numaansystems.portal;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

/**
 * Employee Portal Gateway Application
 *
 * <p>Single entry point in front of the department dashboards. Employees log in with their
 * directory password, pick a department and confirm with an authenticator code; every other
 * request is forwarded to the dashboard of the caller's highest-precedence role.</p>
 *
 * <h2>Login</h2>
 * <ol>
 *   <li>Password checked by an LDAP bind</li>
 *   <li>Directory groups must include the department's group</li>
 *   <li>A 6-digit TOTP code promotes the pending login to an 8-hour session</li>
 * </ol>
 *
 * <h2>Routing</h2>
 * <p>Identity comes from trusted upstream headers, a provider identity token, or the portal
 * session. Roles are ranked by a fixed precedence list and the first match picks the
 * dashboard; the backend receives the identity as {@code X-User-*} headers.</p>
 *
 * @author Numaan Systems
 * @version 0.1.0
 */
@SpringBootApplication
public class PortalGatewayApplication {

    public static void main(String[] args) {
        SpringApplication.run(PortalGatewayApplication.class, args);
    }
}
