package com.numaansystems.portal.routing.token;

import com.numaansystems.portal.model.SubjectClaims;
import com.numaansystems.portal.routing.RoleExtractor;

import java.util.Collection;
import java.util.Collections;
import java.util.Map;
import java.util.Set;

/**
 * Maps provider claims to {@link SubjectClaims}.
 *
 * <p>Roles are read from {@code realm_access.roles} (Keycloak), then {@code roles}, then
 * {@code groups}. A claim may be a list or a string in any format {@link RoleExtractor}
 * accepts.</p>
 */
public class TokenClaimsMapper {

    private final RoleExtractor roleExtractor;

    public TokenClaimsMapper(RoleExtractor roleExtractor) {
        this.roleExtractor = roleExtractor;
    }

    public SubjectClaims toSubject(Map<String, Object> claims) {
        String username = stringClaim(claims, "preferred_username");
        if (username == null) {
            username = stringClaim(claims, "sub");
        }
        return new SubjectClaims(stringClaim(claims, "email"), username, roles(claims));
    }

    private Set<String> roles(Map<String, Object> claims) {
        Object realmAccess = claims.get("realm_access");
        if (realmAccess instanceof Map<?, ?> realm && realm.get("roles") != null) {
            return toRoles(realm.get("roles"));
        }
        if (claims.get("roles") != null) {
            return toRoles(claims.get("roles"));
        }
        if (claims.get("groups") != null) {
            return toRoles(claims.get("groups"));
        }
        return Collections.emptySet();
    }

    private Set<String> toRoles(Object claim) {
        if (claim instanceof Collection<?> values) {
            return roleExtractor.normalize(values);
        }
        return roleExtractor.extract(String.valueOf(claim));
    }

    private static String stringClaim(Map<String, Object> claims, String name) {
        Object value = claims.get(name);
        return value != null ? value.toString() : null;
    }
}
