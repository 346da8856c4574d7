package com.numaansystems.portal.routing;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.util.Arrays;
import java.util.Collection;
import java.util.Collections;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Locale;
import java.util.Set;

/**
 * Parses role lists as sent by authenticating proxies and identity providers.
 *
 * <p>Accepts a JSON array ({@code ["Admin","Sales"]}) or a comma-separated list
 * ({@code Admin, Sales}). Entries are trimmed, unquoted and lower-cased; blank entries are
 * dropped. Unparseable JSON yields an empty set.</p>
 *
 * @author Numaan Systems
 * @version 0.1.0
 */
@Component
public class RoleExtractor {

    private static final Logger logger = LoggerFactory.getLogger(RoleExtractor.class);

    private static final TypeReference<List<Object>> JSON_LIST = new TypeReference<>() {
    };

    private final ObjectMapper objectMapper;

    public RoleExtractor(ObjectMapper objectMapper) {
        this.objectMapper = objectMapper;
    }

    public Set<String> extract(String rawRoles) {
        if (rawRoles == null || rawRoles.isBlank()) {
            return Collections.emptySet();
        }

        String value = rawRoles.trim();
        if (value.startsWith("[")) {
            try {
                return normalize(objectMapper.readValue(value, JSON_LIST));
            } catch (JsonProcessingException e) {
                logger.warn("Failed to parse roles as JSON: {}", value);
                return Collections.emptySet();
            }
        }
        return normalize(Arrays.asList(value.split(",")));
    }

    /**
     * Normalizes already split role values, e.g. a token claim. Nested values are ignored.
     */
    public Set<String> normalize(Collection<?> values) {
        Set<String> roles = new LinkedHashSet<>();
        for (Object value : values) {
            if (value == null || value instanceof Collection || value instanceof java.util.Map) {
                continue;
            }
            String role = unquote(value.toString().trim()).trim().toLowerCase(Locale.ROOT);
            if (!role.isEmpty()) {
                roles.add(role);
            }
        }
        return roles;
    }

    private static String unquote(String value) {
        if (value.length() >= 2 && value.startsWith("\"") && value.endsWith("\"")) {
            return value.substring(1, value.length() - 1);
        }
        return value;
    }
}
