package com.guardianintel.claims.security;

import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Set;

import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.context.annotation.Configuration;
import org.springframework.util.StringUtils;

import com.guardianintel.claims.security.ApiKeyHeaderAuthenticationFilter.ApiPrincipal;

import lombok.extern.slf4j.Slf4j;

/**
 * API callers of the claims server, keyed by the name that shows up as the actor
 * in claim history and logs ({@code dashboard}, {@code assistant}, {@code admin}).
 */
@Configuration
@ConfigurationProperties(prefix = "claims.security")
@Slf4j
public class ClaimsAuthProperties {

    static final Set<String> ROLES = Set.of("ROLE_USER", "ROLE_ADMIN");

    private Map<String, Caller> users = new LinkedHashMap<>();

    public Map<String, Caller> getUsers() {
        return users;
    }

    public void setUsers(Map<String, Caller> users) {
        this.users = users;
    }

    /**
     * Key to principal for every usable caller. Callers without a key or with an
     * unknown role are left out; two callers sharing one key fail startup, since
     * the actor recorded on a claim would be ambiguous.
     */
    public Map<String, ApiPrincipal> principalsByKey() {
        Map<String, ApiPrincipal> principals = new HashMap<>();
        users.forEach((name, caller) -> {
            if (!StringUtils.hasText(caller.getKey())) {
                log.warn("[SEC] Caller '{}' has no API key; it cannot authenticate", name);
                return;
            }
            if (!ROLES.contains(caller.getRole())) {
                log.warn("[SEC] Caller '{}' has unknown role '{}'; ignored", name, caller.getRole());
                return;
            }
            ApiPrincipal previous = principals.put(caller.getKey(), new ApiPrincipal(name, caller.getRole()));
            if (previous != null) {
                throw new IllegalStateException("Callers '" + previous.name() + "' and '" + name + "' share an API key");
            }
            log.info("[SEC] Registered caller: {} -> {}", name, caller.getRole());
        });
        return principals;
    }

    public static class Caller {
        private String key;
        private String role = "ROLE_USER";

        public String getKey() { return key; }
        public void setKey(String key) { this.key = key; }

        public String getRole() { return role; }
        public void setRole(String role) { this.role = role; }
    }
}
