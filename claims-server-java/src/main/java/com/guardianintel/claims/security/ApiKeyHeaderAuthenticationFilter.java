package com.guardianintel.claims.security;

import java.io.IOException;
import java.util.Collections;
import java.util.Map;

import org.slf4j.MDC;
import org.springframework.security.authentication.UsernamePasswordAuthenticationToken;
import org.springframework.security.core.authority.SimpleGrantedAuthority;
import org.springframework.security.core.context.SecurityContextHolder;
import org.springframework.util.StringUtils;
import org.springframework.web.filter.OncePerRequestFilter;

import jakarta.servlet.FilterChain;
import jakarta.servlet.ServletException;
import jakarta.servlet.http.HttpServletRequest;
import jakarta.servlet.http.HttpServletResponse;
import lombok.extern.slf4j.Slf4j;

/**
 * Authenticates callers by the {@code X-Claims-API-Key} header. An unknown or
 * missing key leaves the request anonymous; the security chain decides whether
 * that is enough for the path.
 */
@Slf4j
public class ApiKeyHeaderAuthenticationFilter extends OncePerRequestFilter {

    public static final String HEADER = "X-Claims-API-Key";
    static final String MDC_ACTOR = "actor";

    public record ApiPrincipal(String name, String role) {}

    private final Map<String, ApiPrincipal> principalsByKey;

    public ApiKeyHeaderAuthenticationFilter(Map<String, ApiPrincipal> principalsByKey) {
        this.principalsByKey = Map.copyOf(principalsByKey);
    }

    @Override
    protected void doFilterInternal(HttpServletRequest request, HttpServletResponse response, FilterChain filterChain)
            throws ServletException, IOException {

        String clientKey = request.getHeader(HEADER);

        if (StringUtils.hasText(clientKey)) {
            ApiPrincipal principal = principalsByKey.get(clientKey);
            if (principal != null) {
                UsernamePasswordAuthenticationToken auth = new UsernamePasswordAuthenticationToken(
                        principal.name(), null,
                        Collections.singletonList(new SimpleGrantedAuthority(principal.role())));
                SecurityContextHolder.getContext().setAuthentication(auth);
                MDC.put(MDC_ACTOR, principal.name());
            } else {
                log.warn("Rejected unknown API key on {} {}", request.getMethod(), request.getRequestURI());
            }
        }

        try {
            filterChain.doFilter(request, response);
        } finally {
            MDC.remove(MDC_ACTOR);
        }
    }
}
