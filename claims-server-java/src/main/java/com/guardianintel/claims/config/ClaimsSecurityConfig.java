package com.guardianintel.claims.config;

import java.util.Map;

import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.http.HttpStatus;
import org.springframework.security.config.annotation.method.configuration.EnableMethodSecurity;
import org.springframework.security.config.annotation.web.builders.HttpSecurity;
import org.springframework.security.config.http.SessionCreationPolicy;
import org.springframework.security.web.SecurityFilterChain;
import org.springframework.security.web.authentication.HttpStatusEntryPoint;
import org.springframework.security.web.authentication.UsernamePasswordAuthenticationFilter;

import com.guardianintel.claims.security.ApiKeyHeaderAuthenticationFilter;
import com.guardianintel.claims.security.ApiKeyHeaderAuthenticationFilter.ApiPrincipal;
import com.guardianintel.claims.security.ClaimsAuthProperties;

import lombok.extern.slf4j.Slf4j;

@Configuration
@EnableMethodSecurity
@Slf4j
public class ClaimsSecurityConfig {

    private final ClaimsAuthProperties authProperties;

    public ClaimsSecurityConfig(ClaimsAuthProperties authProperties) {
        this.authProperties = authProperties;
    }

    @Bean
    public SecurityFilterChain securityFilterChain(HttpSecurity http) throws Exception {

        // Key -> principal, built once from configuration
        Map<String, ApiPrincipal> principals = authProperties.principalsByKey();
        if (principals.isEmpty()) {
            log.warn("[SEC] No API callers configured; every claims endpoint will answer 401");
        }

        http
            .csrf(csrf -> csrf.disable())
            .sessionManagement(session -> session.sessionCreationPolicy(SessionCreationPolicy.STATELESS))
            .authorizeHttpRequests(auth -> auth
                .requestMatchers("/actuator/health/**").permitAll()
                .anyRequest().authenticated()
            )
            .exceptionHandling(ex -> ex.authenticationEntryPoint(new HttpStatusEntryPoint(HttpStatus.UNAUTHORIZED)))
            .addFilterBefore(
                new ApiKeyHeaderAuthenticationFilter(principals),
                UsernamePasswordAuthenticationFilter.class
            );

        return http.build();
    }
}
