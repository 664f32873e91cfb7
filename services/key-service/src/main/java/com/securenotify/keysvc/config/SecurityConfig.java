package com.securenotify.keysvc.config;

import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.security.config.annotation.web.builders.HttpSecurity;
import org.springframework.security.config.annotation.web.configuration.EnableWebSecurity;
import org.springframework.security.config.annotation.web.configurers.AbstractHttpConfigurer;
import org.springframework.security.config.http.SessionCreationPolicy;
import org.springframework.security.web.SecurityFilterChain;
import org.springframework.security.web.header.writers.ReferrerPolicyHeaderWriter;

/**
 * Stateless chain for the key service. Callers authenticate per request with {@code X-API-Key}
 * (revocation routes) or {@code X-Cleanup-Secret} (cleanup trigger); both are checked by the
 * domain services, which need the key's owner and permissions anyway. This chain opens the known
 * routes, denies everything else and sets response headers.
 */
@Configuration
@EnableWebSecurity
public class SecurityConfig {

    private static final String[] API_ROUTES = {
            "/api/v1/keys/**", "/api/v1/revocations/**", "/api/v1/admin/cleanup", "/api/v1/admin/cleanup/**"
    };

    private static final String[] OPERATIONAL_ROUTES = {
            "/health", "/health/**",
            "/actuator/health/**", "/actuator/info", "/actuator/metrics/**",
            "/v3/api-docs/**", "/swagger-ui/**", "/swagger-ui.html",
            "/error"
    };

    @Bean
    public SecurityFilterChain securityFilterChain(HttpSecurity http) throws Exception {
        http
            .csrf(AbstractHttpConfigurer::disable)
            .httpBasic(AbstractHttpConfigurer::disable)
            .formLogin(AbstractHttpConfigurer::disable)
            .logout(AbstractHttpConfigurer::disable)
            .sessionManagement(session -> session.sessionCreationPolicy(SessionCreationPolicy.STATELESS))
            .headers(headers -> headers
                .frameOptions(frame -> frame.deny())
                .referrerPolicy(referrer -> referrer.policy(ReferrerPolicyHeaderWriter.ReferrerPolicy.NO_REFERRER)))
            .authorizeHttpRequests(auth -> auth
                .requestMatchers(API_ROUTES).permitAll()
                .requestMatchers(OPERATIONAL_ROUTES).permitAll()
                .anyRequest().denyAll()
            );

        return http.build();
    }
}
