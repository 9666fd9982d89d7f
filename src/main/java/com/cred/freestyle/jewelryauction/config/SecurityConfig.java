package com.cred.freestyle.jewelryauction.config;

import com.cred.freestyle.jewelryauction.security.HeaderAuthenticationFilter;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.http.HttpMethod;
import org.springframework.http.HttpStatus;
import org.springframework.security.config.annotation.method.configuration.EnableMethodSecurity;
import org.springframework.security.config.annotation.web.builders.HttpSecurity;
import org.springframework.security.config.annotation.web.configuration.EnableWebSecurity;
import org.springframework.security.config.http.SessionCreationPolicy;
import org.springframework.security.crypto.bcrypt.BCryptPasswordEncoder;
import org.springframework.security.crypto.password.PasswordEncoder;
import org.springframework.security.web.SecurityFilterChain;
import org.springframework.security.web.authentication.HttpStatusEntryPoint;
import org.springframework.security.web.authentication.UsernamePasswordAuthenticationFilter;

/**
 * Security configuration for the auction service.
 *
 * Authentication Strategy:
 * - Header-based authentication using X-User-Id and X-User-Role
 * - Stateless session management (no server-side sessions)
 *
 * Authorization:
 * - Controllers require an authenticated caller via @PreAuthorize
 * - Role and ownership rules are enforced in the service layer
 *
 * Public Endpoints (no authentication required):
 * - /actuator/** (health checks, metrics)
 * - POST /api/v1/users (registration)
 * - GET /api/v1/jewelry/** (catalogue browsing)
 * - GET on sessions, their lots, lot details, bid history and current winner
 *
 * @author Jewelry Auction Team
 */
@Configuration
@EnableWebSecurity
@EnableMethodSecurity(prePostEnabled = true)
public class SecurityConfig {

    @Bean
    public SecurityFilterChain securityFilterChain(HttpSecurity http) throws Exception {
        http
            // Disable CSRF for stateless REST API
            .csrf(csrf -> csrf.disable())

            .authorizeHttpRequests(auth -> auth
                .requestMatchers("/actuator/**").permitAll()
                .requestMatchers(HttpMethod.POST, "/api/v1/users", "/api/v1/users/credentials/verify").permitAll()
                .requestMatchers(HttpMethod.GET, "/api/v1/jewelry/**").permitAll()
                .requestMatchers(HttpMethod.GET,
                        "/api/v1/sessions", "/api/v1/sessions/*", "/api/v1/sessions/*/items").permitAll()
                .requestMatchers(HttpMethod.GET,
                        "/api/v1/lots/*", "/api/v1/lots/*/bids", "/api/v1/lots/*/winner").permitAll()
                .anyRequest().authenticated()
            )

            .sessionManagement(session -> session
                .sessionCreationPolicy(SessionCreationPolicy.STATELESS)
            )

            // Missing identity is a 401, not a redirect or 403
            .exceptionHandling(ex -> ex
                .authenticationEntryPoint(new HttpStatusEntryPoint(HttpStatus.UNAUTHORIZED))
            )

            .addFilterBefore(
                headerAuthenticationFilter(),
                UsernamePasswordAuthenticationFilter.class
            );

        return http.build();
    }

    @Bean
    public HeaderAuthenticationFilter headerAuthenticationFilter() {
        return new HeaderAuthenticationFilter();
    }

    /**
     * Password hashing for registered users.
     */
    @Bean
    public PasswordEncoder passwordEncoder() {
        return new BCryptPasswordEncoder();
    }
}
