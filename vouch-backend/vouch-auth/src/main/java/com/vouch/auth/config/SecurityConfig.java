package com.vouch.auth.config;

import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.http.HttpStatus;
import org.springframework.security.config.annotation.web.builders.HttpSecurity;
import org.springframework.security.config.annotation.web.configuration.EnableWebSecurity;
import org.springframework.security.config.annotation.web.configurers.AbstractHttpConfigurer;
import org.springframework.security.config.http.SessionCreationPolicy;
import org.springframework.security.web.SecurityFilterChain;
import org.springframework.security.web.authentication.AnonymousAuthenticationFilter;
import org.springframework.security.web.authentication.HttpStatusEntryPoint;

@Configuration
@EnableWebSecurity
public class SecurityConfig {

    @Bean
    public java.security.SecureRandom secureRandom() {
        return new java.security.SecureRandom();
    }

    @Bean
    public SecurityFilterChain filterChain(HttpSecurity http) throws Exception {
        http
            // Disable CSRF for stateless APIs
            .csrf(AbstractHttpConfigurer::disable)

            // Stateless session management
            .sessionManagement(session -> session
                    .sessionCreationPolicy(SessionCreationPolicy.STATELESS)
            )

            // Caller identity is asserted by the gateway in request headers
            .addFilterBefore(new GatewayUserContextFilter(), AnonymousAuthenticationFilter.class)

            .exceptionHandling(ex -> ex
                    .authenticationEntryPoint(new HttpStatusEntryPoint(HttpStatus.UNAUTHORIZED))
            )

            // Authorization Rules
            .authorizeHttpRequests(auth -> auth
                // Public endpoints - anonymous credential flows
                .requestMatchers("/auth/password-reset/request").permitAll()
                .requestMatchers("/auth/password-reset/confirm").permitAll()
                .requestMatchers("/auth/email-verification/confirm").permitAll()

                // Protected endpoints - require an authenticated user
                .requestMatchers("/auth/email-verification/request").authenticated()

                // Operations endpoints
                .requestMatchers("/internal/**").hasRole("ADMIN")

                // API docs
                .requestMatchers("/v3/api-docs/**", "/swagger-ui/**").permitAll()

                // All other requests require authentication
                .anyRequest().authenticated()
            );

        return http.build();
    }
}
