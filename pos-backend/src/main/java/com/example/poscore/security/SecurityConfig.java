package com.example.poscore.security;

import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.http.HttpMethod;
import org.springframework.http.HttpStatus;
import org.springframework.security.config.annotation.web.builders.HttpSecurity;
import org.springframework.security.config.annotation.web.configuration.EnableWebSecurity;
import org.springframework.security.config.http.SessionCreationPolicy;
import org.springframework.security.crypto.bcrypt.BCryptPasswordEncoder;
import org.springframework.security.crypto.password.PasswordEncoder;
import org.springframework.security.web.SecurityFilterChain;
import org.springframework.security.web.authentication.HttpStatusEntryPoint;
import org.springframework.security.web.authentication.UsernamePasswordAuthenticationFilter;

@Configuration
@EnableWebSecurity
public class SecurityConfig {

        private static final String ROLE_ADMIN = "ADMIN";
        private static final String PROMOTIONS_ALL = "/api/promotions/**";

        @Bean
        public SecurityFilterChain filterChain(HttpSecurity http, JwtAuthFilter jwtAuthFilter,
                        AuthAttributesFilter authAttributesFilter) throws Exception {
                // /health stays outside the chain
                http.securityMatcher("/api/**")
                                .csrf(csrf -> csrf.disable())
                                .sessionManagement(sm -> sm.sessionCreationPolicy(SessionCreationPolicy.STATELESS))
                                .exceptionHandling(ex -> ex
                                                .authenticationEntryPoint(new HttpStatusEntryPoint(HttpStatus.UNAUTHORIZED)))
                                .authorizeHttpRequests(auth -> auth
                                                .requestMatchers(HttpMethod.OPTIONS, "/api/**").permitAll()
                                                .requestMatchers(HttpMethod.GET, "/api").permitAll()
                                                .requestMatchers("/api/auth/login").permitAll()
                                                .requestMatchers("/api/auth/me").authenticated()
                                                .requestMatchers(HttpMethod.POST, "/api/promotions").hasRole(ROLE_ADMIN)
                                                .requestMatchers(HttpMethod.PUT, PROMOTIONS_ALL).hasRole(ROLE_ADMIN)
                                                .requestMatchers(HttpMethod.PATCH, PROMOTIONS_ALL).hasRole(ROLE_ADMIN)
                                                .requestMatchers(HttpMethod.DELETE, PROMOTIONS_ALL).hasRole(ROLE_ADMIN)
                                                .anyRequest().authenticated());

                http.addFilterBefore(jwtAuthFilter, UsernamePasswordAuthenticationFilter.class);
                http.addFilterAfter(authAttributesFilter, JwtAuthFilter.class);
                return http.build();
        }

        @Bean
        public PasswordEncoder passwordEncoder() {
                return new BCryptPasswordEncoder();
        }
}
