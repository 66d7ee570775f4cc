package com.nosota.mpayout.config;

import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.core.env.Environment;
import org.springframework.core.env.Profiles;
import org.springframework.security.config.annotation.web.builders.HttpSecurity;
import org.springframework.security.config.annotation.web.configuration.EnableWebSecurity;
import org.springframework.security.config.annotation.web.configurers.AbstractHttpConfigurer;
import org.springframework.security.config.http.SessionCreationPolicy;
import org.springframework.security.web.SecurityFilterChain;

/**
 * Merchants are authenticated upstream (gateway), so payout endpoints are open here.
 * OpenAPI docs are only served for the profiles in {@code payout.api-docs.profiles}.
 */
@Configuration
@EnableWebSecurity
public class SecurityConfig {

    private final Environment environment;
    private final String[] docsProfiles;

    public SecurityConfig(Environment environment,
                          @Value("${payout.api-docs.profiles:dev}") String[] docsProfiles) {
        this.environment = environment;
        this.docsProfiles = docsProfiles;
    }

    @Bean
    public SecurityFilterChain securityFilterChain(HttpSecurity http) throws Exception {
        boolean docsVisible = environment.acceptsProfiles(Profiles.of(docsProfiles));

        return http
                .authorizeHttpRequests(auth -> {
                    if (!docsVisible) {
                        auth.requestMatchers("/v3/api-docs/**", "/swagger-ui/**", "/swagger-ui.html").denyAll();
                    }
                    auth.anyRequest().permitAll();
                })
                .sessionManagement(session -> session.sessionCreationPolicy(SessionCreationPolicy.STATELESS))
                .csrf(AbstractHttpConfigurer::disable)
                .httpBasic(AbstractHttpConfigurer::disable)
                .formLogin(AbstractHttpConfigurer::disable)
                .build();
    }
}
