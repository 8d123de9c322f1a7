package com.koni.energy.infrastructure.security;

import com.koni.energy.domain.exception.ConfigurationException;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.security.config.Customizer;
import org.springframework.security.config.annotation.web.builders.HttpSecurity;
import org.springframework.security.config.annotation.web.configuration.EnableWebSecurity;
import org.springframework.security.config.annotation.web.configurers.AbstractHttpConfigurer;
import org.springframework.security.config.http.SessionCreationPolicy;
import org.springframework.security.oauth2.core.DelegatingOAuth2TokenValidator;
import org.springframework.security.oauth2.jose.jws.MacAlgorithm;
import org.springframework.security.oauth2.jwt.JwtDecoder;
import org.springframework.security.oauth2.jwt.JwtValidators;
import org.springframework.security.oauth2.jwt.NimbusJwtDecoder;
import org.springframework.security.web.SecurityFilterChain;

import javax.crypto.SecretKey;
import javax.crypto.spec.SecretKeySpec;
import java.nio.charset.StandardCharsets;

/**
 * Stateless bearer token security for the REST API.
 * 
 * Tokens are HS256 JWTs signed with {@code energy.security.jwt-secret}; the {@code sub}
 * claim is the owner's user id. Health and info probes stay open.
 */
@Configuration
@EnableWebSecurity
@Slf4j
public class SecurityConfiguration {

    static final int MIN_SECRET_BYTES = 32;

    @Bean
    public SecurityFilterChain securityFilterChain(HttpSecurity http) throws Exception {
        http
            .csrf(AbstractHttpConfigurer::disable)
            .sessionManagement(session -> session.sessionCreationPolicy(SessionCreationPolicy.STATELESS))
            .authorizeHttpRequests(auth -> auth
                .requestMatchers("/actuator/health/**", "/actuator/info").permitAll()
                .requestMatchers("/api/**").authenticated()
                .anyRequest().authenticated())
            .oauth2ResourceServer(oauth2 -> oauth2.jwt(Customizer.withDefaults()));
        return http.build();
    }

    /**
     * @throws ConfigurationException if the secret is missing or shorter than 32 bytes
     */
    @Bean
    public JwtDecoder jwtDecoder(@Value("${energy.security.jwt-secret:}") String secret) {
        NimbusJwtDecoder decoder = NimbusJwtDecoder.withSecretKey(signingKey(secret))
                .macAlgorithm(MacAlgorithm.HS256)
                .build();
        decoder.setJwtValidator(new DelegatingOAuth2TokenValidator<>(
                JwtValidators.createDefault(), new OwnerSubjectValidator()));
        return decoder;
    }

    static SecretKey signingKey(String secret) {
        if (secret == null || secret.isBlank()) {
            throw new ConfigurationException("energy.security.jwt-secret is not set (JWT_SECRET)");
        }
        byte[] bytes = secret.getBytes(StandardCharsets.UTF_8);
        if (bytes.length < MIN_SECRET_BYTES) {
            throw new ConfigurationException(
                    "energy.security.jwt-secret must be at least " + MIN_SECRET_BYTES + " bytes for HS256");
        }
        log.info("JWT decoder configured: algorithm=HS256");
        return new SecretKeySpec(bytes, "HmacSHA256");
    }
}
