package com.tiktimer.backend.config;

import lombok.RequiredArgsConstructor;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.security.crypto.bcrypt.BCryptPasswordEncoder;
import org.springframework.security.crypto.password.PasswordEncoder;

import java.time.Clock;

/**
 * Application Configuration
 * Defines the time source and password encoder shared by the authentication core
 */
@Configuration
@RequiredArgsConstructor
public class ApplicationConfig {

    private final SecurityProperties securityProperties;

    @Bean
    public PasswordEncoder passwordEncoder() {
        return new BCryptPasswordEncoder(securityProperties.getPasswordStrength());
    }

    @Bean
    public Clock clock() {
        return Clock.systemUTC();
    }
}
