package com.flagship.bank_transfer.config;

import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.security.crypto.bcrypt.BCryptPasswordEncoder;
import org.springframework.security.crypto.password.PasswordEncoder;

import java.time.Clock;

@Configuration
public class BankingConfig {

    /**
     * Single time source for sessions, transfer timestamps and audit entries.
     */
    @Bean
    public Clock clock() {
        return Clock.systemUTC();
    }

    /**
     * Credential verifier for stored user secrets.
     */
    @Bean
    public PasswordEncoder passwordEncoder() {
        return new BCryptPasswordEncoder();
    }
}
