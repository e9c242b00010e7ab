package com.syncnest.authstarter;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.boot.autoconfigure.security.servlet.UserDetailsServiceAutoConfiguration;
import org.springframework.data.jpa.repository.config.EnableJpaAuditing;

// passwords are checked by AuthService; no in-memory UserDetailsService
@SpringBootApplication(exclude = UserDetailsServiceAutoConfiguration.class)
@EnableJpaAuditing(auditorAwareRef = "auditorAware")
public class AuthStarterApplication {

    public static void main(String[] args) {
        SpringApplication.run(AuthStarterApplication.class, args);
    }
}
