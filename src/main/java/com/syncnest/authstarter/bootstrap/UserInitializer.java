package com.syncnest.authstarter.bootstrap;

import com.syncnest.authstarter.entity.UserRole;
import com.syncnest.authstarter.service.UserService;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.boot.CommandLineRunner;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.core.annotation.Order;
import org.springframework.security.crypto.password.PasswordEncoder;
import org.springframework.stereotype.Component;

/**
 * Seeds one account per role for local development. Off unless {@code app.init.enabled=true}.
 */
@Slf4j
@Component
@Order(1)
@RequiredArgsConstructor
@ConditionalOnProperty(prefix = "app.init", name = "enabled", havingValue = "true")
public class UserInitializer implements CommandLineRunner {

    private final UserService userService;
    private final PasswordEncoder passwordEncoder;

    @Value("${app.init.admin.password}")
    private String adminPlainPassword;

    @Value("${app.init.manager.password}")
    private String managerPlainPassword;

    @Value("${app.init.user.password}")
    private String userPlainPassword;

    @Override
    public void run(String... args) {
        createUserIfNotExists("admin@example.com", adminPlainPassword, UserRole.ROLE_ADMIN, "Admin", "User");
        createUserIfNotExists("manager@example.com", managerPlainPassword, UserRole.ROLE_MANAGER, "Manager", "User");
        createUserIfNotExists("user@example.com", userPlainPassword, UserRole.ROLE_USER, "Regular", "User");
    }

    private void createUserIfNotExists(String email, String password, UserRole role,
                                       String firstName, String lastName) {
        if (userService.existsByEmail(email)) {
            log.info("Seed user '{}' already present.", email);
            return;
        }
        userService.create(email, ensureEncoded(password), role, firstName, lastName);
        log.info("Seed user '{}' ({}) added.", email, role);
    }

    private String ensureEncoded(String rawOrEncoded) {
        if (rawOrEncoded == null) throw new IllegalArgumentException("Password cannot be null");
        if (isBcrypt(rawOrEncoded)) return rawOrEncoded;
        return passwordEncoder.encode(rawOrEncoded);
    }

    private boolean isBcrypt(String value) {
        return value.startsWith("$2a$") || value.startsWith("$2b$") || value.startsWith("$2y$");
    }
}
