package com.syncnest.authstarter.utils;

import com.syncnest.authstarter.SecurityConfig.AuthenticatedUser;
import lombok.NonNull;
import org.springframework.data.domain.AuditorAware;
import org.springframework.security.core.Authentication;
import org.springframework.security.core.context.SecurityContextHolder;
import org.springframework.stereotype.Component;

import java.util.Optional;

/** Fills created_by / modified_by: {@code ADMIN:<email>}, {@code USER:<email>}, or SYSTEM. */
@Component("auditorAware")
public class AuditorAwareImpl implements AuditorAware<String> {

    private static final String SYSTEM = "SYSTEM";

    @Override
    @NonNull
    public Optional<String> getCurrentAuditor() {
        Authentication auth = SecurityContextHolder.getContext().getAuthentication();

        // Unauthenticated, anonymous, or registration/seeding → SYSTEM
        if (auth == null || !auth.isAuthenticated() || !(auth.getPrincipal() instanceof AuthenticatedUser user)) {
            return Optional.of(SYSTEM);
        }

        String prefix = switch (user.role()) {
            case ROLE_ADMIN -> "ADMIN";
            case ROLE_MANAGER -> "MANAGER";
            case ROLE_USER -> "USER";
        };
        return Optional.of(prefix + ":" + user.email());
    }
}
