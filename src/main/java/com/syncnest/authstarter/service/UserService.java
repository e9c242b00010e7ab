package com.syncnest.authstarter.service;

import com.syncnest.authstarter.dto.UserView;
import com.syncnest.authstarter.entity.User;
import com.syncnest.authstarter.entity.UserRole;

import java.util.Optional;

/**
 * User lookups needed by authentication. Emails are compared in their normalized
 * form (trimmed, lower case).
 */
public interface UserService {

    Optional<User> findById(long id);

    Optional<User> findByEmail(String email);

    boolean existsByEmail(String email);

    /** Persist a new user; {@code passwordHash} is already BCrypt-encoded. */
    User create(String email, String passwordHash, UserRole role, String firstName, String lastName);

    /** Public projection without the password hash. */
    UserView toSafeView(User user);

    static String normalizeEmail(String email) {
        return email == null ? null : email.trim().toLowerCase(java.util.Locale.ROOT);
    }
}
