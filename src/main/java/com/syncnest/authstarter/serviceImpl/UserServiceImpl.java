package com.syncnest.authstarter.serviceImpl;

import com.syncnest.authstarter.config.CacheConfig;
import com.syncnest.authstarter.dto.UserView;
import com.syncnest.authstarter.entity.User;
import com.syncnest.authstarter.entity.UserRole;
import com.syncnest.authstarter.repository.UserRepository;
import com.syncnest.authstarter.service.UserService;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.cache.annotation.Cacheable;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.util.Optional;

@Slf4j
@Service
@RequiredArgsConstructor
public class UserServiceImpl implements UserService {

    private final UserRepository userRepository;

    /** Hit on every authenticated request; cached briefly so bursts do not all reach MySQL. */
    @Override
    @Transactional(readOnly = true)
    @Cacheable(cacheNames = CacheConfig.USERS_BY_ID, key = "#id", unless = "#result == null")
    public Optional<User> findById(long id) {
        log.debug("Loading user by id: {}", id);
        return userRepository.findById(id);
    }

    @Override
    @Transactional(readOnly = true)
    public Optional<User> findByEmail(String email) {
        String normalized = UserService.normalizeEmail(email);
        if (normalized == null || normalized.isEmpty()) return Optional.empty();
        return userRepository.findByEmail(normalized);
    }

    @Override
    @Transactional(readOnly = true)
    public boolean existsByEmail(String email) {
        String normalized = UserService.normalizeEmail(email);
        return normalized != null && userRepository.existsByEmail(normalized);
    }

    @Override
    @Transactional
    public User create(String email, String passwordHash, UserRole role, String firstName, String lastName) {
        User user = User.builder()
                .email(UserService.normalizeEmail(email))
                .password(passwordHash)
                .role(role != null ? role : UserRole.ROLE_USER)
                .firstName(trimToNull(firstName))
                .lastName(trimToNull(lastName))
                .build();
        User saved = userRepository.save(user);
        log.info("Created user {} with role {}", saved.getId(), saved.getRole());
        return saved;
    }

    @Override
    public UserView toSafeView(User user) {
        return UserView.builder()
                .id(user.getId())
                .email(user.getEmail())
                .role(user.getRole())
                .firstName(user.getFirstName())
                .lastName(user.getLastName())
                .createdAt(user.getCreatedAt())
                .updatedAt(user.getModifiedAt())
                .build();
    }

    private static String trimToNull(String s) {
        if (s == null) return null;
        String t = s.trim();
        return t.isEmpty() ? null : t;
    }
}
