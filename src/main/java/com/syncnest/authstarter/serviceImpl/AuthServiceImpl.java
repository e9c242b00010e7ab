package com.syncnest.authstarter.serviceImpl;

import com.syncnest.authstarter.dto.AuthResponse;
import com.syncnest.authstarter.dto.ClientMetadata;
import com.syncnest.authstarter.dto.LoginRequest;
import com.syncnest.authstarter.dto.RefreshTokenRequest;
import com.syncnest.authstarter.dto.RegisterRequest;
import com.syncnest.authstarter.dto.SuccessResponse;
import com.syncnest.authstarter.dto.TokenPair;
import com.syncnest.authstarter.dto.UserView;
import com.syncnest.authstarter.entity.User;
import com.syncnest.authstarter.entity.UserRole;
import com.syncnest.authstarter.exception.AuthExceptions;
import com.syncnest.authstarter.exception.RequestExceptions;
import com.syncnest.authstarter.exception.UserExceptions;
import com.syncnest.authstarter.service.AuthService;
import com.syncnest.authstarter.service.TokenLifecycleService;
import com.syncnest.authstarter.service.UserService;
import com.syncnest.authstarter.utils.ErrorMessages;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.security.crypto.password.PasswordEncoder;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.util.Optional;

@Slf4j
@Service
@RequiredArgsConstructor
public class AuthServiceImpl implements AuthService {

    /** Compared against when the email is unknown, so both failure paths cost one BCrypt check. */
    private static final String DUMMY_HASH = "$2a$12$C6UzMDM.H6dfI/f/IKxGhuGGj8mL0rC6oQy0uA5sWmzMdHn5cjvWK";

    private final UserService userService;
    private final PasswordEncoder passwordEncoder;
    private final TokenLifecycleService tokenLifecycle;

    @Override
    @Transactional
    public AuthResponse register(RegisterRequest request, ClientMetadata metadata) {
        final String email = UserService.normalizeEmail(request.getEmail());
        if (userService.existsByEmail(email)) {
            throw new UserExceptions.EmailTaken();
        }

        User user = userService.create(
                email,
                passwordEncoder.encode(request.getPassword()),
                UserRole.ROLE_USER,
                request.getFirstName(),
                request.getLastName());

        TokenPair tokens = tokenLifecycle.issueTokenPair(user.getId(), user.getRole(), metadata);
        log.info("Registered user {}", user.getId());
        return AuthResponse.of(tokens);
    }

    @Override
    public AuthResponse login(LoginRequest request, ClientMetadata metadata) {
        Optional<User> found = userService.findByEmail(request.getEmail());
        if (found.isEmpty()) {
            passwordEncoder.matches(request.getPassword(), DUMMY_HASH);
            throw new AuthExceptions.InvalidCredentials();
        }
        User user = found.get();
        if (!passwordEncoder.matches(request.getPassword(), user.getPassword())) {
            log.debug("Wrong password for user {}", user.getId());
            throw new AuthExceptions.InvalidCredentials();
        }

        TokenPair tokens = tokenLifecycle.issueTokenPair(user.getId(), user.getRole(), metadata);
        log.info("Login success for user {}", user.getId());
        return AuthResponse.of(tokens);
    }

    @Override
    public AuthResponse refresh(RefreshTokenRequest request, ClientMetadata metadata) {
        return AuthResponse.of(tokenLifecycle.rotateRefreshToken(request.getRefreshToken(), metadata));
    }

    @Override
    public SuccessResponse logout(long userId, String accessToken) {
        if (accessToken == null || accessToken.isBlank()) {
            throw new RequestExceptions.InvalidHeader(
                    ErrorMessages.Auth.BEARER_TOKEN_REQUIRED, "Bearer token is required.");
        }
        tokenLifecycle.logout(userId, accessToken);
        return SuccessResponse.ok();
    }

    @Override
    public UserView me(long userId) {
        return userService.findById(userId)
                .map(userService::toSafeView)
                .orElseThrow(() -> new UserExceptions.UserNotFound("User not found."));
    }
}
