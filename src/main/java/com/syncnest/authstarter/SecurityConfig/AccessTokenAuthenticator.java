package com.syncnest.authstarter.SecurityConfig;

import com.syncnest.authstarter.entity.User;
import com.syncnest.authstarter.exception.AuthExceptions;
import com.syncnest.authstarter.service.UserService;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

/**
 * Request-time check of a bearer token, in this order: present, not blacklisted,
 * signature and claims valid, subject still exists. Each failure is its own
 * {@link AuthExceptions} type so clients can tell refresh from re-login.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class AccessTokenAuthenticator {

    private final TokenBlacklistService blacklist;
    private final JwtTokenProvider tokenProvider;
    private final UserService userService;

    public AuthenticatedUser authenticate(String accessToken) {
        if (accessToken == null || accessToken.isBlank()) {
            throw new AuthExceptions.TokenMissing();
        }
        if (blacklist.isBlacklisted(accessToken)) {
            throw new AuthExceptions.TokenRevoked();
        }
        AccessTokenClaims claims = tokenProvider.verify(accessToken);
        User user = userService.findById(claims.subjectId())
                .orElseThrow(() -> {
                    log.debug("Token subject {} no longer exists", claims.subjectId());
                    return new AuthExceptions.UserNotFound();
                });
        return new AuthenticatedUser(user.getId(), user.getEmail(), user.getRole());
    }
}
