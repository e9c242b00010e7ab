package com.syncnest.authstarter.serviceImpl;

import com.syncnest.authstarter.SecurityConfig.JwtTokenProvider;
import com.syncnest.authstarter.SecurityConfig.TokenBlacklistService;
import com.syncnest.authstarter.dto.ClientMetadata;
import com.syncnest.authstarter.dto.TokenPair;
import com.syncnest.authstarter.entity.User;
import com.syncnest.authstarter.entity.UserRole;
import com.syncnest.authstarter.exception.AuthExceptions;
import com.syncnest.authstarter.exception.ExternalExceptions;
import com.syncnest.authstarter.model.RefreshTokenRecord;
import com.syncnest.authstarter.service.RefreshTokenService;
import com.syncnest.authstarter.service.TokenLifecycleService;
import com.syncnest.authstarter.service.UserService;
import com.syncnest.authstarter.store.StoreUnavailableException;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.util.Optional;

/**
 * Rotation: verify, look up the owner, then take the token out with GETDEL. Two concurrent
 * rotations of the same token both pass verify but only one gets the record from GETDEL;
 * the other fails with InvalidRefreshToken. The new pair carries the user's current role.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class TokenLifecycleServiceImpl implements TokenLifecycleService {

    private final JwtTokenProvider tokenProvider;
    private final RefreshTokenService refreshTokens;
    private final TokenBlacklistService blacklist;
    private final UserService userService;

    @Override
    public TokenPair issueTokenPair(long userId, UserRole role, ClientMetadata metadata) {
        String accessToken = tokenProvider.issue(userId, role);
        final String refreshToken;
        try {
            refreshToken = refreshTokens.issue(userId, role, metadata);
        } catch (StoreUnavailableException e) {
            throw new ExternalExceptions.UpstreamUnavailable("Token store is unavailable; try again later.", e);
        }
        return TokenPair.builder()
                .accessToken(accessToken)
                .refreshToken(refreshToken)
                .expiresIn(tokenProvider.getAccessTokenSeconds())
                .build();
    }

    @Override
    public TokenPair rotateRefreshToken(String presentedToken, ClientMetadata metadata) {
        RefreshTokenRecord presented = refreshTokens.verify(presentedToken)
                .orElseThrow(AuthExceptions.InvalidRefreshToken::new);

        // resolve the owner first: a failing lookup must not burn the token
        Optional<User> owner = userService.findById(presented.userId());

        if (refreshTokens.consume(presentedToken).isEmpty()) {
            log.info("Refresh token already consumed by a concurrent rotation");
            throw new AuthExceptions.InvalidRefreshToken();
        }
        User user = owner.orElseThrow(AuthExceptions.UserNotFound::new);

        TokenPair pair = issueTokenPair(user.getId(), user.getRole(), metadata);
        log.info("Rotated refresh token for user {}", user.getId());
        return pair;
    }

    @Override
    public void logout(long userId, String accessToken) {
        // blacklist first: the access token dies even if revocation below is partial
        blacklist.add(accessToken);
        refreshTokens.revokeAll(userId);
        log.info("User {} logged out", userId);
    }
}
