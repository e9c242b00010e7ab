package com.syncnest.authstarter.service;

import com.syncnest.authstarter.dto.ClientMetadata;
import com.syncnest.authstarter.dto.TokenPair;
import com.syncnest.authstarter.entity.UserRole;

/**
 * Single entry point for token issuance, rotation and logout. Authentication flows go
 * through here rather than touching the codec or the stores directly.
 */
public interface TokenLifecycleService {

    /**
     * @throws com.syncnest.authstarter.exception.ExternalExceptions.UpstreamUnavailable
     *         if the refresh token cannot be stored
     */
    TokenPair issueTokenPair(long userId, UserRole role, ClientMetadata metadata);

    /**
     * Exchange a refresh token for a new pair. The presented token is single-use.
     *
     * @throws com.syncnest.authstarter.exception.AuthExceptions.InvalidRefreshToken
     *         if the token is unknown, expired, or already used
     * @throws com.syncnest.authstarter.exception.AuthExceptions.UserNotFound
     *         if its owner no longer exists
     */
    TokenPair rotateRefreshToken(String presentedToken, ClientMetadata metadata);

    /** Blacklist the access token, then revoke every refresh token of the user. */
    void logout(long userId, String accessToken);
}
