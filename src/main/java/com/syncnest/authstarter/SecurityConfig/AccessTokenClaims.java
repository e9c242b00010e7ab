package com.syncnest.authstarter.SecurityConfig;

import com.syncnest.authstarter.entity.UserRole;

import java.time.Instant;

/**
 * Claims carried by an access token. From {@link JwtTokenProvider#decode} any field may be
 * null; from {@link JwtTokenProvider#verify} all of them are present.
 */
public record AccessTokenClaims(
        Long subjectId,
        UserRole role,
        Instant issuedAt,
        Instant expiresAt
) {
}
