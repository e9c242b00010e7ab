package com.syncnest.authstarter.model;

import com.fasterxml.jackson.annotation.JsonInclude;

/**
 * Refresh token state as stored under {@code refresh:<token>}.
 * Timestamps are epoch seconds.
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record RefreshTokenRecord(
        long userId,
        String role,
        long expiresAt,
        long createdAt,
        String ipAddress,
        String userAgent
) {
    public boolean isExpiredAt(long epochSecond) {
        return expiresAt <= epochSecond;
    }
}
