package com.syncnest.authstarter.dto;

import lombok.Builder;
import lombok.Value;

/** Access token, refresh token and the access token's lifetime in seconds. */
@Value
@Builder
public class TokenPair {
    String accessToken;
    String refreshToken;
    long expiresIn;
}
