package com.syncnest.authstarter.dto;

import lombok.Value;

@Value
public class AuthResponse {
    TokenPair tokens;

    public static AuthResponse of(TokenPair tokens) {
        return new AuthResponse(tokens);
    }
}
