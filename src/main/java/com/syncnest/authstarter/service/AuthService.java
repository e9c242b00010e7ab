package com.syncnest.authstarter.service;

import com.syncnest.authstarter.dto.AuthResponse;
import com.syncnest.authstarter.dto.ClientMetadata;
import com.syncnest.authstarter.dto.LoginRequest;
import com.syncnest.authstarter.dto.RefreshTokenRequest;
import com.syncnest.authstarter.dto.RegisterRequest;
import com.syncnest.authstarter.dto.SuccessResponse;
import com.syncnest.authstarter.dto.UserView;

public interface AuthService {

    AuthResponse register(RegisterRequest request, ClientMetadata metadata);

    /** Unknown email and wrong password fail identically, before any token is written. */
    AuthResponse login(LoginRequest request, ClientMetadata metadata);

    AuthResponse refresh(RefreshTokenRequest request, ClientMetadata metadata);

    SuccessResponse logout(long userId, String accessToken);

    UserView me(long userId);
}
