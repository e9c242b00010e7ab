package com.syncnest.authstarter.controller;

import com.syncnest.authstarter.SecurityConfig.AuthenticatedUser;
import com.syncnest.authstarter.SecurityConfig.JwtAuthFilter;
import com.syncnest.authstarter.dto.AuthResponse;
import com.syncnest.authstarter.dto.LoginRequest;
import com.syncnest.authstarter.dto.RefreshTokenRequest;
import com.syncnest.authstarter.dto.RegisterRequest;
import com.syncnest.authstarter.dto.SuccessResponse;
import com.syncnest.authstarter.dto.UserView;
import com.syncnest.authstarter.service.AuthService;
import com.syncnest.authstarter.utils.ClientMetadataResolver;
import com.syncnest.authstarter.utils.ResponseMessage;
import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.security.SecurityRequirement;
import io.swagger.v3.oas.annotations.tags.Tag;
import jakarta.servlet.http.HttpServletRequest;
import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpHeaders;
import org.springframework.http.HttpStatus;
import org.springframework.security.core.annotation.AuthenticationPrincipal;
import org.springframework.web.bind.annotation.*;

@Slf4j
@RestController
@RequestMapping("/api/v1/auth")
@RequiredArgsConstructor
@Tag(name = "auth")
public class AuthController {

    private final AuthService authService;

    @PostMapping("/register")
    @ResponseStatus(HttpStatus.CREATED)
    @ResponseMessage("Registered")
    @Operation(summary = "Create an account and sign in")
    public AuthResponse register(@Valid @RequestBody RegisterRequest request, HttpServletRequest http) {
        return authService.register(request, ClientMetadataResolver.resolve(http));
    }

    @PostMapping("/login")
    @ResponseMessage("Logged in")
    @Operation(summary = "Exchange email and password for a token pair")
    public AuthResponse login(@Valid @RequestBody LoginRequest request, HttpServletRequest http) {
        return authService.login(request, ClientMetadataResolver.resolve(http));
    }

    @PostMapping("/refresh")
    @ResponseMessage("Token refreshed")
    @Operation(summary = "Rotate a refresh token; the presented one stops working")
    public AuthResponse refresh(@Valid @RequestBody RefreshTokenRequest request, HttpServletRequest http) {
        return authService.refresh(request, ClientMetadataResolver.resolve(http));
    }

    @PostMapping("/logout")
    @ResponseMessage("Logged out")
    @SecurityRequirement(name = "bearerAuth")
    @Operation(summary = "Revoke the current access token and every refresh token of the user")
    public SuccessResponse logout(@AuthenticationPrincipal AuthenticatedUser user, HttpServletRequest http) {
        String accessToken = http.getAttribute(JwtAuthFilter.ACCESS_TOKEN_ATTR) instanceof String s
                ? s
                : JwtAuthFilter.resolveBearerToken(http.getHeader(HttpHeaders.AUTHORIZATION));
        return authService.logout(user.id(), accessToken);
    }

    @GetMapping("/me")
    @SecurityRequirement(name = "bearerAuth")
    @Operation(summary = "Current user")
    public UserView me(@AuthenticationPrincipal AuthenticatedUser user) {
        return authService.me(user.id());
    }
}
