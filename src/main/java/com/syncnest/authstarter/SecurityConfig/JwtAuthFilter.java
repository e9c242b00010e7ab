package com.syncnest.authstarter.SecurityConfig;

import com.syncnest.authstarter.exception.ApiException;
import jakarta.servlet.FilterChain;
import jakarta.servlet.ServletException;
import jakarta.servlet.http.HttpServletRequest;
import jakarta.servlet.http.HttpServletResponse;
import lombok.NonNull;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpHeaders;
import org.springframework.security.authentication.UsernamePasswordAuthenticationToken;
import org.springframework.security.core.context.SecurityContext;
import org.springframework.security.core.context.SecurityContextHolder;
import org.springframework.security.web.authentication.WebAuthenticationDetailsSource;
import org.springframework.stereotype.Component;
import org.springframework.util.StringUtils;
import org.springframework.web.filter.OncePerRequestFilter;

import java.io.IOException;

/**
 * Authenticates requests carrying {@code Authorization: Bearer <token>}.
 * A rejected token leaves the request anonymous and records the reason under
 * {@link #AUTH_ERROR_ATTR} for {@link JwtAuthenticationEntryPoint}; public endpoints still run.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class JwtAuthFilter extends OncePerRequestFilter {

    public static final String AUTH_ERROR_ATTR = "SYNCNEST_AUTH_ERROR";
    public static final String ACCESS_TOKEN_ATTR = "SYNCNEST_ACCESS_TOKEN";
    private static final String BEARER_PREFIX = "Bearer ";

    private final AccessTokenAuthenticator authenticator;

    @Override
    protected void doFilterInternal(@NonNull HttpServletRequest request,
                                    @NonNull HttpServletResponse response,
                                    @NonNull FilterChain filterChain) throws ServletException, IOException {

        // 1) Extract Bearer token quickly
        final String token = resolveBearerToken(request.getHeader(HttpHeaders.AUTHORIZATION));
        if (token == null || SecurityContextHolder.getContext().getAuthentication() != null) {
            filterChain.doFilter(request, response);
            return;
        }

        // 2) Blacklist, signature/claims, user lookup
        try {
            AuthenticatedUser principal = authenticator.authenticate(token);

            SecurityContext securityContext = SecurityContextHolder.createEmptyContext();
            UsernamePasswordAuthenticationToken authToken =
                    new UsernamePasswordAuthenticationToken(principal, null, principal.authorities());
            authToken.setDetails(new WebAuthenticationDetailsSource().buildDetails(request));
            securityContext.setAuthentication(authToken);
            SecurityContextHolder.setContext(securityContext);
            request.setAttribute(ACCESS_TOKEN_ATTR, token);
        } catch (ApiException ex) {
            log.debug("Bearer token rejected: {}", ex.code());
            request.setAttribute(AUTH_ERROR_ATTR, ex);
        }

        // 3) Continue filter chain
        filterChain.doFilter(request, response);
    }

    /** {@code Bearer <token>} (scheme case-insensitive) or null. */
    public static String resolveBearerToken(String authHeader) {
        if (!StringUtils.hasText(authHeader) || authHeader.length() <= BEARER_PREFIX.length()) {
            return null;
        }
        if (!authHeader.regionMatches(true, 0, BEARER_PREFIX, 0, BEARER_PREFIX.length())) {
            return null;
        }
        String token = authHeader.substring(BEARER_PREFIX.length()).trim();
        return token.isEmpty() ? null : token;
    }
}
