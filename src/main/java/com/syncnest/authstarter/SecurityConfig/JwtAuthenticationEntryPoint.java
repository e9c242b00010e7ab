package com.syncnest.authstarter.SecurityConfig;

import com.syncnest.authstarter.exception.ApiException;
import com.syncnest.authstarter.exception.AuthExceptions;
import com.syncnest.authstarter.utils.ErrorResponseWriter;
import com.syncnest.authstarter.utils.LocalizedMessages;
import jakarta.servlet.http.HttpServletRequest;
import jakarta.servlet.http.HttpServletResponse;
import lombok.extern.slf4j.Slf4j;
import org.springframework.lang.NonNull;
import org.springframework.security.core.AuthenticationException;
import org.springframework.security.web.AuthenticationEntryPoint;
import org.springframework.stereotype.Component;

import java.io.IOException;

/**
 * Sends 401 Unauthorized for unauthenticated requests, with the reason recorded by
 * {@link JwtAuthFilter} as {@code code} (token_missing when no token was sent).
 * Adds RFC 6750 WWW-Authenticate hint when the client attempted Bearer auth.
 */
@Slf4j
@Component
public class JwtAuthenticationEntryPoint implements AuthenticationEntryPoint {

    private final ErrorResponseWriter writer;
    private final LocalizedMessages messages;

    public JwtAuthenticationEntryPoint(ErrorResponseWriter writer, LocalizedMessages messages) {
        this.writer = writer;
        this.messages = messages;
    }

    @Override
    public void commence(@NonNull HttpServletRequest request,
                         @NonNull HttpServletResponse response,
                         @NonNull AuthenticationException authException) throws IOException {
        ApiException cause = request.getAttribute(JwtAuthFilter.AUTH_ERROR_ATTR) instanceof ApiException ex
                ? ex
                : new AuthExceptions.TokenMissing();

        if (!(cause instanceof AuthExceptions.TokenMissing)) {
            response.setHeader("WWW-Authenticate", "Bearer error=\"invalid_token\"");
        } else {
            response.setHeader("WWW-Authenticate", "Bearer");
        }

        writer.write(
                request,
                response,
                cause.getStatus(),
                cause.getType(),
                cause.getTitle(),
                messages.resolve(cause.getMessageKey(), cause.getMessage()),
                cause.code()
        );
    }
}
