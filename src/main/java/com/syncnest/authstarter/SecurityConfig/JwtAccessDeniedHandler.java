package com.syncnest.authstarter.SecurityConfig;

import com.syncnest.authstarter.utils.ErrorMessages;
import com.syncnest.authstarter.utils.ErrorResponseWriter;
import com.syncnest.authstarter.utils.LocalizedMessages;
import jakarta.servlet.http.HttpServletRequest;
import jakarta.servlet.http.HttpServletResponse;
import org.springframework.http.HttpStatus;
import org.springframework.lang.NonNull;
import org.springframework.security.access.AccessDeniedException;
import org.springframework.security.web.access.AccessDeniedHandler;
import org.springframework.stereotype.Component;

import java.io.IOException;

/**
 * Sends 403 Forbidden for authenticated requests that lack the required role.
 */
@Component
public class JwtAccessDeniedHandler implements AccessDeniedHandler {

    private final ErrorResponseWriter writer;
    private final LocalizedMessages messages;

    public JwtAccessDeniedHandler(ErrorResponseWriter writer, LocalizedMessages messages) {
        this.writer = writer;
        this.messages = messages;
    }

    @Override
    public void handle(@NonNull HttpServletRequest request,
                       @NonNull HttpServletResponse response,
                       @NonNull AccessDeniedException accessDeniedException) throws IOException {
        writer.write(
                request,
                response,
                HttpStatus.FORBIDDEN,
                "https://syncnest.dev/problems/forbidden",
                "Forbidden",
                messages.resolve(ErrorMessages.Errors.FORBIDDEN, "You do not have permission to access this resource.")
        );
    }
}
