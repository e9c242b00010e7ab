package com.syncnest.authstarter.utils;

import com.fasterxml.jackson.databind.ObjectMapper;
import jakarta.servlet.http.HttpServletRequest;
import jakarta.servlet.http.HttpServletResponse;
import org.slf4j.MDC;
import org.springframework.http.HttpStatus;
import org.springframework.http.ProblemDetail;
import org.springframework.lang.NonNull;
import org.springframework.lang.Nullable;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.net.URI;
import java.time.Clock;
import java.time.OffsetDateTime;

@Component
public class ErrorResponseWriter {

    private final ObjectMapper objectMapper;
    private final Clock clock;

    public ErrorResponseWriter(ObjectMapper objectMapper, Clock clock) {
        this.objectMapper = objectMapper;
        this.clock = clock;
    }

    public void write(@NonNull HttpServletRequest req,
                      @NonNull HttpServletResponse resp,
                      @NonNull HttpStatus status,
                      String type,              // e.g. "https://syncnest.dev/problems/unauthorized"
                      @NonNull String title,
                      @NonNull String detail) throws IOException {
        write(req, resp, status, type, title, detail, null);
    }

    public void write(@NonNull HttpServletRequest req,
                      @NonNull HttpServletResponse resp,
                      @NonNull HttpStatus status,
                      String type,
                      @NonNull String title,
                      @NonNull String detail,
                      @Nullable String code) throws IOException {

        if (resp.isCommitted()) return;

        ProblemDetail pd = ProblemDetail.forStatus(status);
        if (type != null && !type.isBlank()) {
            pd.setType(URI.create(type));
        }
        pd.setTitle(title);
        pd.setDetail(detail);

        // RFC 7807 recommended fields
        pd.setInstance(URI.create(req.getRequestURI()));

        // Common context
        pd.setProperty("timestamp", OffsetDateTime.now(clock).toString());
        pd.setProperty("path", req.getRequestURI());
        pd.setProperty("requestId", resolveRequestId(req, resp));
        if (code != null) {
            pd.setProperty("code", code);
        }

        resp.setStatus(status.value());
        resp.setHeader("Cache-Control", "no-store");
        resp.setHeader("Pragma", "no-cache");
        resp.setCharacterEncoding("UTF-8");
        resp.setContentType("application/problem+json");

        objectMapper.writeValue(resp.getOutputStream(), pd);
    }

    private String resolveRequestId(HttpServletRequest req, HttpServletResponse resp) {
        String id = resp.getHeader(RequestIdFilter.REQUEST_ID_HEADER);
        if (id == null || id.isBlank()) {
            Object attr = req.getAttribute(RequestIdFilter.REQUEST_ID_ATTR);
            if (attr instanceof String s && !s.isBlank()) {
                id = s;
            }
        }
        if (id == null || id.isBlank()) {
            id = MDC.get(RequestIdFilter.MDC_KEY);
        }
        return id;
    }
}
