package com.syncnest.authstarter.utils;

import com.syncnest.authstarter.dto.ClientMetadata;
import jakarta.servlet.http.HttpServletRequest;
import org.springframework.http.HttpHeaders;
import org.springframework.util.StringUtils;

/** Origin address and user agent of a request, as stored alongside refresh tokens. */
public final class ClientMetadataResolver {

    private static final int MAX_USER_AGENT = 255;

    private ClientMetadataResolver() {}

    public static ClientMetadata resolve(HttpServletRequest request) {
        return ClientMetadata.builder()
                .ipAddress(clientIp(request))
                .userAgent(truncate(request.getHeader(HttpHeaders.USER_AGENT)))
                .build();
    }

    /** First X-Forwarded-For hop when present, else the socket peer. */
    static String clientIp(HttpServletRequest request) {
        String xfHeader = request.getHeader("X-Forwarded-For");
        if (StringUtils.hasText(xfHeader)) {
            String first = xfHeader.split(",")[0].trim();
            if (!first.isEmpty()) {
                return first;
            }
        }
        return request.getRemoteAddr();
    }

    private static String truncate(String userAgent) {
        if (userAgent == null || userAgent.length() <= MAX_USER_AGENT) return userAgent;
        return userAgent.substring(0, MAX_USER_AGENT);
    }
}
