package com.syncnest.authstarter.dto;

import lombok.Builder;
import lombok.Value;

/** Where a token request came from. Both fields are optional. */
@Value
@Builder
public class ClientMetadata {
    String ipAddress;
    String userAgent;

    public static ClientMetadata empty() {
        return ClientMetadata.builder().build();
    }
}
