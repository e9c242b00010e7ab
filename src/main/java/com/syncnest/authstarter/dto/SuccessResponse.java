package com.syncnest.authstarter.dto;

import lombok.Value;

@Value
public class SuccessResponse {
    boolean success;

    public static SuccessResponse ok() {
        return new SuccessResponse(true);
    }
}
