package com.syncnest.authstarter.entity;

import java.util.Arrays;

public enum UserRole {
    ROLE_ADMIN(1),
    ROLE_MANAGER(2),
    ROLE_USER(3);

    private final int code;

    UserRole(int code) {
        this.code = code;
    }

    public int getCode() {
        return code;
    }

    /** Accepts the enum name ({@code ROLE_ADMIN}), the short name ({@code ADMIN}) or the numeric code. */
    public static UserRole parse(String value) {
        if (value == null || value.isBlank()) {
            throw new IllegalArgumentException("role is required");
        }
        String v = value.trim().toUpperCase();
        return Arrays.stream(values())
                .filter(r -> r.name().equals(v)
                        || r.name().equals("ROLE_" + v)
                        || String.valueOf(r.code).equals(v))
                .findFirst()
                .orElseThrow(() -> new IllegalArgumentException("Unknown role: " + value));
    }
}
