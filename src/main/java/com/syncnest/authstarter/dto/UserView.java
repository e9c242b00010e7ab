package com.syncnest.authstarter.dto;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.syncnest.authstarter.entity.UserRole;
import lombok.Builder;
import lombok.Value;

import java.time.LocalDateTime;

/** User as shown to clients; never carries the password hash. */
@Value
@Builder
@JsonInclude(JsonInclude.Include.NON_NULL)
public class UserView {
    Long id;
    String email;
    UserRole role;
    String firstName;
    String lastName;
    LocalDateTime createdAt;
    LocalDateTime updatedAt;
}
