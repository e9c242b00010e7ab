package com.syncnest.authstarter.dto;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.syncnest.authstarter.Validators.StrongPassword;
import jakarta.validation.constraints.Email;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.Size;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class RegisterRequest {

    @NotBlank(message = "Email cannot be empty")
    @Size(max = 255, message = "email must be <= 255 characters")
    @Email(message = "Invalid email format")
    private String email;

    @NotBlank(message = "Password cannot be empty")
    @StrongPassword
    @JsonProperty(access = JsonProperty.Access.WRITE_ONLY)
    private String password;

    @Size(max = 100, message = "firstName must be <= 100 characters")
    private String firstName;

    @Size(max = 100, message = "lastName must be <= 100 characters")
    private String lastName;
}
