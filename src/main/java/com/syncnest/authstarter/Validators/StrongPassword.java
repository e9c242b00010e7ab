package com.syncnest.authstarter.Validators;

import jakarta.validation.Constraint;
import jakarta.validation.Payload;

import java.lang.annotation.*;

/**
 * At least 8 characters with an upper-case letter, a lower-case letter, a digit
 * and one of {@code @$!%*?&}.
 */
@Documented
@Constraint(validatedBy = StrongPasswordValidator.class)
@Target({ElementType.FIELD, ElementType.PARAMETER})
@Retention(RetentionPolicy.RUNTIME)
public @interface StrongPassword {
    String message() default "Password must be at least 8 characters and contain an uppercase letter, a lowercase letter, a digit and a special character (@$!%*?&).";

    Class<?>[] groups() default {};

    Class<? extends Payload>[] payload() default {};
}
