package com.syncnest.authstarter.Validators;

import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.NullAndEmptySource;
import org.junit.jupiter.params.provider.ValueSource;

import static org.junit.jupiter.api.Assertions.*;

class StrongPasswordValidatorTest {

    private final StrongPasswordValidator validator = new StrongPasswordValidator();

    @ParameterizedTest
    @ValueSource(strings = {"Sup3r$ecret", "Aa1@aaaa", "P4ssw0rd!"})
    void accepts(String password) {
        assertTrue(validator.isValid(password, null));
    }

    @ParameterizedTest
    @NullAndEmptySource
    @ValueSource(strings = {"Aa1@aaa", "alllower1@", "ALLUPPER1@", "NoDigits@@", "NoSpecial11"})
    void rejects(String password) {
        assertFalse(validator.isValid(password, null));
    }
}
