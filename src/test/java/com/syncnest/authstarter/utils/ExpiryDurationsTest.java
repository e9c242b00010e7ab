package com.syncnest.authstarter.utils;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.ValueSource;

import static org.junit.jupiter.api.Assertions.*;

class ExpiryDurationsTest {

    @Nested
    @DisplayName("toSeconds")
    class ToSeconds {

        @Test
        void unitsAreApplied() {
            assertEquals(45, ExpiryDurations.toSeconds("45s"));
            assertEquals(900, ExpiryDurations.toSeconds("15m"));
            assertEquals(7200, ExpiryDurations.toSeconds("2h"));
            assertEquals(604_800, ExpiryDurations.toSeconds("7d"));
        }

        @Test
        @DisplayName("a bare number is seconds")
        void bareNumberIsSeconds() {
            assertEquals(900, ExpiryDurations.toSeconds("900"));
        }

        @Test
        void surroundingWhitespaceAndUpperCaseUnitAreAccepted() {
            assertEquals(3600, ExpiryDurations.toSeconds(" 1H "));
        }

        @ParameterizedTest
        @ValueSource(strings = {"", " ", "1w", "10ms", "-5s", "1.5h", "h", "abc", "5 m"})
        void rejectsAnythingElse(String value) {
            assertThrows(IllegalArgumentException.class, () -> ExpiryDurations.toSeconds(value));
        }

        @Test
        void rejectsNull() {
            assertThrows(IllegalArgumentException.class, () -> ExpiryDurations.toSeconds(null));
        }
    }

    @Test
    void toDaysAllowsFractions() {
        assertEquals(7.0, ExpiryDurations.toDays("7d"));
        assertEquals(1.5, ExpiryDurations.toDays("36h"));
    }
}
