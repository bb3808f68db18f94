package com.rpgtools.prereq.common;

import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.util.HashMap;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

class IEnvGetterTest {

    @Nested
    class IntOr {
        @Test
        void parsesTrimmedValue() {
            assertEquals(8, IEnvGetter.of(Map.of("N", " 8 ")).intOr("N", 1));
        }

        @Test
        void defaultsWhenMissingOrBlank() {
            assertEquals(1, IEnvGetter.of(Map.of()).intOr("N", 1));
            assertEquals(1, IEnvGetter.of(Map.of("N", "  ")).intOr("N", 1));
        }

        @Test
        void garbageNamesTheVariable() {
            var ex = assertThrows(IllegalStateException.class, () -> IEnvGetter.of(Map.of("N", "eight")).intOr("N", 1));
            assertEquals("Invalid integer for environment variable: N = 'eight'", ex.getMessage());
        }
    }

    @Nested
    class BooleanOr {
        @Test
        void onlyTrueIsTrue() {
            assertTrue(IEnvGetter.of(Map.of("FLAG", "TrUe")).booleanOr("FLAG", false));
            assertFalse(IEnvGetter.of(Map.of("FLAG", "yes")).booleanOr("FLAG", true));
        }

        @Test
        void defaultsWhenMissing() {
            assertTrue(IEnvGetter.of(Map.of()).booleanOr("FLAG", true));
        }
    }

    @Test
    void ofTakesASnapshot() {
        Map<String, String> values = new HashMap<>(Map.of("N", "2"));
        IEnvGetter env = IEnvGetter.of(values);
        values.put("N", "3");
        assertEquals(2, env.intOr("N", 0));
    }

    @Test
    void fixedClock() {
        assertEquals(1_000L, ITimeService.fixed(1_000L).now().toEpochMilli());
    }
}
