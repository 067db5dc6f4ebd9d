package com.visprog.common;

import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

class IEnvGetterTest {

    private static IEnvGetter env(Map<String, String> kv) {
        return kv::get;
    }

    @Nested
    class OptionalGetters {
        @Test
        void stringFallsBackWhenBlank() {
            assertEquals("d", IEnvGetter.getStringOr(env(Map.of("X", " ")), "X", "d"));
            assertEquals("v", IEnvGetter.getStringOr(env(Map.of("X", " v ")), "X", "d"));
        }

        @Test
        void booleanParsesStrictly() {
            assertTrue(IEnvGetter.getBooleanOr(env(Map.of("F", "TRUE")), "F", false));
            assertFalse(IEnvGetter.getBooleanOr(env(Map.of("F", "false")), "F", true));
            assertTrue(IEnvGetter.getBooleanOr(env(Map.of()), "F", true));
            assertThrows(IllegalStateException.class, () -> IEnvGetter.getBooleanOr(env(Map.of("F", "yes")), "F", false));
        }
    }
}
