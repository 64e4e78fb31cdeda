package dev.issuebench.config;

import static org.junit.jupiter.api.Assertions.*;
import static org.junit.jupiter.api.Assumptions.assumeFalse;

import java.util.Map;
import org.junit.jupiter.api.Test;

public class BaseConfigTest {

    @Test
    void testGetConfigHierarchy() {
        TestConfig config =
                new TestConfig(Map.of("ISSUEBENCH_TEST_VAR1", "override", "PATH", "override"));

        // overrides take precedence, even over a variable every environment has
        assertEquals("override", config.getConfig("ISSUEBENCH_TEST_VAR1", "default"));
        assertEquals("override", config.getConfig("PATH", "default"));
        // finally, defaults
        assertEquals("default", config.getConfig("ISSUEBENCH_NON_EXISTENT_VAR", "default"));
    }

    @Test
    void testGetConfigFallsBackToEnvironment() {
        assumeFalse(System.getenv().isEmpty());
        var name = System.getenv().keySet().iterator().next();
        TestConfig config = new TestConfig(Map.of());

        assertEquals(System.getenv(name).trim(), config.getConfig(name, "default"));
    }

    @Test
    void testGetConfigWithNullDefault() {
        TestConfig config = new TestConfig(Map.of());
        String result = config.getConfig("ISSUEBENCH_NON_EXISTENT_VAR", null, String.class);
        assertNull(result);
    }

    @Test
    void testGetConfigTrimsValues() {
        TestConfig config = new TestConfig(Map.of("PADDED_VAR", "  42 "));

        assertEquals(42, config.getConfig("PADDED_VAR", 0));
    }

    @Test
    void testCastBoolean() {
        TestConfig config = new TestConfig(Map.of());

        Boolean result1 = config.cast("true", "BOOL_VAR", Boolean.class);
        assertTrue(result1);

        Boolean result2 = config.cast("false", "BOOL_VAR", Boolean.class);
        assertFalse(result2);

        boolean result3 = config.cast("true", "BOOL_VAR", boolean.class);
        assertTrue(result3);
    }

    @Test
    void testCastInteger() {
        TestConfig config = new TestConfig(Map.of());

        Integer result1 = config.cast("42", "INT_VAR", Integer.class);
        assertEquals(42, result1);

        int result2 = config.cast("123", "INT_VAR", int.class);
        assertEquals(123, result2);
    }

    @Test
    void testCastLong() {
        TestConfig config = new TestConfig(Map.of());

        Long result1 = config.cast("9223372036854775807", "LONG_VAR", Long.class);
        assertEquals(9223372036854775807L, result1);

        long result2 = config.cast("456", "LONG_VAR", long.class);
        assertEquals(456L, result2);
    }

    @Test
    void testCastDouble() {
        TestConfig config = new TestConfig(Map.of());

        Double result1 = config.cast("3.14159", "DOUBLE_VAR", Double.class);
        assertEquals(3.14159, result1, 0.00001);

        double result2 = config.cast("2.71828", "DOUBLE_VAR", double.class);
        assertEquals(2.71828, result2, 0.00001);
    }

    @Test
    void testCastMalformedNumberNamesTheSetting() {
        TestConfig config = new TestConfig(Map.of());

        var e =
                assertThrows(
                        IllegalArgumentException.class,
                        () -> config.cast("five", "ISSUEBENCH_DIFF_LIMIT", Integer.class));
        assertTrue(e.getMessage().contains("ISSUEBENCH_DIFF_LIMIT"));
        assertInstanceOf(NumberFormatException.class, e.getCause());
    }

    @Test
    void testCastUnsupportedType() {
        TestConfig config = new TestConfig(Map.of());

        assertThrows(
                IllegalArgumentException.class,
                () -> {
                    config.cast("test", "OBJECT_VAR", Object.class);
                });
    }

    @Test
    void testGetEnvValueFromOverrides() {
        TestConfig config = new TestConfig(Map.of("OVERRIDE_VAR", "override_value"));

        String result = config.getEnvValue("OVERRIDE_VAR");
        assertEquals("override_value", result);
    }

    @Test
    void testGetEnvValueNonExistent() {
        TestConfig config = new TestConfig(Map.of());

        String result = config.getEnvValue("ISSUEBENCH_NON_EXISTENT_VAR_12345");
        assertNull(result);
    }

    @Test
    void testNullSentinalHandling() {
        TestConfig config = new TestConfig(Map.of("PATH", BaseConfig.NULL_OVERRIDE));

        assertNull(config.getEnvValue("PATH"));
        assertEquals("default", config.getConfig("PATH", "default"));
    }

    @Test
    void testGetConfigWithNonNullDefaultThrowsOnNull() {
        TestConfig config = new TestConfig(Map.of());

        assertThrows(
                NullPointerException.class,
                () -> {
                    config.getConfig("TEST", (String) null);
                });
    }

    @Test
    void testIntegrationWithAllTypes() {
        Map<String, String> overrides =
                Map.of(
                        "STRING_VAR", "hello",
                        "BOOL_VAR", "true",
                        "INT_VAR", "42",
                        "LONG_VAR", "123456789",
                        "DOUBLE_VAR", "2.71828");

        TestConfig config = new TestConfig(overrides);

        assertEquals("hello", config.getConfig("STRING_VAR", "default"));
        assertEquals(true, config.getConfig("BOOL_VAR", false));
        assertEquals(42, config.getConfig("INT_VAR", 0));
        assertEquals(123456789L, config.getConfig("LONG_VAR", 0L));
        assertEquals(2.71828, config.getConfig("DOUBLE_VAR", 0.0), 0.00001);
    }

    static class TestConfig extends BaseConfig {
        TestConfig(Map<String, String> envOverrides) {
            super(envOverrides);
        }
    }
}
