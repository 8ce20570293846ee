package com.reactive.xray.config;

import com.typesafe.config.Config;
import com.typesafe.config.ConfigFactory;
import org.junit.jupiter.api.Test;

import java.util.Optional;

import static org.junit.jupiter.api.Assertions.*;

class ConfigAccessorTest {

    private final Config config = ConfigFactory.parseString("""
        name = "checkout"
        number = 42
        flag = true
        mode = "Fast-Path"
        nested { inner = "x" }
        """);

    @Test
    void stringFallsBackWhenMissing() {
        assertEquals(Optional.of("checkout"), ConfigAccessor.string(config, "name"));
        assertEquals("fallback", ConfigAccessor.string(config, "missing", "fallback"));
    }

    @Test
    void strictStringRejectsCoercibleValues() {
        assertEquals(Optional.of("checkout"), ConfigAccessor.strictString(config, "name"));
        assertEquals(Optional.empty(), ConfigAccessor.strictString(config, "number"));
        assertEquals(Optional.empty(), ConfigAccessor.strictString(config, "flag"));
        assertEquals(Optional.empty(), ConfigAccessor.strictString(config, "missing"));
    }

    @Test
    void boolAndNested() {
        assertTrue(ConfigAccessor.bool(config, "flag", false));
        assertFalse(ConfigAccessor.bool(config, "missing", false));
        assertEquals("x", ConfigAccessor.nested(config, "nested").orElseThrow().getString("inner"));
    }

    enum Mode { FAST_PATH, SLOW }

    @Test
    void enumValAcceptsDashesAndAnyCase() {
        assertEquals(Mode.FAST_PATH, ConfigAccessor.enumVal(config, "mode", Mode.class, Mode.SLOW));
        assertEquals(Mode.SLOW, ConfigAccessor.enumVal(config, "missing", Mode.class, Mode.SLOW));
    }

    @Test
    void enumValRejectsUnknownConstant() {
        assertThrows(IllegalArgumentException.class,
            () -> ConfigAccessor.enumVal(config, "name", Mode.class, Mode.SLOW));
    }
}
