package me.christianrobert.pysourcegen.config.service;

import me.christianrobert.pysourcegen.unparser.dialect.PythonVersion;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

class ConfigServiceTest {

    private ConfigService configService;

    @BeforeEach
    void setUp() {
        configService = new ConfigService();
    }

    @Test
    void defaults() {
        assertEquals("    ", configService.getRenderOptions().getIndentUnit());
        assertEquals(PythonVersion.PY36, configService.getDefaultVersion());
        assertFalse(configService.isIncludeTree());
        assertTrue(configService.hasConfigKey(ConfigService.INDENT_UNIT));
    }

    @Test
    void indentAsTextOrWidth() {
        configService.setConfigValue(ConfigService.INDENT_UNIT, "\t");
        assertEquals("\t", configService.getRenderOptions().getIndentUnit());

        configService.setConfigValue(ConfigService.INDENT_UNIT, 3);
        assertEquals("   ", configService.getRenderOptions().getIndentUnit());
    }

    @Test
    void booleanFromString() {
        configService.updateConfiguration(Map.of(ConfigService.INCLUDE_TREE, "true"));

        assertTrue(configService.isIncludeTree());
    }

    @Test
    void unknownDefaultDialectIsRejectedOnRead() {
        configService.setConfigValue(ConfigService.DEFAULT_DIALECT, "2.5");

        assertThrows(IllegalArgumentException.class, () -> configService.getDefaultVersion());
    }

    @Test
    void resetRestoresDefaults() {
        configService.updateConfiguration(Map.of(ConfigService.DEFAULT_DIALECT, "py27", "custom", 1));

        configService.resetToDefaults();

        assertEquals("3.6", configService.getConfigValueAsString(ConfigService.DEFAULT_DIALECT));
        assertFalse(configService.hasConfigKey("custom"));
    }
}
