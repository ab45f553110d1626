package me.christianrobert.pystyle.config.service;

import me.christianrobert.pystyle.config.model.ConversionConfig;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.util.HashMap;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

class ConfigServiceTest {

    private ConfigService configService;

    @BeforeEach
    void setUp() {
        configService = new ConfigService();
    }

    @Test
    void defaultsMatchConversionConfigDefaults() {
        assertEquals(ConversionConfig.defaults(), configService.getConversionConfig());
        assertEquals("pythva.generated", configService.getConfigValueAsString(ConfigService.PACKAGE_NAME));
        assertEquals(Integer.valueOf(4), configService.getConfigValueAsInteger(ConfigService.INDENT_SIZE));
    }

    @Test
    void stringValuesAreConverted() {
        Map<String, Object> update = new HashMap<>();
        update.put(ConfigService.INDENT_SIZE, " 2 ");
        update.put(ConfigService.ADD_ACCESS_MODIFIERS, "false");
        update.put(ConfigService.CACHE_CAPACITY, "50");
        configService.updateConfiguration(update);

        ConversionConfig config = configService.getConversionConfig();

        assertEquals(2, config.getIndentSize());
        assertFalse(config.isAddAccessModifiers());
        assertEquals(50, config.getCacheCapacity());
    }

    @Test
    void nonNumericValueIsRejected() {
        configService.setConfigValue(ConfigService.INDENT_SIZE, "wide");

        assertThrows(IllegalArgumentException.class, () -> configService.getConversionConfig());
    }

    @Test
    void outOfRangeValuesAreRejected() {
        configService.setConfigValue(ConfigService.INDENT_SIZE, 0);
        assertThrows(IllegalArgumentException.class, () -> configService.getConversionConfig());

        configService.resetToDefaults();
        configService.setConfigValue(ConfigService.CACHE_CAPACITY, -1);
        assertThrows(IllegalArgumentException.class, () -> configService.getConversionConfig());
    }

    @Test
    void blankPackageNameOnlyMattersWithDeclaration() {
        configService.setConfigValue(ConfigService.PACKAGE_NAME, " ");
        assertThrows(IllegalArgumentException.class, () -> configService.getConversionConfig());

        configService.setConfigValue(ConfigService.ADD_PACKAGE_DECLARATION, false);
        assertFalse(configService.getConversionConfig().isAddPackageDeclaration());
    }

    @Test
    void resetRestoresDefaults() {
        configService.setConfigValue(ConfigService.ENABLE_TYPE_INFERENCE, false);
        configService.setConfigValue("custom.key", "value");

        configService.resetToDefaults();

        assertTrue(configService.getConversionConfig().isEnableTypeInference());
        assertFalse(configService.hasConfigKey("custom.key"));
    }

    @Test
    void configIsASnapshot() {
        ConversionConfig before = configService.getConversionConfig();

        configService.setConfigValue(ConfigService.INDENT_SIZE, 8);

        assertEquals(4, before.getIndentSize());
        assertEquals(8, configService.getConversionConfig().getIndentSize());
        assertNotEquals(before, configService.getConversionConfig());
    }
}
