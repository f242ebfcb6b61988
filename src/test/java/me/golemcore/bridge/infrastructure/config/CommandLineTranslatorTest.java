package me.golemcore.bridge.infrastructure.config;

import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

class CommandLineTranslatorTest {

    @Test
    void shouldTranslateSeparateValues() {
        String[] translated = CommandLineTranslator.translate("--config", "/etc/bridge.json", "--log-level", "DEBUG");

        assertArrayEquals(new String[] { "--bridge.config-path=/etc/bridge.json", "--logging.level.root=DEBUG" },
                translated);
    }

    @Test
    void shouldTranslateInlineValues() {
        String[] translated = CommandLineTranslator.translate("--log-file=/var/log/bridge.log");

        assertArrayEquals(new String[] { "--logging.file.name=/var/log/bridge.log" }, translated);
    }

    @Test
    void shouldPassThroughOtherArguments() {
        String[] translated = CommandLineTranslator.translate("--bridge.browser.headless=true", "--config=a.json");

        assertArrayEquals(new String[] { "--bridge.browser.headless=true", "--bridge.config-path=a.json" },
                translated);
    }

    @Test
    void shouldRejectFlagWithoutValue() {
        assertThrows(ConfigurationException.class, () -> CommandLineTranslator.translate("--config"));
        assertThrows(ConfigurationException.class,
                () -> CommandLineTranslator.translate("--log-level", "--config=a.json"));
        assertThrows(ConfigurationException.class, () -> CommandLineTranslator.translate("--log-file="));
    }

    @Test
    void shouldAcceptNoArguments() {
        assertEquals(0, CommandLineTranslator.translate().length);
    }
}
