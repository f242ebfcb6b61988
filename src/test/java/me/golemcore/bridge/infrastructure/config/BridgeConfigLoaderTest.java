package me.golemcore.bridge.infrastructure.config;

import me.golemcore.bridge.domain.model.BridgeConfig;
import me.golemcore.bridge.domain.model.ConversationMapping;
import me.golemcore.bridge.domain.model.ProviderDefinition;
import me.golemcore.bridge.domain.model.TransportKind;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.net.URISyntaxException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Duration;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class BridgeConfigLoaderTest {

    @TempDir
    Path tempDir;

    private final BridgeConfigLoader loader = new BridgeConfigLoader(BridgeConfiguration.objectMapper());

    @Test
    void shouldLoadFullConfiguration() throws URISyntaxException {
        BridgeConfig config = loader.load(fixture("/config/bridge.json"));

        assertEquals("https://web.whatsapp.com", config.getMessagingUrl());
        assertEquals(List.of("Family"), config.getIgnored());
        assertTrue(config.isIgnored("Family"));
        assertEquals(List.of("chatgpt", "perplexity-web", "openai"), List.copyOf(config.getProviders().keySet()));
        assertEquals(List.of("Capivara", "VanDog", "Research"), List.copyOf(config.getConversations().keySet()));
    }

    @Test
    void shouldMapUiProvider() throws URISyntaxException {
        ProviderDefinition chatgpt = loader.load(fixture("/config/bridge.json")).getProviders().get("chatgpt");

        assertEquals(TransportKind.UI, chatgpt.getTransport());
        assertEquals("#prompt-textarea", chatgpt.getInputSelector());
        assertEquals("input[type='file']", chatgpt.getUploadSelector());
        assertTrue(chatgpt.isReloadAfterResponse());
        assertEquals(4000, chatgpt.getMaxPromptChars());
        assertEquals("#prompt-textarea", chatgpt.effectiveReadySelector());
    }

    @Test
    void shouldDefaultToUiTransport() throws URISyntaxException {
        ProviderDefinition provider = loader.load(fixture("/config/bridge.json")).getProviders().get("perplexity-web");

        assertEquals(TransportKind.UI, provider.getTransport());
        assertEquals(8000, provider.getMaxPromptChars());
        assertFalse(provider.isReloadAfterResponse());
    }

    @Test
    void shouldMapConversations() throws URISyntaxException {
        BridgeConfig config = loader.load(fixture("/config/bridge.json"));

        ConversationMapping capivara = config.getConversations().get("Capivara");
        assertEquals("chatgpt", capivara.getProviderId());
        assertEquals(TransportKind.UI, capivara.getTransport());
        assertEquals(Duration.ofSeconds(30), capivara.getTimeout());
        assertTrue(capivara.isEnabled());

        ConversationMapping vanDog = config.getConversations().get("VanDog");
        assertEquals(TransportKind.API, vanDog.getTransport());
        assertEquals("gpt-4o-mini", vanDog.getTextModel());
        assertEquals("gpt-4o", vanDog.getVisionModel());
        assertEquals("Answer briefly: {message}", vanDog.getTextPromptTemplate());
        assertEquals(Duration.ofSeconds(1), vanDog.getResponseWait());
        assertNull(vanDog.getTimeout());

        assertFalse(config.getConversations().get("Research").isEnabled());
    }

    @Test
    void shouldRejectMissingFile() {
        Path missing = tempDir.resolve("absent.json");

        ConfigurationException ex = assertThrows(ConfigurationException.class, () -> loader.load(missing));
        assertTrue(ex.getMessage().contains("Cannot read"));
    }

    @Test
    void shouldRejectInvalidJson() throws IOException {
        Path file = write("{\"messaging_url\": ");

        ConfigurationException ex = assertThrows(ConfigurationException.class, () -> loader.load(file));
        assertTrue(ex.getMessage().startsWith("Invalid configuration file"));
    }

    @Test
    void shouldRequireMessagingUrl() throws IOException {
        Path file = write("{\"providers\": {\"openai\": {\"transport\": \"api\", \"platform\": \"openai\"}}}");

        ConfigurationException ex = assertThrows(ConfigurationException.class, () -> loader.load(file));
        assertEquals("messaging_url is required", ex.getMessage());
    }

    @Test
    void shouldRequireProviders() throws IOException {
        Path file = write("{\"messaging_url\": \"https://web.whatsapp.com\"}");

        assertThrows(ConfigurationException.class, () -> loader.load(file));
    }

    @Test
    void shouldRequireSelectorsOfUiProvider() throws IOException {
        Path file = write("""
                {"messaging_url": "https://web.whatsapp.com",
                 "providers": {"chatgpt": {"url": "https://chatgpt.com", "input_selector": "#prompt"}}}
                """);

        ConfigurationException ex = assertThrows(ConfigurationException.class, () -> loader.load(file));
        assertEquals("Provider 'chatgpt' is missing response_selector", ex.getMessage());
    }

    @Test
    void shouldRequirePlatformOfApiProvider() throws IOException {
        Path file = write("""
                {"messaging_url": "https://web.whatsapp.com",
                 "providers": {"openai": {"transport": "api"}}}
                """);

        assertThrows(ConfigurationException.class, () -> loader.load(file));
    }

    @Test
    void shouldRejectUnknownTransport() throws IOException {
        Path file = write("""
                {"messaging_url": "https://web.whatsapp.com",
                 "providers": {"carrier": {"transport": "pigeon"}}}
                """);

        ConfigurationException ex = assertThrows(ConfigurationException.class, () -> loader.load(file));
        assertTrue(ex.getMessage().contains("unknown transport"));
    }

    @Test
    void shouldRejectConversationWithUnknownProvider() throws IOException {
        Path file = write("""
                {"messaging_url": "https://web.whatsapp.com",
                 "providers": {"openai": {"transport": "api", "platform": "openai"}},
                 "conversations": {"Capivara": {"provider": "chatgpt"}}}
                """);

        ConfigurationException ex = assertThrows(ConfigurationException.class, () -> loader.load(file));
        assertTrue(ex.getMessage().contains("unknown provider: chatgpt"));
    }

    @Test
    void shouldRejectNonPositiveTimeout() throws IOException {
        Path file = write("""
                {"messaging_url": "https://web.whatsapp.com",
                 "providers": {"openai": {"transport": "api", "platform": "openai"}},
                 "conversations": {"VanDog": {"provider": "openai", "timeout_seconds": 0}}}
                """);

        assertThrows(ConfigurationException.class, () -> loader.load(file));
    }

    private Path fixture(String resource) throws URISyntaxException {
        return Path.of(getClass().getResource(resource).toURI());
    }

    private Path write(String json) throws IOException {
        Path file = tempDir.resolve("config.json");
        Files.writeString(file, json, StandardCharsets.UTF_8);
        return file;
    }
}
