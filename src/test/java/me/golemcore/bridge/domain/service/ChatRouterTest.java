package me.golemcore.bridge.domain.service;

import me.golemcore.bridge.domain.model.BridgeConfig;
import me.golemcore.bridge.domain.model.ConversationMapping;
import me.golemcore.bridge.domain.model.Message;
import me.golemcore.bridge.domain.model.MessageKind;
import me.golemcore.bridge.domain.model.ProviderRequest;
import me.golemcore.bridge.domain.model.TransportKind;
import me.golemcore.bridge.infrastructure.config.BridgeProperties;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.nio.file.Path;
import java.time.Duration;
import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

class ChatRouterTest {

    private static final Instant ARRIVED = Instant.parse("2026-10-18T10:00:00Z");

    private ChatRouter router;
    private ConversationMapping vanDog;
    private ConversationMapping capivara;

    @BeforeEach
    void setUp() {
        capivara = ConversationMapping.builder()
                .name("Capivara")
                .transport(TransportKind.UI)
                .providerId("chatgpt")
                .timeout(Duration.ofSeconds(30))
                .build();
        vanDog = ConversationMapping.builder()
                .name("VanDog")
                .transport(TransportKind.API)
                .providerId("openai")
                .textModel("gpt-4o-mini")
                .visionModel("gpt-4o")
                .textPromptTemplate("Answer briefly: {message}")
                .imagePromptTemplate("What is in this picture? {message}")
                .build();
        ConversationMapping disabled = ConversationMapping.builder()
                .name("Research")
                .transport(TransportKind.UI)
                .providerId("chatgpt")
                .enabled(false)
                .build();

        Map<String, ConversationMapping> conversations = new LinkedHashMap<>();
        conversations.put("VanDog", vanDog);
        conversations.put("Research", disabled);
        conversations.put("Capivara", capivara);
        BridgeConfig config = BridgeConfig.builder()
                .messagingUrl("https://web.example.com")
                .providers(Map.of())
                .conversations(conversations)
                .build();

        BridgeProperties properties = new BridgeProperties();
        properties.getTiming().setMaxResponseWait(Duration.ofSeconds(120));
        properties.getTiming().setResponseWaitText(Duration.ofSeconds(2));
        properties.getTiming().setResponseWaitImage(Duration.ofSeconds(5));
        router = new ChatRouter(config, new PromptComposer(), properties);
    }

    @Test
    void resolvesConfiguredConversation() {
        assertEquals(vanDog, router.resolve("VanDog").orElseThrow());
    }

    @Test
    void resolutionIsCaseSensitive() {
        assertTrue(router.resolve("vandog").isEmpty());
        assertTrue(router.resolve(null).isEmpty());
    }

    @Test
    void conversationsKeepConfigurationOrderAndSkipDisabled() {
        List<String> names = router.conversations().stream().map(ConversationMapping::getName).toList();

        assertEquals(List.of("VanDog", "Capivara"), names);
    }

    @Test
    void textMessageUsesTextModelAndTemplate() {
        ProviderRequest request = router.route(vanDog, text("VanDog", "Is it raining?"));

        assertEquals("Answer briefly: Is it raining?", request.getPrompt());
        assertEquals("gpt-4o-mini", request.getModel());
        assertEquals(Duration.ofSeconds(120), request.getTimeout());
        assertEquals(Duration.ofSeconds(2), request.getResponseWait());
        assertFalse(request.hasImage());
    }

    @Test
    void imageMessageUsesVisionModelAndImageTemplate() {
        Message image = Message.builder()
                .conversation("VanDog")
                .kind(MessageKind.IMAGE)
                .content("image:row-1")
                .caption("which breed?")
                .imageRef(Path.of("/tmp/dog.jpg"))
                .arrivedAt(ARRIVED)
                .build();

        ProviderRequest request = router.route(vanDog, image);

        assertEquals("What is in this picture? which breed?", request.getPrompt());
        assertEquals("gpt-4o", request.getModel());
        assertEquals(Path.of("/tmp/dog.jpg"), request.getImageRef());
        assertEquals(Duration.ofSeconds(5), request.getResponseWait());
    }

    @Test
    void conversationTimeoutOverridesGlobalWait() {
        ProviderRequest request = router.route(capivara, text("Capivara", "Hello"));

        assertEquals("Hello", request.getPrompt());
        assertEquals(Duration.ofSeconds(30), request.getTimeout());
    }

    @Test
    void imageWithoutMaterializedFileIsUnroutable() {
        Message image = Message.builder()
                .conversation("VanDog")
                .kind(MessageKind.IMAGE)
                .content("image:row-2")
                .arrivedAt(ARRIVED)
                .build();

        assertThrows(ChatRouter.UnroutableMessageException.class, () -> router.route(vanDog, image));
    }

    @Test
    void blankTextIsUnroutable() {
        assertThrows(ChatRouter.UnroutableMessageException.class,
                () -> router.route(capivara, text("Capivara", "   ")));
    }

    private static Message text(String conversation, String content) {
        return Message.builder()
                .conversation(conversation)
                .kind(MessageKind.TEXT)
                .content(content)
                .arrivedAt(ARRIVED)
                .build();
    }
}
