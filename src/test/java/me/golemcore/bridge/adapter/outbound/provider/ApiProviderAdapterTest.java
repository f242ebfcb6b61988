package me.golemcore.bridge.adapter.outbound.provider;

import me.golemcore.bridge.adapter.outbound.image.ImageCompressor;
import me.golemcore.bridge.domain.model.FailureKind;
import me.golemcore.bridge.domain.model.ProviderDefinition;
import me.golemcore.bridge.domain.model.ProviderRequest;
import me.golemcore.bridge.domain.model.ProviderResponse;
import me.golemcore.bridge.domain.model.SessionState;
import me.golemcore.bridge.domain.model.TransportKind;
import me.golemcore.bridge.domain.service.ResponseTextCleaner;
import me.golemcore.bridge.infrastructure.config.BridgeProperties;
import me.golemcore.bridge.testsupport.ClockAdvancingSleeper;
import me.golemcore.bridge.testsupport.MutableClock;
import dev.langchain4j.data.message.AiMessage;
import dev.langchain4j.data.message.ImageContent;
import dev.langchain4j.data.message.TextContent;
import dev.langchain4j.data.message.UserMessage;
import dev.langchain4j.exception.AuthenticationException;
import dev.langchain4j.exception.HttpException;
import dev.langchain4j.exception.InternalServerException;
import dev.langchain4j.exception.InvalidRequestException;
import dev.langchain4j.exception.RateLimitException;
import dev.langchain4j.exception.TimeoutException;
import dev.langchain4j.model.chat.ChatModel;
import dev.langchain4j.model.chat.request.ChatRequest;
import dev.langchain4j.model.chat.response.ChatResponse;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.mockito.ArgumentCaptor;

import java.io.IOException;
import java.nio.file.Path;
import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.Mockito.*;

class ApiProviderAdapterTest {

    private static final String MODEL = "gpt-4o-mini";

    private ChatModel model;
    private ChatModelFactory chatModelFactory;
    private ImageCompressor imageCompressor;
    private BridgeProperties.PlatformProperties settings;
    private BridgeProperties.RetryProperties retry;
    private MutableClock clock;
    private ClockAdvancingSleeper sleeper;
    private ExecutorService executor;

    @BeforeEach
    void setUp() {
        model = mock(ChatModel.class);
        chatModelFactory = mock(ChatModelFactory.class);
        when(chatModelFactory.create(any(), any(), anyString(), any())).thenReturn(model);
        imageCompressor = mock(ImageCompressor.class);

        settings = new BridgeProperties.PlatformProperties();
        settings.setApiKey("sk-test");
        retry = new BridgeProperties.RetryProperties();
        clock = new MutableClock(Instant.parse("2026-10-18T10:00:00Z"));
        sleeper = new ClockAdvancingSleeper(clock);
        executor = Executors.newSingleThreadExecutor();
    }

    @AfterEach
    void tearDown() {
        executor.shutdownNow();
    }

    @Test
    void shouldReturnCompletionText() {
        when(model.chat(any(ChatRequest.class))).thenReturn(completion("It is sunny."));

        ProviderResponse response = adapter().ask(request("Weather?"));

        assertTrue(response.isSuccess());
        assertEquals("It is sunny.", response.getText());
        verify(chatModelFactory).create(ApiPlatform.OPENAI, settings, MODEL, Duration.ofSeconds(120));
    }

    @Test
    void shouldRetryRateLimitWithBackoff() {
        when(model.chat(any(ChatRequest.class)))
                .thenThrow(new RateLimitException("429 Too Many Requests"))
                .thenThrow(new RateLimitException("429 Too Many Requests"))
                .thenReturn(completion("Woof."));

        ProviderResponse response = adapter().ask(request("Say hi"));

        assertTrue(response.isSuccess());
        assertEquals("Woof.", response.getText());
        assertEquals(List.of(Duration.ofSeconds(1), Duration.ofSeconds(2)), sleeper.getSleeps());
        verify(model, times(3)).chat(any(ChatRequest.class));
    }

    @Test
    void shouldGiveUpAfterAttemptCeiling() {
        when(model.chat(any(ChatRequest.class))).thenThrow(new HttpException(503, "Service Unavailable"));

        ProviderResponse response = adapter().ask(request("Say hi"));

        assertEquals(FailureKind.TRANSPORT_FAILURE, response.getFailureKind());
        assertTrue(response.getReason().startsWith("failed after 4 attempts"));
        verify(model, times(4)).chat(any(ChatRequest.class));
        assertEquals(3, sleeper.getSleeps().size());
    }

    @Test
    void shouldNotRetryInvalidRequest() {
        when(model.chat(any(ChatRequest.class))).thenThrow(new InvalidRequestException("content filtered"));

        ProviderResponse response = adapter().ask(request("Say hi"));

        assertEquals(FailureKind.MALFORMED_INPUT, response.getFailureKind());
        verify(model, times(1)).chat(any(ChatRequest.class));
        assertTrue(sleeper.getSleeps().isEmpty());
    }

    @Test
    void shouldReportAuthenticationFailureAsSessionNotReady() {
        when(model.chat(any(ChatRequest.class))).thenThrow(new AuthenticationException("invalid api key"));

        ProviderResponse response = adapter().ask(request("Say hi"));

        assertEquals(FailureKind.SESSION_NOT_READY, response.getFailureKind());
        verify(model, times(1)).chat(any(ChatRequest.class));
    }

    @Test
    void shouldTimeOutSlowCall() {
        when(model.chat(any(ChatRequest.class))).thenAnswer(invocation -> {
            Thread.sleep(5_000);
            return completion("too late");
        });

        ProviderResponse response = adapter().ask(ProviderRequest.builder()
                .prompt("Say hi")
                .model(MODEL)
                .timeout(Duration.ofMillis(200))
                .build());

        assertEquals(FailureKind.EXTRACTION_TIMEOUT, response.getFailureKind());
    }

    @Test
    void shouldFailWithoutCredential() {
        settings.setApiKey(" ");
        ApiProviderAdapter adapter = adapter();

        assertEquals(SessionState.LOGGED_OUT, adapter.probeSession());
        assertEquals(FailureKind.SESSION_NOT_READY, adapter.ask(request("Say hi")).getFailureKind());
        verifyNoInteractions(model);
    }

    @Test
    void shouldRejectMissingModel() {
        ProviderResponse response = adapter().ask(ProviderRequest.builder()
                .prompt("Say hi")
                .timeout(Duration.ofSeconds(10))
                .build());

        assertEquals(FailureKind.MALFORMED_INPUT, response.getFailureKind());
    }

    @Test
    void shouldFailOnEmptyCompletion() {
        when(model.chat(any(ChatRequest.class))).thenReturn(completion("[1]"));

        ProviderResponse response = adapter().ask(request("Say hi"));

        assertEquals(FailureKind.TRANSPORT_FAILURE, response.getFailureKind());
    }

    @Test
    void shouldAttachCompressedImage() throws IOException {
        Path image = Path.of("/tmp/dog.png");
        when(imageCompressor.compress(image, settings.getMaxImageKb()))
                .thenReturn(new ImageCompressor.EncodedImage(new byte[] { 1, 2, 3 }, "image/png"));
        when(model.chat(any(ChatRequest.class))).thenReturn(completion("A dog."));

        ProviderResponse response = adapter().ask(ProviderRequest.builder()
                .prompt("What breed?")
                .imageRef(image)
                .model("gpt-4o")
                .timeout(Duration.ofSeconds(60))
                .build());

        assertTrue(response.isSuccess());
        ArgumentCaptor<ChatRequest> captor = ArgumentCaptor.forClass(ChatRequest.class);
        verify(model).chat(captor.capture());
        UserMessage message = (UserMessage) captor.getValue().messages().get(0);
        assertEquals(2, message.contents().size());
        assertInstanceOf(TextContent.class, message.contents().get(0));
        ImageContent imageContent = assertInstanceOf(ImageContent.class, message.contents().get(1));
        assertEquals("image/png", imageContent.image().mimeType());
        assertEquals("AQID", imageContent.image().base64Data());
    }

    @Test
    void shouldDeliverImageAnswerAfterTwoTransientFailures() throws IOException {
        Path image = Path.of("/tmp/vandog.jpg");
        when(imageCompressor.compress(image, settings.getMaxImageKb()))
                .thenReturn(new ImageCompressor.EncodedImage(new byte[] { 9, 9 }, "image/jpeg"));
        when(model.chat(any(ChatRequest.class)))
                .thenThrow(new TimeoutException("read timed out"))
                .thenThrow(new InternalServerException("502 Bad Gateway"))
                .thenReturn(completion("A golden retriever."));

        ProviderResponse response = adapter().ask(ProviderRequest.builder()
                .prompt("Describe this image briefly.")
                .imageRef(image)
                .model("gpt-4o")
                .timeout(Duration.ofSeconds(120))
                .build());

        assertTrue(response.isSuccess());
        assertEquals("A golden retriever.", response.getText());
        verify(model, times(3)).chat(any(ChatRequest.class));
        verify(imageCompressor, times(1)).compress(image, settings.getMaxImageKb());
    }

    @Test
    void shouldRejectUnreadableImage() throws IOException {
        Path image = Path.of("/tmp/broken.bin");
        when(imageCompressor.compress(image, settings.getMaxImageKb())).thenThrow(new IOException("not an image"));

        ProviderResponse response = adapter().ask(ProviderRequest.builder()
                .prompt("What is it?")
                .imageRef(image)
                .model("gpt-4o")
                .timeout(Duration.ofSeconds(60))
                .build());

        assertEquals(FailureKind.MALFORMED_INPUT, response.getFailureKind());
        verifyNoInteractions(model);
    }

    @Test
    void shouldReuseModelClientPerModelName() {
        when(model.chat(any(ChatRequest.class))).thenReturn(completion("ok"));
        ApiProviderAdapter adapter = adapter();

        adapter.ask(request("one"));
        adapter.ask(request("two"));

        verify(chatModelFactory, times(1)).create(any(), any(), eq(MODEL), any());
    }

    @Test
    void shouldBuildSeparateClientForEachConversationTimeout() {
        ChatModel slowModel = mock(ChatModel.class);
        when(chatModelFactory.create(any(), any(), eq(MODEL), eq(Duration.ofSeconds(10)))).thenReturn(model);
        when(chatModelFactory.create(any(), any(), eq(MODEL), eq(Duration.ofSeconds(120)))).thenReturn(slowModel);
        when(model.chat(any(ChatRequest.class))).thenReturn(completion("quick"));
        when(slowModel.chat(any(ChatRequest.class))).thenReturn(completion("patient"));
        ApiProviderAdapter adapter = adapter();

        ProviderResponse first = adapter.ask(request("one", Duration.ofSeconds(10)));
        ProviderResponse second = adapter.ask(request("two", Duration.ofSeconds(120)));
        ProviderResponse third = adapter.ask(request("three", Duration.ofSeconds(10)));

        assertEquals("quick", first.getText());
        assertEquals("patient", second.getText());
        assertEquals("quick", third.getText());
        verify(chatModelFactory, times(1)).create(ApiPlatform.OPENAI, settings, MODEL, Duration.ofSeconds(10));
        verify(chatModelFactory, times(1)).create(ApiPlatform.OPENAI, settings, MODEL, Duration.ofSeconds(120));
    }

    @Test
    void shouldGrowBackoffExponentiallyUpToCap() {
        ApiProviderAdapter adapter = adapter();
        Duration plenty = Duration.ofMinutes(5);

        assertEquals(Duration.ofSeconds(1), adapter.backoff(1, plenty));
        assertEquals(Duration.ofSeconds(2), adapter.backoff(2, plenty));
        assertEquals(Duration.ofSeconds(4), adapter.backoff(3, plenty));
        assertEquals(Duration.ofSeconds(8), adapter.backoff(4, plenty));
        assertEquals(Duration.ofSeconds(8), adapter.backoff(6, plenty));
        assertEquals(Duration.ofSeconds(3), adapter.backoff(3, Duration.ofSeconds(3)));
    }

    private ApiProviderAdapter adapter() {
        ProviderDefinition definition = ProviderDefinition.builder()
                .id("openai")
                .transport(TransportKind.API)
                .platform("openai")
                .build();
        return new ApiProviderAdapter(definition, ApiPlatform.OPENAI, settings, retry, chatModelFactory,
                new ProviderErrorClassifier(), imageCompressor, new ResponseTextCleaner(), executor, clock, sleeper);
    }

    private static ProviderRequest request(String prompt) {
        return request(prompt, Duration.ofSeconds(120));
    }

    private static ProviderRequest request(String prompt, Duration timeout) {
        return ProviderRequest.builder()
                .prompt(prompt)
                .model(MODEL)
                .timeout(timeout)
                .build();
    }

    private static ChatResponse completion(String text) {
        return ChatResponse.builder().aiMessage(AiMessage.from(text)).build();
    }
}
