package club.ppmc.aidbg.service.llm;

import static org.junit.jupiter.api.Assertions.*;

import club.ppmc.aidbg.model.ErrorKind;
import club.ppmc.aidbg.model.Result;
import club.ppmc.aidbg.model.llm.LlmRequest;
import club.ppmc.aidbg.model.llm.LlmResponse;
import club.ppmc.aidbg.service.SecurityService;
import java.time.Duration;
import java.util.List;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicReference;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

class DefaultLlmEngineTest {

    /** 把提示词原样回显的提供方，记录收到的密钥。 */
    static class EchoProvider implements AiProvider {
        private final String name;
        final AtomicReference<String> lastKey = new AtomicReference<>();

        EchoProvider(String name) {
            this.name = name;
        }

        @Override
        public String getName() {
            return name;
        }

        @Override
        public Result<LlmResponse> complete(LlmRequest request, String apiKey) {
            lastKey.set(apiKey);
            return Result.success(new LlmResponse(request.prompt(), request.provider(), "echo", 1, Duration.ZERO));
        }
    }

    private SecurityService security;
    private EchoProvider claude;
    private DefaultLlmEngine engine;

    @BeforeEach
    void setUp() {
        security = new SecurityService();
        claude = new EchoProvider("claude");
        engine = new DefaultLlmEngine(security, List.of(claude, new EchoProvider("openai")), null, 2);
    }

    @AfterEach
    void tearDown() {
        engine.close();
        security.close();
    }

    @Test
    void dispatchesToDefaultProviderWithStoredKey() {
        assertTrue(engine.setApiKey("claude", "sk-abcdefghijklmnopqrstuvwxyz").isSuccess());

        Result<LlmResponse> result = engine.sendRequestSync(LlmRequest.of("explain", List.of("ret"), null));

        assertEquals("explain", result.getValue().content());
        assertEquals("claude", result.getValue().provider());
        assertEquals("sk-abcdefghijklmnopqrstuvwxyz", claude.lastKey.get());
    }

    @Test
    void explicitProviderIsHonoured() {
        Result<LlmResponse> result = engine.sendRequestSync(LlmRequest.of("hi", null, null).withProvider("openai"));
        assertEquals("openai", result.getValue().provider());
    }

    @Test
    void unknownProviderIsConfigurationError() {
        CompletableFuture<Result<LlmResponse>> future =
                engine.sendRequest(LlmRequest.of("hi", null, null).withProvider("nobody"));
        assertTrue(future.isDone());
        assertEquals(ErrorKind.CONFIGURATION, future.join().getErrorKind());
        assertEquals(ErrorKind.CONFIGURATION, engine.setDefaultProvider("nobody").getErrorKind());
        assertEquals(ErrorKind.CONFIGURATION, engine.validateConnection("nobody").getErrorKind());
    }

    @Test
    void blankPromptIsValidationError() {
        assertEquals(ErrorKind.VALIDATION, engine.sendRequestSync(LlmRequest.of(" ", null, null)).getErrorKind());
        assertEquals(ErrorKind.VALIDATION, engine.sendRequestSync(null).getErrorKind());
    }

    @Test
    void providerExceptionBecomesProtocolError() {
        engine.registerProvider(new EchoProvider("claude") {
            @Override
            public Result<LlmResponse> complete(LlmRequest request, String apiKey) {
                throw new IllegalStateException("HTTP 500");
            }
        });
        assertEquals(ErrorKind.PROTOCOL, engine.sendRequestSync(LlmRequest.of("hi", null, null)).getErrorKind());
    }

    @Test
    void providerRegistryAndDefault() {
        assertEquals(List.of("claude", "openai"), engine.getSupportedProviders());
        assertEquals("claude", engine.getDefaultProvider());
        assertTrue(engine.setDefaultProvider("openai").isSuccess());
        assertEquals("openai", engine.getDefaultProvider());

        assertEquals(ErrorKind.CONFIGURATION, engine.validateConnection("claude").getErrorKind());
        engine.setApiKey("claude", "sk-abcdefghijklmnopqrstuvwxyz");
        assertTrue(engine.validateConnection("claude").isSuccess());
    }

    @Test
    void cancelAllCompletesPendingRequests() throws Exception {
        var started = new CountDownLatch(1);
        var release = new CountDownLatch(1);
        engine.registerProvider(new EchoProvider("slow") {
            @Override
            public Result<LlmResponse> complete(LlmRequest request, String apiKey) {
                started.countDown();
                try {
                    release.await(5, TimeUnit.SECONDS);
                } catch (InterruptedException e) {
                    Thread.currentThread().interrupt();
                }
                return super.complete(request, apiKey);
            }
        });

        CompletableFuture<Result<LlmResponse>> future = engine.sendRequest(LlmRequest.of("hi", null, null).withProvider("slow"));
        assertTrue(started.await(2, TimeUnit.SECONDS));
        assertEquals(1, engine.getActiveRequestCount());

        engine.cancelAllRequests();

        assertEquals(ErrorKind.RESOURCE, future.get(1, TimeUnit.SECONDS).getErrorKind());
        assertEquals(0, engine.getActiveRequestCount());
        release.countDown();
    }

    @Test
    void closedEngineRejectsRequests() {
        engine.close();
        assertEquals(ErrorKind.RESOURCE, engine.sendRequestSync(LlmRequest.of("hi", null, null)).getErrorKind());
    }
}
