/**
 * DefaultLlmEngine.java
 *
 * LlmEngine 的默认实现：按名称持有 AiProvider 注册表，在一个固定大小的线程池中执行请求。
 * API 密钥在每次请求时从 SecurityService 读取，引擎本身不保存密钥。
 * 同时进行的请求数受线程池大小限制，多余的请求排队等待。
 */
package club.ppmc.aidbg.service.llm;

import club.ppmc.aidbg.model.ErrorKind;
import club.ppmc.aidbg.model.Result;
import club.ppmc.aidbg.model.llm.LlmRequest;
import club.ppmc.aidbg.model.llm.LlmResponse;
import club.ppmc.aidbg.service.SecurityService;
import java.util.ArrayList;
import java.util.Collection;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Set;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;
import lombok.extern.slf4j.Slf4j;

@Slf4j
public class DefaultLlmEngine implements LlmEngine {

    public static final String DEFAULT_PROVIDER = "claude";

    private final SecurityService securityService;
    private final Map<String, AiProvider> providers = new ConcurrentHashMap<>();
    private final Set<CompletableFuture<Result<LlmResponse>>> pending = ConcurrentHashMap.newKeySet();
    private final ExecutorService requestExecutor;
    private volatile String defaultProvider;
    private volatile boolean closed;

    public DefaultLlmEngine(
            SecurityService securityService,
            Collection<? extends AiProvider> initialProviders,
            String defaultProvider,
            int maxConcurrentRequests) {
        this.securityService = Objects.requireNonNull(securityService, "securityService");
        this.defaultProvider = defaultProvider != null && !defaultProvider.isBlank() ? defaultProvider : DEFAULT_PROVIDER;
        var threadCounter = new AtomicInteger();
        this.requestExecutor =
                Executors.newFixedThreadPool(
                        Math.max(1, maxConcurrentRequests),
                        r -> {
                            Thread t = new Thread(r, "llm-request-" + threadCounter.incrementAndGet());
                            t.setDaemon(true);
                            return t;
                        });
        if (initialProviders != null) {
            initialProviders.forEach(this::registerProvider);
        }
        log.info("AI 引擎已初始化，提供方: {}，默认: {}", getSupportedProviders(), this.defaultProvider);
    }

    @Override
    public CompletableFuture<Result<LlmResponse>> sendRequest(LlmRequest request) {
        if (request == null || request.prompt() == null || request.prompt().isBlank()) {
            return CompletableFuture.completedFuture(Result.error(ErrorKind.VALIDATION, "请求的提示词不能为空"));
        }
        if (closed) {
            return CompletableFuture.completedFuture(Result.error(ErrorKind.RESOURCE, "AI 引擎已关闭"));
        }
        String providerName = request.provider() != null && !request.provider().isBlank() ? request.provider() : defaultProvider;
        AiProvider provider = providers.get(providerName);
        if (provider == null) {
            log.warn("请求了未注册的 AI 提供方: {}", providerName);
            return CompletableFuture.completedFuture(
                    Result.error(ErrorKind.CONFIGURATION, "未知的 AI 提供方: " + providerName));
        }

        LlmRequest resolved = request.withProvider(providerName);
        var future = new CompletableFuture<Result<LlmResponse>>();
        pending.add(future);
        future.whenComplete((r, ex) -> pending.remove(future));
        try {
            requestExecutor.execute(() -> {
                if (future.isDone()) {
                    return;
                }
                future.complete(invoke(provider, resolved));
            });
        } catch (RejectedExecutionException e) {
            future.complete(Result.error(ErrorKind.RESOURCE, "AI 引擎已关闭"));
        }
        return future;
    }

    private Result<LlmResponse> invoke(AiProvider provider, LlmRequest request) {
        String apiKey = securityService.hasCredential(provider.getName())
                ? securityService.retrieveCredential(provider.getName()).getValueOr(null)
                : null;
        long started = System.nanoTime();
        try {
            Result<LlmResponse> result = provider.complete(request, apiKey);
            if (result == null) {
                return Result.error(ErrorKind.PROTOCOL, provider.getName() + " 返回了空结果");
            }
            if (result.isError()) {
                log.warn("AI 提供方 {} 请求失败: {}", provider.getName(), result.getErrorMessage());
            } else {
                log.debug(
                        "AI 提供方 {} 完成请求，耗时 {} ms",
                        provider.getName(),
                        TimeUnit.NANOSECONDS.toMillis(System.nanoTime() - started));
            }
            return result;
        } catch (RuntimeException e) {
            log.error("AI 提供方 {} 抛出异常", provider.getName(), e);
            return Result.error(ErrorKind.PROTOCOL, provider.getName() + " 请求失败: " + e.getMessage());
        }
    }

    @Override
    public Result<LlmResponse> sendRequestSync(LlmRequest request) {
        return sendRequest(request).join();
    }

    @Override
    public Result<Void> setApiKey(String provider, String apiKey) {
        if (!securityService.validateApiKey(apiKey)) {
            log.warn("{} 的 API 密钥格式看起来不正确，仍将保存", provider);
        }
        return securityService.storeCredential(provider, apiKey);
    }

    @Override
    public List<String> getSupportedProviders() {
        var names = new ArrayList<>(providers.keySet());
        names.sort(null);
        return names;
    }

    @Override
    public Result<Void> validateConnection(String provider) {
        AiProvider target = provider != null ? providers.get(provider) : null;
        if (target == null) {
            return Result.error(ErrorKind.CONFIGURATION, "未知的 AI 提供方: " + provider);
        }
        String apiKey = securityService.retrieveCredential(provider).getValueOr(null);
        return target.validateConnection(apiKey);
    }

    @Override
    public Result<Void> setDefaultProvider(String provider) {
        if (provider == null || !providers.containsKey(provider)) {
            return Result.error(ErrorKind.CONFIGURATION, "未知的 AI 提供方: " + provider);
        }
        this.defaultProvider = provider;
        log.info("默认 AI 提供方已切换为 {}", provider);
        return Result.ok();
    }

    @Override
    public String getDefaultProvider() {
        return defaultProvider;
    }

    @Override
    public void registerProvider(AiProvider provider) {
        Objects.requireNonNull(provider, "provider");
        AiProvider previous = providers.put(provider.getName(), provider);
        if (previous != null) {
            log.info("AI 提供方 {} 已被替换", provider.getName());
        }
    }

    @Override
    public int getActiveRequestCount() {
        return pending.size();
    }

    @Override
    public void cancelAllRequests() {
        int cancelled = 0;
        for (CompletableFuture<Result<LlmResponse>> future : List.copyOf(pending)) {
            if (future.complete(Result.error(ErrorKind.RESOURCE, "请求已被取消"))) {
                cancelled++;
            }
        }
        if (cancelled > 0) {
            log.info("已取消 {} 个进行中的 AI 请求", cancelled);
        }
    }

    @Override
    public void close() {
        if (closed) {
            return;
        }
        closed = true;
        cancelAllRequests();
        requestExecutor.shutdownNow();
        log.info("AI 引擎已关闭");
    }
}
