/**
 * LlmEngine.java
 *
 * 按提供方名称分发的异步 AI 请求服务。
 * 所有失败都以 Result 的错误分支返回；sendRequest 返回的 Future 不会异常完成。
 */
package club.ppmc.aidbg.service.llm;

import club.ppmc.aidbg.model.Result;
import club.ppmc.aidbg.model.llm.LlmRequest;
import club.ppmc.aidbg.model.llm.LlmResponse;
import java.util.List;
import java.util.concurrent.CompletableFuture;

public interface LlmEngine extends AutoCloseable {

    /**
     * 异步发送请求。请求未指定提供方时使用默认提供方；
     * 提供方未注册时返回一个已完成的、带 CONFIGURATION 错误的 Future。
     */
    CompletableFuture<Result<LlmResponse>> sendRequest(LlmRequest request);

    /** 同步发送请求，阻塞直到得到结果。 */
    Result<LlmResponse> sendRequestSync(LlmRequest request);

    Result<Void> setApiKey(String provider, String apiKey);

    List<String> getSupportedProviders();

    Result<Void> validateConnection(String provider);

    Result<Void> setDefaultProvider(String provider);

    String getDefaultProvider();

    void registerProvider(AiProvider provider);

    /** 当前尚未完成的请求数。 */
    int getActiveRequestCount();

    /** 以 RESOURCE 错误结束所有尚未完成的请求。 */
    void cancelAllRequests();

    @Override
    void close();
}
