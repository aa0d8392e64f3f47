/**
 * AiProvider.java
 *
 * AI 提供方的扩展接口。每个实现对应一个具体的推理服务（例如 claude、openai、gemini），
 * 以 Spring Bean 的形式声明后由 DefaultLlmEngine 按名称注册。
 * complete() 在引擎的请求线程池中被同步调用，实现不需要自己管理线程。
 */
package club.ppmc.aidbg.service.llm;

import club.ppmc.aidbg.model.ErrorKind;
import club.ppmc.aidbg.model.Result;
import club.ppmc.aidbg.model.llm.LlmRequest;
import club.ppmc.aidbg.model.llm.LlmResponse;

public interface AiProvider {

    /** 提供方名称，作为注册表的键。 */
    String getName();

    /**
     * 完成一次请求。
     *
     * @param request 请求内容，provider 字段已被引擎填充。
     * @param apiKey 从 SecurityService 取得的密钥，未配置时为 null。
     */
    Result<LlmResponse> complete(LlmRequest request, String apiKey);

    /** 检查提供方是否可用。默认只检查是否配置了密钥。 */
    default Result<Void> validateConnection(String apiKey) {
        if (apiKey == null || apiKey.isBlank()) {
            return Result.error(ErrorKind.CONFIGURATION, getName() + " 未配置 API 密钥");
        }
        return Result.ok();
    }
}
