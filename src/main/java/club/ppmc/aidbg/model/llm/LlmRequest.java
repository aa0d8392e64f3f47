/**
 * LlmRequest.java
 *
 * 发送给 AI 推理服务的请求。provider 为空时由 LlmEngine 使用默认提供方。
 */
package club.ppmc.aidbg.model.llm;

import java.util.List;
import java.util.Map;

/**
 * @param provider 提供方名称，例如 "claude"、"openai"；为空表示使用默认值。
 * @param model 模型名称，为空表示由提供方决定。
 * @param prompt 主提示词。
 * @param context 附加的上下文片段（例如反汇编文本）。
 * @param parameters 提供方特定的额外参数。
 * @param temperature 采样温度。
 * @param maxTokens 最大输出 token 数。
 * @param systemPrompt 可选的系统提示词。
 */
public record LlmRequest(
        String provider,
        String model,
        String prompt,
        List<String> context,
        Map<String, String> parameters,
        double temperature,
        int maxTokens,
        String systemPrompt) {

    public static final double DEFAULT_TEMPERATURE = 0.7;
    public static final int DEFAULT_MAX_TOKENS = 1024;

    public LlmRequest {
        context = context != null ? List.copyOf(context) : List.of();
        parameters = parameters != null ? Map.copyOf(parameters) : Map.of();
    }

    /** 使用默认提供方和默认采样参数创建请求。 */
    public static LlmRequest of(String prompt, List<String> context, String systemPrompt) {
        return new LlmRequest(
                null, null, prompt, context, Map.of(), DEFAULT_TEMPERATURE, DEFAULT_MAX_TOKENS, systemPrompt);
    }

    public LlmRequest withProvider(String providerName) {
        return new LlmRequest(
                providerName, model, prompt, context, parameters, temperature, maxTokens, systemPrompt);
    }
}
