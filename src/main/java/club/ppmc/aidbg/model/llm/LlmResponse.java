/**
 * LlmResponse.java
 *
 * AI 推理服务的成功响应。失败通过 Result 的错误分支表达，不在此记录中。
 */
package club.ppmc.aidbg.model.llm;

import java.time.Duration;

/**
 * @param content 模型返回的文本。
 * @param provider 实际处理请求的提供方。
 * @param model 实际使用的模型。
 * @param tokensUsed 消耗的 token 数，未知时为 0。
 * @param responseTime 请求耗时。
 */
public record LlmResponse(String content, String provider, String model, int tokensUsed, Duration responseTime) {

    public LlmResponse {
        content = content != null ? content : "";
        responseTime = responseTime != null ? responseTime : Duration.ZERO;
    }
}
