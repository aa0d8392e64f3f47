/**
 * DebuggerOperationException.java
 *
 * 一个自定义的运行时异常，用于在 Web 层表示调试桥或编排器返回的失败结果。
 * 核心模块之间只传递 Result，只有 Controller 通过 Result.orElseThrow() 抛出此异常，
 * 再由 ApiExceptionHandler 转换为对前端友好的结构化响应。
 */
package club.ppmc.aidbg.exception;

import club.ppmc.aidbg.model.ErrorKind;
import java.util.Map;
import lombok.Getter;

@Getter
public class DebuggerOperationException extends RuntimeException {

    /** 失败的分类，决定 HTTP 状态码。 */
    private final ErrorKind errorKind;

    /**
     * 构造函数。
     * @param errorKind 失败的分类。
     * @param message 详细的错误信息，将展示给用户。
     */
    public DebuggerOperationException(ErrorKind errorKind, String message) {
        super(message);
        this.errorKind = errorKind;
    }

    /**
     * 将异常信息转换为一个Map，便于序列化为JSON。
     *
     * @return 包含结构化错误信息的Map。
     */
    public Map<String, Object> toErrorData() {
        return Map.of(
                "type", errorKind.name(),
                "message", getMessage() != null ? getMessage() : ""
        );
    }
}
