/**
 * ScriptRequest.java
 *
 * 按顺序执行的一组命令模板。每行先经过表达式求值器展开 ${name} 变量，再交给调试桥执行。
 */
package club.ppmc.aidbg.model.debug;

import jakarta.validation.constraints.NotEmpty;
import java.util.List;
import java.util.Map;

/**
 * @param commands 命令模板，例如 "bp ${entry}"。
 * @param variables 仅对本次执行有效的变量。
 */
public record ScriptRequest(
        @NotEmpty(message = "命令列表 (commands) 不能为空") List<String> commands, Map<String, String> variables) {}
