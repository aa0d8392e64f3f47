/**
 * CommandRequest.java
 *
 * 执行一条原始调试器命令的请求体。命令内容由调试桥做安全校验。
 */
package club.ppmc.aidbg.model.debug;

import jakarta.validation.constraints.NotBlank;

public record CommandRequest(@NotBlank(message = "命令 (command) 不能为空") String command) {}
