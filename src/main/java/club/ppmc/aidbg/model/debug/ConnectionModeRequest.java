/**
 * ConnectionModeRequest.java
 *
 * 修改连接模式的请求体。
 */
package club.ppmc.aidbg.model.debug;

import jakarta.validation.constraints.NotNull;

public record ConnectionModeRequest(@NotNull(message = "连接模式 (mode) 不能为空") ConnectionMode mode) {}
