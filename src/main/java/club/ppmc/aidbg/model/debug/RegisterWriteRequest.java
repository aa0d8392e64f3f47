/**
 * RegisterWriteRequest.java
 *
 * 修改寄存器值的请求体，value 为十六进制文本。
 */
package club.ppmc.aidbg.model.debug;

import jakarta.validation.constraints.NotBlank;

public record RegisterWriteRequest(@NotBlank(message = "值 (value) 不能为空") String value) {}
