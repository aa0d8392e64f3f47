/**
 * MemoryWriteRequest.java
 *
 * 写内存请求体。地址和数据都是十六进制文本，例如 address="0x401000", data="90 90 c3"。
 */
package club.ppmc.aidbg.model.debug;

import jakarta.validation.constraints.NotBlank;

public record MemoryWriteRequest(
        @NotBlank(message = "地址 (address) 不能为空") String address,
        @NotBlank(message = "数据 (data) 不能为空") String data) {}
