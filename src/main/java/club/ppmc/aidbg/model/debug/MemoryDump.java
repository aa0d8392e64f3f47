/**
 * MemoryDump.java
 *
 * 每次 ReadMemory 调用新建的内存快照，归调用者所有，从不缓存。
 * 字节数组在进出时都做防御性复制，以保持记录不可变。
 */
package club.ppmc.aidbg.model.debug;

import java.time.Instant;

/**
 * @param baseAddress 读取的起始地址。
 * @param data 实际读到的字节。
 * @param size 请求读取的长度。
 * @param moduleName 尽力解析出的模块/符号名，解析失败时为空字符串。
 * @param timestamp 读取完成的时间。
 */
public record MemoryDump(long baseAddress, byte[] data, int size, String moduleName, Instant timestamp) {

    public MemoryDump {
        data = data != null ? data.clone() : new byte[0];
        moduleName = moduleName != null ? moduleName : "";
        timestamp = timestamp != null ? timestamp : Instant.now();
    }

    @Override
    public byte[] data() {
        return data.clone();
    }

    /** 读取单个字节，避免为小范围访问复制整个数组。 */
    public int byteAt(int offset) {
        return data[offset] & 0xFF;
    }

    public int length() {
        return data.length;
    }
}
