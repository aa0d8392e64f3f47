/**
 * DebugEvent.java
 *
 * 该文件定义了一个不可变的调试事件记录。
 * 它由传输层产生，进入事件通道，被事件分发循环恰好消费一次，
 * 然后按注册顺序以引用方式分发给每一个事件处理器。处理器不应在回调之外持有它。
 */
package club.ppmc.aidbg.model.debug;

import java.time.Instant;
import java.util.Map;

/**
 * 一个调试事件。
 *
 * @param type 事件类型。
 * @param address 事件发生的地址，未知时为 0。
 * @param processId 目标进程 ID。
 * @param threadId 目标线程 ID。
 * @param moduleName 相关模块名，可能为空字符串。
 * @param description 人类可读的描述。
 * @param timestamp 事件产生的时间。
 * @param metadata 传输层附带的其他键值对。
 */
public record DebugEvent(
        DebugEventType type,
        long address,
        long processId,
        long threadId,
        String moduleName,
        String description,
        Instant timestamp,
        Map<String, String> metadata) {

    public DebugEvent {
        moduleName = moduleName != null ? moduleName : "";
        description = description != null ? description : "";
        timestamp = timestamp != null ? timestamp : Instant.now();
        metadata = metadata != null ? Map.copyOf(metadata) : Map.of();
    }

    public static DebugEvent of(DebugEventType type, long address, String description) {
        return new DebugEvent(type, address, 0, 0, "", description, Instant.now(), Map.of());
    }
}
