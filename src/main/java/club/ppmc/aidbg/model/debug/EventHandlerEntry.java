/**
 * EventHandlerEntry.java
 *
 * 事件处理器注册表中的一项。ID 单调递增且永不复用；本设计不提供移除操作。
 */
package club.ppmc.aidbg.model.debug;

/**
 * @param id 注册时分配的唯一 ID。
 * @param handler 事件回调。
 */
public record EventHandlerEntry(long id, DebugEventHandler handler) {}
