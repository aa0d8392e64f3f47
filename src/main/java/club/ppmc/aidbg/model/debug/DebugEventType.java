/**
 * DebugEventType.java
 *
 * 调试器可能推送的异步事件类型。
 */
package club.ppmc.aidbg.model.debug;

public enum DebugEventType {
    BREAKPOINT_HIT,
    EXCEPTION,
    PROCESS_CREATED,
    PROCESS_TERMINATED,
    MODULE_LOADED,
    MODULE_UNLOADED,
    THREAD_CREATED,
    THREAD_TERMINATED
}
