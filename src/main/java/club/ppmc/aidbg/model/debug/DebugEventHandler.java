/**
 * DebugEventHandler.java
 *
 * 调试事件回调。由事件分发线程调用，抛出的异常会被单独捕获并记录，
 * 不会影响其他处理器或后续事件。
 */
package club.ppmc.aidbg.model.debug;

@FunctionalInterface
public interface DebugEventHandler {

    void onEvent(DebugEvent event);
}
