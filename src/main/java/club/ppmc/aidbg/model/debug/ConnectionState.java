/**
 * ConnectionState.java
 *
 * 调试桥的连接状态机：DISCONNECTED -> CONNECTING -> CONNECTED -> DISCONNECTED。
 * 连接失败时从 CONNECTING 直接回到 DISCONNECTED。
 */
package club.ppmc.aidbg.model.debug;

public enum ConnectionState {
    DISCONNECTED,
    CONNECTING,
    CONNECTED
}
