/**
 * ConnectionMode.java
 *
 * 调试桥与 x64dbg 之间的连接方式。
 * 每种模式对应一个 DebuggerTransport 策略实现，由 TransportFactory 创建。
 */
package club.ppmc.aidbg.model.debug;

public enum ConnectionMode {
    /** 在 x64dbg 进程内以插件方式运行，通过宿主提供的句柄直接调用。 */
    PLUGIN,
    /** 启动外部调试器进程，通过标准输入输出通信。 */
    EXTERNAL,
    /** 通过固定名称的本地命名管道通信。 */
    PIPE,
    /** 通过 TCP 套接字连接到配置的端点。 */
    TCP
}
