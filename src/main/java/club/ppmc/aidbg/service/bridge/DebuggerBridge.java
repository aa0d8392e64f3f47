/**
 * DebuggerBridge.java
 *
 * 与外部交互式调试器通信的协议桥。
 * 所有操作都返回 Result，不会把异常抛出本接口；未连接时除 connect/disconnect
 * 和配置类方法外的操作都以 NOT_CONNECTED 立即失败。
 */
package club.ppmc.aidbg.service.bridge;

import club.ppmc.aidbg.model.Result;
import club.ppmc.aidbg.model.debug.ConnectionMode;
import club.ppmc.aidbg.model.debug.ConnectionState;
import club.ppmc.aidbg.model.debug.DebugEvent;
import club.ppmc.aidbg.model.debug.DebugEventHandler;
import club.ppmc.aidbg.model.debug.MemoryDump;

public interface DebuggerBridge extends AutoCloseable {

    // --- 连接管理 ---

    /** 使用当前连接模式建立连接。已连接时直接返回成功。 */
    Result<Void> connect();

    /** 停止事件循环并释放传输资源。未连接时直接返回成功。 */
    Result<Void> disconnect();

    boolean isConnected();

    ConnectionState getState();

    /** 已连接或曾经成功连接过之后再修改模式会返回 CONFIGURATION 错误。 */
    Result<Void> setConnectionMode(ConnectionMode mode);

    ConnectionMode getConnectionMode();

    // --- 配置 ---

    void setDebuggerPath(String path);

    void setConnectionTimeout(int timeoutMs);

    void setCommandTimeout(int timeoutMs);

    void setTcpEndpoint(String host, int port);

    // --- 命令 ---

    Result<String> executeCommand(String command);

    Result<String> getDisassembly(long address);

    Result<MemoryDump> readMemory(long address, long size);

    Result<Void> writeMemory(long address, byte[] data);

    Result<Void> setBreakpoint(long address);

    Result<Void> removeBreakpoint(long address);

    Result<Long> getRegisterValue(String register);

    Result<Void> setRegisterValue(String register, long value);

    Result<String> getSymbolAt(long address);

    // --- 执行控制 ---

    Result<Void> stepInto();

    Result<Void> stepOver();

    Result<Void> stepOut();

    Result<Void> resume();

    Result<Void> pause();

    // --- 事件 ---

    /**
     * 注册一个事件处理器。处理器按注册顺序被调用，在桥的整个生命周期内保留。
     *
     * @return 分配给该处理器的 ID，单调递增。
     */
    long registerEventHandler(DebugEventHandler handler);

    /**
     * 把一个事件放入事件通道。供传输层以外的宿主适配层注入事件；未连接时事件被丢弃。
     *
     * @return 事件是否被接受。
     */
    boolean publishEvent(DebugEvent event);

    @Override
    default void close() {
        disconnect();
    }
}
