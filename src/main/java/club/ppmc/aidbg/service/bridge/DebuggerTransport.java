/**
 * DebuggerTransport.java
 *
 * 调试桥与调试器之间的传输策略接口。
 * 每种连接模式对应一个实现，由 TransportFactory 在 connect() 时创建，
 * 一个实例只服务一次连接，close() 之后不可再次 open()。
 */
package club.ppmc.aidbg.service.bridge;

import club.ppmc.aidbg.model.ErrorKind;
import club.ppmc.aidbg.model.Result;
import club.ppmc.aidbg.model.debug.ConnectionMode;
import club.ppmc.aidbg.model.debug.DebugEvent;
import club.ppmc.aidbg.model.debug.TransportSettings;
import java.util.function.Consumer;

public interface DebuggerTransport extends AutoCloseable {

    ConnectionMode mode();

    /**
     * 建立连接。
     *
     * @param settings 本次连接使用的配置快照。
     * @param eventSink 传输层收到调试事件时调用，通常是事件通道的 offer。
     * @return 失败时为 CONNECTION 或 RESOURCE 错误。
     */
    Result<Void> open(TransportSettings settings, Consumer<DebugEvent> eventSink);

    /**
     * 发送一条已经过校验的命令并同步等待完整响应。
     * 调用方保证同一时刻只有一个线程调用本方法。
     */
    Result<String> send(String command);

    /**
     * 传输是否已因超时或 I/O 错误而失效。失效的传输已自行关闭，调用方应当丢弃它。
     */
    default boolean isBroken() {
        return false;
    }

    /** 是否支持绕过文本命令直接读写目标进程内存。 */
    default boolean supportsDirectMemory() {
        return false;
    }

    default Result<byte[]> readMemory(long address, int size) {
        return Result.error(ErrorKind.RESOURCE, mode() + " 模式不支持直接内存读取");
    }

    default Result<Void> writeMemory(long address, byte[] data) {
        return Result.error(ErrorKind.RESOURCE, mode() + " 模式不支持直接内存写入");
    }

    /** 释放传输资源。重复调用无效果，不抛出异常。 */
    @Override
    void close();
}
