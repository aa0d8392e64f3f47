/**
 * PluginTransport.java
 *
 * 进程内插件模式的传输策略。命令和内存访问都直接委托给宿主句柄，
 * 因此支持直接内存读写。宿主产生的调试事件由适配层通过 DebuggerBridge.publishEvent 注入。
 */
package club.ppmc.aidbg.service.bridge;

import club.ppmc.aidbg.model.ErrorKind;
import club.ppmc.aidbg.model.Result;
import club.ppmc.aidbg.model.debug.ConnectionMode;
import club.ppmc.aidbg.model.debug.DebugEvent;
import club.ppmc.aidbg.model.debug.TransportSettings;
import java.util.function.Consumer;
import lombok.extern.slf4j.Slf4j;

@Slf4j
public class PluginTransport implements DebuggerTransport {

    private final PluginHostHandle host;
    private volatile boolean open;

    public PluginTransport(PluginHostHandle host) {
        this.host = host;
    }

    @Override
    public ConnectionMode mode() {
        return ConnectionMode.PLUGIN;
    }

    @Override
    public Result<Void> open(TransportSettings settings, Consumer<DebugEvent> eventSink) {
        if (host == null) {
            return Result.error(ErrorKind.CONNECTION, "未提供插件宿主句柄，无法使用 PLUGIN 模式");
        }
        if (!host.isAvailable()) {
            return Result.error(ErrorKind.CONNECTION, "插件宿主当前不可用");
        }
        open = true;
        log.info("已连接到进程内插件宿主");
        return Result.ok();
    }

    @Override
    public Result<String> send(String command) {
        if (!open) {
            return Result.error(ErrorKind.NOT_CONNECTED, "插件传输未打开");
        }
        return host.execute(command);
    }

    @Override
    public boolean supportsDirectMemory() {
        return true;
    }

    @Override
    public Result<byte[]> readMemory(long address, int size) {
        if (!open) {
            return Result.error(ErrorKind.NOT_CONNECTED, "插件传输未打开");
        }
        return host.readMemory(address, size);
    }

    @Override
    public Result<Void> writeMemory(long address, byte[] data) {
        if (!open) {
            return Result.error(ErrorKind.NOT_CONNECTED, "插件传输未打开");
        }
        return host.writeMemory(address, data);
    }

    @Override
    public void close() {
        open = false;
    }
}
