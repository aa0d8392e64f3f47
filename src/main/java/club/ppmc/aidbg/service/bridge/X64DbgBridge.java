/**
 * X64DbgBridge.java
 *
 * DebuggerBridge 针对 x64dbg 的实现。
 * 连接状态由 stateLock 保护；命令往返由 commandLock 串行化，保证同一连接上的请求和响应不会交错；
 * 事件经由独立的 EventChannel 交给每个连接专属的 "debug-event-loop" 线程分发，
 * 处理器在任何锁之外被调用，因此慢处理器不会阻塞传输层或连接状态的变更。
 */
package club.ppmc.aidbg.service.bridge;

import club.ppmc.aidbg.model.ErrorKind;
import club.ppmc.aidbg.model.Result;
import club.ppmc.aidbg.model.debug.ConnectionMode;
import club.ppmc.aidbg.model.debug.ConnectionState;
import club.ppmc.aidbg.model.debug.DebugEvent;
import club.ppmc.aidbg.model.debug.DebugEventHandler;
import club.ppmc.aidbg.model.debug.EventHandlerEntry;
import club.ppmc.aidbg.model.debug.MemoryDump;
import club.ppmc.aidbg.model.debug.TransportSettings;
import club.ppmc.aidbg.util.AddressFormat;
import club.ppmc.aidbg.util.CommandValidator;
import club.ppmc.aidbg.util.EventChannel;
import club.ppmc.aidbg.util.HexCodec;
import java.time.Instant;
import java.util.Arrays;
import java.util.List;
import java.util.Objects;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.atomic.AtomicLong;
import java.util.regex.Matcher;
import java.util.regex.Pattern;
import lombok.extern.slf4j.Slf4j;

@Slf4j
public class X64DbgBridge implements DebuggerBridge {

    static final int DEFAULT_CONNECTION_TIMEOUT_MS = 5000;
    static final int DEFAULT_COMMAND_TIMEOUT_MS = 10000;
    static final long EVENT_LOOP_JOIN_TIMEOUT_MS = 2000;

    /** 每条 fill 命令写入的字节数，使命令长度保持在校验上限之内。 */
    static final int FILL_CHUNK_BYTES = 1024;

    private static final Pattern REGISTER_NAME = Pattern.compile("[A-Za-z][A-Za-z0-9]{0,15}");

    private final TransportFactory transportFactory;

    private final Object stateLock = new Object();
    private final Object commandLock = new Object();

    // --- 由 stateLock 保护，volatile 以便无锁读取 ---
    private volatile ConnectionState state = ConnectionState.DISCONNECTED;
    private volatile ConnectionMode mode = ConnectionMode.EXTERNAL;
    private volatile boolean modeLocked;
    private volatile DebuggerTransport transport;
    private volatile EventChannel<DebugEvent> eventChannel;
    private Thread eventThread;

    private final List<EventHandlerEntry> handlers = new CopyOnWriteArrayList<>();
    private final AtomicLong nextHandlerId = new AtomicLong(1);

    // --- 下一次 connect() 使用的配置 ---
    private volatile String debuggerPath;
    private volatile int connectionTimeoutMs = DEFAULT_CONNECTION_TIMEOUT_MS;
    private volatile int commandTimeoutMs = DEFAULT_COMMAND_TIMEOUT_MS;
    private volatile String tcpHost = "127.0.0.1";
    private volatile int tcpPort = 27042;

    public X64DbgBridge(TransportFactory transportFactory) {
        this.transportFactory = Objects.requireNonNull(transportFactory, "transportFactory");
    }

    // ========================================================================
    // 连接管理
    // ========================================================================

    /**
     * 按当前连接模式建立连接，并启动本次连接专属的事件分发线程。
     *
     * <p><b>设计思路</b>:
     * 1. <b>状态锁</b>: 整个过程持有 {@code stateLock}，与 {@link #disconnect()} 和模式切换互斥；
     *    已连接时直接返回成功，不会创建第二个传输或第二个事件线程。
     * 2. <b>一次性的传输</b>: 每次连接都由 {@link TransportFactory} 新建一个传输实例，打开失败时立即关闭它，
     *    调试桥回到 DISCONNECTED，模式也不会被锁定。
     * 3. <b>事件通道</b>: 传输层拿到的只是 {@link EventChannel#offer} 回调，读取线程不会直接调用处理器，
     *    慢处理器因此不会拖住传输层。
     * 4. <b>模式锁定</b>: 首次成功连接后连接模式被锁定，之后的 {@code setConnectionMode} 返回 CONFIGURATION 错误。
     * </p>
     */
    @Override
    public Result<Void> connect() {
        synchronized (stateLock) {
            if (state == ConnectionState.CONNECTED) {
                log.debug("调试桥已连接，忽略重复的 connect 请求");
                return Result.ok();
            }
            ConnectionMode currentMode = mode;
            log.info("正在以 {} 模式连接调试器...", currentMode);
            state = ConnectionState.CONNECTING;

            DebuggerTransport newTransport;
            try {
                newTransport = transportFactory.create(currentMode);
            } catch (RuntimeException e) {
                state = ConnectionState.DISCONNECTED;
                log.error("创建 {} 传输失败: {}", currentMode, e.getMessage(), e);
                return Result.error(ErrorKind.RESOURCE, "无法创建传输: " + e.getMessage());
            }

            var channel = new EventChannel<DebugEvent>();
            Result<Void> opened;
            try {
                opened = newTransport.open(snapshotSettings(), channel::offer);
            } catch (RuntimeException e) {
                log.error("打开 {} 传输时发生意外错误", currentMode, e);
                opened = Result.error(ErrorKind.RESOURCE, "打开传输失败: " + e.getMessage());
            }
            if (opened.isError()) {
                newTransport.close();
                channel.close();
                state = ConnectionState.DISCONNECTED;
                log.warn("连接调试器失败 [{}]: {}", opened.getErrorKind(), opened.getErrorMessage());
                return opened;
            }

            this.transport = newTransport;
            this.eventChannel = channel;
            this.modeLocked = true;
            this.eventThread = startEventLoop(channel);
            state = ConnectionState.CONNECTED;
            log.info("已连接到调试器 ({} 模式)", currentMode);
            return Result.ok();
        }
    }

    /**
     * 关闭事件通道、等待事件线程退出，然后关闭传输。重复调用无效果。
     * 在事件处理器内部调用时不会等待自身所在的线程。
     */
    @Override
    public Result<Void> disconnect() {
        synchronized (stateLock) {
            if (state == ConnectionState.DISCONNECTED) {
                return Result.ok();
            }
            log.info("正在断开调试器连接...");
            EventChannel<DebugEvent> channel = eventChannel;
            Thread loop = eventThread;
            DebuggerTransport current = transport;

            if (channel != null) {
                channel.close();
            }
            if (loop != null && loop != Thread.currentThread()) {
                try {
                    loop.join(EVENT_LOOP_JOIN_TIMEOUT_MS);
                } catch (InterruptedException e) {
                    Thread.currentThread().interrupt();
                    log.warn("等待事件线程退出时被中断");
                }
                if (loop.isAlive()) {
                    log.warn("事件线程未在 {} ms 内退出，可能有处理器仍在运行", EVENT_LOOP_JOIN_TIMEOUT_MS);
                }
            }
            if (current != null) {
                current.close();
            }

            eventChannel = null;
            eventThread = null;
            transport = null;
            state = ConnectionState.DISCONNECTED;
            log.info("调试器连接已断开");
            return Result.ok();
        }
    }

    /**
     * 传输失效后把调试桥转为断开状态，走与 disconnect() 相同的清理路径。
     * 如果期间已经重新连接，当前传输不再是失效的那个，则不做任何事。
     */
    private void dropIfBroken(DebuggerTransport used) {
        if (!used.isBroken()) {
            return;
        }
        synchronized (stateLock) {
            if (transport != used) {
                return;
            }
            log.warn("{} 传输已失效，调试桥转为断开状态", used.mode());
            disconnect();
        }
    }

    @Override
    public boolean isConnected() {
        return state == ConnectionState.CONNECTED;
    }

    @Override
    public ConnectionState getState() {
        return state;
    }

    @Override
    public Result<Void> setConnectionMode(ConnectionMode newMode) {
        if (newMode == null) {
            return Result.error(ErrorKind.VALIDATION, "连接模式不能为空");
        }
        synchronized (stateLock) {
            if (state != ConnectionState.DISCONNECTED) {
                return Result.error(ErrorKind.CONFIGURATION, "已连接时不能修改连接模式");
            }
            if (modeLocked) {
                return Result.error(ErrorKind.CONFIGURATION, "连接模式在首次成功连接后已锁定为 " + mode);
            }
            mode = newMode;
            log.info("连接模式已设置为 {}", newMode);
            return Result.ok();
        }
    }

    @Override
    public ConnectionMode getConnectionMode() {
        return mode;
    }

    // ========================================================================
    // 配置
    // ========================================================================

    @Override
    public void setDebuggerPath(String path) {
        this.debuggerPath = path;
    }

    @Override
    public void setConnectionTimeout(int timeoutMs) {
        if (timeoutMs <= 0) {
            log.warn("忽略无效的连接超时: {} ms", timeoutMs);
            return;
        }
        this.connectionTimeoutMs = timeoutMs;
    }

    @Override
    public void setCommandTimeout(int timeoutMs) {
        if (timeoutMs <= 0) {
            log.warn("忽略无效的命令超时: {} ms", timeoutMs);
            return;
        }
        this.commandTimeoutMs = timeoutMs;
    }

    @Override
    public void setTcpEndpoint(String host, int port) {
        this.tcpHost = host;
        this.tcpPort = port;
    }

    private TransportSettings snapshotSettings() {
        return new TransportSettings(debuggerPath, connectionTimeoutMs, commandTimeoutMs, tcpHost, tcpPort);
    }

    // ========================================================================
    // 命令
    // ========================================================================

    /**
     * 校验并发送一条调试器命令，返回去掉控制字符后的响应文本。
     *
     * <p><b>设计思路</b>:
     * 1. <b>先校验后发送</b>: 含有 shell 元字符、控制字符或非 ASCII 字符的命令直接返回 VALIDATION 错误，
     *    永远不会到达传输层。
     * 2. <b>命令锁</b>: 同一连接上的命令由 {@code commandLock} 串行化，请求和响应一一对应，不会交错。
     * 3. <b>失效即断开</b>: 如果传输在这次往返中因超时或 I/O 错误失效，调试桥立即走 {@link #disconnect()}
     *    的清理路径转为 DISCONNECTED，之后的命令返回 NOT_CONNECTED，迟到的响应不会被当成下一条命令的结果。
     * </p>
     */
    @Override
    public Result<String> executeCommand(String command) {
        if (!isConnected()) {
            return notConnected();
        }
        Result<String> validated = CommandValidator.validateCommand(command);
        if (validated.isError()) {
            log.warn("拒绝不安全的命令: {}", validated.getErrorMessage());
            return validated;
        }
        synchronized (commandLock) {
            DebuggerTransport current = transport;
            if (current == null || !isConnected()) {
                return notConnected();
            }
            log.debug("执行调试器命令: {}", command);
            Result<String> response = current.send(command);
            dropIfBroken(current);
            return response.map(CommandValidator::stripControlCharacters);
        }
    }

    @Override
    public Result<String> getDisassembly(long address) {
        return executeCommand("disasm " + AddressFormat.format(address));
    }

    @Override
    public Result<MemoryDump> readMemory(long address, long size) {
        if (!isConnected()) {
            return notConnected();
        }
        Result<Void> range = CommandValidator.validateMemoryRange(address, size);
        if (range.isError()) {
            return range.propagate();
        }
        int length = (int) size;

        Result<byte[]> bytes;
        DebuggerTransport current = transport;
        if (current != null && current.supportsDirectMemory()) {
            synchronized (commandLock) {
                bytes = current.readMemory(address, length);
                dropIfBroken(current);
            }
        } else {
            bytes = executeCommand("dump " + AddressFormat.format(address) + " " + Integer.toHexString(length))
                    .map(HexCodec::parseHexBytes);
        }
        if (bytes.isError()) {
            return bytes.propagate();
        }
        byte[] data = bytes.getValue();
        if (data.length == 0) {
            return Result.error(ErrorKind.PROTOCOL, "调试器没有返回 " + AddressFormat.format(address) + " 处的内存数据");
        }
        if (data.length > length) {
            data = Arrays.copyOf(data, length);
        }
        String module = getSymbolAt(address).getValueOr("");
        return Result.success(new MemoryDump(address, data, length, module, Instant.now()));
    }

    @Override
    public Result<Void> writeMemory(long address, byte[] data) {
        if (!isConnected()) {
            return notConnected();
        }
        if (data == null) {
            return Result.error(ErrorKind.VALIDATION, "写入数据不能为空");
        }
        Result<Void> range = CommandValidator.validateMemoryRange(address, data.length);
        if (range.isError()) {
            return range;
        }

        DebuggerTransport current = transport;
        if (current != null && current.supportsDirectMemory()) {
            synchronized (commandLock) {
                Result<Void> written = current.writeMemory(address, data.clone());
                dropIfBroken(current);
                return written;
            }
        }
        for (int offset = 0; offset < data.length; offset += FILL_CHUNK_BYTES) {
            int end = Math.min(data.length, offset + FILL_CHUNK_BYTES);
            String hex = HexCodec.toHex(Arrays.copyOfRange(data, offset, end));
            Result<String> written = executeCommand("fill " + AddressFormat.format(address + offset) + " " + hex);
            if (written.isError()) {
                return written.propagate();
            }
        }
        return Result.ok();
    }

    @Override
    public Result<Void> setBreakpoint(long address) {
        if (address == 0) {
            return isConnected() ? Result.error(ErrorKind.VALIDATION, "断点地址不能为 0") : notConnected();
        }
        Result<String> response = executeCommand("bp " + AddressFormat.format(address));
        if (response.isError()) {
            return response.propagate();
        }
        if (!response.getValue().contains("Breakpoint set")) {
            return Result.error(ErrorKind.PROTOCOL, "设置断点失败，调试器响应: " + abbreviate(response.getValue()));
        }
        log.info("已在 {} 设置断点", AddressFormat.format(address));
        return Result.ok();
    }

    @Override
    public Result<Void> removeBreakpoint(long address) {
        return toVoid(executeCommand("bc " + AddressFormat.format(address)));
    }

    @Override
    public Result<Long> getRegisterValue(String register) {
        if (!isConnected()) {
            return notConnected();
        }
        if (register == null || !REGISTER_NAME.matcher(register).matches()) {
            return Result.error(ErrorKind.VALIDATION, "寄存器名无效: " + register);
        }
        Result<String> response = executeCommand("r " + register);
        if (response.isError()) {
            return response.propagate();
        }
        Pattern valuePattern =
                Pattern.compile("\\b" + Pattern.quote(register) + "\\s*=\\s*(?:0x)?([0-9A-Fa-f]{1,16})\\b", Pattern.CASE_INSENSITIVE);
        Matcher matcher = valuePattern.matcher(response.getValue());
        if (!matcher.find()) {
            return Result.error(
                    ErrorKind.PROTOCOL, "无法从响应中解析寄存器 " + register + ": " + abbreviate(response.getValue()));
        }
        return Result.success(Long.parseUnsignedLong(matcher.group(1), 16));
    }

    @Override
    public Result<Void> setRegisterValue(String register, long value) {
        if (!isConnected()) {
            return notConnected();
        }
        if (register == null || !REGISTER_NAME.matcher(register).matches()) {
            return Result.error(ErrorKind.VALIDATION, "寄存器名无效: " + register);
        }
        return toVoid(executeCommand("mov " + register + ", " + AddressFormat.format(value)));
    }

    @Override
    public Result<String> getSymbolAt(long address) {
        return executeCommand("sym " + AddressFormat.format(address)).map(String::trim);
    }

    // ========================================================================
    // 执行控制
    // ========================================================================

    @Override
    public Result<Void> stepInto() {
        return toVoid(executeCommand("sti"));
    }

    @Override
    public Result<Void> stepOver() {
        return toVoid(executeCommand("sto"));
    }

    @Override
    public Result<Void> stepOut() {
        return toVoid(executeCommand("rtr"));
    }

    @Override
    public Result<Void> resume() {
        return toVoid(executeCommand("run"));
    }

    @Override
    public Result<Void> pause() {
        return toVoid(executeCommand("pause"));
    }

    // ========================================================================
    // 事件
    // ========================================================================

    @Override
    public long registerEventHandler(DebugEventHandler handler) {
        Objects.requireNonNull(handler, "handler");
        long id = nextHandlerId.getAndIncrement();
        handlers.add(new EventHandlerEntry(id, handler));
        log.debug("已注册事件处理器 #{}", id);
        return id;
    }

    @Override
    public boolean publishEvent(DebugEvent event) {
        EventChannel<DebugEvent> channel = eventChannel;
        if (event == null || channel == null || !isConnected()) {
            log.debug("调试桥未连接，丢弃事件: {}", event);
            return false;
        }
        return channel.offer(event);
    }

    private Thread startEventLoop(EventChannel<DebugEvent> channel) {
        Thread thread = new Thread(() -> runEventLoop(channel), "debug-event-loop");
        thread.setDaemon(true);
        thread.start();
        return thread;
    }

    private void runEventLoop(EventChannel<DebugEvent> channel) {
        log.debug("事件分发线程已启动");
        try {
            DebugEvent event;
            while ((event = channel.take()) != null) {
                dispatch(event);
            }
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
        }
        log.debug("事件分发线程已退出");
    }

    private void dispatch(DebugEvent event) {
        for (EventHandlerEntry entry : handlers) {
            try {
                entry.handler().onEvent(event);
            } catch (RuntimeException e) {
                log.error("事件处理器 #{} 处理 {} 事件时出错: {}", entry.id(), event.type(), e.getMessage(), e);
            }
        }
    }

    // ========================================================================
    // 辅助方法
    // ========================================================================

    private static <T> Result<T> notConnected() {
        return Result.error(ErrorKind.NOT_CONNECTED, "调试器未连接");
    }

    private static Result<Void> toVoid(Result<String> result) {
        return result.isError() ? result.propagate() : Result.ok();
    }

    private static String abbreviate(String text) {
        return text.length() <= 200 ? text : text.substring(0, 200) + "...";
    }
}
