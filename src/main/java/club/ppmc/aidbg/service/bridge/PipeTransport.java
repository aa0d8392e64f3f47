/**
 * PipeTransport.java
 *
 * 通过本地管道连接调试器插件的传输策略。
 * Windows 上以重叠 I/O 方式打开命名管道 \\.\pipe\x64dbg_bridge，读取线程阻塞读时命令仍可写入；
 * 其他平台使用临时目录下的 Unix 域套接字 x64dbg_bridge.sock。
 */
package club.ppmc.aidbg.service.bridge;

import club.ppmc.aidbg.model.ErrorKind;
import club.ppmc.aidbg.model.Result;
import club.ppmc.aidbg.model.debug.ConnectionMode;
import club.ppmc.aidbg.model.debug.DebugEvent;
import club.ppmc.aidbg.model.debug.TransportSettings;
import java.io.Closeable;
import java.io.IOException;
import java.io.InterruptedIOException;
import java.net.StandardProtocolFamily;
import java.net.UnixDomainSocketAddress;
import java.nio.channels.AsynchronousFileChannel;
import java.nio.channels.SocketChannel;
import java.nio.file.Path;
import java.nio.file.StandardOpenOption;
import java.util.Locale;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.Future;
import java.util.function.Consumer;
import lombok.extern.slf4j.Slf4j;

@Slf4j
public class PipeTransport extends AbstractStreamTransport {

    public static final String WINDOWS_PIPE_NAME = "\\\\.\\pipe\\x64dbg_bridge";
    public static final String SOCKET_FILE_NAME = "x64dbg_bridge.sock";

    private final boolean windows;
    private final Path socketPath;
    private Closeable connection;

    public PipeTransport() {
        this(
                System.getProperty("os.name", "").toLowerCase(Locale.ROOT).contains("win"),
                Path.of(System.getProperty("java.io.tmpdir"), SOCKET_FILE_NAME));
    }

    /** 测试用：指定平台和套接字路径。 */
    PipeTransport(boolean windows, Path socketPath) {
        this.windows = windows;
        this.socketPath = socketPath;
    }

    @Override
    public ConnectionMode mode() {
        return ConnectionMode.PIPE;
    }

    @Override
    public Result<Void> open(TransportSettings settings, Consumer<DebugEvent> eventSink) {
        return windows ? openNamedPipe(settings, eventSink) : openUnixSocket(settings, eventSink);
    }

    private Result<Void> openNamedPipe(TransportSettings settings, Consumer<DebugEvent> eventSink) {
        try {
            // 管道忽略位置参数
            var pipe = AsynchronousFileChannel.open(
                    Path.of(WINDOWS_PIPE_NAME), StandardOpenOption.READ, StandardOpenOption.WRITE);
            this.connection = pipe;
            attachStreams(
                    ChannelStreams.input(buffer -> await(pipe.read(buffer, 0))),
                    ChannelStreams.output(buffer -> await(pipe.write(buffer, 0))),
                    eventSink,
                    settings.commandTimeoutMs());
        } catch (IOException | RuntimeException e) {
            log.warn("打开命名管道 {} 失败: {}", WINDOWS_PIPE_NAME, e.getMessage());
            return Result.error(ErrorKind.CONNECTION, "无法打开命名管道 " + WINDOWS_PIPE_NAME + ": " + e.getMessage());
        }
        log.info("已通过命名管道 {} 连接到调试器", WINDOWS_PIPE_NAME);
        return Result.ok();
    }

    private static int await(Future<Integer> pending) throws IOException {
        try {
            return pending.get();
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            pending.cancel(true);
            throw new InterruptedIOException("管道 I/O 被中断");
        } catch (ExecutionException e) {
            Throwable cause = e.getCause();
            if (cause instanceof IOException) {
                throw (IOException) cause;
            }
            throw new IOException(cause);
        }
    }

    private Result<Void> openUnixSocket(TransportSettings settings, Consumer<DebugEvent> eventSink) {
        SocketChannel channel = null;
        try {
            channel = SocketChannel.open(StandardProtocolFamily.UNIX);
            channel.connect(UnixDomainSocketAddress.of(socketPath));
            this.connection = channel;
            attachStreams(
                    ChannelStreams.input(channel::read),
                    ChannelStreams.output(channel::write),
                    eventSink,
                    settings.commandTimeoutMs());
        } catch (IOException | UnsupportedOperationException e) {
            if (channel != null) {
                try {
                    channel.close();
                } catch (IOException closeError) {
                    e.addSuppressed(closeError);
                }
            }
            this.connection = null;
            log.warn("连接 Unix 域套接字 {} 失败: {}", socketPath, e.getMessage());
            return Result.error(ErrorKind.CONNECTION, "无法连接到 " + socketPath + ": " + e.getMessage());
        }
        log.info("已通过 Unix 域套接字 {} 连接到调试器", socketPath);
        return Result.ok();
    }

    @Override
    protected void releaseConnection() throws IOException {
        if (connection != null) {
            connection.close();
        }
    }
}
