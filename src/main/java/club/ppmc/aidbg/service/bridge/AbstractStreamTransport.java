/**
 * AbstractStreamTransport.java
 *
 * 基于一对字节流的传输策略的公共部分：外部进程的 stdin/stdout、命名管道、
 * Unix 域套接字和 TCP 套接字都走同一套行协议。
 * 子类只负责建立和释放底层连接，然后调用 attachStreams()。
 *
 * 每个连接有一个专属的读取线程持续读取输入流：事件行立即交给事件接收器，
 * 其余行进入响应队列，由正在等待的 send() 取走。
 * 一旦某条命令超时或流出错，连接上剩余的数据就无法再与命令对齐，传输会被标记为失效并关闭。
 */
package club.ppmc.aidbg.service.bridge;

import club.ppmc.aidbg.model.ErrorKind;
import club.ppmc.aidbg.model.Result;
import club.ppmc.aidbg.model.debug.DebugEvent;
import club.ppmc.aidbg.util.WireProtocol;
import java.io.BufferedReader;
import java.io.BufferedWriter;
import java.io.IOException;
import java.io.InputStream;
import java.io.InputStreamReader;
import java.io.OutputStream;
import java.io.OutputStreamWriter;
import java.nio.charset.StandardCharsets;
import java.util.Locale;
import java.util.concurrent.BlockingQueue;
import java.util.concurrent.LinkedBlockingQueue;
import java.util.concurrent.TimeUnit;
import java.util.function.Consumer;
import lombok.extern.slf4j.Slf4j;

@Slf4j
public abstract class AbstractStreamTransport implements DebuggerTransport {

    private static final long READER_JOIN_TIMEOUT_MS = 1000;

    /** 读取线程交给 send() 的一行输入；failure 非空表示流已结束。 */
    private record InboundLine(String text, String failure) {

        static InboundLine of(String text) {
            return new InboundLine(text, null);
        }

        static InboundLine endOfStream(String failure) {
            return new InboundLine(null, failure);
        }

        boolean isEndOfStream() {
            return failure != null;
        }
    }

    private final BlockingQueue<InboundLine> responseLines = new LinkedBlockingQueue<>();

    private volatile BufferedWriter writer;
    private volatile Consumer<DebugEvent> eventSink = event -> {};
    private volatile long commandTimeoutMs;
    private volatile boolean closed;
    private volatile boolean broken;
    private volatile Thread readerThread;

    /**
     * 绑定底层流并启动读取线程。
     *
     * @param commandTimeoutMs 等待单条响应的超时，非正数表示无限等待。
     */
    protected void attachStreams(InputStream in, OutputStream out, Consumer<DebugEvent> sink, long commandTimeoutMs) {
        var source = new BufferedReader(new InputStreamReader(in, StandardCharsets.US_ASCII));
        this.writer = new BufferedWriter(new OutputStreamWriter(out, StandardCharsets.US_ASCII));
        this.eventSink = sink != null ? sink : event -> {};
        this.commandTimeoutMs = commandTimeoutMs;
        Thread thread = new Thread(() -> readLoop(source), "debug-" + mode().name().toLowerCase(Locale.ROOT) + "-reader");
        thread.setDaemon(true);
        this.readerThread = thread;
        thread.start();
    }

    private void readLoop(BufferedReader source) {
        log.debug("{} 读取线程已启动", mode());
        try (source) {
            String line;
            while ((line = source.readLine()) != null) {
                if (WireProtocol.isEventLine(line)) {
                    WireProtocol.parseEventLine(line).ifPresent(this::deliverEvent);
                } else {
                    responseLines.offer(InboundLine.of(line));
                }
            }
            responseLines.offer(InboundLine.endOfStream("调试器关闭了连接"));
        } catch (IOException e) {
            if (!closed) {
                log.warn("读取调试器输出失败 ({}): {}", mode(), e.getMessage());
            }
            responseLines.offer(InboundLine.endOfStream("读取调试器输出失败: " + e.getMessage()));
        }
        log.debug("{} 读取线程已退出", mode());
    }

    private void deliverEvent(DebugEvent event) {
        try {
            eventSink.accept(event);
        } catch (RuntimeException e) {
            log.error("事件接收器处理 {} 事件时出错: {}", event.type(), e.getMessage(), e);
        }
    }

    @Override
    public Result<String> send(String command) {
        BufferedWriter out = writer;
        if (closed || out == null) {
            return Result.error(ErrorKind.NOT_CONNECTED, mode() + " 传输未打开");
        }
        Result<Void> clean = discardUnsolicitedLines();
        if (clean.isError()) {
            return clean.propagate();
        }
        try {
            WireProtocol.writeCommand(out, command);
        } catch (IOException e) {
            markBroken("写入命令失败: " + e.getMessage());
            return Result.error(ErrorKind.RESOURCE, "写入命令失败: " + e.getMessage());
        }
        return awaitResponse();
    }

    private Result<String> awaitResponse() {
        var response = new WireProtocol.ResponseBuffer();
        long timeoutMs = commandTimeoutMs;
        long deadline = System.nanoTime() + TimeUnit.MILLISECONDS.toNanos(timeoutMs);
        try {
            while (true) {
                InboundLine next;
                if (timeoutMs > 0) {
                    next = responseLines.poll(deadline - System.nanoTime(), TimeUnit.NANOSECONDS);
                } else {
                    next = responseLines.take();
                }
                if (next == null) {
                    markBroken("等待响应超过 " + timeoutMs + " ms");
                    return Result.error(ErrorKind.PROTOCOL, "等待调试器响应超时");
                }
                if (next.isEndOfStream()) {
                    markBroken(next.failure());
                    return Result.error(ErrorKind.CONNECTION, "调试器在响应结束前关闭了连接: " + next.failure());
                }
                if (WireProtocol.isTerminator(next.text())) {
                    return Result.success(response.text());
                }
                if (!response.append(next.text())) {
                    markBroken("响应超过上限");
                    return response.overflow();
                }
            }
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            markBroken("等待响应时被中断");
            return Result.error(ErrorKind.RESOURCE, "等待调试器响应时被中断");
        }
    }

    /** 丢弃两次命令之间到达的非事件行，它们不属于任何命令。 */
    private Result<Void> discardUnsolicitedLines() {
        InboundLine stale;
        while ((stale = responseLines.poll()) != null) {
            if (stale.isEndOfStream()) {
                markBroken(stale.failure());
                return Result.error(ErrorKind.NOT_CONNECTED, "调试器连接已关闭: " + stale.failure());
            }
            log.warn("丢弃调试器发来的不属于任何命令的输出 ({}): {}", mode(), stale.text());
        }
        return Result.ok();
    }

    private void markBroken(String reason) {
        if (broken) {
            return;
        }
        broken = true;
        log.warn("{} 传输已失效，关闭连接: {}", mode(), reason);
        close();
    }

    @Override
    public boolean isBroken() {
        return broken;
    }

    @Override
    public final void close() {
        if (closed) {
            return;
        }
        closed = true;
        // 先断开底层连接，使阻塞在 readLine 上的读取线程退出；reader 由读取线程自己关闭
        try {
            releaseConnection();
        } catch (IOException e) {
            log.warn("释放 {} 传输资源时出错: {}", mode(), e.getMessage());
        }
        closeQuietly(writer);
        responseLines.offer(InboundLine.endOfStream("传输已关闭"));
        Thread thread = readerThread;
        if (thread != null && thread != Thread.currentThread()) {
            try {
                thread.join(READER_JOIN_TIMEOUT_MS);
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
            }
            if (thread.isAlive()) {
                log.warn("{} 读取线程未在 {} ms 内退出", mode(), READER_JOIN_TIMEOUT_MS);
            }
        }
        log.debug("{} 传输已关闭", mode());
    }

    /** 释放子类持有的底层连接。 */
    protected abstract void releaseConnection() throws IOException;

    private static void closeQuietly(AutoCloseable closeable) {
        if (closeable == null) {
            return;
        }
        try {
            closeable.close();
        } catch (Exception e) {
            log.debug("关闭流时出错: {}", e.getMessage());
        }
    }
}
