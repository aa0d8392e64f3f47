/**
 * ExternalProcessTransport.java
 *
 * 启动一个独立的调试器进程并通过其标准输入/输出进行行协议通信的传输策略。
 * 可执行文件依次取自配置的路径和内置的安装路径列表；
 * 标准错误由一个后台线程持续读取并写入日志，避免缓冲区写满导致子进程阻塞。
 */
package club.ppmc.aidbg.service.bridge;

import club.ppmc.aidbg.model.ErrorKind;
import club.ppmc.aidbg.model.Result;
import club.ppmc.aidbg.model.debug.ConnectionMode;
import club.ppmc.aidbg.model.debug.DebugEvent;
import club.ppmc.aidbg.model.debug.TransportSettings;
import java.io.BufferedReader;
import java.io.IOException;
import java.io.InputStream;
import java.io.InputStreamReader;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.concurrent.TimeUnit;
import java.util.function.Consumer;
import lombok.extern.slf4j.Slf4j;

@Slf4j
public class ExternalProcessTransport extends AbstractStreamTransport {

    static final List<Path> DEFAULT_SEARCH_PATHS =
            List.of(
                    Path.of("C:\\x64dbg\\release\\x64\\x64dbg.exe"),
                    Path.of("C:\\Program Files\\x64dbg\\x64dbg.exe"),
                    Path.of("C:\\Program Files (x86)\\x64dbg\\x64dbg.exe"));

    private final List<Path> searchPaths;
    private Process process;
    private long shutdownWaitMs = 1000;

    public ExternalProcessTransport() {
        this(DEFAULT_SEARCH_PATHS);
    }

    ExternalProcessTransport(List<Path> searchPaths) {
        this.searchPaths = List.copyOf(searchPaths);
    }

    @Override
    public ConnectionMode mode() {
        return ConnectionMode.EXTERNAL;
    }

    @Override
    public Result<Void> open(TransportSettings settings, Consumer<DebugEvent> eventSink) {
        Optional<Path> executable = resolveExecutable(settings.debuggerPath());
        if (executable.isEmpty()) {
            return Result.error(ErrorKind.CONNECTION, "找不到调试器可执行文件，已检查: " + candidates(settings.debuggerPath()));
        }
        Path exe = executable.get();
        ProcessBuilder pb = new ProcessBuilder(exe.toString());
        if (exe.getParent() != null) {
            pb.directory(exe.getParent().toFile());
        }
        log.info("启动外部调试器: {}", exe);
        Process p;
        try {
            p = pb.start();
        } catch (IOException e) {
            log.error("启动调试器进程失败: {}", e.getMessage(), e);
            return Result.error(ErrorKind.CONNECTION, "无法启动调试器进程 " + exe + ": " + e.getMessage());
        }
        if (!p.isAlive()) {
            return Result.error(ErrorKind.CONNECTION, "调试器进程启动后立即退出，退出码: " + p.exitValue());
        }
        this.process = p;
        this.shutdownWaitMs = Math.max(100, settings.connectionTimeoutMs());
        drainErrorStream(p.getErrorStream(), p.pid());
        attachStreams(p.getInputStream(), p.getOutputStream(), eventSink, settings.commandTimeoutMs());
        log.info("调试器进程已启动，PID: {}", p.pid());
        return Result.ok();
    }

    Optional<Path> resolveExecutable(String configuredPath) {
        for (Path candidate : candidates(configuredPath)) {
            if (Files.isRegularFile(candidate)) {
                return Optional.of(candidate);
            }
        }
        return Optional.empty();
    }

    private List<Path> candidates(String configuredPath) {
        var result = new ArrayList<Path>();
        if (configuredPath != null && !configuredPath.isBlank()) {
            result.add(Path.of(configuredPath.trim()));
        }
        result.addAll(searchPaths);
        return result;
    }

    private void drainErrorStream(InputStream errorStream, long pid) {
        Thread drain =
                new Thread(
                        () -> {
                            try (var reader = new BufferedReader(new InputStreamReader(errorStream, StandardCharsets.UTF_8))) {
                                String line;
                                while ((line = reader.readLine()) != null) {
                                    log.debug("[x64dbg:{}] {}", pid, line);
                                }
                            } catch (IOException e) {
                                log.debug("读取调试器错误输出时出错 (可能是进程已结束): {}", e.getMessage());
                            }
                        },
                        "x64dbg-stderr-" + pid);
        drain.setDaemon(true);
        drain.start();
    }

    @Override
    protected void releaseConnection() {
        Process p = process;
        if (p == null || !p.isAlive()) {
            return;
        }
        p.destroy();
        try {
            if (!p.waitFor(shutdownWaitMs, TimeUnit.MILLISECONDS)) {
                p.destroyForcibly();
                log.info("调试器进程未在 {} ms 内退出，已强制终止", shutdownWaitMs);
            }
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            p.destroyForcibly();
        }
    }
}
