/**
 * LogService.java
 *
 * 编排器持有的日志子系统。底层仍是 slf4j + Logback，本类只负责两件事：
 * 运行时调整本应用的日志级别，以及把调试事件、内存快照、AI 分析结果按统一格式写入日志。
 */
package club.ppmc.aidbg.service;

import ch.qos.logback.classic.Level;
import ch.qos.logback.classic.Logger;
import club.ppmc.aidbg.model.ErrorKind;
import club.ppmc.aidbg.model.Result;
import club.ppmc.aidbg.model.debug.DebugEvent;
import club.ppmc.aidbg.model.debug.MemoryDump;
import club.ppmc.aidbg.util.AddressFormat;
import club.ppmc.aidbg.util.HexCodec;
import java.util.Arrays;
import java.util.Locale;
import java.util.Set;
import org.slf4j.LoggerFactory;

public class LogService implements AutoCloseable {

    public static final String APPLICATION_LOGGER = "club.ppmc.aidbg";
    static final String EVENT_LOGGER = "club.ppmc.aidbg.events";

    /** 内存快照在日志中最多展示的字节数。 */
    static final int DUMP_PREVIEW_BYTES = 64;

    private static final Set<String> LEVELS = Set.of("TRACE", "DEBUG", "INFO", "WARN", "ERROR", "OFF");

    private final org.slf4j.Logger eventLog = LoggerFactory.getLogger(EVENT_LOGGER);
    private final org.slf4j.Logger log = LoggerFactory.getLogger(LogService.class);

    public LogService(String initialLevel) {
        if (initialLevel != null && !initialLevel.isBlank()) {
            Result<Void> applied = setLevel(initialLevel);
            if (applied.isError()) {
                log.warn("初始日志级别无效，保持默认: {}", applied.getErrorMessage());
            }
        }
        log.info("日志服务已初始化，当前级别: {}", getLevel());
    }

    /**
     * 修改本应用根包的日志级别。
     */
    public Result<Void> setLevel(String level) {
        String normalized = level == null ? "" : level.trim().toUpperCase(Locale.ROOT);
        if (!LEVELS.contains(normalized)) {
            return Result.error(ErrorKind.VALIDATION, "未知的日志级别: " + level + "，可选值: " + LEVELS);
        }
        if (!(LoggerFactory.getLogger(APPLICATION_LOGGER) instanceof Logger logbackLogger)) {
            return Result.error(ErrorKind.RESOURCE, "当前日志实现不是 Logback，无法在运行时修改级别");
        }
        logbackLogger.setLevel(Level.toLevel(normalized));
        return Result.ok();
    }

    public String getLevel() {
        if (LoggerFactory.getLogger(APPLICATION_LOGGER) instanceof Logger logbackLogger) {
            return logbackLogger.getEffectiveLevel().toString();
        }
        return "UNKNOWN";
    }

    public void logDebugEvent(DebugEvent event) {
        eventLog.info(
                "[{}] address={} pid={} tid={} module={} {}",
                event.type(),
                AddressFormat.format(event.address()),
                event.processId(),
                event.threadId(),
                event.moduleName().isEmpty() ? "-" : event.moduleName(),
                event.description());
    }

    public void logMemoryDump(MemoryDump dump) {
        if (!eventLog.isDebugEnabled()) {
            return;
        }
        byte[] data = dump.data();
        byte[] preview = Arrays.copyOf(data, Math.min(data.length, DUMP_PREVIEW_BYTES));
        eventLog.debug(
                "内存快照 {} ({} 字节, 模块: {}): {}{}",
                AddressFormat.format(dump.baseAddress()),
                data.length,
                dump.moduleName().isEmpty() ? "-" : dump.moduleName(),
                HexCodec.toHex(preview),
                data.length > preview.length ? "..." : "");
    }

    public void logAnalysis(long address, String provider, String content) {
        eventLog.info("AI 分析 {} (提供方: {}): {}", AddressFormat.format(address), provider, content);
    }

    @Override
    public void close() {
        log.info("日志服务已关闭");
    }
}
