/**
 * WireProtocol.java
 *
 * 面向行的 ASCII 线路协议的分帧与事件解析。
 * 客户端每行发送一条命令；服务端返回零或多行响应，以单独一行 "END" 结束。
 * 服务端可在任何时候插入以 "EVENT " 开头的事件行，包括没有命令在执行的时候；
 * 这些行会被路由到事件通道，永远不会成为命令响应的一部分。
 *
 * 事件行格式:
 * EVENT type=BREAKPOINT_HIT address=0x401000 pid=1234 tid=5678 module=app.exe description=剩余整行文本
 */
package club.ppmc.aidbg.util;

import club.ppmc.aidbg.model.ErrorKind;
import club.ppmc.aidbg.model.Result;
import club.ppmc.aidbg.model.debug.DebugEvent;
import club.ppmc.aidbg.model.debug.DebugEventType;
import java.io.IOException;
import java.io.Writer;
import java.time.Instant;
import java.util.HashMap;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;
import lombok.extern.slf4j.Slf4j;

@Slf4j
public final class WireProtocol {

    public static final String RESPONSE_TERMINATOR = "END";
    public static final String EVENT_PREFIX = "EVENT ";

    /** 单条响应的最大字符数，超过即视为协议错误。略大于 dump 1 MiB 的十六进制文本。 */
    static final int MAX_RESPONSE_CHARS = 4 * 1024 * 1024;

    private WireProtocol() {}

    public static void writeCommand(Writer writer, String command) throws IOException {
        writer.write(command);
        writer.write('\n');
        writer.flush();
    }

    public static boolean isTerminator(String line) {
        return RESPONSE_TERMINATOR.equals(line);
    }

    public static boolean isEventLine(String line) {
        return line != null && line.startsWith(EVENT_PREFIX);
    }

    /**
     * 逐行累积一条命令的响应文本，行之间以换行连接。
     * 超过 MAX_RESPONSE_CHARS 后拒绝继续追加，此时连接上的剩余响应已无法与后续命令对齐。
     */
    public static final class ResponseBuffer {

        private final StringBuilder text = new StringBuilder();

        /**
         * @return 追加后仍在上限之内返回 true。
         */
        public boolean append(String line) {
            int separator = text.length() > 0 ? 1 : 0;
            if (text.length() + separator + line.length() > MAX_RESPONSE_CHARS) {
                return false;
            }
            if (text.length() > 0) {
                text.append('\n');
            }
            text.append(line);
            return true;
        }

        public Result<String> overflow() {
            return Result.error(ErrorKind.PROTOCOL, "调试器响应超过上限 " + MAX_RESPONSE_CHARS + " 字符");
        }

        public String text() {
            return text.toString();
        }
    }

    /**
     * 解析一行事件文本。无法识别的事件类型会被记录并丢弃。
     */
    public static Optional<DebugEvent> parseEventLine(String line) {
        if (!isEventLine(line)) {
            return Optional.empty();
        }
        String body = line.substring(EVENT_PREFIX.length()).trim();
        Map<String, String> fields = new HashMap<>();
        int descriptionStart = body.indexOf("description=");
        if (descriptionStart >= 0) {
            fields.put("description", body.substring(descriptionStart + "description=".length()));
            body = body.substring(0, descriptionStart).trim();
        }
        for (String token : body.split("\\s+")) {
            int eq = token.indexOf('=');
            if (eq > 0) {
                fields.put(token.substring(0, eq), token.substring(eq + 1));
            }
        }

        String typeText = fields.remove("type");
        if (typeText == null) {
            log.warn("事件行缺少 type 字段，已丢弃: {}", line);
            return Optional.empty();
        }
        DebugEventType type;
        try {
            type = DebugEventType.valueOf(typeText.toUpperCase(Locale.ROOT));
        } catch (IllegalArgumentException e) {
            log.warn("未知的调试事件类型 '{}'，已丢弃", typeText);
            return Optional.empty();
        }

        long address = parseAddressField(fields.remove("address"));
        long pid = parseNumberField(fields.remove("pid"));
        long tid = parseNumberField(fields.remove("tid"));
        String module = fields.remove("module");
        String description = fields.remove("description");
        return Optional.of(new DebugEvent(type, address, pid, tid, module, description, Instant.now(), fields));
    }

    private static long parseAddressField(String value) {
        if (value == null) {
            return 0;
        }
        return AddressFormat.parse(value).getValueOr(0L);
    }

    private static long parseNumberField(String value) {
        if (value == null) {
            return 0;
        }
        try {
            return Long.parseLong(value);
        } catch (NumberFormatException e) {
            return 0;
        }
    }
}
