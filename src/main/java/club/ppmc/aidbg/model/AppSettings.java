/**
 * AppSettings.java
 *
 * 该文件定义了一个POJO，用于表示调试桥和 AI 分析功能的各项配置。
 * 初始值来自 application.properties，由 ConfigService 持有并支持运行时按 JSON Pointer 修改。
 * 它是一个可变对象，以便于Jackson库进行树模型转换。
 */
package club.ppmc.aidbg.model;

import club.ppmc.aidbg.model.debug.ConnectionMode;
import java.util.HashMap;
import java.util.Map;
import lombok.Data;

@Data
public class AppSettings {

    // --- 调试器连接 ---
    /**
     * x64dbg 可执行文件的绝对路径，例如 "C:/x64dbg/release/x64/x64dbg.exe"。
     * 为空时 EXTERNAL 模式会依次尝试内置的安装路径列表。
     */
    private String debuggerPath;

    private ConnectionMode connectionMode = ConnectionMode.EXTERNAL;

    /** 建立连接的超时时间（毫秒）。 */
    private int connectionTimeoutMs = 5000;

    /** 等待单条命令响应的超时时间（毫秒）。 */
    private int commandTimeoutMs = 10000;

    private String tcpHost = "127.0.0.1";
    private int tcpPort = 27042;

    // --- AI 分析 ---
    /**
     * 默认的 AI 提供方名称，例如 "claude"。
     * 请求未指定提供方时由 LlmEngine 使用。
     */
    private String defaultProvider = "claude";

    /**
     * 各提供方的 API 密钥。
     * Key: 提供方名称；Value: 密钥。启动时转存到 SecurityService 后从这里清除。
     */
    private Map<String, String> providerApiKeys = new HashMap<>();

    /** AnalyzeCurrentContext 分析的目标地址。 */
    private long analysisAddress = 0x140001000L;

    /** 同时进行中的 AI 请求上限。 */
    private int maxConcurrentRequests = 4;

    // --- 日志 ---
    private String logLevel = "INFO";
}
