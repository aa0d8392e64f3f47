/**
 * CoreOrchestrator.java
 *
 * 应用的核心编排器，负责所有子系统的生命周期并对外提供共享访问。
 * 初始化按固定顺序进行：日志 -> 安全 -> 配置 -> 表达式求值 -> 内存分析 -> 调试桥 -> AI 引擎，
 * 任一步失败都会按相反顺序关闭已创建的模块并返回该错误。
 * 初始化成功后先发布 ModuleSet，再写 volatile 的 immutable 标志；此后各 getXxx() 无锁读取。
 * 关闭后的编排器不能再次初始化。
 */
package club.ppmc.aidbg.service;

import club.ppmc.aidbg.model.AppSettings;
import club.ppmc.aidbg.model.ErrorKind;
import club.ppmc.aidbg.model.Result;
import club.ppmc.aidbg.model.llm.LlmRequest;
import club.ppmc.aidbg.model.llm.LlmResponse;
import club.ppmc.aidbg.service.bridge.DebuggerBridge;
import club.ppmc.aidbg.service.llm.DefaultLlmEngine;
import club.ppmc.aidbg.service.llm.LlmEngine;
import club.ppmc.aidbg.util.AddressFormat;
import club.ppmc.aidbg.util.CommentText;
import java.util.ArrayDeque;
import java.util.Deque;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.concurrent.CompletableFuture;
import java.util.function.Supplier;
import lombok.extern.slf4j.Slf4j;

@Slf4j
public class CoreOrchestrator {

    static final String ANALYSIS_SYSTEM_PROMPT =
            "You are a reverse engineering assistant. Reply with one short plain-ASCII comment "
                    + "describing what the given x86-64 code does. No markdown, no quotes.";

    private final SubsystemFactory factory;
    private final Object lock = new Object();

    /** 在 immutable 置为 true 之前由 lock 保护；之后只读。 */
    private ModuleSet modules;

    private volatile boolean immutable;
    private volatile boolean initialized;
    private boolean shutDown;

    public CoreOrchestrator(SubsystemFactory factory) {
        this.factory = Objects.requireNonNull(factory, "factory");
    }

    // ========================================================================
    // 生命周期
    // ========================================================================

    /**
     * 按固定顺序创建并连接所有子系统。
     *
     * <p><b>设计思路</b>:
     * 1. <b>整体发布</b>: 所有模块先在局部变量中创建完毕，组装成一个不可变的 {@link ModuleSet}，
     *    最后一步才赋值给字段并设置 volatile 的 {@code immutable} 标志。读者要么看到 null，要么看到完整的一组模块，
     *    不会看到只创建了一半的状态。
     * 2. <b>失败回滚</b>: 已创建的模块压入栈中，任一步失败时按相反顺序逐个关闭，然后把失败原因作为结果返回。
     * 3. <b>幂等</b>: 已初始化时直接返回成功；关闭之后再次调用返回 CONFIGURATION 错误，
     *    因为被关闭的调试桥和 AI 引擎都不能复用。
     * 4. <b>密钥转移</b>: 配置中携带的 API 密钥在这里移交给 {@link SecurityService}，此后配置中不再保留明文。
     * </p>
     *
     * @return 成功，或第一个失败模块的错误。
     */
    public Result<Void> initialize() {
        synchronized (lock) {
            if (initialized) {
                return Result.ok();
            }
            if (shutDown) {
                return Result.error(ErrorKind.CONFIGURATION, "编排器已关闭，不能再次初始化");
            }
            log.info("核心编排器开始初始化...");

            Deque<AutoCloseable> built = new ArrayDeque<>();
            ModuleSet created;
            try {
                LogService logService = construct("日志服务", factory::createLogService, built);
                SecurityService securityService = construct("安全服务", factory::createSecurityService, built);
                ConfigService configService = construct("配置服务", factory::createConfigService, built);
                ExpressionEvaluator evaluator = construct("表达式求值器", factory::createExpressionEvaluator, built);
                DumpAnalyzer dumpAnalyzer = construct("内存分析器", factory::createDumpAnalyzer, built);
                DebuggerBridge bridge = construct("调试桥", () -> factory.createDebuggerBridge(configService), built);
                LlmEngine llmEngine = construct("AI 引擎", () -> createLlmEngine(configService, securityService), built);
                created = new ModuleSet(
                        logService, securityService, configService, evaluator, dumpAnalyzer, bridge, llmEngine);
            } catch (SubsystemInitializationException e) {
                log.error("核心编排器初始化失败: {}，正在回滚 {} 个已创建的模块", e.getMessage(), built.size());
                while (!built.isEmpty()) {
                    closeQuietly(built.pop());
                }
                return Result.error(e.getErrorKind(), e.getMessage());
            }

            transferApiKeys(created);
            applyBridgeSettings(created);
            registerDefaultEventLogging(created);

            this.modules = created;
            this.immutable = true;
            this.initialized = true;
            log.info("核心编排器初始化完成");
            return Result.ok();
        }
    }

    /**
     * 按初始化的相反顺序关闭所有模块，日志服务最后关闭，以便记录其他模块的关闭过程。重复调用无效果。
     */
    public Result<Void> shutdown() {
        synchronized (lock) {
            if (!initialized) {
                return Result.ok();
            }
            log.info("核心编排器开始关闭...");
            List<AutoCloseable> ordered = modules.inInitializationOrder();
            for (int i = ordered.size() - 1; i >= 0; i--) {
                closeQuietly(ordered.get(i));
            }
            initialized = false;
            shutDown = true;
            log.info("核心编排器已关闭");
            return Result.ok();
        }
    }

    public boolean isInitialized() {
        return initialized;
    }

    private <T> T construct(String name, Supplier<T> supplier, Deque<AutoCloseable> built)
            throws SubsystemInitializationException {
        T module;
        try {
            module = supplier.get();
        } catch (RuntimeException e) {
            log.error("创建{}时出错", name, e);
            throw new SubsystemInitializationException(ErrorKind.RESOURCE, "创建" + name + "失败: " + e.getMessage());
        }
        if (module == null) {
            throw new SubsystemInitializationException(ErrorKind.RESOURCE, "创建" + name + "失败: 工厂返回了 null");
        }
        if (module instanceof AutoCloseable closeable) {
            built.push(closeable);
        }
        log.debug("{}已创建", name);
        return module;
    }

    private LlmEngine createLlmEngine(ConfigService configService, SecurityService securityService) {
        LlmEngine engine = factory.createLlmEngine(configService, securityService);
        if (engine != null) {
            return engine;
        }
        AppSettings settings = configService.getSettings();
        log.info("未提供 AI 引擎，使用默认实现");
        return new DefaultLlmEngine(
                securityService, List.of(), settings.getDefaultProvider(), settings.getMaxConcurrentRequests());
    }

    private static void transferApiKeys(ModuleSet created) {
        Map<String, String> keys = created.configService().drainProviderApiKeys();
        keys.forEach((provider, key) -> {
            if (key == null || key.isBlank()) {
                return;
            }
            Result<Void> stored = created.securityService().storeCredential(provider, key);
            if (stored.isError()) {
                log.warn("无法保存 {} 的 API 密钥: {}", provider, stored.getErrorMessage());
            }
        });
    }

    /** 所有调试事件都经由 LogService 记录一份。 */
    private static void registerDefaultEventLogging(ModuleSet created) {
        long id = created.debugBridge().registerEventHandler(created.logService()::logDebugEvent);
        log.debug("调试事件日志处理器已注册 (#{})", id);
    }

    private static void closeQuietly(AutoCloseable module) {
        try {
            module.close();
        } catch (Exception e) {
            log.error("关闭模块 {} 时出错", module.getClass().getSimpleName(), e);
        }
    }

    // ========================================================================
    // 模块访问
    // ========================================================================

    private ModuleSet currentModules() {
        if (immutable) {
            return modules;
        }
        synchronized (lock) {
            return modules;
        }
    }

    public LogService getLogService() {
        ModuleSet m = currentModules();
        return m != null ? m.logService() : null;
    }

    public SecurityService getSecurityService() {
        ModuleSet m = currentModules();
        return m != null ? m.securityService() : null;
    }

    public ConfigService getConfigService() {
        ModuleSet m = currentModules();
        return m != null ? m.configService() : null;
    }

    public ExpressionEvaluator getExpressionEvaluator() {
        ModuleSet m = currentModules();
        return m != null ? m.expressionEvaluator() : null;
    }

    public DumpAnalyzer getDumpAnalyzer() {
        ModuleSet m = currentModules();
        return m != null ? m.dumpAnalyzer() : null;
    }

    public DebuggerBridge getDebugBridge() {
        ModuleSet m = currentModules();
        return m != null ? m.debugBridge() : null;
    }

    public LlmEngine getLlmEngine() {
        ModuleSet m = currentModules();
        return m != null ? m.llmEngine() : null;
    }

    // ========================================================================
    // 配置
    // ========================================================================

    /**
     * 把配置服务中的调试器路径、超时和 TCP 端点推送到调试桥。
     * 连接模式只在调试桥尚未锁定模式时生效。
     */
    public Result<Void> reloadBridgeSettings() {
        ModuleSet m = currentModules();
        if (m == null || !initialized) {
            return Result.error(ErrorKind.CONFIGURATION, "编排器尚未初始化");
        }
        applyBridgeSettings(m);
        return Result.ok();
    }

    private static void applyBridgeSettings(ModuleSet m) {
        AppSettings settings = m.configService().getSettings();
        DebuggerBridge bridge = m.debugBridge();
        bridge.setDebuggerPath(settings.getDebuggerPath());
        bridge.setConnectionTimeout(settings.getConnectionTimeoutMs());
        bridge.setCommandTimeout(settings.getCommandTimeoutMs());
        bridge.setTcpEndpoint(settings.getTcpHost(), settings.getTcpPort());
        if (settings.getConnectionMode() != null && settings.getConnectionMode() != bridge.getConnectionMode()) {
            Result<Void> modeResult = bridge.setConnectionMode(settings.getConnectionMode());
            if (modeResult.isError()) {
                log.warn("连接模式未更新: {}", modeResult.getErrorMessage());
            }
        }
    }

    // ========================================================================
    // AI 上下文分析
    // ========================================================================

    /**
     * 分析配置中 analysisAddress 处的代码。
     *
     * @see #analyzeContextAt(long)
     */
    public CompletableFuture<Void> analyzeCurrentContext() {
        ConfigService configService = getConfigService();
        if (configService == null || !initialized) {
            log.warn("编排器尚未初始化，跳过上下文分析");
            return CompletableFuture.completedFuture(null);
        }
        return analyzeContextAt(configService.getSettings().getAnalysisAddress());
    }

    /**
     * 同步获取指定地址的反汇编，异步请求 AI 分析，并把结果作为注释写回调试器。
     *
     * <p><b>设计思路</b>:
     * 1. <b>不阻塞调用方</b>: 只有反汇编在调用线程上完成，AI 请求和写回注释都在 Future 的后续阶段执行，
     *    REST 控制器因此可以立刻返回 202。
     * 2. <b>错误只记录</b>: 任何一步失败都写入日志并结束流程，返回的 Future 总是以 null 正常完成，
     *    它只用于等待流程结束，不能用于取消分析。
     * 3. <b>安全的注释</b>: AI 返回的文本经 {@link CommentText} 转义后才拼进 {@code SetCommentAt} 命令，
     *    保证生成的命令一定能通过调试桥的命令校验。
     * </p>
     */
    public CompletableFuture<Void> analyzeContextAt(long address) {
        ModuleSet m = currentModules();
        if (m == null || !initialized) {
            log.warn("编排器尚未初始化，跳过上下文分析");
            return CompletableFuture.completedFuture(null);
        }
        DebuggerBridge bridge = m.debugBridge();
        LlmEngine engine = m.llmEngine();
        LogService logService = m.logService();

        Result<String> disassembly = bridge.getDisassembly(address);
        if (disassembly.isError()) {
            log.error("获取 {} 的反汇编失败 [{}]: {}", AddressFormat.format(address),
                    disassembly.getErrorKind(), disassembly.getErrorMessage());
            return CompletableFuture.completedFuture(null);
        }

        var request = LlmRequest.of(
                "Explain the following disassembly at " + AddressFormat.format(address) + ".",
                List.of(disassembly.getValue()),
                ANALYSIS_SYSTEM_PROMPT);
        CompletableFuture<Result<LlmResponse>> pending;
        try {
            pending = engine.sendRequest(request);
        } catch (RuntimeException e) {
            log.error("提交 AI 分析请求失败", e);
            return CompletableFuture.completedFuture(null);
        }
        // 后续工作持有 bridge、engine 和编排器本身的引用，直到完成
        return pending.handleAsync((result, error) -> {
            try {
                applyAnalysis(bridge, engine, logService, address, result, error);
            } catch (RuntimeException e) {
                log.error("处理 AI 分析结果时出错", e);
            }
            return null;
        });
    }

    private void applyAnalysis(
            DebuggerBridge bridge,
            LlmEngine engine,
            LogService logService,
            long address,
            Result<LlmResponse> result,
            Throwable error) {
        if (error != null) {
            log.error("AI 分析请求异常结束", error);
            return;
        }
        if (result == null || result.isError()) {
            log.error("AI 分析失败: {}", result == null ? "无结果" : result.getErrorMessage());
            return;
        }
        LlmResponse response = result.getValue();
        String comment = CommentText.escape(response.content());
        if (comment.isEmpty()) {
            log.warn("AI 分析返回了空内容 (提供方: {})", response.provider());
            return;
        }
        String provider = response.provider() != null ? response.provider() : engine.getDefaultProvider();
        logService.logAnalysis(address, provider, response.content());

        Result<String> written = bridge.executeCommand("SetCommentAt " + AddressFormat.format(address) + ", " + comment);
        if (written.isError()) {
            log.error("写入注释失败 [{}]: {}", written.getErrorKind(), written.getErrorMessage());
        } else {
            log.info("已在 {} 写入 AI 注释", AddressFormat.format(address));
        }
    }

    private static final class SubsystemInitializationException extends Exception {

        private final ErrorKind errorKind;

        SubsystemInitializationException(ErrorKind errorKind, String message) {
            super(message);
            this.errorKind = errorKind;
        }

        ErrorKind getErrorKind() {
            return errorKind;
        }
    }
}
