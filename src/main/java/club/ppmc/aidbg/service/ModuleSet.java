/**
 * ModuleSet.java
 *
 * 编排器持有的全部子系统句柄。初始化成功后一次性整体发布，之后不再改变。
 */
package club.ppmc.aidbg.service;

import club.ppmc.aidbg.service.bridge.DebuggerBridge;
import club.ppmc.aidbg.service.llm.LlmEngine;
import java.util.List;
import java.util.Objects;

public record ModuleSet(
        LogService logService,
        SecurityService securityService,
        ConfigService configService,
        ExpressionEvaluator expressionEvaluator,
        DumpAnalyzer dumpAnalyzer,
        DebuggerBridge debugBridge,
        LlmEngine llmEngine) {

    public ModuleSet {
        Objects.requireNonNull(logService, "logService");
        Objects.requireNonNull(securityService, "securityService");
        Objects.requireNonNull(configService, "configService");
        Objects.requireNonNull(expressionEvaluator, "expressionEvaluator");
        Objects.requireNonNull(dumpAnalyzer, "dumpAnalyzer");
        Objects.requireNonNull(debugBridge, "debugBridge");
        Objects.requireNonNull(llmEngine, "llmEngine");
    }

    /** 按初始化顺序排列的全部模块。 */
    public List<AutoCloseable> inInitializationOrder() {
        return List.of(logService, securityService, configService, expressionEvaluator, dumpAnalyzer, debugBridge, llmEngine);
    }
}
