/**
 * SubsystemFactory.java
 *
 * CoreOrchestrator 用来创建各子系统的工厂。按初始化顺序逐个调用；
 * 任何方法抛出异常或返回 null 都会中止初始化（createLlmEngine 返回 null 时改用默认引擎）。
 */
package club.ppmc.aidbg.service;

import club.ppmc.aidbg.service.bridge.DebuggerBridge;
import club.ppmc.aidbg.service.llm.LlmEngine;

public interface SubsystemFactory {

    LogService createLogService();

    SecurityService createSecurityService();

    ConfigService createConfigService();

    ExpressionEvaluator createExpressionEvaluator();

    DumpAnalyzer createDumpAnalyzer();

    DebuggerBridge createDebuggerBridge(ConfigService configService);

    /**
     * @return 要使用的 AI 引擎；返回 null 表示使用编排器内置的 DefaultLlmEngine。
     */
    default LlmEngine createLlmEngine(ConfigService configService, SecurityService securityService) {
        return null;
    }
}
