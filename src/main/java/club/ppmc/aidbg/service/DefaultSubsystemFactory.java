/**
 * DefaultSubsystemFactory.java
 *
 * 生产环境使用的子系统工厂。
 * 它从 application.properties 读取 aidbg.* 配置作为初始 AppSettings，
 * 从 Spring 容器收集 AiProvider Bean 和可选的 PluginHostHandle，并据此创建各子系统。
 * 所有配置都应通过 ConfigService 读取，本类是唯一使用 @Value 的地方。
 */
package club.ppmc.aidbg.service;

import club.ppmc.aidbg.model.AppSettings;
import club.ppmc.aidbg.model.Result;
import club.ppmc.aidbg.model.debug.ConnectionMode;
import club.ppmc.aidbg.service.bridge.DebuggerBridge;
import club.ppmc.aidbg.service.bridge.PluginHostHandle;
import club.ppmc.aidbg.service.bridge.TransportFactory;
import club.ppmc.aidbg.service.bridge.X64DbgBridge;
import club.ppmc.aidbg.service.llm.AiProvider;
import club.ppmc.aidbg.service.llm.DefaultLlmEngine;
import club.ppmc.aidbg.service.llm.LlmEngine;
import club.ppmc.aidbg.util.AddressFormat;
import java.util.HashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.ObjectProvider;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Component;
import org.springframework.util.StringUtils;

@Component
public class DefaultSubsystemFactory implements SubsystemFactory {

    private static final Logger LOGGER = LoggerFactory.getLogger(DefaultSubsystemFactory.class);

    private final AppSettings initialSettings;
    private final ObjectProvider<AiProvider> aiProviders;
    private final ObjectProvider<PluginHostHandle> pluginHost;

    public DefaultSubsystemFactory(
            @Value("${aidbg.debugger.path:}") String debuggerPath,
            @Value("${aidbg.debugger.connection-mode:EXTERNAL}") String connectionMode,
            @Value("${aidbg.debugger.connection-timeout-ms:5000}") int connectionTimeoutMs,
            @Value("${aidbg.debugger.command-timeout-ms:10000}") int commandTimeoutMs,
            @Value("${aidbg.debugger.tcp-host:127.0.0.1}") String tcpHost,
            @Value("${aidbg.debugger.tcp-port:27042}") int tcpPort,
            @Value("${aidbg.llm.default-provider:claude}") String defaultProvider,
            @Value("${aidbg.llm.max-concurrent-requests:4}") int maxConcurrentRequests,
            @Value("#{${aidbg.llm.api-keys:{:}}}") Map<String, String> apiKeys,
            @Value("${aidbg.analysis.address:0x140001000}") String analysisAddress,
            @Value("${aidbg.log.level:INFO}") String logLevel,
            ObjectProvider<AiProvider> aiProviders,
            ObjectProvider<PluginHostHandle> pluginHost) {
        this.aiProviders = aiProviders;
        this.pluginHost = pluginHost;

        var settings = new AppSettings();
        if (StringUtils.hasText(debuggerPath)) {
            settings.setDebuggerPath(debuggerPath);
        }
        settings.setConnectionMode(parseMode(connectionMode));
        settings.setConnectionTimeoutMs(connectionTimeoutMs);
        settings.setCommandTimeoutMs(commandTimeoutMs);
        settings.setTcpHost(tcpHost);
        settings.setTcpPort(tcpPort);
        settings.setDefaultProvider(defaultProvider);
        settings.setMaxConcurrentRequests(maxConcurrentRequests);
        settings.setProviderApiKeys(apiKeys != null ? new HashMap<>(apiKeys) : new HashMap<>());
        Result<Long> address = AddressFormat.parse(analysisAddress);
        if (address.isSuccess()) {
            settings.setAnalysisAddress(address.getValue());
        } else {
            LOGGER.warn("aidbg.analysis.address 无效 ({})，使用默认值 {}",
                    analysisAddress, AddressFormat.format(settings.getAnalysisAddress()));
        }
        settings.setLogLevel(logLevel);
        this.initialSettings = settings;
    }

    private static ConnectionMode parseMode(String value) {
        try {
            return ConnectionMode.valueOf(value.trim().toUpperCase(Locale.ROOT));
        } catch (IllegalArgumentException e) {
            LOGGER.warn("未知的连接模式 '{}'，使用 EXTERNAL", value);
            return ConnectionMode.EXTERNAL;
        }
    }

    @Override
    public LogService createLogService() {
        return new LogService(initialSettings.getLogLevel());
    }

    @Override
    public SecurityService createSecurityService() {
        return new SecurityService();
    }

    @Override
    public ConfigService createConfigService() {
        return new ConfigService(initialSettings);
    }

    @Override
    public ExpressionEvaluator createExpressionEvaluator() {
        return new TemplateExpressionEvaluator();
    }

    @Override
    public DumpAnalyzer createDumpAnalyzer() {
        return new DumpAnalyzer();
    }

    @Override
    public DebuggerBridge createDebuggerBridge(ConfigService configService) {
        return new X64DbgBridge(new TransportFactory(pluginHost.getIfAvailable()));
    }

    @Override
    public LlmEngine createLlmEngine(ConfigService configService, SecurityService securityService) {
        AppSettings settings = configService.getSettings();
        List<AiProvider> providers = aiProviders.orderedStream().toList();
        return new DefaultLlmEngine(
                securityService, providers, settings.getDefaultProvider(), settings.getMaxConcurrentRequests());
    }
}
