/**
 * AnalysisController.java
 *
 * 该控制器负责 AI 上下文分析和内存快照静态分析相关的HTTP请求。
 * 上下文分析是异步的：请求立即返回 202，分析结果以注释形式写回调试器。
 */
package club.ppmc.aidbg.controller;

import club.ppmc.aidbg.exception.DebuggerOperationException;
import club.ppmc.aidbg.model.ErrorKind;
import club.ppmc.aidbg.model.analysis.DumpAnalysisResult;
import club.ppmc.aidbg.model.debug.MemoryDump;
import club.ppmc.aidbg.service.CoreOrchestrator;
import club.ppmc.aidbg.service.WebSocketNotificationService;
import club.ppmc.aidbg.service.llm.LlmEngine;
import club.ppmc.aidbg.util.AddressFormat;
import java.util.LinkedHashMap;
import java.util.Map;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.PutMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

@RestController
@RequestMapping("/api/analysis")
@Slf4j
public class AnalysisController {

    private final CoreOrchestrator orchestrator;
    private final WebSocketNotificationService notificationService;

    public AnalysisController(CoreOrchestrator orchestrator, WebSocketNotificationService notificationService) {
        this.orchestrator = orchestrator;
        this.notificationService = notificationService;
    }

    private void requireInitialized() {
        if (!orchestrator.isInitialized()) {
            throw new DebuggerOperationException(ErrorKind.CONFIGURATION, "核心编排器尚未初始化");
        }
    }

    /**
     * 提交一次 AI 上下文分析。未指定地址时分析配置中的 analysisAddress。
     */
    @PostMapping("/context")
    public ResponseEntity<Map<String, String>> analyzeContext(@RequestParam(required = false) String address) {
        requireInitialized();
        long target = address != null
                ? AddressFormat.parse(address).orElseThrow()
                : orchestrator.getConfigService().getSettings().getAnalysisAddress();
        orchestrator.analyzeContextAt(target)
                .thenRun(() -> log.debug("{} 的上下文分析流程已结束", AddressFormat.format(target)));
        notificationService.sendAnalysisSubmitted(target);
        return ResponseEntity.status(HttpStatus.ACCEPTED)
                .body(Map.of("message", "分析已提交", "address", AddressFormat.format(target)));
    }

    /**
     * 读取一段内存并做完整的静态分析。
     */
    @GetMapping("/dump")
    public ResponseEntity<DumpAnalysisResult> analyzeDump(
            @RequestParam String address, @RequestParam(defaultValue = "4096") long size) {
        requireInitialized();
        MemoryDump dump = orchestrator.getDebugBridge()
                .readMemory(AddressFormat.parse(address).orElseThrow(), size)
                .orElseThrow();
        orchestrator.getLogService().logMemoryDump(dump);
        return ResponseEntity.ok(orchestrator.getDumpAnalyzer().performFullAnalysis(dump).orElseThrow());
    }

    @GetMapping("/providers")
    public ResponseEntity<Map<String, Object>> providers() {
        requireInitialized();
        LlmEngine engine = orchestrator.getLlmEngine();
        Map<String, Object> body = new LinkedHashMap<>();
        body.put("providers", engine.getSupportedProviders());
        body.put("defaultProvider", engine.getDefaultProvider());
        body.put("activeRequests", engine.getActiveRequestCount());
        return ResponseEntity.ok(body);
    }

    @PutMapping("/providers/default")
    public ResponseEntity<Map<String, String>> setDefaultProvider(@RequestBody Map<String, String> body) {
        requireInitialized();
        String provider = body.get("provider");
        orchestrator.getLlmEngine().setDefaultProvider(provider).orElseThrow();
        return ResponseEntity.ok(Map.of("defaultProvider", provider));
    }

    /**
     * 保存一个提供方的 API 密钥。密钥只进入 SecurityService，不会被回显。
     */
    @PutMapping("/providers/key")
    public ResponseEntity<Map<String, String>> setApiKey(@RequestBody Map<String, String> body) {
        requireInitialized();
        String provider = body.get("provider");
        orchestrator.getLlmEngine().setApiKey(provider, body.get("apiKey")).orElseThrow();
        return ResponseEntity.ok(Map.of("message", "已保存 " + provider + " 的 API 密钥"));
    }

    @GetMapping("/providers/validate")
    public ResponseEntity<Map<String, Object>> validateProvider(@RequestParam String provider) {
        requireInitialized();
        orchestrator.getLlmEngine().validateConnection(provider).orElseThrow();
        return ResponseEntity.ok(Map.of("provider", provider, "valid", true));
    }

    @PostMapping("/cancel")
    public ResponseEntity<Map<String, String>> cancelAll() {
        requireInitialized();
        orchestrator.getLlmEngine().cancelAllRequests();
        return ResponseEntity.ok(Map.of("message", "已取消所有进行中的 AI 请求"));
    }
}
