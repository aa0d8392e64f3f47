/**
 * SettingsController.java
 *
 * 该控制器负责运行期配置的读取和修改。
 * 单个配置项按 JSON Pointer 定位；修改调试器相关配置后会立即推送到调试桥。
 */
package club.ppmc.aidbg.controller;

import club.ppmc.aidbg.exception.DebuggerOperationException;
import club.ppmc.aidbg.model.AppSettings;
import club.ppmc.aidbg.model.ErrorKind;
import club.ppmc.aidbg.service.ConfigService;
import club.ppmc.aidbg.service.CoreOrchestrator;
import com.fasterxml.jackson.databind.JsonNode;
import java.util.Map;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PutMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

@RestController
@RequestMapping("/api/settings")
@Slf4j
public class SettingsController {

    private final CoreOrchestrator orchestrator;

    public SettingsController(CoreOrchestrator orchestrator) {
        this.orchestrator = orchestrator;
    }

    private ConfigService config() {
        ConfigService config = orchestrator.isInitialized() ? orchestrator.getConfigService() : null;
        if (config == null) {
            throw new DebuggerOperationException(ErrorKind.CONFIGURATION, "核心编排器尚未初始化");
        }
        return config;
    }

    /**
     * 获取当前配置。API 密钥不会出现在响应中。
     */
    @GetMapping
    public ResponseEntity<AppSettings> getSettings() {
        AppSettings settings = config().getSettings();
        settings.setProviderApiKeys(Map.of());
        return ResponseEntity.ok(settings);
    }

    @GetMapping("/value")
    public ResponseEntity<JsonNode> getValue(@RequestParam String pointer) {
        return ResponseEntity.ok(config().getValue(pointer).orElseThrow());
    }

    /**
     * 修改一个配置项，例如 pointer=/connectionTimeoutMs，请求体为 8000。
     */
    @PutMapping("/value")
    public ResponseEntity<Map<String, String>> setValue(@RequestParam String pointer, @RequestBody JsonNode value) {
        if (pointer.startsWith("/providerApiKeys")) {
            throw new DebuggerOperationException(ErrorKind.VALIDATION, "API 密钥请通过 /api/analysis/providers/key 设置");
        }
        config().setValue(pointer, value).orElseThrow();
        orchestrator.reloadBridgeSettings().orElseThrow();
        log.info("配置项 {} 已通过接口修改", pointer);
        return ResponseEntity.ok(Map.of("message", "配置已更新"));
    }

    @PutMapping("/log-level")
    public ResponseEntity<Map<String, String>> setLogLevel(@RequestBody Map<String, String> body) {
        config();
        var logService = orchestrator.getLogService();
        logService.setLevel(body.get("level")).orElseThrow();
        return ResponseEntity.ok(Map.of("level", logService.getLevel()));
    }
}
