/**
 * DebugController.java
 *
 * 该控制器负责处理所有与调试器交互相关的HTTP请求。
 * 它作为前端UI和调试桥之间的桥梁，把连接管理、命令执行、内存读写、断点和单步等操作
 * 转换为对 DebuggerBridge 的调用。失败结果通过 Result.orElseThrow() 交给 ApiExceptionHandler。
 */
package club.ppmc.aidbg.controller;

import club.ppmc.aidbg.exception.DebuggerOperationException;
import club.ppmc.aidbg.model.ErrorKind;
import club.ppmc.aidbg.model.debug.CommandRequest;
import club.ppmc.aidbg.model.debug.ConnectionModeRequest;
import club.ppmc.aidbg.model.debug.MemoryDump;
import club.ppmc.aidbg.model.debug.MemoryWriteRequest;
import club.ppmc.aidbg.model.debug.RegisterWriteRequest;
import club.ppmc.aidbg.model.debug.ScriptRequest;
import club.ppmc.aidbg.model.debug.WsDebugEvent;
import club.ppmc.aidbg.service.CoreOrchestrator;
import club.ppmc.aidbg.service.ExpressionEvaluator;
import club.ppmc.aidbg.service.WebSocketNotificationService;
import club.ppmc.aidbg.service.bridge.DebuggerBridge;
import club.ppmc.aidbg.util.AddressFormat;
import club.ppmc.aidbg.util.HexCodec;
import jakarta.validation.Valid;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.DeleteMapping;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.PutMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

@RestController
@RequestMapping("/api/debug")
public class DebugController {

    private final CoreOrchestrator orchestrator;
    private final WebSocketNotificationService notificationService;

    public DebugController(CoreOrchestrator orchestrator, WebSocketNotificationService notificationService) {
        this.orchestrator = orchestrator;
        this.notificationService = notificationService;
    }

    private DebuggerBridge bridge() {
        DebuggerBridge bridge = orchestrator.isInitialized() ? orchestrator.getDebugBridge() : null;
        if (bridge == null) {
            throw new DebuggerOperationException(ErrorKind.CONFIGURATION, "核心编排器尚未初始化");
        }
        return bridge;
    }

    private ExpressionEvaluator evaluator() {
        ExpressionEvaluator evaluator = orchestrator.isInitialized() ? orchestrator.getExpressionEvaluator() : null;
        if (evaluator == null) {
            throw new DebuggerOperationException(ErrorKind.CONFIGURATION, "核心编排器尚未初始化");
        }
        return evaluator;
    }

    private static long address(String text) {
        return AddressFormat.parse(text).orElseThrow();
    }

    // --- 连接管理 ---

    @PostMapping("/connect")
    public ResponseEntity<Map<String, Object>> connect() {
        DebuggerBridge bridge = bridge();
        bridge.connect().orElseThrow();
        notificationService.sendDebugEvent(new WsDebugEvent<>("CONNECTED", bridge.getConnectionMode().name()));
        return ResponseEntity.ok(status(bridge));
    }

    @PostMapping("/disconnect")
    public ResponseEntity<Map<String, Object>> disconnect() {
        DebuggerBridge bridge = bridge();
        bridge.disconnect().orElseThrow();
        notificationService.sendDebugEvent(new WsDebugEvent<>("DISCONNECTED", null));
        return ResponseEntity.ok(status(bridge));
    }

    @GetMapping("/status")
    public ResponseEntity<Map<String, Object>> status() {
        return ResponseEntity.ok(status(bridge()));
    }

    @PutMapping("/mode")
    public ResponseEntity<Map<String, Object>> setMode(@Valid @RequestBody ConnectionModeRequest request) {
        DebuggerBridge bridge = bridge();
        bridge.setConnectionMode(request.mode()).orElseThrow();
        return ResponseEntity.ok(status(bridge));
    }

    private static Map<String, Object> status(DebuggerBridge bridge) {
        Map<String, Object> body = new LinkedHashMap<>();
        body.put("state", bridge.getState().name());
        body.put("mode", bridge.getConnectionMode().name());
        body.put("connected", bridge.isConnected());
        return body;
    }

    // --- 命令与内存 ---

    @PostMapping("/command")
    public ResponseEntity<Map<String, String>> executeCommand(@Valid @RequestBody CommandRequest request) {
        String output = bridge().executeCommand(request.command()).orElseThrow();
        return ResponseEntity.ok(Map.of("output", output));
    }

    /**
     * 依次展开并执行一组命令模板。遇到第一个失败即停止，已执行的命令不回滚。
     */
    @PostMapping("/script")
    public ResponseEntity<Map<String, Object>> executeScript(@Valid @RequestBody ScriptRequest request) {
        DebuggerBridge bridge = bridge();
        ExpressionEvaluator evaluator = evaluator();
        Map<String, String> variables = request.variables() != null ? request.variables() : Map.of();
        List<String> outputs = new ArrayList<>();
        for (String template : request.commands()) {
            String command = evaluator.evaluate(template, variables).orElseThrow();
            outputs.add(bridge.executeCommand(command).orElseThrow());
        }
        return ResponseEntity.ok(Map.of("outputs", outputs));
    }

    /**
     * 设置一个全局脚本变量，之后的脚本都可以通过 ${name} 引用它。
     */
    @PutMapping("/variables/{name}")
    public ResponseEntity<Map<String, String>> setVariable(@PathVariable String name, @RequestBody Map<String, String> body) {
        String value = body.get("value");
        if (value == null) {
            throw new DebuggerOperationException(ErrorKind.VALIDATION, "值 (value) 不能为空");
        }
        ExpressionEvaluator evaluator = evaluator();
        try {
            evaluator.setVariable(name, value);
        } catch (IllegalArgumentException e) {
            throw new DebuggerOperationException(ErrorKind.VALIDATION, e.getMessage());
        }
        return ResponseEntity.ok(Map.of("name", name, "value", evaluator.getVariable(name).orElseThrow()));
    }

    @GetMapping("/disassembly")
    public ResponseEntity<Map<String, String>> disassembly(@RequestParam String address) {
        String text = bridge().getDisassembly(address(address)).orElseThrow();
        return ResponseEntity.ok(Map.of("address", AddressFormat.format(address(address)), "disassembly", text));
    }

    @GetMapping("/memory")
    public ResponseEntity<Map<String, Object>> readMemory(
            @RequestParam String address, @RequestParam(defaultValue = "256") long size) {
        MemoryDump dump = bridge().readMemory(address(address), size).orElseThrow();
        Map<String, Object> body = new LinkedHashMap<>();
        body.put("baseAddress", AddressFormat.format(dump.baseAddress()));
        body.put("size", dump.length());
        body.put("moduleName", dump.moduleName());
        body.put("data", HexCodec.toHex(dump.data()));
        return ResponseEntity.ok(body);
    }

    @PostMapping("/memory")
    public ResponseEntity<Map<String, String>> writeMemory(@Valid @RequestBody MemoryWriteRequest request) {
        String compact = request.data().replaceAll("\\s+", "");
        if (compact.length() % 2 != 0 || !compact.matches("[0-9A-Fa-f]+")) {
            throw new DebuggerOperationException(ErrorKind.VALIDATION, "数据必须是成对的十六进制数字");
        }
        byte[] data = HexCodec.parseHexBytes(compact);
        bridge().writeMemory(address(request.address()), data).orElseThrow();
        return ResponseEntity.ok(Map.of("message", "已写入 " + data.length + " 字节"));
    }

    // --- 断点与寄存器 ---

    @PostMapping("/breakpoint")
    public ResponseEntity<Map<String, String>> setBreakpoint(@RequestParam String address) {
        bridge().setBreakpoint(address(address)).orElseThrow();
        return ResponseEntity.ok(Map.of("message", "断点已设置于 " + AddressFormat.format(address(address))));
    }

    @DeleteMapping("/breakpoint")
    public ResponseEntity<Void> removeBreakpoint(@RequestParam String address) {
        bridge().removeBreakpoint(address(address)).orElseThrow();
        return ResponseEntity.ok().build();
    }

    @GetMapping("/register/{name}")
    public ResponseEntity<Map<String, String>> getRegister(@PathVariable String name) {
        long value = bridge().getRegisterValue(name).orElseThrow();
        return ResponseEntity.ok(Map.of("name", name, "value", AddressFormat.format(value)));
    }

    @PutMapping("/register/{name}")
    public ResponseEntity<Void> setRegister(@PathVariable String name, @Valid @RequestBody RegisterWriteRequest request) {
        bridge().setRegisterValue(name, address(request.value())).orElseThrow();
        return ResponseEntity.ok().build();
    }

    // --- 执行控制 ---

    @PostMapping("/stepInto")
    public ResponseEntity<Void> stepInto() {
        bridge().stepInto().orElseThrow();
        return ResponseEntity.ok().build();
    }

    @PostMapping("/stepOver")
    public ResponseEntity<Void> stepOver() {
        bridge().stepOver().orElseThrow();
        return ResponseEntity.ok().build();
    }

    @PostMapping("/stepOut")
    public ResponseEntity<Void> stepOut() {
        bridge().stepOut().orElseThrow();
        return ResponseEntity.ok().build();
    }

    @PostMapping("/resume")
    public ResponseEntity<Void> resume() {
        bridge().resume().orElseThrow();
        return ResponseEntity.ok().build();
    }

    @PostMapping("/pause")
    public ResponseEntity<Void> pause() {
        bridge().pause().orElseThrow();
        return ResponseEntity.ok().build();
    }
}
