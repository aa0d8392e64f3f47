package club.ppmc.aidbg.controller;

import static org.mockito.ArgumentMatchers.*;
import static org.mockito.Mockito.*;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.*;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.*;

import club.ppmc.aidbg.model.ErrorKind;
import club.ppmc.aidbg.model.Result;
import club.ppmc.aidbg.model.debug.ConnectionMode;
import club.ppmc.aidbg.model.debug.ConnectionState;
import club.ppmc.aidbg.model.debug.MemoryDump;
import club.ppmc.aidbg.model.debug.WsDebugEvent;
import club.ppmc.aidbg.service.CoreOrchestrator;
import club.ppmc.aidbg.service.TemplateExpressionEvaluator;
import club.ppmc.aidbg.service.WebSocketNotificationService;
import club.ppmc.aidbg.service.bridge.DebuggerBridge;
import java.time.Instant;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.http.MediaType;
import org.springframework.test.web.servlet.MockMvc;
import org.springframework.test.web.servlet.setup.MockMvcBuilders;

class DebugControllerTest {

    private CoreOrchestrator orchestrator;
    private WebSocketNotificationService notificationService;
    private DebuggerBridge bridge;
    private MockMvc mockMvc;

    @BeforeEach
    void setUp() {
        orchestrator = mock(CoreOrchestrator.class);
        notificationService = mock(WebSocketNotificationService.class);
        bridge = mock(DebuggerBridge.class);
        when(orchestrator.isInitialized()).thenReturn(true);
        when(orchestrator.getDebugBridge()).thenReturn(bridge);
        when(orchestrator.getExpressionEvaluator()).thenReturn(new TemplateExpressionEvaluator());
        when(bridge.getConnectionMode()).thenReturn(ConnectionMode.TCP);
        when(bridge.getState()).thenReturn(ConnectionState.CONNECTED);
        when(bridge.isConnected()).thenReturn(true);

        mockMvc = MockMvcBuilders.standaloneSetup(new DebugController(orchestrator, notificationService))
                .setControllerAdvice(new ApiExceptionHandler())
                .build();
    }

    @Test
    void connectReportsStatusAndNotifies() throws Exception {
        when(bridge.connect()).thenReturn(Result.ok());

        mockMvc.perform(post("/api/debug/connect"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.state").value("CONNECTED"))
                .andExpect(jsonPath("$.mode").value("TCP"))
                .andExpect(jsonPath("$.connected").value(true));
        verify(notificationService).sendDebugEvent(any(WsDebugEvent.class));
    }

    @Test
    void connectionFailureMapsToBadGateway() throws Exception {
        when(bridge.connect()).thenReturn(Result.error(ErrorKind.CONNECTION, "refused"));

        mockMvc.perform(post("/api/debug/connect"))
                .andExpect(status().isBadGateway())
                .andExpect(jsonPath("$.type").value("CONNECTION"))
                .andExpect(jsonPath("$.message").value("refused"));
    }

    @Test
    void commandOutputIsReturned() throws Exception {
        when(bridge.executeCommand("disasm 0x401000")).thenReturn(Result.success("push rbp"));

        mockMvc.perform(post("/api/debug/command")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"command\":\"disasm 0x401000\"}"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.output").value("push rbp"));
    }

    @Test
    void blankCommandIsRejectedBeforeReachingBridge() throws Exception {
        mockMvc.perform(post("/api/debug/command").contentType(MediaType.APPLICATION_JSON).content("{\"command\":\"\"}"))
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.type").value("VALIDATION"));
        verify(bridge, never()).executeCommand(anyString());
    }

    @Test
    void notConnectedMapsToConflict() throws Exception {
        when(bridge.stepInto()).thenReturn(Result.error(ErrorKind.NOT_CONNECTED, "调试器未连接"));
        mockMvc.perform(post("/api/debug/stepInto"))
                .andExpect(status().isConflict())
                .andExpect(jsonPath("$.type").value("NOT_CONNECTED"));
    }

    @Test
    void uninitializedOrchestratorMapsToConflict() throws Exception {
        when(orchestrator.isInitialized()).thenReturn(false);
        mockMvc.perform(get("/api/debug/status"))
                .andExpect(status().isConflict())
                .andExpect(jsonPath("$.type").value("CONFIGURATION"));
    }

    @Test
    void readsMemoryAsHex() throws Exception {
        when(bridge.readMemory(0x401000L, 4))
                .thenReturn(Result.success(new MemoryDump(0x401000L, new byte[] {0x55, 0x48, (byte) 0x89, (byte) 0xE5}, 4, "app.exe", Instant.now())));

        mockMvc.perform(get("/api/debug/memory").param("address", "0x401000").param("size", "4"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.baseAddress").value("0x401000"))
                .andExpect(jsonPath("$.data").value("554889e5"))
                .andExpect(jsonPath("$.moduleName").value("app.exe"));
    }

    @Test
    void malformedAddressIsBadRequest() throws Exception {
        mockMvc.perform(get("/api/debug/memory").param("address", "0xZZ"))
                .andExpect(status().isBadRequest());
        verify(bridge, never()).readMemory(anyLong(), anyLong());
    }

    @Test
    void writesMemoryFromHex() throws Exception {
        when(bridge.writeMemory(eq(0x2000L), any())).thenReturn(Result.ok());

        mockMvc.perform(post("/api/debug/memory")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"address\":\"0x2000\",\"data\":\"90 90 CC\"}"))
                .andExpect(status().isOk());
        verify(bridge).writeMemory(0x2000L, new byte[] {(byte) 0x90, (byte) 0x90, (byte) 0xCC});

        mockMvc.perform(post("/api/debug/memory")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"address\":\"0x2000\",\"data\":\"909\"}"))
                .andExpect(status().isBadRequest());
    }

    @Test
    void scriptExpandsVariablesAndStopsAtFirstFailure() throws Exception {
        when(bridge.executeCommand("bp 0x401000")).thenReturn(Result.success("Breakpoint set"));
        when(bridge.executeCommand("run")).thenReturn(Result.error(ErrorKind.PROTOCOL, "timeout"));

        mockMvc.perform(post("/api/debug/script")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"commands\":[\"bp ${entry}\",\"run\",\"sti\"],\"variables\":{\"entry\":\"0x401000\"}}"))
                .andExpect(status().isBadGateway());
        verify(bridge).executeCommand("bp 0x401000");
        verify(bridge, never()).executeCommand("sti");
    }

    @Test
    void readsRegister() throws Exception {
        when(bridge.getRegisterValue("rip")).thenReturn(Result.success(0x140001000L));
        mockMvc.perform(get("/api/debug/register/rip"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.value").value("0x140001000"));
    }

    @Test
    void illegalModeChangeIsConflict() throws Exception {
        when(bridge.setConnectionMode(ConnectionMode.PIPE)).thenReturn(Result.error(ErrorKind.CONFIGURATION, "locked"));
        mockMvc.perform(put("/api/debug/mode").contentType(MediaType.APPLICATION_JSON).content("{\"mode\":\"PIPE\"}"))
                .andExpect(status().isConflict());
    }
}
