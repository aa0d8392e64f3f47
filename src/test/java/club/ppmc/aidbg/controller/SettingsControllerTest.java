package club.ppmc.aidbg.controller;

import static org.mockito.Mockito.*;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.*;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.*;

import club.ppmc.aidbg.model.AppSettings;
import club.ppmc.aidbg.model.Result;
import club.ppmc.aidbg.service.ConfigService;
import club.ppmc.aidbg.service.CoreOrchestrator;
import java.util.HashMap;
import java.util.Map;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.http.MediaType;
import org.springframework.test.web.servlet.MockMvc;
import org.springframework.test.web.servlet.setup.MockMvcBuilders;

class SettingsControllerTest {

    private CoreOrchestrator orchestrator;
    private ConfigService config;
    private MockMvc mockMvc;

    @BeforeEach
    void setUp() {
        var settings = new AppSettings();
        settings.setProviderApiKeys(new HashMap<>(Map.of("claude", "sk-secret")));
        config = new ConfigService(settings);
        orchestrator = mock(CoreOrchestrator.class);
        when(orchestrator.isInitialized()).thenReturn(true);
        when(orchestrator.getConfigService()).thenReturn(config);
        when(orchestrator.reloadBridgeSettings()).thenReturn(Result.ok());

        mockMvc = MockMvcBuilders.standaloneSetup(new SettingsController(orchestrator))
                .setControllerAdvice(new ApiExceptionHandler())
                .build();
    }

    @Test
    void settingsNeverExposeApiKeys() throws Exception {
        mockMvc.perform(get("/api/settings"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.tcpPort").value(27042))
                .andExpect(jsonPath("$.providerApiKeys.claude").doesNotExist());
    }

    @Test
    void updatesValueAndPushesToBridge() throws Exception {
        mockMvc.perform(put("/api/settings/value")
                        .param("pointer", "/commandTimeoutMs")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("15000"))
                .andExpect(status().isOk());
        verify(orchestrator).reloadBridgeSettings();

        mockMvc.perform(get("/api/settings/value").param("pointer", "/commandTimeoutMs"))
                .andExpect(status().isOk())
                .andExpect(content().string("15000"));
    }

    @Test
    void invalidValueIsBadRequest() throws Exception {
        mockMvc.perform(put("/api/settings/value")
                        .param("pointer", "/commandTimeoutMs")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("\"later\""))
                .andExpect(status().isBadRequest());
        verify(orchestrator, never()).reloadBridgeSettings();
    }

    @Test
    void apiKeysCannotBeWrittenThroughSettings() throws Exception {
        mockMvc.perform(put("/api/settings/value")
                        .param("pointer", "/providerApiKeys/claude")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("\"sk-other\""))
                .andExpect(status().isBadRequest());
    }

    @Test
    void unknownPointerIsConflict() throws Exception {
        mockMvc.perform(get("/api/settings/value").param("pointer", "/nope"))
                .andExpect(status().isConflict());
    }
}
