package club.ppmc.aidbg.service;

import static org.junit.jupiter.api.Assertions.*;

import club.ppmc.aidbg.model.AppSettings;
import club.ppmc.aidbg.model.ErrorKind;
import club.ppmc.aidbg.model.debug.ConnectionMode;
import java.util.HashMap;
import java.util.Map;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

class ConfigServiceTest {

    private ConfigService config;

    @BeforeEach
    void setUp() {
        var settings = new AppSettings();
        settings.setDebuggerPath("C:/x64dbg/release/x64/x64dbg.exe");
        settings.setProviderApiKeys(new HashMap<>(Map.of("claude", "sk-secret")));
        config = new ConfigService(settings);
    }

    @Test
    void settingsAreCopiedOnTheWayOut() {
        AppSettings copy = config.getSettings();
        copy.setTcpPort(1);
        assertEquals(27042, config.getSettings().getTcpPort());
    }

    @Test
    void readsValuesByPointer() {
        assertEquals("C:/x64dbg/release/x64/x64dbg.exe", config.getString("/debuggerPath", null));
        assertEquals(5000, config.getInt("/connectionTimeoutMs", -1));
        assertEquals("EXTERNAL", config.getValue("/connectionMode").getValue().asText());
        assertEquals(ErrorKind.CONFIGURATION, config.getValue("/nope").getErrorKind());
        assertEquals(ErrorKind.VALIDATION, config.getValue("no-slash").getErrorKind());
        assertEquals(7, config.getInt("/nope", 7));
    }

    @Test
    void updatesValuesByPointer() {
        assertTrue(config.setValue("/connectionTimeoutMs", 8000).isSuccess());
        assertTrue(config.setValue("/connectionMode", "TCP").isSuccess());
        assertEquals(8000, config.getSettings().getConnectionTimeoutMs());
        assertEquals(ConnectionMode.TCP, config.getSettings().getConnectionMode());
    }

    @Test
    void rejectedUpdateLeavesSettingsUntouched() {
        assertEquals(ErrorKind.VALIDATION, config.setValue("/connectionTimeoutMs", "soon").getErrorKind());
        assertEquals(ErrorKind.VALIDATION, config.setValue("/connectionMode", "CARRIER_PIGEON").getErrorKind());
        assertEquals(ErrorKind.VALIDATION, config.setValue("/unknownField", 1).getErrorKind());
        assertEquals(ErrorKind.CONFIGURATION, config.setValue("/missing/child", 1).getErrorKind());
        assertEquals(ErrorKind.VALIDATION, config.setValue("", 1).getErrorKind());
        assertEquals(5000, config.getSettings().getConnectionTimeoutMs());
        assertEquals(ConnectionMode.EXTERNAL, config.getSettings().getConnectionMode());
    }

    @Test
    void drainingApiKeysClearsThem() {
        assertEquals(Map.of("claude", "sk-secret"), config.drainProviderApiKeys());
        assertTrue(config.drainProviderApiKeys().isEmpty());
        assertTrue(config.getSettings().getProviderApiKeys().isEmpty());
    }
}
