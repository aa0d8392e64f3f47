package club.ppmc.aidbg.util;

import static org.junit.jupiter.api.Assertions.*;

import club.ppmc.aidbg.model.ErrorKind;
import club.ppmc.aidbg.model.debug.DebugEvent;
import club.ppmc.aidbg.model.debug.DebugEventType;
import java.io.StringWriter;
import java.util.Optional;
import org.junit.jupiter.api.Test;

class WireProtocolTest {

    @Test
    void writesOneLinePerCommand() throws Exception {
        var out = new StringWriter();
        WireProtocol.writeCommand(out, "sti");
        assertEquals("sti\n", out.toString());
    }

    @Test
    void classifiesTerminatorAndEventLines() {
        assertTrue(WireProtocol.isTerminator("END"));
        assertFalse(WireProtocol.isTerminator("END "));
        assertFalse(WireProtocol.isTerminator("ENDING"));
        assertTrue(WireProtocol.isEventLine("EVENT type=PAUSED"));
        assertFalse(WireProtocol.isEventLine("EVENTS are not events"));
        assertFalse(WireProtocol.isEventLine(null));
    }

    @Test
    void responseBufferJoinsLinesWithNewlines() {
        var buffer = new WireProtocol.ResponseBuffer();
        assertEquals("", buffer.text());
        assertTrue(buffer.append("mov eax, 1"));
        assertTrue(buffer.append("ret"));
        assertEquals("mov eax, 1\nret", buffer.text());
    }

    @Test
    void responseBufferRejectsOversizedResponse() {
        var buffer = new WireProtocol.ResponseBuffer();
        // 四段加三个换行正好比上限少一个字符
        String chunk = "A".repeat(1024 * 1024 - 1);
        for (int i = 0; i < 4; i++) {
            assertTrue(buffer.append(chunk));
        }
        assertFalse(buffer.append("B"));
        assertEquals(ErrorKind.PROTOCOL, buffer.overflow().getErrorKind());
    }

    @Test
    void parsesBreakpointEvent() {
        DebugEvent event = WireProtocol
                .parseEventLine("EVENT type=BREAKPOINT_HIT address=0x401000 pid=12 tid=34 description=hit it")
                .orElseThrow();
        assertEquals(DebugEventType.BREAKPOINT_HIT, event.type());
        assertEquals(0x401000L, event.address());
        assertEquals(12, event.processId());
        assertEquals(34, event.threadId());
        assertEquals("hit it", event.description());
    }

    @Test
    void parsesModuleAndKeepsUnknownKeysAsMetadata() {
        Optional<DebugEvent> parsed =
                WireProtocol.parseEventLine("EVENT type=module_loaded module=kernel32.dll base=0x7ff0 description=loaded kernel32.dll ok");
        assertTrue(parsed.isPresent());
        DebugEvent event = parsed.get();
        assertEquals(DebugEventType.MODULE_LOADED, event.type());
        assertEquals("kernel32.dll", event.moduleName());
        assertEquals("loaded kernel32.dll ok", event.description());
        assertEquals("0x7ff0", event.metadata().get("base"));
        assertEquals(0, event.address());
    }

    @Test
    void dropsUnknownOrUntypedEvents() {
        assertTrue(WireProtocol.parseEventLine("EVENT type=NOPE").isEmpty());
        assertTrue(WireProtocol.parseEventLine("EVENT address=0x1").isEmpty());
        assertTrue(WireProtocol.parseEventLine("not an event").isEmpty());
    }
}
