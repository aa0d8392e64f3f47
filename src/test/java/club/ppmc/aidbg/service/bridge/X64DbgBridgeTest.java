package club.ppmc.aidbg.service.bridge;

import static org.junit.jupiter.api.Assertions.*;

import club.ppmc.aidbg.model.ErrorKind;
import club.ppmc.aidbg.model.Result;
import club.ppmc.aidbg.model.debug.ConnectionMode;
import club.ppmc.aidbg.model.debug.ConnectionState;
import club.ppmc.aidbg.model.debug.DebugEvent;
import club.ppmc.aidbg.model.debug.DebugEventType;
import club.ppmc.aidbg.model.debug.MemoryDump;
import club.ppmc.aidbg.model.debug.TransportSettings;
import java.util.ArrayList;
import java.util.Collections;
import java.util.HashSet;
import java.util.List;
import java.util.Set;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.function.Consumer;
import java.util.function.Function;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

class X64DbgBridgeTest {

    /** 按命令返回预设响应的内存传输。 */
    static class ScriptedTransport implements DebuggerTransport {
        final List<String> sent = Collections.synchronizedList(new ArrayList<>());
        final ConnectionMode mode;
        Function<String, Result<String>> responder = cmd -> Result.success("");
        Result<Void> openResult = Result.ok();
        boolean directMemory;
        byte[] directBytes = new byte[0];
        Consumer<DebugEvent> sink;
        volatile boolean closed;
        volatile boolean broken;

        ScriptedTransport(ConnectionMode mode) {
            this.mode = mode;
        }

        @Override
        public ConnectionMode mode() {
            return mode;
        }

        @Override
        public Result<Void> open(TransportSettings settings, Consumer<DebugEvent> eventSink) {
            this.sink = eventSink;
            return openResult;
        }

        @Override
        public Result<String> send(String command) {
            sent.add(command);
            return responder.apply(command);
        }

        @Override
        public boolean supportsDirectMemory() {
            return directMemory;
        }

        @Override
        public Result<byte[]> readMemory(long address, int size) {
            sent.add("<direct-read>");
            return Result.success(directBytes);
        }

        @Override
        public boolean isBroken() {
            return broken;
        }

        @Override
        public void close() {
            closed = true;
        }
    }

    /** 当前存活、且不在 baseline 中的事件分发线程。 */
    private static List<Thread> newEventLoops(Set<Thread> baseline) {
        return Thread.getAllStackTraces().keySet().stream()
                .filter(t -> t.getName().equals("debug-event-loop") && t.isAlive() && !baseline.contains(t))
                .toList();
    }

    private static Set<Thread> liveEventLoops() {
        return new HashSet<>(newEventLoops(Set.of()));
    }

    private final List<ScriptedTransport> created = new CopyOnWriteArrayList<>();
    private Function<ConnectionMode, ScriptedTransport> transportSupplier;
    private X64DbgBridge bridge;

    @BeforeEach
    void setUp() {
        transportSupplier = ScriptedTransport::new;
        bridge = new X64DbgBridge(new TransportFactory(null) {
            @Override
            public DebuggerTransport create(ConnectionMode mode) {
                ScriptedTransport transport = transportSupplier.apply(mode);
                created.add(transport);
                return transport;
            }
        });
    }

    @AfterEach
    void tearDown() {
        bridge.close();
    }

    private ScriptedTransport connect() {
        assertTrue(bridge.connect().isSuccess());
        return created.get(created.size() - 1);
    }

    @Test
    void commandsFailFastWhenNotConnected() {
        assertEquals(ErrorKind.NOT_CONNECTED, bridge.executeCommand("run").getErrorKind());
        assertEquals(ErrorKind.NOT_CONNECTED, bridge.readMemory(0x1000, 16).getErrorKind());
        assertEquals(ErrorKind.NOT_CONNECTED, bridge.writeMemory(0x1000, new byte[] {1}).getErrorKind());
        assertEquals(ErrorKind.NOT_CONNECTED, bridge.setBreakpoint(0).getErrorKind());
        assertEquals(ErrorKind.NOT_CONNECTED, bridge.getRegisterValue("rax").getErrorKind());
        assertEquals(ErrorKind.NOT_CONNECTED, bridge.stepInto().getErrorKind());
        assertTrue(created.isEmpty());
    }

    @Test
    void connectTwiceKeepsSingleTransport() {
        connect();
        assertTrue(bridge.connect().isSuccess());
        assertEquals(1, created.size());
        assertEquals(ConnectionState.CONNECTED, bridge.getState());
    }

    @Test
    void secondConnectStartsNoSecondEventLoop() {
        Set<Thread> before = liveEventLoops();
        connect();
        assertEquals(1, newEventLoops(before).size());
        assertTrue(bridge.connect().isSuccess());
        assertEquals(1, newEventLoops(before).size());
    }

    @Test
    void disconnectTerminatesEventLoop() {
        Set<Thread> before = liveEventLoops();
        connect();
        Thread loop = newEventLoops(before).get(0);

        assertTrue(bridge.disconnect().isSuccess());

        assertFalse(loop.isAlive());
        assertTrue(newEventLoops(before).isEmpty());
    }

    @Test
    void brokenTransportMovesBridgeToDisconnected() {
        Set<Thread> before = liveEventLoops();
        ScriptedTransport transport = connect();
        transport.responder = cmd -> {
            transport.broken = true;
            return Result.error(ErrorKind.PROTOCOL, "timeout");
        };

        assertEquals(ErrorKind.PROTOCOL, bridge.executeCommand("sti").getErrorKind());

        assertEquals(ConnectionState.DISCONNECTED, bridge.getState());
        assertTrue(transport.closed);
        assertTrue(newEventLoops(before).isEmpty());
        assertEquals(ErrorKind.NOT_CONNECTED, bridge.executeCommand("sti").getErrorKind());
        // 可以重新连接，得到新的传输
        connect();
        assertEquals(2, created.size());
    }

    @Test
    void failedOpenLeavesBridgeDisconnected() {
        transportSupplier = mode -> {
            var t = new ScriptedTransport(mode);
            t.openResult = Result.error(ErrorKind.CONNECTION, "refused");
            return t;
        };
        Result<Void> result = bridge.connect();
        assertEquals(ErrorKind.CONNECTION, result.getErrorKind());
        assertEquals(ConnectionState.DISCONNECTED, bridge.getState());
        assertTrue(created.get(0).closed);
        // 失败的连接不会锁定模式
        assertTrue(bridge.setConnectionMode(ConnectionMode.TCP).isSuccess());
    }

    @Test
    void disconnectIsIdempotentAndClosesTransport() {
        ScriptedTransport transport = connect();
        assertTrue(bridge.disconnect().isSuccess());
        assertTrue(bridge.disconnect().isSuccess());
        assertTrue(transport.closed);
        assertFalse(bridge.isConnected());
        assertEquals(ErrorKind.NOT_CONNECTED, bridge.executeCommand("run").getErrorKind());
    }

    @Test
    void modeIsLockedAfterFirstSuccessfulConnect() {
        assertTrue(bridge.setConnectionMode(ConnectionMode.TCP).isSuccess());
        connect();
        assertEquals(ConnectionMode.TCP, created.get(0).mode());
        assertEquals(ErrorKind.CONFIGURATION, bridge.setConnectionMode(ConnectionMode.PIPE).getErrorKind());

        bridge.disconnect();
        assertEquals(ErrorKind.CONFIGURATION, bridge.setConnectionMode(ConnectionMode.PIPE).getErrorKind());
        assertEquals(ConnectionMode.TCP, bridge.getConnectionMode());
        assertEquals(ErrorKind.VALIDATION, bridge.setConnectionMode(null).getErrorKind());
    }

    @Test
    void rejectsUnsafeCommandsWithoutSending() {
        ScriptedTransport transport = connect();
        assertEquals(ErrorKind.VALIDATION, bridge.executeCommand("bp 0x1; run").getErrorKind());
        assertTrue(transport.sent.isEmpty());
    }

    @Test
    void stripsControlCharactersFromOutput() {
        ScriptedTransport transport = connect();
        transport.responder = cmd -> Result.success("ok\u0007\r\nnext");
        assertEquals("ok\nnext", bridge.executeCommand("run").getValue());
    }

    @Test
    void readMemoryUsesDumpCommandAndTruncates() {
        ScriptedTransport transport = connect();
        transport.responder = cmd -> {
            if (cmd.startsWith("dump")) {
                return Result.success("4D 5A 90 00 03 00");
            }
            if (cmd.startsWith("sym")) {
                return Result.success("  app.exe  ");
            }
            return Result.success("");
        };

        MemoryDump dump = bridge.readMemory(0x400000, 4).getValue();
        assertEquals("dump 0x400000 4", transport.sent.get(0));
        assertArrayEquals(new byte[] {0x4D, 0x5A, (byte) 0x90, 0x00}, dump.data());
        assertEquals(4, dump.size());
        assertEquals("app.exe", dump.moduleName());
        assertEquals(0x400000, dump.baseAddress());
    }

    @Test
    void readMemoryPrefersDirectPath() {
        transportSupplier = mode -> {
            var t = new ScriptedTransport(mode);
            t.directMemory = true;
            t.directBytes = new byte[] {1, 2, 3};
            return t;
        };
        ScriptedTransport transport = connect();
        MemoryDump dump = bridge.readMemory(0x1000, 3).getValue();
        assertEquals("<direct-read>", transport.sent.get(0));
        assertEquals(3, dump.length());
    }

    @Test
    void readMemoryValidatesRangeAndEmptyResponse() {
        ScriptedTransport transport = connect();
        assertEquals(ErrorKind.VALIDATION, bridge.readMemory(0, 16).getErrorKind());
        assertEquals(ErrorKind.VALIDATION, bridge.readMemory(0x1000, 2L * 1024 * 1024).getErrorKind());
        assertTrue(transport.sent.isEmpty());

        assertEquals(ErrorKind.PROTOCOL, bridge.readMemory(0x1000, 16).getErrorKind());
    }

    @Test
    void writeMemoryChunksFillCommands() {
        ScriptedTransport transport = connect();
        byte[] data = new byte[X64DbgBridge.FILL_CHUNK_BYTES + 2];
        data[0] = (byte) 0xCC;

        assertTrue(bridge.writeMemory(0x2000, data).isSuccess());
        assertEquals(2, transport.sent.size());
        assertTrue(transport.sent.get(0).startsWith("fill 0x2000 cc00"));
        assertEquals("fill 0x2400 0000", transport.sent.get(1));
    }

    @Test
    void breakpointRequiresConfirmation() {
        ScriptedTransport transport = connect();
        transport.responder = cmd -> Result.success("Breakpoint set at 0x401000!");
        assertTrue(bridge.setBreakpoint(0x401000).isSuccess());
        assertEquals("bp 0x401000", transport.sent.get(0));

        transport.responder = cmd -> Result.success("Error setting breakpoint");
        assertEquals(ErrorKind.PROTOCOL, bridge.setBreakpoint(0x401000).getErrorKind());
        assertEquals(ErrorKind.VALIDATION, bridge.setBreakpoint(0).getErrorKind());

        transport.responder = cmd -> Result.success("");
        assertTrue(bridge.removeBreakpoint(0x401000).isSuccess());
        assertEquals("bc 0x401000", transport.sent.get(transport.sent.size() - 1));
    }

    @Test
    void parsesRegisterValues() {
        ScriptedTransport transport = connect();
        transport.responder = cmd -> Result.success("RAX = 0x00000000DEADBEEF");
        assertEquals(0xDEADBEEFL, bridge.getRegisterValue("rax").getValue());

        transport.responder = cmd -> Result.success("rip=FFFFFFFFFFFFFFFF");
        assertEquals(-1L, bridge.getRegisterValue("rip").getValue());

        transport.responder = cmd -> Result.success("unknown register");
        assertEquals(ErrorKind.PROTOCOL, bridge.getRegisterValue("rbx").getErrorKind());
        assertEquals(ErrorKind.VALIDATION, bridge.getRegisterValue("r ax").getErrorKind());
    }

    @Test
    void setRegisterSendsMov() {
        ScriptedTransport transport = connect();
        assertTrue(bridge.setRegisterValue("rcx", 0x10).isSuccess());
        assertEquals("mov rcx, 0x10", transport.sent.get(0));
    }

    @Test
    void executionControlCommands() {
        ScriptedTransport transport = connect();
        bridge.stepInto();
        bridge.stepOver();
        bridge.stepOut();
        bridge.resume();
        bridge.pause();
        assertEquals(List.of("sti", "sto", "rtr", "run", "pause"), transport.sent);
    }

    @Test
    void handlersRunInRegistrationOrderAndSurviveFailures() throws Exception {
        List<String> calls = new CopyOnWriteArrayList<>();
        var latch = new CountDownLatch(2);
        long first = bridge.registerEventHandler(e -> {
            calls.add("A");
            throw new IllegalStateException("boom");
        });
        long second = bridge.registerEventHandler(e -> {
            calls.add("B:" + e.type());
            latch.countDown();
        });
        assertTrue(second > first);

        ScriptedTransport transport = connect();
        transport.sink.accept(DebugEvent.of(DebugEventType.BREAKPOINT_HIT, 0x401000, "bp"));
        assertTrue(bridge.publishEvent(DebugEvent.of(DebugEventType.EXCEPTION, 0x401004, "av")));

        assertTrue(latch.await(2, TimeUnit.SECONDS));
        assertEquals(List.of("A", "B:BREAKPOINT_HIT", "A", "B:EXCEPTION"), calls);
    }

    @Test
    void publishEventIsDroppedWhenDisconnected() {
        var count = new AtomicInteger();
        bridge.registerEventHandler(e -> count.incrementAndGet());
        assertFalse(bridge.publishEvent(DebugEvent.of(DebugEventType.EXCEPTION, 1, "x")));
        assertEquals(0, count.get());
    }
}
