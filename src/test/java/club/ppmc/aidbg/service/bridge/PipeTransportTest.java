package club.ppmc.aidbg.service.bridge;

import static org.junit.jupiter.api.Assertions.*;

import club.ppmc.aidbg.model.debug.DebugEvent;
import club.ppmc.aidbg.model.debug.TransportSettings;
import java.io.BufferedReader;
import java.io.InputStreamReader;
import java.io.PrintWriter;
import java.net.StandardProtocolFamily;
import java.net.UnixDomainSocketAddress;
import java.nio.channels.Channels;
import java.nio.channels.ServerSocketChannel;
import java.nio.channels.SocketChannel;
import java.nio.charset.StandardCharsets;
import java.nio.file.Path;
import java.util.List;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.TimeUnit;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.condition.DisabledOnOs;
import org.junit.jupiter.api.condition.OS;
import org.junit.jupiter.api.io.TempDir;

/**
 * 在 Unix 域套接字上验证读取线程常驻时命令仍能写出。
 */
@DisabledOnOs(OS.WINDOWS)
class PipeTransportTest {

    @TempDir
    Path tempDir;

    @Test
    void commandsAndIdleEventsFlowOverUnixSocket() throws Exception {
        Path socketPath = tempDir.resolve("bridge.sock");
        List<DebugEvent> events = new CopyOnWriteArrayList<>();

        try (ServerSocketChannel server = ServerSocketChannel.open(StandardProtocolFamily.UNIX)) {
            server.bind(UnixDomainSocketAddress.of(socketPath));
            CompletableFuture<Void> serving = CompletableFuture.runAsync(() -> {
                try (SocketChannel client = server.accept();
                        var in = new BufferedReader(new InputStreamReader(Channels.newInputStream(client), StandardCharsets.US_ASCII));
                        var out = new PrintWriter(Channels.newOutputStream(client), true, StandardCharsets.US_ASCII)) {
                    out.println("EVENT type=PROCESS_CREATED pid=42 description=started");
                    String line;
                    while ((line = in.readLine()) != null) {
                        out.println("ack " + line);
                        out.println("END");
                    }
                } catch (Exception e) {
                    // 客户端断开即结束
                }
            });

            var transport = new PipeTransport(false, socketPath);
            assertTrue(transport.open(new TransportSettings(null, 1000, 2000, null, 0), events::add).isSuccess());
            try {
                assertEquals("ack sym 0x401000", transport.send("sym 0x401000").getValue());
                assertEquals("ack sti", transport.send("sti").getValue());
                assertEquals(1, events.size());
                assertEquals(42, events.get(0).processId());
            } finally {
                transport.close();
            }
            serving.get(2, TimeUnit.SECONDS);
        }
    }
}
