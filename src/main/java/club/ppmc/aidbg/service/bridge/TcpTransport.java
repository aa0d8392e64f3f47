/**
 * TcpTransport.java
 *
 * 通过 TCP 套接字连接远程调试器代理的传输策略。
 * 连接超时取 connectionTimeoutMs；套接字本身不设读超时，读取线程一直阻塞到有数据或连接关闭，
 * 单条命令的等待上限 commandTimeoutMs 由 send() 控制，超时返回 PROTOCOL 错误并关闭连接。
 */
package club.ppmc.aidbg.service.bridge;

import club.ppmc.aidbg.model.ErrorKind;
import club.ppmc.aidbg.model.Result;
import club.ppmc.aidbg.model.debug.ConnectionMode;
import club.ppmc.aidbg.model.debug.DebugEvent;
import club.ppmc.aidbg.model.debug.TransportSettings;
import java.io.IOException;
import java.net.InetSocketAddress;
import java.net.Socket;
import java.util.function.Consumer;
import lombok.extern.slf4j.Slf4j;

@Slf4j
public class TcpTransport extends AbstractStreamTransport {

    private Socket socket;

    @Override
    public ConnectionMode mode() {
        return ConnectionMode.TCP;
    }

    @Override
    public Result<Void> open(TransportSettings settings, Consumer<DebugEvent> eventSink) {
        String host = settings.tcpHost();
        int port = settings.tcpPort();
        if (host == null || host.isBlank() || port <= 0 || port > 65535) {
            return Result.error(ErrorKind.CONFIGURATION, "TCP 端点配置无效: " + host + ":" + port);
        }
        var newSocket = new Socket();
        try {
            newSocket.connect(new InetSocketAddress(host, port), Math.max(0, settings.connectionTimeoutMs()));
            newSocket.setTcpNoDelay(true);
            attachStreams(
                    newSocket.getInputStream(), newSocket.getOutputStream(), eventSink, settings.commandTimeoutMs());
        } catch (IOException e) {
            try {
                newSocket.close();
            } catch (IOException closeError) {
                e.addSuppressed(closeError);
            }
            log.warn("连接调试器 {}:{} 失败: {}", host, port, e.getMessage());
            return Result.error(ErrorKind.CONNECTION, "无法连接到 " + host + ":" + port + ": " + e.getMessage());
        }
        this.socket = newSocket;
        log.info("已通过 TCP 连接到调试器 {}:{}", host, port);
        return Result.ok();
    }

    @Override
    protected void releaseConnection() throws IOException {
        if (socket != null) {
            socket.close();
        }
    }
}
