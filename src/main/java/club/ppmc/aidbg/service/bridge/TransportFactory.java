/**
 * TransportFactory.java
 *
 * 根据连接模式创建传输策略实例。插件宿主句柄通过构造参数显式传入，可以为 null。
 */
package club.ppmc.aidbg.service.bridge;

import club.ppmc.aidbg.model.debug.ConnectionMode;

public class TransportFactory {

    private final PluginHostHandle pluginHost;

    public TransportFactory(PluginHostHandle pluginHost) {
        this.pluginHost = pluginHost;
    }

    public DebuggerTransport create(ConnectionMode mode) {
        return switch (mode) {
            case PLUGIN -> new PluginTransport(pluginHost);
            case EXTERNAL -> new ExternalProcessTransport();
            case PIPE -> new PipeTransport();
            case TCP -> new TcpTransport();
        };
    }
}
