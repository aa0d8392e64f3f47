/**
 * TransportSettings.java
 *
 * 建立连接时传给传输策略的配置快照。
 * 调试桥在每次 connect() 时根据当前配置生成一份新的快照，传输层不持有可变配置。
 */
package club.ppmc.aidbg.model.debug;

/**
 * @param debuggerPath 外部调试器可执行文件路径，可为空（此时使用内置搜索列表）。
 * @param connectionTimeoutMs 建立连接的超时时间（毫秒），具体是否生效取决于传输策略。
 * @param commandTimeoutMs 等待单条命令响应的超时时间（毫秒）。
 * @param tcpHost TCP 模式下的主机名。
 * @param tcpPort TCP 模式下的端口。
 */
public record TransportSettings(
        String debuggerPath, int connectionTimeoutMs, int commandTimeoutMs, String tcpHost, int tcpPort) {}
