/**
 * ErrorKind.java
 *
 * 定义了跨模块边界返回的错误分类。
 * 每个 Result 的失败分支都携带一个 ErrorKind，Controller 层据此决定 HTTP 状态码。
 */
package club.ppmc.aidbg.model;

public enum ErrorKind {
    /** 非法的配置变更，例如在已连接时切换连接模式。 */
    CONFIGURATION,
    /** 传输通道建立失败。 */
    CONNECTION,
    /** 命令过长/含危险字符，或地址、长度非法。 */
    VALIDATION,
    /** 调试器或 AI 服务返回了无法解析或不符合预期的响应。 */
    PROTOCOL,
    /** 平台句柄或 I/O 资源失败，子系统构造失败。 */
    RESOURCE,
    /** 在未连接状态下调用了桥接操作。 */
    NOT_CONNECTED
}
