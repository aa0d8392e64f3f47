/**
 * PluginHostHandle.java
 *
 * 调试器插件宿主提供给调试桥的句柄。
 * 当本服务作为 x64dbg 插件的一部分运行时，由宿主适配层创建并显式传给 TransportFactory；
 * 独立运行时不存在该句柄，PLUGIN 模式的连接会失败。
 */
package club.ppmc.aidbg.service.bridge;

import club.ppmc.aidbg.model.Result;

public interface PluginHostHandle {

    /** 宿主当前是否可以接受命令。 */
    boolean isAvailable();

    /** 在宿主调试器中执行一条命令并返回其文本输出。 */
    Result<String> execute(String command);

    Result<byte[]> readMemory(long address, int size);

    Result<Void> writeMemory(long address, byte[] data);
}
