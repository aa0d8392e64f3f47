/**
 * AppConfig.java
 *
 * Spring Boot 应用的基础配置类。
 * 定义核心编排器和用于 WebSocket 序列化的 Gson 等应用级别的 Bean。
 */
package club.ppmc.aidbg.config;

import club.ppmc.aidbg.service.CoreOrchestrator;
import club.ppmc.aidbg.service.SubsystemFactory;
import com.google.gson.Gson;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

@Configuration
public class AppConfig {

    /**
     * 定义全局唯一的核心编排器。
     * 初始化推迟到应用就绪之后；容器关闭时调用 shutdown() 按相反顺序释放所有子系统。
     *
     * @param subsystemFactory 创建各子系统的工厂。
     * @return 一个尚未初始化的编排器。
     */
    @Bean(destroyMethod = "shutdown")
    public CoreOrchestrator coreOrchestrator(SubsystemFactory subsystemFactory) {
        return new CoreOrchestrator(subsystemFactory);
    }

    /**
     * 定义一个全局的 Gson Bean。
     * 在WebSocket服务中用于将事件对象转换为JSON字符串，确保与前端的兼容性。
     *
     * @return 一个新的 Gson 实例。
     */
    @Bean
    public Gson gson() {
        return new Gson();
    }
}
