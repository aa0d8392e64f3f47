/**
 * AiDebuggerApplication.java
 *
 * Spring Boot 应用的主入口类。
 * 负责启动整个应用程序；核心编排器在应用就绪后由 OrchestratorStartupListener 初始化。
 */
package club.ppmc.aidbg;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

@SpringBootApplication
public class AiDebuggerApplication {

    public static void main(String[] args) {
        SpringApplication.run(AiDebuggerApplication.class, args);
    }
}
