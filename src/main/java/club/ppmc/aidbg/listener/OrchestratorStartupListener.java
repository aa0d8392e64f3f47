/**
 * OrchestratorStartupListener.java
 *
 * 这是一个Spring事件监听器，在应用就绪后初始化核心编排器，
 * 并向调试桥注册一个把调试事件转发到 WebSocket 的处理器。
 * 初始化失败不会阻止应用启动，调试相关接口此时会返回 409。
 */
package club.ppmc.aidbg.listener;

import club.ppmc.aidbg.model.Result;
import club.ppmc.aidbg.service.CoreOrchestrator;
import club.ppmc.aidbg.service.WebSocketNotificationService;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.context.event.ApplicationReadyEvent;
import org.springframework.context.event.EventListener;
import org.springframework.stereotype.Component;

@Component
@Slf4j
public class OrchestratorStartupListener {

    private final CoreOrchestrator orchestrator;
    private final WebSocketNotificationService notificationService;

    public OrchestratorStartupListener(
            CoreOrchestrator orchestrator, WebSocketNotificationService notificationService) {
        this.orchestrator = orchestrator;
        this.notificationService = notificationService;
    }

    @EventListener(ApplicationReadyEvent.class)
    public void onApplicationReady() {
        Result<Void> result = orchestrator.initialize();
        if (result.isError()) {
            log.error("核心编排器初始化失败 [{}]: {}", result.getErrorKind(), result.getErrorMessage());
            return;
        }
        long handlerId = orchestrator.getDebugBridge().registerEventHandler(notificationService::sendDebugEvent);
        log.info("调试事件将通过 WebSocket 转发 (处理器 #{})", handlerId);
    }
}
