/**
 * WebSocketNotificationService.java
 *
 * 一个统一的WebSocket消息发送服务。
 * 该服务封装了 SimpMessagingTemplate 的使用细节，把调试事件和 AI 分析通知
 * 序列化后发送到前端对应的WebSocket主题(topic)上。
 */
package club.ppmc.aidbg.service;

import club.ppmc.aidbg.model.debug.DebugEvent;
import club.ppmc.aidbg.model.debug.WsDebugEvent;
import club.ppmc.aidbg.util.AddressFormat;
import com.google.gson.Gson;
import java.util.LinkedHashMap;
import java.util.Map;
import org.springframework.messaging.simp.SimpMessagingTemplate;
import org.springframework.stereotype.Service;

@Service
public class WebSocketNotificationService {

    public static final String DEBUG_EVENTS_TOPIC = "/topic/debug-events";
    public static final String ANALYSIS_TOPIC = "/topic/analysis";

    private final SimpMessagingTemplate messagingTemplate;
    private final Gson gson;

    public WebSocketNotificationService(SimpMessagingTemplate messagingTemplate, Gson gson) {
        this.messagingTemplate = messagingTemplate;
        this.gson = gson;
    }

    /**
     * 发送调试事件到前端。
     * 事件先被展开为只含字符串和数字的 Map，地址以十六进制文本表示。
     *
     * @param event 调试桥分发的事件。
     */
    public void sendDebugEvent(DebugEvent event) {
        Map<String, Object> data = new LinkedHashMap<>();
        data.put("address", AddressFormat.format(event.address()));
        data.put("processId", event.processId());
        data.put("threadId", event.threadId());
        data.put("moduleName", event.moduleName());
        data.put("description", event.description());
        data.put("timestamp", event.timestamp().toString());
        data.put("metadata", event.metadata());
        sendDebugEvent(new WsDebugEvent<>(event.type().name(), data));
    }

    /**
     * 发送连接状态等简单通知。
     * @param event 要发送的调试事件对象。
     */
    public void sendDebugEvent(WsDebugEvent<?> event) {
        // 使用Gson手动序列化，可以更好地控制JSON输出，特别是对于泛型记录类型
        String payload = gson.toJson(event);
        sendMessage(DEBUG_EVENTS_TOPIC, payload);
    }

    /**
     * 通知前端一次 AI 分析已提交。
     * @param address 被分析的地址。
     */
    public void sendAnalysisSubmitted(long address) {
        sendMessage(ANALYSIS_TOPIC, gson.toJson(Map.of("status", "SUBMITTED", "address", AddressFormat.format(address))));
    }

    /**
     * 向指定的WebSocket主题发送一个通用载荷(payload)。
     *
     * @param destination 目标WebSocket主题 (例如, "/topic/some-status")
     * @param payload 要发送的任何对象 (将被框架自动序列化为JSON)
     */
    public void sendMessage(String destination, Object payload) {
        messagingTemplate.convertAndSend(destination, payload);
    }
}
