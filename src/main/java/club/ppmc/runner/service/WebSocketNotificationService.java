/**
 * WebSocketNotificationService.java
 *
 * 一个统一的WebSocket消息发送服务。
 * 该服务为应用提供一个单一、清晰的WebSocket通信出口，封装了 SimpMessagingTemplate 的使用细节。
 * 它负责将会话事件序列化后发送到对应会话的主题(topic)上：/topic/session/{sessionId}/{event}。
 */
package club.ppmc.runner.service;

import club.ppmc.runner.exception.SessionException;
import club.ppmc.runner.model.SessionEvent;
import club.ppmc.runner.model.SessionEventType;
import com.google.gson.Gson;
import java.util.Map;
import org.springframework.messaging.simp.SimpMessagingTemplate;
import org.springframework.stereotype.Service;

@Service
public class WebSocketNotificationService implements SessionEventPublisher {

    private final SimpMessagingTemplate messagingTemplate;
    private final Gson gson;

    public WebSocketNotificationService(SimpMessagingTemplate messagingTemplate, Gson gson) {
        this.messagingTemplate = messagingTemplate;
        this.gson = gson;
    }

    @Override
    public void sessionStarted(String sessionId) {
        sendSessionEvent(sessionId, SessionEventType.SESSION_STARTED, Map.of());
    }

    @Override
    public void output(String sessionId, String data) {
        sendSessionEvent(sessionId, SessionEventType.OUTPUT, Map.of("data", data));
    }

    @Override
    public void artifact(String sessionId, String filename, String imageDataEncoded) {
        sendSessionEvent(
                sessionId,
                SessionEventType.ARTIFACT,
                Map.of("filename", filename, "imageDataEncoded", imageDataEncoded));
    }

    @Override
    public void processEnded(String sessionId) {
        sendSessionEvent(sessionId, SessionEventType.PROCESS_ENDED, Map.of());
    }

    @Override
    public void error(String sessionId, SessionException error) {
        sendSessionEvent(sessionId, SessionEventType.SESSION_ERROR, error.toErrorData());
    }

    /**
     * 发送会话事件到该会话专属的主题。
     * 使用Gson手动序列化，可以更好地控制泛型记录类型的JSON输出。
     */
    private void sendSessionEvent(String sessionId, SessionEventType type, Map<String, ?> data) {
        String destination = String.format("/topic/session/%s/%s", sessionId, type.eventName());
        sendMessage(destination, gson.toJson(new SessionEvent<>(type.eventName(), data)));
    }

    /**
     * 向指定的WebSocket主题发送一个通用载荷(payload)。
     *
     * @param destination 目标WebSocket主题 (例如, "/topic/session/abc/output")
     * @param payload 要发送的任何对象
     */
    public void sendMessage(String destination, Object payload) {
        messagingTemplate.convertAndSend(destination, payload);
    }
}
