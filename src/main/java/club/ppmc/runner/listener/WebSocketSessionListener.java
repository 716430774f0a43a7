/**
 * WebSocketSessionListener.java
 *
 * 这是一个Spring事件监听器，负责处理WebSocket的连接和断开事件。
 * 连接断开（无论是正常关闭还是意外掉线）时，静默清理该连接拥有的执行会话，
 * 确保后端子进程与临时工作区不会残留。
 */
package club.ppmc.runner.listener;

import club.ppmc.runner.service.ExecutionSessionService;
import lombok.extern.slf4j.Slf4j;
import org.springframework.context.event.EventListener;
import org.springframework.messaging.simp.stomp.StompHeaderAccessor;
import org.springframework.stereotype.Component;
import org.springframework.web.socket.messaging.SessionConnectedEvent;
import org.springframework.web.socket.messaging.SessionDisconnectEvent;

@Component
@Slf4j
public class WebSocketSessionListener {

    private final ExecutionSessionService executionSessionService;

    public WebSocketSessionListener(ExecutionSessionService executionSessionService) {
        this.executionSessionService = executionSessionService;
    }

    @EventListener
    public void handleWebSocketConnectListener(SessionConnectedEvent event) {
        String sessionId = StompHeaderAccessor.wrap(event.getMessage()).getSessionId();
        if (sessionId == null) {
            log.error("在 SessionConnectedEvent 中无法获取到 session ID。");
            return;
        }
        log.info("接收到新的 WebSocket 连接，会话 ID: {}", sessionId);
    }

    @EventListener
    public void handleWebSocketDisconnectListener(SessionDisconnectEvent event) {
        String sessionId = event.getSessionId();
        if (sessionId != null) {
            log.info("WebSocket 连接断开，会话 ID: {}。正在清理执行会话。", sessionId);
            executionSessionService.release(sessionId);
        }
    }
}
