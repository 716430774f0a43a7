/**
 * SessionController.java
 *
 * 这是一个WebSocket控制器，处理客户端对代码执行会话的操作。
 * 它监听来自客户端的STOMP消息，从消息头中取出连接的会话ID，然后交给 ExecutionSessionService。
 * 所有结果都以事件形式异步推送，因此这里的方法都没有返回值。
 */
package club.ppmc.runner.controller;

import club.ppmc.runner.model.InputRequest;
import club.ppmc.runner.model.StartSessionRequest;
import club.ppmc.runner.service.ExecutionSessionService;
import lombok.extern.slf4j.Slf4j;
import org.springframework.messaging.handler.annotation.MessageMapping;
import org.springframework.messaging.handler.annotation.Payload;
import org.springframework.messaging.simp.SimpMessageHeaderAccessor;
import org.springframework.stereotype.Controller;

@Controller
@Slf4j
public class SessionController {

    private final ExecutionSessionService executionSessionService;

    public SessionController(ExecutionSessionService executionSessionService) {
        this.executionSessionService = executionSessionService;
    }

    /**
     * 处理启动代码执行会话的请求。
     *
     * @param request 包含语言和源码的请求体。
     * @param headerAccessor 消息头访问器，用于获取唯一的会话ID。
     */
    @MessageMapping("/session/start")
    public void start(@Payload StartSessionRequest request, SimpMessageHeaderAccessor headerAccessor) {
        String sessionId = headerAccessor.getSessionId();
        if (sessionId != null) {
            log.info("收到会话 {} 的 {} 代码执行请求", sessionId, request.language());
            executionSessionService.start(sessionId, request.language(), request.code());
        }
    }

    @MessageMapping("/session/input")
    public void input(@Payload InputRequest request, SimpMessageHeaderAccessor headerAccessor) {
        String sessionId = headerAccessor.getSessionId();
        if (sessionId != null) {
            executionSessionService.sendInput(sessionId, request.line());
        }
    }

    /**
     * 处理用户主动终止当前执行会话的请求。
     */
    @MessageMapping("/session/disconnect")
    public void disconnect(SimpMessageHeaderAccessor headerAccessor) {
        String sessionId = headerAccessor.getSessionId();
        if (sessionId != null) {
            log.info("收到会话 {} 的终止请求", sessionId);
            executionSessionService.disconnect(sessionId);
        }
    }
}
